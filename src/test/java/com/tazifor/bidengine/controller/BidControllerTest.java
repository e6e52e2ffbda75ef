package com.tazifor.bidengine.controller;

import com.tazifor.bidengine.config.BidEngineProperties;
import com.tazifor.bidengine.config.BidEngineProperties.OverflowPolicy;
import com.tazifor.bidengine.exception.OverloadedException;
import com.tazifor.bidengine.exception.ValidationException;
import com.tazifor.bidengine.model.BidRequest;
import com.tazifor.bidengine.model.BidResponse;
import com.tazifor.bidengine.service.AuctionWorkerPool;
import com.tazifor.bidengine.service.BiddingService;
import com.tazifor.bidengine.service.CampaignCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

@ExtendWith(MockitoExtension.class)
public class BidControllerTest {

    @Mock
    private BiddingService biddingService;

    @Mock
    private CampaignCatalog catalog;

    private AuctionWorkerPool workerPool;
    private BidEngineProperties properties;
    private BidController target;

    @BeforeEach
    public void setUp() {
        workerPool = new AuctionWorkerPool(1, 10, OverflowPolicy.REJECT_NEW);
        properties = new BidEngineProperties();
        properties.getOrchestrator().setResponseTimeout(Duration.ofMillis(100));
        target = new BidController(biddingService, workerPool, catalog, properties);
    }

    @AfterEach
    public void tearDown() {
        workerPool.shutdown();
    }

    @Test
    public void handleBidRequestShouldReturnAuctionResponse() throws Exception {
        // given
        BidResponse bid = BidResponse.builder().id("req-1").currency("USD").seatBids(List.of()).build();
        given(biddingService.processBidRequest(any())).willReturn(bid);

        // when
        ResponseEntity<BidResponse> response = target.handleBidRequest(request()).get();

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(bid);
        assertThat(response.getHeaders().getFirst(BidController.PROCESSING_TIME_HEADER)).isNotNull();
    }

    @Test
    public void handleBidRequestShouldAnswerBadRequestForInvalidRequest() throws Exception {
        // given
        given(biddingService.processBidRequest(any()))
            .willThrow(new ValidationException(List.of("request.user.id is required")));

        // when
        ResponseEntity<BidResponse> response = target.handleBidRequest(request()).get();

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getNoBidReason())
            .isEqualTo(BidResponse.NoBidReason.INVALID_REQUEST.getCode());
    }

    @Test
    public void handleBidRequestShouldAnswerTimeoutNoBidWhenAuctionIsTooSlow() throws Exception {
        // given
        given(biddingService.processBidRequest(any())).willAnswer(invocation -> {
            Thread.sleep(1_000);
            return BidResponse.builder().id("req-1").build();
        });

        // when
        ResponseEntity<BidResponse> response = target.handleBidRequest(request()).get();

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getId()).isEqualTo("req-1");
        assertThat(response.getBody().getNoBidReason()).isEqualTo(BidResponse.NoBidReason.TIMEOUT.getCode());
    }

    @Test
    public void handleBidRequestShouldAnswerOverloadedNoBidWhenQueueIsFull() throws Exception {
        // given
        AuctionWorkerPool saturated = mock(AuctionWorkerPool.class);
        given(saturated.<BidResponse>submit(any()))
            .willReturn(CompletableFuture.failedFuture(new OverloadedException("Auction queue full, request rejected")));
        BidController controller = new BidController(biddingService, saturated, catalog, properties);

        // when
        ResponseEntity<BidResponse> response = controller.handleBidRequest(request()).get();

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getNoBidReason()).isEqualTo(BidResponse.NoBidReason.OVERLOADED.getCode());
    }

    @Test
    public void handleBidRequestShouldAnswerTechnicalErrorOnUnexpectedFailure() throws Exception {
        // given
        given(biddingService.processBidRequest(any())).willThrow(new IllegalStateException("boom"));

        // when
        ResponseEntity<BidResponse> response = target.handleBidRequest(request()).get();

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getNoBidReason())
            .isEqualTo(BidResponse.NoBidReason.TECHNICAL_ERROR.getCode());
    }

    @Test
    public void healthShouldReportCatalogAndQueueState() {
        // given
        given(catalog.size()).willReturn(3);
        given(catalog.lastRefresh()).willReturn(Optional.of(Instant.parse("2024-05-01T10:00:00Z")));

        // when
        ResponseEntity<Map<String, Object>> response = target.health();

        // then
        assertThat(response.getBody())
            .containsEntry("status", "UP")
            .containsEntry("campaigns", 3)
            .containsEntry("queuedAuctions", 0)
            .containsEntry("overloadedAuctions", 0L)
            .containsEntry("lastCampaignRefresh", "2024-05-01T10:00:00Z");
    }

    private static BidRequest request() {
        return BidRequest.builder().id("req-1").build();
    }
}
