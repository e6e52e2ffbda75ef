package com.tazifor.bidengine.controller;

import com.tazifor.bidengine.config.BidEngineProperties;
import com.tazifor.bidengine.exception.OverloadedException;
import com.tazifor.bidengine.exception.ValidationException;
import com.tazifor.bidengine.model.BidRequest;
import com.tazifor.bidengine.model.BidResponse;
import com.tazifor.bidengine.service.AuctionWorkerPool;
import com.tazifor.bidengine.service.BiddingService;
import com.tazifor.bidengine.service.CampaignCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * BidController - OpenRTB style bidding endpoint
 *
 * Each request becomes one task on the {@link AuctionWorkerPool}. The servlet thread is released
 * while the auction runs; the response is written when the task completes or when
 * {@code bidengine.orchestrator.response-timeout} elapses, whichever comes first.
 *
 * <pre>
 *   ValidationException  → 400, nbr = INVALID_REQUEST
 *   OverloadedException  → 200, nbr = OVERLOADED
 *   response timeout     → 200, nbr = TIMEOUT
 *   anything else        → 200, nbr = TECHNICAL_ERROR
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class BidController {

    static final String PROCESSING_TIME_HEADER = "X-Processing-Time-Ms";

    private final BiddingService biddingService;
    private final AuctionWorkerPool workerPool;
    private final CampaignCatalog catalog;
    private final BidEngineProperties properties;

    public BidController(BiddingService biddingService, AuctionWorkerPool workerPool, CampaignCatalog catalog,
                         BidEngineProperties properties) {
        this.biddingService = biddingService;
        this.workerPool = workerPool;
        this.catalog = catalog;
        this.properties = properties;
    }

    /**
     * Main bidding endpoint
     *
     * POST /api/bid
     * Content-Type: application/json
     */
    @PostMapping("/bid")
    public CompletableFuture<ResponseEntity<BidResponse>> handleBidRequest(@RequestBody BidRequest request) {
        long startTime = System.nanoTime();
        String requestId = request.getId();
        long timeoutMs = properties.getOrchestrator().getResponseTimeout().toMillis();

        return workerPool.submit(() -> biddingService.processBidRequest(request))
            .completeOnTimeout(BidResponse.noBid(requestId, BidResponse.NoBidReason.TIMEOUT), timeoutMs, TimeUnit.MILLISECONDS)
            .handle((response, error) -> {
                if (error != null) {
                    return toErrorResponse(requestId, unwrap(error), startTime);
                }
                return withLatency(ResponseEntity.ok(), startTime).body(response);
            });
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", "Bid Engine");
        body.put("campaigns", catalog.size());
        body.put("queuedAuctions", workerPool.queuedTasks());
        body.put("overloadedAuctions", workerPool.overloadedTasks());
        catalog.lastRefresh().ifPresent(instant -> body.put("lastCampaignRefresh", instant.toString()));
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<BidResponse> handleUnreadableRequest(HttpMessageNotReadableException e) {
        log.debug("Unreadable bid request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(BidResponse.noBid(null, BidResponse.NoBidReason.INVALID_REQUEST));
    }

    private ResponseEntity<BidResponse> toErrorResponse(String requestId, Throwable error, long startTime) {
        if (error instanceof ValidationException validation) {
            log.debug("Invalid bid request {}: {}", requestId, validation.getMessages());
            return withLatency(ResponseEntity.status(HttpStatus.BAD_REQUEST), startTime)
                .body(BidResponse.noBid(requestId, BidResponse.NoBidReason.INVALID_REQUEST));
        }
        if (error instanceof OverloadedException) {
            log.debug("Bid request {} shed: {}", requestId, error.getMessage());
            return withLatency(ResponseEntity.ok(), startTime)
                .body(BidResponse.noBid(requestId, BidResponse.NoBidReason.OVERLOADED));
        }

        log.error("Error in bid controller for request {}", requestId, error);
        return withLatency(ResponseEntity.ok(), startTime)
            .body(BidResponse.noBid(requestId, BidResponse.NoBidReason.TECHNICAL_ERROR));
    }

    private static ResponseEntity.BodyBuilder withLatency(ResponseEntity.BodyBuilder builder, long startTime) {
        long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
        return builder.header(PROCESSING_TIME_HEADER, String.valueOf(latencyMs));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
