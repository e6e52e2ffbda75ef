package com.tazifor.bidengine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
    "bidengine.notifier.enabled=false",
    "bidengine.campaigns.daily-reset-cron=-"
})
public class BidEngineApplicationTest {

    private static final String NYC_REQUEST = """
        {
          "id": "req-it-1",
          "impressions": [{"id": "imp-1", "banner": {"w": 300, "h": 250}, "bidfloor": 0.50}],
          "device": {"type": 1},
          "user": {"id": "it-user", "interests": ["sports"]},
          "geo": {"lat": 40.7580, "lng": -73.9855},
          "tmax_ms": 200
        }
        """;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    public void bidEndpointShouldBidForSeededCampaign() throws Exception {
        // when
        ResponseEntity<String> response = restTemplate.postForEntity("/api/bid", json(NYC_REQUEST), String.class);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getFirst("X-Processing-Time-Ms")).isNotNull();
        JsonNode body = objectMapper.readTree(response.getBody());
        assertThat(body.path("id").asText()).isEqualTo("req-it-1");
        assertThat(body.path("cur").asText()).isEqualTo("USD");
        JsonNode bid = body.path("seatbid").get(0).path("bid").get(0);
        assertThat(bid.path("cid").asText()).isEqualTo("camp-nyc-sports");
        assertThat(bid.path("impid").asText()).isEqualTo("imp-1");
        assertThat(bid.path("price").decimalValue()).isGreaterThanOrEqualTo(new BigDecimal("0.50"));
    }

    @Test
    public void bidEndpointShouldRejectInvalidRequest() throws Exception {
        // when
        ResponseEntity<String> response = restTemplate.postForEntity("/api/bid", json("{\"id\": \"req-it-2\"}"), String.class);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(objectMapper.readTree(response.getBody()).path("nbr").asInt()).isEqualTo(2);
    }

    @Test
    public void bidEndpointShouldRejectUnreadableBody() {
        // when
        ResponseEntity<String> response = restTemplate.postForEntity("/api/bid", json("{not json"), String.class);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    public void healthShouldReportSeededCampaigns() throws Exception {
        // when
        ResponseEntity<String> response = restTemplate.getForEntity("/api/health", String.class);

        // then
        JsonNode body = objectMapper.readTree(response.getBody());
        assertThat(body.path("status").asText()).isEqualTo("UP");
        assertThat(body.path("campaigns").asInt()).isEqualTo(3);
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }
}
