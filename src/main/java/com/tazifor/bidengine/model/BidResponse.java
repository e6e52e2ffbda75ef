package com.tazifor.bidengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * OpenRTB style bid response
 *
 * Either carries one seat bid with the winning bid, or no seat bids and a no-bid reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BidResponse {

    /**
     * ID of the bid request to which this is a response
     */
    private String id;

    @JsonProperty("seatbid")
    private List<SeatBid> seatBids;

    /**
     * Bid currency (ISO-4217 code)
     */
    @JsonProperty("cur")
    private String currency;

    /**
     * Reason for not bidding
     */
    @JsonProperty("nbr")
    private Integer noBidReason;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SeatBid {
        @JsonProperty("bid")
        private List<Bid> bids;

        private String seat;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Bid {
        private String id;

        @JsonProperty("impid")
        private String impressionId;

        /**
         * Clearing price charged to the winner
         */
        private BigDecimal price;

        /**
         * Opaque creative markup, never interpreted here
         */
        private String adm;

        @JsonProperty("crid")
        private String creativeId;

        @JsonProperty("cid")
        private String campaignId;

        private Integer w;
        private Integer h;
    }

    /**
     * No-bid reason codes. The first block follows OpenRTB 2.5; codes from 500 up are
     * exchange specific.
     */
    public enum NoBidReason {
        UNKNOWN_ERROR(0),
        TECHNICAL_ERROR(1),
        INVALID_REQUEST(2),
        UNMATCHED_USER(8),
        NO_ELIGIBLE_BID(500),
        TIMEOUT(501),
        OVERLOADED(502);

        private final int code;

        NoBidReason(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    public static BidResponse noBid(String requestId, NoBidReason reason) {
        return BidResponse.builder()
            .id(requestId)
            .noBidReason(reason.getCode())
            .build();
    }

    @JsonIgnore
    public boolean isNoBid() {
        return seatBids == null || seatBids.isEmpty();
    }
}
