package com.tazifor.bidengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fire-and-forget message sent to the winning campaign's owner after a committed win.
 */
@Value
@Builder
public class WinNotification {

    @JsonProperty("auction_id")
    String auctionId;

    @JsonProperty("bid_id")
    String bidId;

    @JsonProperty("winning_price")
    BigDecimal winningPrice;

    @JsonProperty("impression_id")
    String impressionId;
}
