package com.tazifor.bidengine.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One scored bid of a candidate campaign for a single opportunity.
 */
@Value
@Builder(toBuilder = true)
public class Bid {

    public static final String INTERNAL_SEAT = "internal";

    String bidId;

    String campaignId;

    BigDecimal price;

    BidType bidType;

    Instant timestamp;

    double score;

    /**
     * {@link #INTERNAL_SEAT} or the id of the external source that priced the bid
     */
    String seat;

    /**
     * Markup returned by an external source, null for internally priced bids
     */
    String adm;
}
