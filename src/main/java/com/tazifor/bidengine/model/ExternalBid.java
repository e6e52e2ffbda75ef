package com.tazifor.bidengine.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Bid returned by an external bid source on behalf of a known campaign.
 */
@Value
@Builder
public class ExternalBid {

    String sourceId;

    String campaignId;

    BigDecimal price;

    String adm;
}
