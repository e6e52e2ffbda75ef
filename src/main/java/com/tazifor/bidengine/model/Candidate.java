package com.tazifor.bidengine.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A campaign that survived pruning, together with the price it bids.
 * Internal candidates bid the campaign's own price; external sources may price it differently.
 */
@Value
public class Candidate {

    Campaign campaign;

    BigDecimal price;

    String seat;

    String adm;

    public static Candidate internal(Campaign campaign) {
        return new Candidate(campaign, campaign.getBidPrice(), Bid.INTERNAL_SEAT, null);
    }

    public static Candidate external(Campaign campaign, ExternalBid bid) {
        return new Candidate(campaign, bid.getPrice(), bid.getSourceId(), bid.getAdm());
    }

    public String getCampaignId() {
        return campaign.getId();
    }
}
