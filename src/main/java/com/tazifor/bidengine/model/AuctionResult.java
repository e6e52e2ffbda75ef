package com.tazifor.bidengine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one auction, emitted exactly once per request.
 */
@Value
@Builder(toBuilder = true)
public class AuctionResult {

    String auctionId;

    AuctionStatus status;

    /**
     * Committed winning bid, present only when {@link #status} is {@link AuctionStatus#WON}
     */
    Bid winningBid;

    BigDecimal clearingPrice;

    int candidatesConsidered;

    @Singular
    Map<String, RejectionReason> rejections;

    public Optional<String> getWinnerCampaignId() {
        return Optional.ofNullable(winningBid).map(Bid::getCampaignId);
    }

    public boolean isWon() {
        return status == AuctionStatus.WON;
    }

    public static AuctionResult noBid(String auctionId, int candidatesConsidered,
                                      Map<String, RejectionReason> rejections) {
        return AuctionResult.builder()
            .auctionId(auctionId)
            .status(AuctionStatus.NO_BID)
            .candidatesConsidered(candidatesConsidered)
            .rejections(rejections)
            .build();
    }
}
