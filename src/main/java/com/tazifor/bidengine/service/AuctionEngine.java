package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.AuctionResult;
import com.tazifor.bidengine.model.AuctionStatus;
import com.tazifor.bidengine.model.Bid;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.Candidate;
import com.tazifor.bidengine.model.RejectionReason;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * AuctionEngine - sealed-bid second-price auction over the surviving candidates
 *
 * <pre>
 *   COLLECTING → FILTERING → SCORING → SELECTING → COMMITTING → WON
 *                                                     │
 *                                                     └──────→ NO_BID
 * </pre>
 *
 * <h3>Ranking</h3>
 * Bid price descending. Equal prices go to the higher score, then to the lowest campaign id.
 * Only one bid per campaign takes part: the best-ranked one. The score never lifts a lower
 * price above a higher one.
 *
 * <h3>Clearing price</h3>
 * <ul>
 *   <li>one eligible bid: the floor price</li>
 *   <li>two or more: runner-up price + one increment, capped at the winner's own price and
 *       never below the floor</li>
 * </ul>
 *
 * <h3>Commit and cascade</h3>
 * Committing reserves the clearing price in the {@link BudgetLedger}, consumes a frequency-cap
 * exposure and records the campaign and opportunity in the {@link DuplicateSuppressionFilter}.
 * If the reservation or the exposure is refused (another auction got there first), earlier
 * steps are rolled back and the next-ranked bid is tried against its own runner-up, at most
 * {@code maxCascades} times.
 */
@Slf4j
public class AuctionEngine {

    public enum State {
        COLLECTING,
        FILTERING,
        SCORING,
        SELECTING,
        COMMITTING,
        WON,
        NO_BID
    }

    static final Comparator<Bid> RANKING = Comparator
        .comparing(Bid::getPrice, Comparator.reverseOrder())
        .thenComparing(Comparator.comparingDouble(Bid::getScore).reversed())
        .thenComparing(Bid::getCampaignId);

    private final BidScorer scorer;
    private final BudgetLedger budgetLedger;
    private final FrequencyCapService frequencyCaps;
    private final DuplicateSuppressionFilter duplicateFilter;
    private final BigDecimal priceIncrement;
    private final int maxCascades;
    private final Clock clock;

    public AuctionEngine(BidScorer scorer, BudgetLedger budgetLedger, FrequencyCapService frequencyCaps,
                         DuplicateSuppressionFilter duplicateFilter, BigDecimal priceIncrement,
                         int maxCascades, Clock clock) {
        this.scorer = scorer;
        this.budgetLedger = budgetLedger;
        this.frequencyCaps = frequencyCaps;
        this.duplicateFilter = duplicateFilter;
        this.priceIncrement = priceIncrement;
        this.maxCascades = maxCascades;
        this.clock = clock;
    }

    public AuctionResult run(AdOpportunity opportunity, List<Candidate> candidates) {
        AuctionRun auction = new AuctionRun(opportunity);

        // COLLECTING
        Map<String, Campaign> campaigns = new HashMap<>();
        for (Candidate candidate : candidates) {
            campaigns.putIfAbsent(candidate.getCampaignId(), candidate.getCampaign());
        }

        auction.moveTo(State.FILTERING);
        List<Candidate> eligible = new ArrayList<>();
        for (Candidate candidate : candidates) {
            BigDecimal price = candidate.getPrice();
            if (price == null || price.signum() < 0) {
                auction.reject(candidate.getCampaignId(), RejectionReason.NOT_ELIGIBLE);
            } else if (price.compareTo(opportunity.getFloorPrice()) < 0) {
                auction.reject(candidate.getCampaignId(), RejectionReason.BELOW_FLOOR);
            } else {
                eligible.add(candidate);
            }
        }

        auction.moveTo(State.SCORING);
        Map<String, Bid> bestBidByCampaign = new LinkedHashMap<>();
        for (Candidate candidate : eligible) {
            Bid bid;
            try {
                bid = toBid(opportunity, candidate);
            } catch (RuntimeException e) {
                log.warn("Auction {}: scoring failed for campaign {}, dropping it: {}",
                    opportunity.getRequestId(), candidate.getCampaignId(), e.getMessage());
                auction.reject(candidate.getCampaignId(), RejectionReason.SCORING_ERROR);
                continue;
            }
            bestBidByCampaign.merge(bid.getCampaignId(), bid,
                (current, challenger) -> RANKING.compare(challenger, current) < 0 ? challenger : current);
        }
        // a campaign with at least one valid bid is not rejected
        bestBidByCampaign.keySet().forEach(auction.rejections::remove);

        auction.moveTo(State.SELECTING);
        List<Bid> ranked = new ArrayList<>(bestBidByCampaign.values());
        ranked.sort(RANKING);
        if (ranked.isEmpty()) {
            return auction.noBid(campaigns.size());
        }

        auction.moveTo(State.COMMITTING);
        for (int i = 0; i < ranked.size() && i <= maxCascades; i++) {
            Bid winner = ranked.get(i);
            Bid runnerUp = i + 1 < ranked.size() ? ranked.get(i + 1) : null;
            BigDecimal clearingPrice = clearingPrice(winner, runnerUp, opportunity.getFloorPrice());

            Optional<RejectionReason> refused = commit(opportunity, campaigns.get(winner.getCampaignId()), clearingPrice);
            if (refused.isEmpty()) {
                auction.moveTo(State.WON);
                return AuctionResult.builder()
                    .auctionId(opportunity.getRequestId())
                    .status(AuctionStatus.WON)
                    .winningBid(winner)
                    .clearingPrice(clearingPrice)
                    .candidatesConsidered(campaigns.size())
                    .rejections(auction.rejections)
                    .build();
            }

            auction.reject(winner.getCampaignId(), refused.get());
            log.debug("Auction {}: commit refused for {} ({}), cascading",
                opportunity.getRequestId(), winner.getCampaignId(), refused.get());
        }

        if (ranked.size() > maxCascades + 1) {
            ranked.subList(maxCascades + 1, ranked.size())
                .forEach(bid -> auction.reject(bid.getCampaignId(), RejectionReason.CASCADE_LIMIT));
        }
        return auction.noBid(campaigns.size());
    }

    /**
     * Second-price clearing. {@code runnerUp} is null for a single eligible bid.
     */
    BigDecimal clearingPrice(Bid winner, Bid runnerUp, BigDecimal floorPrice) {
        if (runnerUp == null) {
            return floorPrice;
        }
        BigDecimal secondPrice = runnerUp.getPrice().add(priceIncrement);
        return secondPrice.min(winner.getPrice()).max(floorPrice);
    }

    private Bid toBid(AdOpportunity opportunity, Candidate candidate) {
        Campaign campaign = candidate.getCampaign();
        return Bid.builder()
            .bidId(UUID.randomUUID().toString())
            .campaignId(campaign.getId())
            .price(candidate.getPrice())
            .bidType(campaign.getBidType())
            .timestamp(Instant.now(clock))
            .score(scorer.score(opportunity, campaign, candidate.getPrice()))
            .seat(candidate.getSeat())
            .adm(candidate.getAdm())
            .build();
    }

    /**
     * @return empty on success, otherwise why the campaign could not take the win
     */
    private Optional<RejectionReason> commit(AdOpportunity opportunity, Campaign campaign, BigDecimal clearingPrice) {
        String campaignId = campaign.getId();
        String userId = opportunity.getUserId();

        if (!budgetLedger.tryReserve(campaignId, clearingPrice)) {
            return Optional.of(RejectionReason.BUDGET_EXHAUSTED);
        }

        if (campaign.isFrequencyCapped()
            && !frequencyCaps.tryConsume(userId, campaignId, campaign.getFrequencyCap(), campaign.getFrequencyCapWindow())) {
            budgetLedger.release(campaignId, clearingPrice);
            return Optional.of(RejectionReason.FREQUENCY_CAPPED);
        }

        duplicateFilter.recordShown(userId, DuplicateSuppressionFilter.adKey(campaignId, opportunity));
        return Optional.empty();
    }

    /**
     * Per-request state. Confined to the calling thread.
     */
    private static final class AuctionRun {
        private final String auctionId;
        private final Map<String, RejectionReason> rejections = new LinkedHashMap<>();
        private State state = State.COLLECTING;

        AuctionRun(AdOpportunity opportunity) {
            this.auctionId = opportunity.getRequestId();
        }

        void moveTo(State next) {
            log.trace("Auction {}: {} -> {}", auctionId, state, next);
            state = next;
        }

        void reject(String campaignId, RejectionReason reason) {
            rejections.put(campaignId, reason);
        }

        AuctionResult noBid(int candidatesConsidered) {
            moveTo(State.NO_BID);
            return AuctionResult.noBid(auctionId, candidatesConsidered, rejections);
        }
    }
}
