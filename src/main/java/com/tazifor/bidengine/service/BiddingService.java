package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.AuctionResult;
import com.tazifor.bidengine.model.AuctionStatus;
import com.tazifor.bidengine.model.Bid;
import com.tazifor.bidengine.model.BidRequest;
import com.tazifor.bidengine.model.BidResponse;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.Candidate;
import com.tazifor.bidengine.model.Creative;
import com.tazifor.bidengine.model.ExternalBid;
import com.tazifor.bidengine.model.RejectionReason;
import com.tazifor.bidengine.model.WinNotification;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * BiddingService - turns one bid request into exactly one auction result
 *
 * <pre>
 *   validate → index query → prune (targeting, duplicates, frequency) → external bid sources
 *            → auction (score, rank, clear, commit) → response + win notification
 * </pre>
 *
 * <h3>Pruning</h3>
 * Only non-mutating checks run here. The authoritative budget and frequency updates happen
 * once, for the winner, inside {@link AuctionEngine}.
 *
 * <h3>Deadline</h3>
 * External sources are queried concurrently and waited on until
 * {@code min(request tmax, configured deadline)} after the auction started. Sources that
 * have not answered by then are cancelled and ignored. An auction that ends without a winner
 * while at least one source was cut off reports {@link AuctionStatus#TIMEOUT}.
 *
 * <h3>Failure isolation</h3>
 * A campaign that throws while being pruned, or a source that fails, only loses its own bid.
 */
@Slf4j
@Builder
public class BiddingService {

    @NonNull
    private final RequestValidator validator;

    @NonNull
    private final CampaignCatalog catalog;

    @NonNull
    private final CampaignIndex index;

    @NonNull
    private final TargetingService targetingService;

    @NonNull
    private final FrequencyCapService frequencyCaps;

    @NonNull
    private final DuplicateSuppressionFilter duplicateFilter;

    @NonNull
    private final AuctionEngine auctionEngine;

    @NonNull
    private final Duration deadline;

    @Builder.Default
    private final boolean dedupEnabled = true;

    @Builder.Default
    private final List<BidSource> bidSources = Collections.emptyList();

    /**
     * Runs bid source calls; required only when {@link #bidSources} is not empty
     */
    private final ExecutorService bidSourceExecutor;

    @Builder.Default
    private final CreativeSelector creativeSelector = new CreativeSelector();

    @Builder.Default
    private final WinNotifier winNotifier = WinNotifier.NOOP;

    @Builder.Default
    private final String currency = "USD";

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    /**
     * Full request path used by the bid endpoint.
     *
     * @throws com.tazifor.bidengine.exception.ValidationException if the request is malformed
     */
    public BidResponse processBidRequest(BidRequest request) {
        long startTime = System.nanoTime();

        AdOpportunity opportunity = validator.validate(request);

        Outcome outcome;
        try {
            outcome = runAuction(opportunity);
        } catch (RuntimeException e) {
            log.error("Error processing bid request {}", opportunity.getRequestId(), e);
            return BidResponse.noBid(opportunity.getRequestId(), BidResponse.NoBidReason.TECHNICAL_ERROR);
        }

        AuctionResult result = outcome.result();
        BidResponse response;
        if (result.isWon()) {
            Campaign winner = outcome.eligible().get(result.getWinningBid().getCampaignId());
            response = buildBidResponse(opportunity, result, winner);
            notifyWin(opportunity, result, winner);
        } else {
            response = BidResponse.noBid(opportunity.getRequestId(), noBidReason(result));
        }

        if (log.isDebugEnabled()) {
            log.debug("[BID] Latency: {}ms | Candidates: {} | Status: {} | Winner: {} | Clearing: {} | Rejections: {}",
                (System.nanoTime() - startTime) / 1_000_000,
                result.getCandidatesConsidered(),
                result.getStatus(),
                result.getWinnerCampaignId().orElse("-"),
                result.getClearingPrice(),
                result.getRejections());
        }
        return response;
    }

    /**
     * Runs the auction for an already validated opportunity.
     */
    public AuctionResult auction(AdOpportunity opportunity) {
        return runAuction(opportunity).result();
    }

    private Outcome runAuction(AdOpportunity opportunity) {
        long deadlineNanos = System.nanoTime() + effectiveDeadline(opportunity).toNanos();
        Instant now = Instant.now(clock);
        Map<String, RejectionReason> rejections = new LinkedHashMap<>();

        Set<String> campaignIds = index.query(opportunity.getLocation().orElse(null), opportunity.getInterests());

        Map<String, Campaign> eligible = new LinkedHashMap<>();
        for (String campaignId : campaignIds) {
            try {
                Optional<Campaign> campaign = catalog.find(campaignId);
                if (campaign.isEmpty()) {
                    rejections.put(campaignId, RejectionReason.UNKNOWN_CAMPAIGN);
                    continue;
                }
                RejectionReason pruned = prune(opportunity, campaign.get(), now);
                if (pruned != null) {
                    rejections.put(campaignId, pruned);
                } else {
                    eligible.put(campaignId, campaign.get());
                }
            } catch (RuntimeException e) {
                log.warn("Request {}: campaign {} failed eligibility checks, dropping it",
                    opportunity.getRequestId(), campaignId, e);
                rejections.put(campaignId, RejectionReason.NOT_ELIGIBLE);
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        eligible.values().forEach(campaign -> candidates.add(Candidate.internal(campaign)));

        boolean timedOut = false;
        if (!bidSources.isEmpty() && !eligible.isEmpty()) {
            Solicitation solicitation = solicit(opportunity, eligible, deadlineNanos);
            candidates.addAll(solicitation.candidates());
            timedOut = solicitation.timedOut();
        }

        AuctionResult result = auctionEngine.run(opportunity, candidates);

        Map<String, RejectionReason> merged = new LinkedHashMap<>(rejections);
        merged.putAll(result.getRejections());
        AuctionResult.AuctionResultBuilder builder = result.toBuilder()
            .candidatesConsidered(campaignIds.size())
            .clearRejections()
            .rejections(merged);
        if (!result.isWon() && timedOut) {
            builder.status(AuctionStatus.TIMEOUT);
        }
        return new Outcome(builder.build(), eligible);
    }

    /**
     * Non-mutating eligibility checks, cheapest first.
     *
     * @return why the campaign cannot bid, or null if it can
     */
    private RejectionReason prune(AdOpportunity opportunity, Campaign campaign, Instant now) {
        if (!targetingService.matchesTargeting(campaign, opportunity, now)) {
            return RejectionReason.NOT_ELIGIBLE;
        }
        if (dedupEnabled && duplicateFilter.mightHaveShown(opportunity.getUserId(),
            DuplicateSuppressionFilter.adKey(campaign.getId(), opportunity))) {
            return RejectionReason.DUPLICATE_SUPPRESSED;
        }
        if (campaign.isFrequencyCapped()
            && !frequencyCaps.wouldAllow(opportunity.getUserId(), campaign.getId(),
                campaign.getFrequencyCap(), campaign.getFrequencyCapWindow())) {
            return RejectionReason.FREQUENCY_CAPPED;
        }
        return null;
    }

    private Solicitation solicit(AdOpportunity opportunity, Map<String, Campaign> eligible, long deadlineNanos) {
        Map<BidSource, Future<List<ExternalBid>>> pending = new LinkedHashMap<>();
        for (BidSource source : bidSources) {
            try {
                pending.put(source, bidSourceExecutor.submit(() -> source.requestBids(opportunity)));
            } catch (RejectedExecutionException e) {
                log.warn("Request {}: bid source {} skipped, executor saturated", opportunity.getRequestId(), source.id());
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        boolean timedOut = false;
        for (Map.Entry<BidSource, Future<List<ExternalBid>>> entry : pending.entrySet()) {
            String sourceId = entry.getKey().id();
            Future<List<ExternalBid>> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                List<ExternalBid> bids = future.get(remaining, TimeUnit.NANOSECONDS);
                if (bids != null) {
                    bids.forEach(bid -> toCandidate(opportunity, sourceId, bid, eligible).ifPresent(candidates::add));
                }
            } catch (TimeoutException e) {
                timedOut = true;
                future.cancel(true);
                log.debug("Request {}: bid source {} missed the deadline", opportunity.getRequestId(), sourceId);
            } catch (ExecutionException e) {
                log.warn("Request {}: bid source {} failed: {}",
                    opportunity.getRequestId(), sourceId, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                break;
            }
        }
        return new Solicitation(candidates, timedOut);
    }

    private Optional<Candidate> toCandidate(AdOpportunity opportunity, String sourceId, ExternalBid bid,
                                            Map<String, Campaign> eligible) {
        Campaign campaign = bid == null ? null : eligible.get(bid.getCampaignId());
        if (campaign == null) {
            log.debug("Request {}: bid from {} for unknown or ineligible campaign ignored",
                opportunity.getRequestId(), sourceId);
            return Optional.empty();
        }
        ExternalBid attributed = sourceId.equals(bid.getSourceId()) ? bid : ExternalBid.builder()
            .sourceId(sourceId)
            .campaignId(bid.getCampaignId())
            .price(bid.getPrice())
            .adm(bid.getAdm())
            .build();
        return Optional.of(Candidate.external(campaign, attributed));
    }

    private Duration effectiveDeadline(AdOpportunity opportunity) {
        return opportunity.getTmax()
            .filter(tmax -> tmax.compareTo(deadline) < 0)
            .orElse(deadline);
    }

    private static BidResponse.NoBidReason noBidReason(AuctionResult result) {
        if (result.getStatus() == AuctionStatus.TIMEOUT) {
            return BidResponse.NoBidReason.TIMEOUT;
        }
        return result.getCandidatesConsidered() == 0
            ? BidResponse.NoBidReason.UNMATCHED_USER
            : BidResponse.NoBidReason.NO_ELIGIBLE_BID;
    }

    /**
     * Build OpenRTB bid response for a committed win
     */
    private BidResponse buildBidResponse(AdOpportunity opportunity, AuctionResult result, Campaign campaign) {
        Bid winningBid = result.getWinningBid();
        Optional<Creative> creative = creativeSelector.select(opportunity.getRequestId(), campaign.getCreatives());

        BidResponse.Bid bid = BidResponse.Bid.builder()
            .id(winningBid.getBidId())
            .impressionId(opportunity.getImpressionId())
            .price(result.getClearingPrice())
            .campaignId(campaign.getId())
            .creativeId(creative.map(Creative::getId).orElse(null))
            .adm(winningBid.getAdm() != null ? winningBid.getAdm() : creative.map(Creative::getAdm).orElse(null))
            .w(creative.map(Creative::getW).orElse(opportunity.getWidth()))
            .h(creative.map(Creative::getH).orElse(opportunity.getHeight()))
            .build();

        BidResponse.SeatBid seatBid = BidResponse.SeatBid.builder()
            .bids(List.of(bid))
            .seat(winningBid.getSeat())
            .build();

        return BidResponse.builder()
            .id(opportunity.getRequestId())
            .seatBids(List.of(seatBid))
            .currency(currency)
            .build();
    }

    private void notifyWin(AdOpportunity opportunity, AuctionResult result, Campaign campaign) {
        try {
            winNotifier.notifyWin(campaign, WinNotification.builder()
                .auctionId(result.getAuctionId())
                .bidId(result.getWinningBid().getBidId())
                .winningPrice(result.getClearingPrice())
                .impressionId(opportunity.getImpressionId())
                .build());
        } catch (RuntimeException e) {
            log.warn("[WIN] Notification for auction {} not sent: {}", result.getAuctionId(), e.getMessage());
        }
    }

    private record Outcome(AuctionResult result, Map<String, Campaign> eligible) {
    }

    private record Solicitation(List<Candidate> candidates, boolean timedOut) {
    }
}
