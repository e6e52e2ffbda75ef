package com.tazifor.bidengine.service;

import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.util.Geo;
import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.TargetZone;

import java.math.BigDecimal;
import java.util.Set;

/**
 * BidScorer - ranks candidates for the auction
 *
 * <pre>
 *   score = base_bid
 *         × (1 + interest_overlap_weight)
 *         × (1 + proximity_bonus)
 *         × predicted_value
 *
 *   interest_overlap_weight = min(maxInterestWeight, interestMatchWeight × |shared interests|)
 *   proximity_bonus         = maxProximityBonus × (1 − d / r)   nearest zone containing the point
 *                           = 0                                  outside every zone
 * </pre>
 *
 * The scorer holds no mutable state; identical inputs always give identical scores.
 */
public class BidScorer {

    private final double interestMatchWeight;
    private final double maxInterestWeight;
    private final double maxProximityBonus;
    private final ValuePredictor valuePredictor;

    public BidScorer(double interestMatchWeight, double maxInterestWeight, double maxProximityBonus,
                     ValuePredictor valuePredictor) {
        this.interestMatchWeight = interestMatchWeight;
        this.maxInterestWeight = maxInterestWeight;
        this.maxProximityBonus = maxProximityBonus;
        this.valuePredictor = valuePredictor;
    }

    public double score(AdOpportunity opportunity, Campaign campaign) {
        return score(opportunity, campaign, campaign.getBidPrice());
    }

    /**
     * Scores a campaign bidding {@code basePrice}, which differs from the campaign's own price
     * when an external source priced the bid.
     *
     * @throws IllegalStateException if the value predictor returns a negative or non-finite value
     */
    public double score(AdOpportunity opportunity, Campaign campaign, BigDecimal basePrice) {
        double predicted = valuePredictor.predict(opportunity, campaign);
        if (!Double.isFinite(predicted) || predicted < 0) {
            throw new IllegalStateException("Predictor returned " + predicted + " for campaign " + campaign.getId());
        }

        return basePrice.doubleValue()
            * (1 + interestOverlapWeight(opportunity.getInterests(), campaign.getTargetInterests()))
            * (1 + proximityBonus(opportunity.getLocation().orElse(null), campaign))
            * predicted;
    }

    double interestOverlapWeight(Set<String> requestInterests, Set<String> campaignInterests) {
        if (requestInterests.isEmpty() || campaignInterests.isEmpty()) {
            return 0.0;
        }
        long shared = campaignInterests.stream()
            .map(CampaignIndex::normalize)
            .distinct()
            .filter(requestInterests::contains)
            .count();
        return Math.min(maxInterestWeight, interestMatchWeight * shared);
    }

    double proximityBonus(LatLon location, Campaign campaign) {
        if (location == null) {
            return 0.0;
        }

        double nearest = Double.MAX_VALUE;
        double bonus = 0.0;
        for (TargetZone zone : campaign.getTargetZones()) {
            double distance = Geo.distanceMeters(location, zone.center());
            if (distance > zone.radiusMeters() || distance >= nearest) {
                continue;
            }
            nearest = distance;
            bonus = zone.radiusMeters() > 0
                ? maxProximityBonus * (1.0 - distance / zone.radiusMeters())
                : maxProximityBonus;
        }
        return bonus;
    }
}
