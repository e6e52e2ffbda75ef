package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.Campaign;

/**
 * External CTR / value prediction collaborator.
 *
 * Implementations must be deterministic for a given (opportunity, campaign) pair; the returned
 * value multiplies the campaign's score.
 */
@FunctionalInterface
public interface ValuePredictor {

    ValuePredictor NEUTRAL = (opportunity, campaign) -> 1.0;

    double predict(AdOpportunity opportunity, Campaign campaign);
}
