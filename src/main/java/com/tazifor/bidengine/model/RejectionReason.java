package com.tazifor.bidengine.model;

/**
 * Why a candidate campaign dropped out of an auction.
 */
public enum RejectionReason {
    UNKNOWN_CAMPAIGN,
    NOT_ELIGIBLE,
    DUPLICATE_SUPPRESSED,
    FREQUENCY_CAPPED,
    BELOW_FLOOR,
    SCORING_ERROR,
    BUDGET_EXHAUSTED,
    CASCADE_LIMIT
}
