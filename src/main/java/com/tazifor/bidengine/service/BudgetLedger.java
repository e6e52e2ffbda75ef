package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Campaign;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Atomic spend accounting per campaign.
 *
 * Every campaign has its own balance; reservations against different campaigns never
 * contend. The invariant {@code todaySpend <= dailyBudget} (and {@code currentSpend <= totalBudget}
 * when a total budget is set) holds under any interleaving of {@link #tryReserve} calls.
 */
public interface BudgetLedger {

    /**
     * Makes a campaign known to the ledger. Caps are always updated; spend is seeded from the
     * replica only the first time the campaign is seen, so a replica refresh never rolls back
     * spend committed since.
     */
    void register(Campaign campaign);

    /**
     * Atomically adds {@code amount} to the campaign's spend if the result stays within its caps.
     *
     * @return false, with no mutation, if the campaign is unknown or a cap would be exceeded
     */
    boolean tryReserve(String campaignId, BigDecimal amount);

    /**
     * Reverses a reservation after a downstream step failed.
     */
    void release(String campaignId, BigDecimal amount);

    /**
     * Zeroes today's spend of every campaign. Triggered by the day-boundary event.
     */
    void resetDaily();

    Optional<BudgetStats> stats(String campaignId);
}
