package com.tazifor.bidengine.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Budget Statistics DTO
 *
 * USED FOR: Monitoring endpoints and tests
 */
@Value
@Builder
public class BudgetStats {
    String campaignId;
    BigDecimal dailyBudget;
    BigDecimal todaySpend;
    BigDecimal totalBudget;
    BigDecimal currentSpend;

    public BigDecimal getRemainingDailyBudget() {
        return remaining(todaySpend, dailyBudget);
    }

    public BigDecimal getRemainingBudget() {
        return remaining(currentSpend, totalBudget);
    }

    private static BigDecimal remaining(BigDecimal spent, BigDecimal budget) {
        if (budget == null) return null;
        if (spent == null) spent = BigDecimal.ZERO;
        return budget.subtract(spent).max(BigDecimal.ZERO);
    }
}
