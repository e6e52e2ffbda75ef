package com.tazifor.bidengine.controller;

import com.tazifor.bidengine.service.BudgetLedger;
import com.tazifor.bidengine.service.BudgetStats;
import com.tazifor.bidengine.service.CampaignCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CampaignController - budget and replica management
 *
 * <ul>
 *   <li>GET  /api/campaigns/{id}/budget - budget stats</li>
 *   <li>POST /api/campaigns/budgets/reset-daily - reset today's spend for every campaign</li>
 *   <li>POST /api/campaigns/refresh - reload campaign replicas now</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/campaigns")
public class CampaignController {

    private final BudgetLedger budgetLedger;
    private final CampaignCatalog catalog;

    public CampaignController(BudgetLedger budgetLedger, CampaignCatalog catalog) {
        this.budgetLedger = budgetLedger;
        this.catalog = catalog;
    }

    @GetMapping("/{id}/budget")
    public ResponseEntity<Map<String, Object>> getBudget(@PathVariable String id) {
        return budgetLedger.stats(id)
            .map(stats -> ResponseEntity.ok(toBody(stats)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Campaign not found")));
    }

    /**
     * Called by the external scheduler at day boundary
     */
    @PostMapping("/budgets/reset-daily")
    public ResponseEntity<Map<String, Object>> resetDaily() {
        budgetLedger.resetDaily();
        return ResponseEntity.ok(Map.of("success", true, "message", "Daily budgets reset"));
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        try {
            int loaded = catalog.refresh();
            return ResponseEntity.ok(Map.of("success", true, "campaigns", loaded));
        } catch (RuntimeException e) {
            log.error("[CACHE] Manual campaign refresh failed", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("success", false, "error", "Campaign refresh failed: " + e.getMessage()));
        }
    }

    private static Map<String, Object> toBody(BudgetStats stats) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("campaignId", stats.getCampaignId());
        body.put("currentSpend", stats.getCurrentSpend());
        body.put("totalBudget", stats.getTotalBudget());
        body.put("remainingBudget", stats.getRemainingBudget());
        body.put("totalSpentPercentage", percentage(stats.getCurrentSpend(), stats.getTotalBudget()));
        body.put("todaySpend", stats.getTodaySpend());
        body.put("dailyBudget", stats.getDailyBudget());
        body.put("remainingDailyBudget", stats.getRemainingDailyBudget());
        body.put("dailySpentPercentage", percentage(stats.getTodaySpend(), stats.getDailyBudget()));
        return body;
    }

    private static String percentage(BigDecimal spent, BigDecimal budget) {
        if (budget == null || budget.signum() <= 0 || spent == null) {
            return "0.00%";
        }
        return spent.multiply(BigDecimal.valueOf(100)).divide(budget, 2, RoundingMode.HALF_UP) + "%";
    }
}
