package com.tazifor.bidengine.scheduling;

import com.tazifor.bidengine.service.BudgetLedger;
import com.tazifor.bidengine.service.CampaignCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled housekeeping: campaign replica polling and the optional daily budget reset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignSyncJob {

    private final CampaignCatalog catalog;
    private final BudgetLedger budgetLedger;

    @Scheduled(fixedDelayString = "${bidengine.campaigns.refresh-interval:60s}",
        initialDelayString = "${bidengine.campaigns.refresh-interval:60s}")
    public void refreshCampaigns() {
        catalog.refreshQuietly();
    }

    /**
     * Daily spend reset at the configured cron. Disabled with "-" when an external scheduler
     * calls the reset endpoint instead.
     */
    @Scheduled(cron = "${bidengine.campaigns.daily-reset-cron:-}", zone = "UTC")
    public void resetDailyBudgets() {
        log.info("[BUDGET] Scheduled daily budget reset");
        budgetLedger.resetDaily();
    }
}
