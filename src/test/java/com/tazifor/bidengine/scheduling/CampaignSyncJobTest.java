package com.tazifor.bidengine.scheduling;

import com.tazifor.bidengine.service.BudgetLedger;
import com.tazifor.bidengine.service.CampaignCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class CampaignSyncJobTest {

    @Mock
    private CampaignCatalog catalog;

    @Mock
    private BudgetLedger budgetLedger;

    private CampaignSyncJob target;

    @BeforeEach
    public void setUp() {
        target = new CampaignSyncJob(catalog, budgetLedger);
    }

    @Test
    public void refreshCampaignsShouldReloadCatalogWithoutThrowing() {
        // when
        target.refreshCampaigns();

        // then
        verify(catalog).refreshQuietly();
        verifyNoInteractions(budgetLedger);
    }

    @Test
    public void resetDailyBudgetsShouldResetLedger() {
        // when
        target.resetDailyBudgets();

        // then
        verify(budgetLedger).resetDaily();
    }
}
