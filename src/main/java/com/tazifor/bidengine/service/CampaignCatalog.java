package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * CampaignCatalog - the bidder's local view of campaign replicas
 *
 * <pre>
 *   CampaignRepository ──refresh()──▶ CampaignIndex.prepare(...)   nothing visible yet
 *                                  ├─▶ BudgetLedger.register(...) for every indexed campaign
 *                                  ├─▶ CampaignIndex.publish(...)
 *                                  └─▶ snapshot (id → Campaign)
 * </pre>
 *
 * Readers see an immutable snapshot swapped in atomically; a failed refresh keeps serving
 * the previous one. Campaigns missing from a new snapshot stop bidding immediately.
 * A campaign the index rejects (null interest, invalid zone) is logged and left out of the
 * snapshot while the others are served.
 */
@Slf4j
public class CampaignCatalog {

    private final CampaignRepository repository;
    private final CampaignIndex index;
    private final BudgetLedger budgetLedger;
    private final Clock clock;

    private volatile Map<String, Campaign> snapshot = Collections.emptyMap();
    private volatile Instant lastRefresh;

    public CampaignCatalog(CampaignRepository repository, CampaignIndex index, BudgetLedger budgetLedger,
                           Clock clock) {
        this.repository = repository;
        this.index = index;
        this.budgetLedger = budgetLedger;
        this.clock = clock;
    }

    /**
     * Reloads every campaign from the repository.
     *
     * @return number of campaigns now known
     */
    public synchronized int refresh() {
        long startTime = System.nanoTime();

        Collection<Campaign> campaigns = repository.findAll();
        Map<String, Campaign> loaded = new HashMap<>();
        for (Campaign campaign : campaigns) {
            if (campaign.getId() == null) {
                log.warn("[CACHE] Campaign without id skipped: {}", campaign.getName());
                continue;
            }
            loaded.put(campaign.getId(), campaign);
        }

        CampaignIndex.Generation generation = index.prepare(loaded.values());
        loaded.keySet().retainAll(generation.campaignIds());

        // a ledger failure aborts here, before the index or the snapshot change
        loaded.values().forEach(budgetLedger::register);
        index.publish(generation);
        snapshot = Collections.unmodifiableMap(loaded);
        lastRefresh = Instant.now(clock);

        log.info("[CACHE] Loaded {} campaigns in {}ms ({} tiler)",
            loaded.size(), (System.nanoTime() - startTime) / 1_000_000, index.tilerName());
        return loaded.size();
    }

    /**
     * Refresh for scheduled callers: failures are logged and the current snapshot is kept.
     */
    public void refreshQuietly() {
        try {
            refresh();
        } catch (RuntimeException e) {
            log.error("[CACHE] Campaign refresh failed, keeping {} cached campaigns", snapshot.size(), e);
        }
    }

    public Optional<Campaign> find(String campaignId) {
        return Optional.ofNullable(snapshot.get(campaignId));
    }

    public Collection<Campaign> all() {
        return snapshot.values();
    }

    public int size() {
        return snapshot.size();
    }

    public Optional<Instant> lastRefresh() {
        return Optional.ofNullable(lastRefresh);
    }
}
