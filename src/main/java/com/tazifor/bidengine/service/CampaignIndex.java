package com.tazifor.bidengine.service;

import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.model.TileKey;
import com.tazifor.bidengine.geo.spi.Tiler;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.TargetZone;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CampaignIndex - candidate retrieval by location and interests
 *
 * Three structures, all keyed by campaign id:
 * <pre>
 *   byTile      TileKey  → {campaignId}   campaigns whose zones cover the tile
 *   byInterest  interest → {campaignId}   inverted interest index
 *   global      {campaignId}              no zones, or zones too large to tile
 * </pre>
 *
 * {@link #query} returns the union of the global bucket, the request tile's posting list and
 * the posting lists of every request interest. It is a recall step only: whether a candidate
 * actually matches is decided by {@link TargetingService}.
 *
 * <h3>Copy on write</h3>
 * The structures live in an immutable {@link Generation} held in one volatile field. Writers
 * build the next generation off to the side and publish it with a single write, serialised by
 * a write lock. A query reads the field once, so it sees either the previous or the next
 * generation and never a campaign half removed.
 */
@Slf4j
public class CampaignIndex {

    private final Tiler tiler;
    private final int maxCellsPerZone;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Generation current = Generation.EMPTY;

    public CampaignIndex(Tiler tiler, int maxCellsPerZone) {
        if (maxCellsPerZone < 1) {
            throw new IllegalArgumentException("maxCellsPerZone must be >= 1");
        }
        this.tiler = tiler;
        this.maxCellsPerZone = maxCellsPerZone;
    }

    /**
     * Indexes a campaign, replacing any previous entry with the same id.
     *
     * @throws IllegalArgumentException if the campaign cannot be indexed (missing id, null
     *                                  interest, invalid zone); the index is left unchanged
     */
    public void add(Campaign campaign) {
        Postings postings = postingsFor(campaign);

        writeLock.lock();
        try {
            GenerationBuilder next = new GenerationBuilder(current);
            next.put(campaign.getId(), postings);
            current = next.build();
        } finally {
            writeLock.unlock();
        }
    }

    public void remove(String campaignId) {
        writeLock.lock();
        try {
            if (!current.postingsByCampaign.containsKey(campaignId)) {
                return;
            }
            GenerationBuilder next = new GenerationBuilder(current);
            next.remove(campaignId);
            current = next.build();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Builds, without publishing, a generation holding exactly the given campaigns. Campaigns
     * that cannot be indexed are logged and left out; see {@link Generation#campaignIds()}.
     */
    public Generation prepare(Collection<Campaign> campaigns) {
        GenerationBuilder next = new GenerationBuilder(Generation.EMPTY);
        for (Campaign campaign : campaigns) {
            try {
                next.put(campaign.getId(), postingsFor(campaign));
            } catch (RuntimeException e) {
                log.warn("[CACHE] Campaign {} not indexed: {}", campaign.getId(), e.getMessage());
            }
        }
        return next.build();
    }

    /**
     * Makes {@code generation} the content queries see. Replaces any add or remove made since
     * it was prepared.
     */
    public void publish(Generation generation) {
        writeLock.lock();
        try {
            current = generation;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces the whole index content with the given campaigns.
     *
     * @return ids of the campaigns actually indexed
     */
    public Set<String> rebuild(Collection<Campaign> campaigns) {
        Generation next = prepare(campaigns);
        publish(next);
        return next.campaignIds();
    }

    /**
     * Returns unordered candidate ids for a request.
     *
     * @param location  request location, or null when unknown (only global and interest hits)
     * @param interests request interests
     */
    public Set<String> query(LatLon location, Set<String> interests) {
        Generation generation = current;
        Set<String> out = new LinkedHashSet<>(generation.global);

        if (location != null) {
            Set<String> tileHits = generation.byTile.get(tiler.tileOf(location));
            if (tileHits != null) {
                out.addAll(tileHits);
            }
        }

        for (String interest : interests) {
            Set<String> interestHits = generation.byInterest.get(normalize(interest));
            if (interestHits != null) {
                out.addAll(interestHits);
            }
        }
        return out;
    }

    public int size() {
        return current.postingsByCampaign.size();
    }

    public boolean isGlobal(String campaignId) {
        return current.global.contains(campaignId);
    }

    public String tilerName() {
        return tiler.name();
    }

    private Postings postingsFor(Campaign campaign) {
        if (campaign.getId() == null || campaign.getId().isBlank()) {
            throw new IllegalArgumentException("campaign id is required");
        }

        Set<String> interests = new HashSet<>();
        for (String interest : campaign.getTargetInterests()) {
            if (interest == null) {
                throw new IllegalArgumentException("null target interest");
            }
            interests.add(normalize(interest));
        }

        if (campaign.getTargetZones().isEmpty()) {
            return new Postings(true, Set.of(), interests);
        }

        Set<TileKey> tiles = new HashSet<>();
        for (TargetZone zone : campaign.getTargetZones()) {
            if (zone == null || !zone.center().isValid() || zone.radiusMeters() < 0) {
                throw new IllegalArgumentException("invalid target zone " + zone);
            }
            long estimate = tiler.estimateTileCount(zone.center(), zone.radiusMeters());
            if (estimate > maxCellsPerZone) {
                log.info("Campaign {} zone radius {}m covers ~{} cells (> {}), demoting to global bucket",
                    campaign.getId(), zone.radiusMeters(), estimate, maxCellsPerZone);
                return new Postings(true, Set.of(), interests);
            }
            tiles.addAll(tiler.tilesForCircle(zone.center(), zone.radiusMeters()));
        }
        return new Postings(false, tiles, interests);
    }

    static String normalize(String interest) {
        return interest.trim().toLowerCase();
    }

    /**
     * Immutable index content. Obtained from {@link #prepare} and made visible by
     * {@link #publish}.
     */
    public static final class Generation {

        private static final Generation EMPTY = new Generation(Map.of(), Map.of(), Set.of(), Map.of());

        private final Map<TileKey, Set<String>> byTile;
        private final Map<String, Set<String>> byInterest;
        private final Set<String> global;

        /** What each campaign was filed under, so that removal touches only its own postings. */
        private final Map<String, Postings> postingsByCampaign;

        private Generation(Map<TileKey, Set<String>> byTile, Map<String, Set<String>> byInterest,
                           Set<String> global, Map<String, Postings> postingsByCampaign) {
            this.byTile = byTile;
            this.byInterest = byInterest;
            this.global = global;
            this.postingsByCampaign = postingsByCampaign;
        }

        public Set<String> campaignIds() {
            return postingsByCampaign.keySet();
        }
    }

    /**
     * Mutable copy of a generation. Posting sets shared with the source are copied on first
     * write only.
     */
    private static final class GenerationBuilder {
        private final Map<TileKey, Set<String>> byTile;
        private final Map<String, Set<String>> byInterest;
        private final Set<String> global;
        private final Map<String, Postings> postingsByCampaign;
        private final Set<TileKey> copiedTiles = new HashSet<>();
        private final Set<String> copiedInterests = new HashSet<>();

        GenerationBuilder(Generation from) {
            this.byTile = new HashMap<>(from.byTile);
            this.byInterest = new HashMap<>(from.byInterest);
            this.global = new HashSet<>(from.global);
            this.postingsByCampaign = new HashMap<>(from.postingsByCampaign);
        }

        void put(String campaignId, Postings postings) {
            remove(campaignId);

            if (postings.global()) {
                global.add(campaignId);
            }
            for (TileKey tile : postings.tiles()) {
                writable(byTile, copiedTiles, tile).add(campaignId);
            }
            for (String interest : postings.interests()) {
                writable(byInterest, copiedInterests, interest).add(campaignId);
            }
            postingsByCampaign.put(campaignId, postings);
        }

        void remove(String campaignId) {
            Postings previous = postingsByCampaign.remove(campaignId);
            if (previous == null) {
                return;
            }
            global.remove(campaignId);
            for (TileKey tile : previous.tiles()) {
                writable(byTile, copiedTiles, tile).remove(campaignId);
            }
            for (String interest : previous.interests()) {
                writable(byInterest, copiedInterests, interest).remove(campaignId);
            }
        }

        Generation build() {
            return new Generation(
                freeze(byTile, copiedTiles),
                freeze(byInterest, copiedInterests),
                Set.copyOf(global),
                Map.copyOf(postingsByCampaign));
        }

        private static <K> Set<String> writable(Map<K, Set<String>> index, Set<K> copied, K key) {
            if (copied.add(key)) {
                Set<String> existing = index.get(key);
                Set<String> mutable = existing == null ? new HashSet<>() : new HashSet<>(existing);
                index.put(key, mutable);
                return mutable;
            }
            return index.get(key);
        }

        // empty posting lists are dropped here, not on removal
        private static <K> Map<K, Set<String>> freeze(Map<K, Set<String>> index, Set<K> copied) {
            Map<K, Set<String>> frozen = new HashMap<>(index.size() * 2);
            index.forEach((key, ids) -> {
                if (!ids.isEmpty()) {
                    frozen.put(key, copied.contains(key) ? Set.copyOf(ids) : ids);
                }
            });
            return Collections.unmodifiableMap(frozen);
        }
    }

    private record Postings(boolean global, Set<TileKey> tiles, Set<String> interests) {
    }
}
