package com.tazifor.bidengine.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.bidengine.model.Campaign;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Campaign replicas held in memory, optionally seeded from a JSON array of campaigns.
 */
@Slf4j
public class InMemoryCampaignRepository implements CampaignRepository {

    private final Map<String, Campaign> campaigns = new ConcurrentHashMap<>();

    public InMemoryCampaignRepository() {
    }

    public InMemoryCampaignRepository(ObjectMapper objectMapper, Resource seed) {
        try (InputStream in = seed.getInputStream()) {
            List<Campaign> loaded = objectMapper.readValue(in, new TypeReference<List<Campaign>>() {
            });
            loaded.forEach(this::save);
            log.info("[INIT] Seeded {} campaigns from {}", loaded.size(), seed.getDescription());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read campaign seed " + seed.getDescription(), e);
        }
    }

    @Override
    public Collection<Campaign> findAll() {
        return new ArrayList<>(campaigns.values());
    }

    public Optional<Campaign> findById(String id) {
        return Optional.ofNullable(campaigns.get(id));
    }

    public void save(Campaign campaign) {
        if (campaign.getId() == null || campaign.getId().isBlank()) {
            throw new IllegalArgumentException("Campaign id is required");
        }
        campaigns.put(campaign.getId(), campaign);
    }

    public void delete(String id) {
        campaigns.remove(id);
    }
}
