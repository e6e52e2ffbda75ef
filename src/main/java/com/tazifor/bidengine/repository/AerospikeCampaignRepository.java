package com.tazifor.bidengine.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.bidengine.model.Campaign;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Reads campaign replicas from the {@code campaigns} set. Each record carries the campaign as
 * JSON in its {@code data} bin.
 *
 * A record that cannot be parsed is skipped and logged; the rest of the scan continues.
 */
@Slf4j
public class AerospikeCampaignRepository implements CampaignRepository {

    static final String CAMPAIGN_SET = "campaigns";
    static final String DATA_BIN = "data";

    private final AerospikeClient client;
    private final ObjectMapper objectMapper;
    private final String namespace;
    private final int maxRecords;

    public AerospikeCampaignRepository(AerospikeClient client, ObjectMapper objectMapper, String namespace,
                                       int maxRecords) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.namespace = namespace;
        this.maxRecords = maxRecords;
    }

    @Override
    public Collection<Campaign> findAll() {
        ScanPolicy policy = new ScanPolicy();
        policy.maxRecords = maxRecords;

        List<Campaign> campaigns = Collections.synchronizedList(new ArrayList<>());
        client.scanAll(policy, namespace, CAMPAIGN_SET, (key, record) -> {
            Campaign campaign = toCampaign(record);
            if (campaign != null) {
                campaigns.add(campaign);
            }
        });
        return campaigns;
    }

    private Campaign toCampaign(Record record) {
        String json = record.getString(DATA_BIN);
        if (json == null) {
            log.warn("Campaign record without '{}' bin skipped", DATA_BIN);
            return null;
        }
        try {
            return objectMapper.readValue(json, Campaign.class);
        } catch (JsonProcessingException e) {
            log.warn("Error parsing campaign record: {}", e.getOriginalMessage());
            return null;
        }
    }
}
