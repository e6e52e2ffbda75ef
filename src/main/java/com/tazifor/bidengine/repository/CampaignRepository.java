package com.tazifor.bidengine.repository;

import com.tazifor.bidengine.model.Campaign;

import java.util.Collection;

/**
 * Read replica of the campaign-management system.
 */
public interface CampaignRepository {

    /**
     * Full snapshot of every campaign currently known, active or not.
     */
    Collection<Campaign> findAll();
}
