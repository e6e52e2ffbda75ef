package com.tazifor.bidengine.service;

import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.util.Geo;
import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.TargetZone;

import java.time.Instant;
import java.util.Set;

/**
 * TargetingService - decides whether a candidate from the index may bid
 *
 * Checks run cheapest first and return on the first mismatch:
 * <ol>
 *   <li>status and flight dates</li>
 *   <li>age group (set lookup)</li>
 *   <li>device type (set lookup)</li>
 *   <li>geo / interest reach (distance computations)</li>
 * </ol>
 *
 * Reach: a campaign that targets zones and/or interests matches when the request lies inside
 * one of its zones <em>or</em> shares one of its interests. A campaign targeting neither runs
 * everywhere.
 */
public class TargetingService {

    public boolean matchesTargeting(Campaign campaign, AdOpportunity opportunity, Instant now) {
        if (!campaign.canBid(now)) {
            return false;
        }

        Campaign.TargetingRules targeting = campaign.getTargeting();
        if (targeting == null) {
            return true;
        }

        if (!matchesAgeGroup(targeting.getAgeGroups(), opportunity.getAgeGroup())) {
            return false;
        }

        if (!matchesDevice(targeting.getDeviceTypes(), opportunity)) {
            return false;
        }

        return matchesReach(campaign, opportunity);
    }

    private boolean matchesAgeGroup(Set<String> ageGroups, String ageGroup) {
        if (ageGroups == null || ageGroups.isEmpty()) {
            return true;
        }
        return ageGroup != null && ageGroups.contains(ageGroup);
    }

    private boolean matchesDevice(Set<Integer> deviceTypes, AdOpportunity opportunity) {
        if (deviceTypes == null || deviceTypes.isEmpty()) {
            return true;
        }
        return deviceTypes.contains(opportunity.getDeviceType().getCode());
    }

    private boolean matchesReach(Campaign campaign, AdOpportunity opportunity) {
        boolean hasZones = !campaign.getTargetZones().isEmpty();
        boolean hasInterests = !campaign.getTargetInterests().isEmpty();
        if (!hasZones && !hasInterests) {
            return true;
        }

        if (hasInterests && sharesInterest(campaign.getTargetInterests(), opportunity.getInterests())) {
            return true;
        }
        return hasZones && insideAnyZone(campaign, opportunity.getLocation().orElse(null));
    }

    private boolean sharesInterest(Set<String> campaignInterests, Set<String> requestInterests) {
        for (String interest : campaignInterests) {
            if (requestInterests.contains(CampaignIndex.normalize(interest))) {
                return true;
            }
        }
        return false;
    }

    private boolean insideAnyZone(Campaign campaign, LatLon location) {
        if (location == null) {
            return false;
        }
        for (TargetZone zone : campaign.getTargetZones()) {
            if (Geo.distanceMeters(location, zone.center()) <= zone.radiusMeters()) {
                return true;
            }
        }
        return false;
    }
}
