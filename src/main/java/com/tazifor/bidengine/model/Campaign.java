package com.tazifor.bidengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Campaign Model
 *
 * Read replica of a campaign owned by the external campaign-management system.
 * Every field is treated as read-only by the bidding core; spend is tracked by the
 * {@code BudgetLedger}, which is seeded from {@link #todaySpend} / {@link #currentSpend}
 * when the replica is loaded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Campaign {

    // ===== Basic Info =====
    private String id;
    private String name;
    private String advertiserId;

    // ===== Status =====
    private boolean active;
    private int priority;
    private Instant startDate;
    private Instant endDate;

    // ===== Budget =====
    private BigDecimal dailyBudget;      // Daily spend cap
    private BigDecimal totalBudget;      // Optional lifetime cap
    private BigDecimal todaySpend;       // Spend at replica load time
    private BigDecimal currentSpend;     // Lifetime spend at replica load time

    // ===== Bidding =====
    private BigDecimal bidPrice;
    @Builder.Default
    private BidType bidType = BidType.CPM;

    // ===== Targeting Rules =====
    private TargetingRules targeting;

    // ===== Creatives =====
    private List<Creative> creatives;

    // ===== Frequency Capping =====
    private Integer frequencyCap;             // Max impressions per user, null = uncapped
    private Duration frequencyCapWindow;      // Trailing window for the cap

    /**
     * Owner endpoint receiving win notifications
     */
    private String notificationEndpoint;

    /**
     * Targeting Rules
     *
     * Empty or null sets mean "no restriction" for that dimension.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TargetingRules {
        private Set<String> interests;
        private Set<String> ageGroups;        // e.g. "18-24", "25-34"
        private Set<Integer> deviceTypes;     // 1=mobile, 2=PC, 3=TV, etc.
        private List<TargetZone> zones;
    }

    /**
     * Check if campaign is active and inside its flight dates
     */
    public boolean canBid(Instant now) {
        if (!active) {
            return false;
        }
        if (startDate != null && now.isBefore(startDate)) {
            return false;
        }
        if (endDate != null && now.isAfter(endDate)) {
            return false;
        }
        return bidPrice != null && bidPrice.signum() >= 0;
    }

    @JsonIgnore
    public Set<String> getTargetInterests() {
        return targeting == null || targeting.getInterests() == null ? Set.of() : targeting.getInterests();
    }

    @JsonIgnore
    public List<TargetZone> getTargetZones() {
        return targeting == null || targeting.getZones() == null ? List.of() : targeting.getZones();
    }

    @JsonIgnore
    public boolean isFrequencyCapped() {
        return frequencyCap != null && frequencyCapWindow != null;
    }
}
