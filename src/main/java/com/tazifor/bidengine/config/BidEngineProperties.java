package com.tazifor.bidengine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Typed view of the {@code bidengine.*} section of {@code application.yml}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bidengine")
public class BidEngineProperties {

    /**
     * Where campaign replicas and budgets live: {@code memory} or {@code aerospike}
     */
    @NotNull
    private Store store = Store.MEMORY;

    @Valid
    private Index index = new Index();

    @Valid
    private Auction auction = new Auction();

    @Valid
    private Scorer scorer = new Scorer();

    @Valid
    private Orchestrator orchestrator = new Orchestrator();

    @Valid
    private Dedup dedup = new Dedup();

    @Valid
    private Campaigns campaigns = new Campaigns();

    @Valid
    private Notifier notifier = new Notifier();

    public enum Store {
        MEMORY,
        AEROSPIKE
    }

    public enum TilerType {
        RECT,
        H3
    }

    public enum OverflowPolicy {
        REJECT_NEW,
        DROP_OLDEST
    }

    @Data
    public static class Index {
        @NotNull
        private TilerType tiler = TilerType.RECT;

        /** Rectangular cell size in degrees (~11km at 0.1). */
        @DecimalMin(value = "0.0", inclusive = false)
        private double cellSizeDegrees = 0.1;

        @Min(0)
        private int h3Resolution = 5;

        /** Zones covering more cells than this demote their campaign to the global bucket. */
        @Min(1)
        private int maxCellsPerZone = 64;
    }

    @Data
    public static class Auction {
        /** Minimal currency unit added to the runner-up price. */
        @NotNull
        @DecimalMin("0.0")
        private BigDecimal priceIncrement = new BigDecimal("0.01");

        /** Commit retries on the next-ranked bid after a lost budget race. */
        @Min(0)
        private int maxCascades = 3;

        @NotNull
        private String currency = "USD";
    }

    @Data
    public static class Scorer {
        /** Added to the interest weight for every shared interest. */
        @DecimalMin("0.0")
        private double interestMatchWeight = 0.1;

        @DecimalMin("0.0")
        private double maxInterestWeight = 1.0;

        /** Bonus at the exact zone center, decaying linearly to zero at the radius. */
        @DecimalMin("0.0")
        private double maxProximityBonus = 0.5;
    }

    @Data
    public static class Orchestrator {
        /** Hard deadline for external bid sources; request tmax may shorten it. */
        @NotNull
        private Duration deadline = Duration.ofMillis(100);

        /** Longest the bid endpoint waits for a queued auction before answering with a timeout no-bid. */
        @NotNull
        private Duration responseTimeout = Duration.ofMillis(250);

        @Min(1)
        private int workerThreads = Runtime.getRuntime().availableProcessors();

        @Min(1)
        private int queueCapacity = 1_000;

        @NotNull
        private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT_NEW;

        @Min(1)
        private int bidSourceThreads = 16;
    }

    @Data
    public static class Dedup {
        private boolean enabled = true;

        @Min(1)
        private int expectedItemsPerUser = 100;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double falsePositiveRate = 0.01;

        /** Lifetime of a user's filter before it is rebuilt empty. */
        @NotNull
        private Duration rotation = Duration.ofMinutes(10);

        @Min(1)
        private long maxUsers = 1_000_000;
    }

    @Data
    public static class Campaigns {
        /** Classpath or file resource with campaign replicas for the in-memory store. */
        private String seedLocation;

        @NotNull
        private Duration refreshInterval = Duration.ofSeconds(60);

        /** Cron for the daily budget reset; "-" leaves the reset to an external trigger. */
        @NotNull
        private String dailyResetCron = "-";
    }

    @Data
    public static class Notifier {
        private boolean enabled = true;

        @NotNull
        private Duration timeout = Duration.ofSeconds(2);
    }
}
