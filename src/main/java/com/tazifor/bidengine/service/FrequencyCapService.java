package com.tazifor.bidengine.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * FrequencyCapService - per (user, campaign) exposure counting
 *
 * Each key holds the timestamps of its exposures inside a sliding window. Every operation
 * on a key runs inside {@code Map.compute}, which Caffeine executes atomically per key, so
 * the check and the increment of {@link #tryConsume} can never be split by another request
 * for the same user and campaign. Different keys never contend.
 *
 * <pre>
 *   window = 1h, cap = 3
 *
 *   t-70m   t-40m   t-10m   now
 *     x       x       x      ?     → t-70m is pruned, 2 left, exposure granted
 * </pre>
 *
 * Entries expire from memory one window after their last exposure, when they would be
 * empty anyway.
 */
public class FrequencyCapService {

    private final Clock clock;
    private final Cache<ExposureKey, ExposureLog> exposures;

    public FrequencyCapService(Clock clock) {
        this.clock = clock;
        this.exposures = Caffeine.newBuilder()
            .expireAfter(new WindowExpiry())
            .build();
    }

    /**
     * Records an exposure if the user is still under the cap.
     *
     * @return true if the exposure was recorded, false if the cap is reached (no mutation)
     */
    public boolean tryConsume(String userId, String campaignId, int cap, Duration window) {
        if (cap <= 0) {
            return false;
        }

        boolean[] granted = new boolean[1];
        exposures.asMap().compute(new ExposureKey(userId, campaignId), (key, current) -> {
            long now = clock.millis();
            ExposureLog log = current != null ? current : new ExposureLog(window);
            log.prune(now, window);
            if (log.count() < cap) {
                log.record(now, window);
                granted[0] = true;
            }
            return log.isEmpty() ? null : log;
        });
        return granted[0];
    }

    /**
     * Non-mutating check used to prune candidates before the auction. Only
     * {@link #tryConsume} is authoritative.
     */
    public boolean wouldAllow(String userId, String campaignId, int cap, Duration window) {
        if (cap <= 0) {
            return false;
        }

        int[] count = new int[1];
        exposures.asMap().computeIfPresent(new ExposureKey(userId, campaignId), (key, log) -> {
            log.prune(clock.millis(), window);
            count[0] = log.count();
            return log.isEmpty() ? null : log;
        });
        return count[0] < cap;
    }

    /**
     * Returns the most recent exposure, used when a later commit step fails after
     * {@link #tryConsume} succeeded.
     */
    public void release(String userId, String campaignId) {
        exposures.asMap().computeIfPresent(new ExposureKey(userId, campaignId), (key, log) -> {
            log.dropLatest();
            return log.isEmpty() ? null : log;
        });
    }

    public int currentCount(String userId, String campaignId, Duration window) {
        int[] count = new int[1];
        exposures.asMap().computeIfPresent(new ExposureKey(userId, campaignId), (key, log) -> {
            log.prune(clock.millis(), window);
            count[0] = log.count();
            return log.isEmpty() ? null : log;
        });
        return count[0];
    }

    private record ExposureKey(String userId, String campaignId) {
    }

    /**
     * Only ever touched inside a compute block of its own key.
     */
    private static final class ExposureLog {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private Duration window;

        ExposureLog(Duration window) {
            this.window = window;
        }

        void prune(long now, Duration window) {
            long cutoff = now - window.toMillis();
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }
        }

        void record(long now, Duration window) {
            timestamps.addLast(now);
            this.window = window;
        }

        void dropLatest() {
            timestamps.pollLast();
        }

        int count() {
            return timestamps.size();
        }

        boolean isEmpty() {
            return timestamps.isEmpty();
        }
    }

    private static final class WindowExpiry implements Expiry<ExposureKey, ExposureLog> {
        @Override
        public long expireAfterCreate(ExposureKey key, ExposureLog log, long currentTime) {
            return log.window.toNanos();
        }

        @Override
        public long expireAfterUpdate(ExposureKey key, ExposureLog log, long currentTime, long currentDuration) {
            return log.window.toNanos();
        }

        @Override
        public long expireAfterRead(ExposureKey key, ExposureLog log, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
