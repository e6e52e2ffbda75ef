package com.tazifor.bidengine.service;

import com.tazifor.bidengine.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class FrequencyCapServiceTest {

    private static final Duration HOUR = Duration.ofHours(1);

    private MutableClock clock;

    private FrequencyCapService target;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        target = new FrequencyCapService(clock);
    }

    @Test
    public void tryConsumeShouldGrantUpToCapWithinWindow() {
        // when
        boolean first = target.tryConsume("u1", "c1", 2, HOUR);
        boolean second = target.tryConsume("u1", "c1", 2, HOUR);
        boolean third = target.tryConsume("u1", "c1", 2, HOUR);

        // then
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(third).isFalse();
        assertThat(target.currentCount("u1", "c1", HOUR)).isEqualTo(2);
    }

    @Test
    public void tryConsumeShouldGrantAgainOnceOldestExposureLeavesWindow() {
        // given
        target.tryConsume("u1", "c1", 2, HOUR);
        clock.advance(Duration.ofMinutes(30));
        target.tryConsume("u1", "c1", 2, HOUR);

        // when
        clock.advance(Duration.ofMinutes(31));

        // then
        assertThat(target.tryConsume("u1", "c1", 2, HOUR)).isTrue();
        assertThat(target.tryConsume("u1", "c1", 2, HOUR)).isFalse();
    }

    @Test
    public void tryConsumeShouldAlwaysDenyZeroCap() {
        assertThat(target.tryConsume("u1", "c1", 0, HOUR)).isFalse();
        assertThat(target.wouldAllow("u1", "c1", 0, HOUR)).isFalse();
    }

    @Test
    public void tryConsumeShouldCountUsersAndCampaignsSeparately() {
        // given
        target.tryConsume("u1", "c1", 1, HOUR);

        // when and then
        assertThat(target.tryConsume("u2", "c1", 1, HOUR)).isTrue();
        assertThat(target.tryConsume("u1", "c2", 1, HOUR)).isTrue();
        assertThat(target.tryConsume("u1", "c1", 1, HOUR)).isFalse();
    }

    @Test
    public void wouldAllowShouldNotRecordExposure() {
        // when
        target.wouldAllow("u1", "c1", 1, HOUR);
        target.wouldAllow("u1", "c1", 1, HOUR);

        // then
        assertThat(target.currentCount("u1", "c1", HOUR)).isZero();
        assertThat(target.tryConsume("u1", "c1", 1, HOUR)).isTrue();
        assertThat(target.wouldAllow("u1", "c1", 1, HOUR)).isFalse();
    }

    @Test
    public void releaseShouldReturnTheLatestExposure() {
        // given
        target.tryConsume("u1", "c1", 1, HOUR);

        // when
        target.release("u1", "c1");

        // then
        assertThat(target.tryConsume("u1", "c1", 1, HOUR)).isTrue();
    }

    @Test
    public void concurrentTryConsumeShouldNeverExceedCap() throws InterruptedException {
        // given
        int cap = 5;
        int attempts = 200;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();

        // when
        for (int i = 0; i < attempts; i++) {
            executor.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (target.tryConsume("u1", "c1", cap, HOUR)) {
                    granted.incrementAndGet();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(granted.get()).isEqualTo(cap);
    }
}
