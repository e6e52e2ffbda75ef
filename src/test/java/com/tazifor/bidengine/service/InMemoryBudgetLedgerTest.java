package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Campaign;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class InMemoryBudgetLedgerTest {

    private InMemoryBudgetLedger target;

    @BeforeEach
    public void setUp() {
        target = new InMemoryBudgetLedger();
    }

    @Test
    public void tryReserveShouldSucceedUpToDailyBudget() {
        // given
        target.register(campaign("c1", "10.00", null));

        // when and then
        assertThat(target.tryReserve("c1", new BigDecimal("6.00"))).isTrue();
        assertThat(target.tryReserve("c1", new BigDecimal("4.00"))).isTrue();
        assertThat(target.tryReserve("c1", new BigDecimal("0.01"))).isFalse();
        assertThat(target.stats("c1").orElseThrow().getTodaySpend()).isEqualByComparingTo("10");
    }

    @Test
    public void tryReserveShouldRespectTotalBudget() {
        // given
        target.register(campaign("c1", "100.00", "5.00"));

        // when and then
        assertThat(target.tryReserve("c1", new BigDecimal("5.00"))).isTrue();
        target.resetDaily();
        assertThat(target.tryReserve("c1", new BigDecimal("1.00"))).isFalse();
    }

    @Test
    public void tryReserveShouldFailForUnknownCampaign() {
        assertThat(target.tryReserve("missing", BigDecimal.ONE)).isFalse();
    }

    @Test
    public void tryReserveShouldRejectNegativeAmount() {
        // given
        target.register(campaign("c1", "10.00", null));

        // then
        assertThatIllegalArgumentException().isThrownBy(() -> target.tryReserve("c1", new BigDecimal("-1")));
    }

    @Test
    public void registerShouldSeedSpendOnlyOnFirstSight() {
        // given
        Campaign campaign = campaign("c1", "10.00", null).toBuilder().todaySpend(new BigDecimal("3.00")).build();
        target.register(campaign);
        target.tryReserve("c1", new BigDecimal("2.00"));

        // when
        target.register(campaign.toBuilder().dailyBudget(new BigDecimal("20.00")).build());

        // then
        BudgetStats stats = target.stats("c1").orElseThrow();
        assertThat(stats.getTodaySpend()).isEqualByComparingTo("5");
        assertThat(stats.getDailyBudget()).isEqualByComparingTo("20");
        assertThat(stats.getRemainingDailyBudget()).isEqualByComparingTo("15");
    }

    @Test
    public void releaseShouldReturnReservedAmount() {
        // given
        target.register(campaign("c1", "1.00", null));
        target.tryReserve("c1", BigDecimal.ONE);

        // when
        target.release("c1", BigDecimal.ONE);

        // then
        assertThat(target.tryReserve("c1", BigDecimal.ONE)).isTrue();
    }

    @Test
    public void resetDailyShouldKeepLifetimeSpend() {
        // given
        target.register(campaign("c1", "1.00", null));
        target.tryReserve("c1", BigDecimal.ONE);

        // when
        target.resetDaily();

        // then
        BudgetStats stats = target.stats("c1").orElseThrow();
        assertThat(stats.getTodaySpend()).isEqualByComparingTo("0");
        assertThat(stats.getCurrentSpend()).isEqualByComparingTo("1");
    }

    @Test
    public void concurrentReservationsShouldNeverOverspend() throws InterruptedException {
        // given
        target.register(campaign("c1", "100.00", null));
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        BigDecimal price = new BigDecimal("0.30");

        // when
        for (int i = 0; i < 1_000; i++) {
            executor.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (target.tryReserve("c1", price)) {
                    granted.incrementAndGet();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(granted.get()).isEqualTo(333);
        BudgetStats stats = target.stats("c1").orElseThrow();
        assertThat(stats.getTodaySpend()).isLessThanOrEqualTo(new BigDecimal("100.00"));
        assertThat(stats.getTodaySpend()).isEqualByComparingTo("99.9");
    }

    private static Campaign campaign(String id, String dailyBudget, String totalBudget) {
        return Campaign.builder()
            .id(id)
            .active(true)
            .bidPrice(BigDecimal.ONE)
            .dailyBudget(new BigDecimal(dailyBudget))
            .totalBudget(totalBudget != null ? new BigDecimal(totalBudget) : null)
            .build();
    }
}
