package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process budget ledger.
 *
 * Each campaign owns one {@link AtomicReference} to an immutable {@link Balance}. A reservation
 * reads the balance, checks both caps against the projected spend and publishes the new balance
 * with a compare-and-set; if another thread won the race the loop re-reads and re-checks.
 *
 * <pre>
 *   T1: read (99.50) → check 100.00 ok → CAS 99.50→100.00  ✓
 *   T2: read (99.50) → check 100.00 ok → CAS 99.50→100.00  ✗ (balance changed)
 *   T2: read (100.00) → check 100.50 > 100.00            → false, nothing written
 * </pre>
 */
@Slf4j
public class InMemoryBudgetLedger implements BudgetLedger {

    private static final long UNLIMITED = Long.MAX_VALUE;

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();

    @Override
    public void register(Campaign campaign) {
        long dailyCap = capOf(campaign.getDailyBudget());
        long totalCap = capOf(campaign.getTotalBudget());

        accounts.compute(campaign.getId(), (id, existing) -> {
            if (existing != null) {
                existing.dailyCap = dailyCap;
                existing.totalCap = totalCap;
                return existing;
            }
            Balance seed = new Balance(
                MoneyUtils.toMicros(campaign.getTodaySpend()),
                MoneyUtils.toMicros(campaign.getCurrentSpend()));
            return new Account(dailyCap, totalCap, seed);
        });
    }

    @Override
    public boolean tryReserve(String campaignId, BigDecimal amount) {
        long micros = requireNonNegative(amount);
        Account account = accounts.get(campaignId);
        if (account == null) {
            log.warn("Budget reservation for unknown campaign {}", campaignId);
            return false;
        }

        while (true) {
            Balance current = account.balance.get();
            long today = current.todayMicros() + micros;
            long total = current.totalMicros() + micros;

            if (today > account.dailyCap || total > account.totalCap) {
                return false;
            }
            if (account.balance.compareAndSet(current, new Balance(today, total))) {
                return true;
            }
        }
    }

    @Override
    public void release(String campaignId, BigDecimal amount) {
        long micros = requireNonNegative(amount);
        Account account = accounts.get(campaignId);
        if (account == null) {
            return;
        }
        account.balance.updateAndGet(current -> new Balance(
            Math.max(0L, current.todayMicros() - micros),
            Math.max(0L, current.totalMicros() - micros)));
    }

    @Override
    public void resetDaily() {
        accounts.values().forEach(account ->
            account.balance.updateAndGet(current -> new Balance(0L, current.totalMicros())));
        log.info("[BUDGET] Daily spend reset for {} campaigns", accounts.size());
    }

    @Override
    public Optional<BudgetStats> stats(String campaignId) {
        Account account = accounts.get(campaignId);
        if (account == null) {
            return Optional.empty();
        }
        Balance balance = account.balance.get();
        return Optional.of(BudgetStats.builder()
            .campaignId(campaignId)
            .dailyBudget(amountOf(account.dailyCap))
            .todaySpend(MoneyUtils.fromMicros(balance.todayMicros()))
            .totalBudget(amountOf(account.totalCap))
            .currentSpend(MoneyUtils.fromMicros(balance.totalMicros()))
            .build());
    }

    private static long capOf(BigDecimal budget) {
        return budget == null ? UNLIMITED : MoneyUtils.toMicros(budget);
    }

    private static BigDecimal amountOf(long cap) {
        return cap == UNLIMITED ? null : MoneyUtils.fromMicros(cap);
    }

    private static long requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got: " + amount);
        }
        return MoneyUtils.toMicros(amount);
    }

    private record Balance(long todayMicros, long totalMicros) {
    }

    private static final class Account {
        volatile long dailyCap;
        volatile long totalCap;
        final AtomicReference<Balance> balance;

        Account(long dailyCap, long totalCap, Balance seed) {
            this.dailyCap = dailyCap;
            this.totalCap = totalCap;
            this.balance = new AtomicReference<>(seed);
        }
    }
}
