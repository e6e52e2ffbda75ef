package com.tazifor.bidengine.service;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Budget ledger backed by Aerospike, for deployments where several bidder instances spend
 * from the same campaigns.
 *
 * One record per campaign in the {@code budgets} set, amounts in micros:
 * <pre>
 *   todaySpend | currentSpend | dailyBudget | totalBudget   (-1 = no cap)
 * </pre>
 *
 * <h3>Atomicity</h3>
 * A reservation reads the record, checks the caps against the projected spend, then writes the
 * increments with {@link GenerationPolicy#EXPECT_GEN_EQUAL}. Aerospike rejects the write if any
 * other client modified the record since the read, in which case the reservation is re-evaluated
 * from a fresh read. The write is never applied on top of a balance that was not checked.
 */
@Slf4j
public class AerospikeBudgetLedger implements BudgetLedger {

    static final String BUDGET_SET = "budgets";
    static final String TODAY_SPEND = "todaySpend";
    static final String CURRENT_SPEND = "currentSpend";
    static final String DAILY_BUDGET = "dailyBudget";
    static final String TOTAL_BUDGET = "totalBudget";

    private static final long NO_CAP = -1L;
    private static final int MAX_GENERATION_RETRIES = 5;

    private final AerospikeClient client;
    private final WritePolicy budgetWritePolicy;
    private final String namespace;

    public AerospikeBudgetLedger(AerospikeClient client, WritePolicy budgetWritePolicy, String namespace) {
        this.client = client;
        this.budgetWritePolicy = budgetWritePolicy;
        this.namespace = namespace;
    }

    @Override
    public void register(Campaign campaign) {
        Key key = key(campaign.getId());

        WritePolicy createOnly = new WritePolicy(budgetWritePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(createOnly, key,
                new Bin(TODAY_SPEND, MoneyUtils.toMicros(campaign.getTodaySpend())),
                new Bin(CURRENT_SPEND, MoneyUtils.toMicros(campaign.getCurrentSpend())));
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                throw e;
            }
        }

        client.put(budgetWritePolicy, key,
            new Bin(DAILY_BUDGET, capOf(campaign.getDailyBudget())),
            new Bin(TOTAL_BUDGET, capOf(campaign.getTotalBudget())));
    }

    @Override
    public boolean tryReserve(String campaignId, BigDecimal amount) {
        long micros = requireNonNegative(amount);
        Key key = key(campaignId);

        for (int attempt = 0; attempt < MAX_GENERATION_RETRIES; attempt++) {
            Record record = client.get(null, key);
            if (record == null) {
                log.warn("Budget reservation for unknown campaign {}", campaignId);
                return false;
            }

            long dailyCap = record.getLong(DAILY_BUDGET);
            long totalCap = record.getLong(TOTAL_BUDGET);
            if (exceeds(record.getLong(TODAY_SPEND) + micros, dailyCap)
                || exceeds(record.getLong(CURRENT_SPEND) + micros, totalCap)) {
                return false;
            }

            WritePolicy guarded = new WritePolicy(budgetWritePolicy);
            guarded.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            guarded.generation = record.generation;
            try {
                client.operate(guarded, key,
                    Operation.add(new Bin(TODAY_SPEND, micros)),
                    Operation.add(new Bin(CURRENT_SPEND, micros)));
                return true;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) {
                    throw e;
                }
                log.debug("Budget record {} changed concurrently, retrying ({})", campaignId, attempt + 1);
            }
        }

        log.warn("[BUDGET] Gave up reserving {} for {} after {} concurrent modifications",
            amount, campaignId, MAX_GENERATION_RETRIES);
        return false;
    }

    @Override
    public void release(String campaignId, BigDecimal amount) {
        long micros = requireNonNegative(amount);
        client.operate(budgetWritePolicy, key(campaignId),
            Operation.add(new Bin(TODAY_SPEND, -micros)),
            Operation.add(new Bin(CURRENT_SPEND, -micros)));
    }

    @Override
    public void resetDaily() {
        log.info("[BUDGET] Resetting daily budgets...");
        client.scanAll(null, namespace, BUDGET_SET, (key, record) ->
            client.put(budgetWritePolicy, key, new Bin(TODAY_SPEND, 0L)));
        log.info("[BUDGET] Daily budgets reset complete");
    }

    @Override
    public Optional<BudgetStats> stats(String campaignId) {
        Record record = client.get(null, key(campaignId));
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(BudgetStats.builder()
            .campaignId(campaignId)
            .dailyBudget(amountOf(record.getLong(DAILY_BUDGET)))
            .todaySpend(MoneyUtils.fromMicros(record.getLong(TODAY_SPEND)))
            .totalBudget(amountOf(record.getLong(TOTAL_BUDGET)))
            .currentSpend(MoneyUtils.fromMicros(record.getLong(CURRENT_SPEND)))
            .build());
    }

    private Key key(String campaignId) {
        return new Key(namespace, BUDGET_SET, campaignId);
    }

    private static boolean exceeds(long projected, long cap) {
        return cap != NO_CAP && projected > cap;
    }

    private static long capOf(BigDecimal budget) {
        return budget == null ? NO_CAP : MoneyUtils.toMicros(budget);
    }

    private static BigDecimal amountOf(long cap) {
        return cap == NO_CAP ? null : MoneyUtils.fromMicros(cap);
    }

    private static long requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got: " + amount);
        }
        return MoneyUtils.toMicros(amount);
    }
}
