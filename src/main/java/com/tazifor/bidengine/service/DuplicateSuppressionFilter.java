package com.tazifor.bidengine.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import com.tazifor.bidengine.model.AdOpportunity;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * DuplicateSuppressionFilter - cheap "was this ad already served for this opportunity?" test
 *
 * One Bloom filter per user. Guava sizes it from the expected item count {@code n} and the
 * target false positive rate {@code p}:
 * <pre>
 *   m = -(n * ln p) / (ln 2)^2     bits
 *   k = (m / n) * ln 2             hash functions
 * </pre>
 *
 * A recorded key is always reported (no false negatives); an unseen key is reported with
 * probability about {@code p}. The filter therefore only over-suppresses, and the frequency cap
 * stays the authoritative limiter. Entries are never removed individually: a user's filter
 * is dropped {@code rotation} after it was created and the next record starts a fresh one.
 *
 * Ad keys come from {@link #adKey}: campaign plus opportunity (request and impression id). A
 * redelivered opportunity does not win the same campaign twice, while new opportunities for
 * the same user are left to the frequency cap.
 */
@Slf4j
public class DuplicateSuppressionFilter {

    private final int expectedItemsPerUser;
    private final double falsePositiveRate;
    private final Cache<String, BloomFilter<CharSequence>> filtersByUser;

    public DuplicateSuppressionFilter(int expectedItemsPerUser, double falsePositiveRate,
                                      Duration rotation, long maxUsers) {
        if (expectedItemsPerUser < 1) {
            throw new IllegalArgumentException("expectedItemsPerUser must be >= 1");
        }
        if (falsePositiveRate <= 0.0 || falsePositiveRate >= 1.0) {
            throw new IllegalArgumentException("falsePositiveRate must be in (0, 1)");
        }
        this.expectedItemsPerUser = expectedItemsPerUser;
        this.falsePositiveRate = falsePositiveRate;
        this.filtersByUser = Caffeine.newBuilder()
            .expireAfterWrite(rotation)
            .maximumSize(maxUsers)
            .build();

        log.info("Duplicate filter sized for {} items/user at p={}: {} bits, {} hashes, rotation {}",
            expectedItemsPerUser, falsePositiveRate,
            optimalNumOfBits(expectedItemsPerUser, falsePositiveRate),
            optimalNumOfHashFunctions(expectedItemsPerUser, optimalNumOfBits(expectedItemsPerUser, falsePositiveRate)),
            rotation);
    }

    public static String adKey(String campaignId, AdOpportunity opportunity) {
        return campaignId + '|' + opportunity.getRequestId() + '|' + opportunity.getImpressionId();
    }

    public boolean mightHaveShown(String userId, String adKey) {
        BloomFilter<CharSequence> filter = filtersByUser.getIfPresent(userId);
        return filter != null && filter.mightContain(adKey);
    }

    public void recordShown(String userId, String adKey) {
        filtersByUser.get(userId, this::newFilter).put(adKey);
    }

    private BloomFilter<CharSequence> newFilter(String userId) {
        return BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8),
            expectedItemsPerUser, falsePositiveRate);
    }

    static long optimalNumOfBits(long n, double p) {
        return (long) Math.ceil(-n * Math.log(p) / (Math.log(2) * Math.log(2)));
    }

    static int optimalNumOfHashFunctions(long n, long m) {
        return Math.max(1, (int) Math.round((double) m / n * Math.log(2)));
    }
}
