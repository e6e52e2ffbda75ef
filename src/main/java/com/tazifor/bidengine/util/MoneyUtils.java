package com.tazifor.bidengine.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Ledger amounts are kept as whole micro units (1/1,000,000 of the currency) so that they
 * fit atomic long counters.
 */
public final class MoneyUtils {

    private static final int MICROS_SCALE = 6;

    private MoneyUtils() {}

    public static long toMicros(BigDecimal amount) {
        if (amount == null) return 0L;
        return amount.setScale(MICROS_SCALE, RoundingMode.HALF_UP).movePointRight(MICROS_SCALE).longValueExact();
    }

    public static BigDecimal fromMicros(long micros) {
        return BigDecimal.valueOf(micros, MICROS_SCALE).stripTrailingZeros();
    }
}
