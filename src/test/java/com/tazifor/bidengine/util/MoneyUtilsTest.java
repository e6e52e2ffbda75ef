package com.tazifor.bidengine.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

public class MoneyUtilsTest {

    @Test
    public void toMicrosShouldScaleToSixDecimals() {
        assertThat(MoneyUtils.toMicros(new BigDecimal("1.25"))).isEqualTo(1_250_000L);
        assertThat(MoneyUtils.toMicros(new BigDecimal("0.0000005"))).isEqualTo(1L);
        assertThat(MoneyUtils.toMicros(null)).isZero();
    }

    @Test
    public void fromMicrosShouldStripTrailingZeros() {
        assertThat(MoneyUtils.fromMicros(91_000_000L)).isEqualByComparingTo("91");
        assertThat(MoneyUtils.fromMicros(10_000L).toPlainString()).isEqualTo("0.01");
    }
}
