package com.phillippitts.streamscribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
        assertThat(TimeUtils.nanosToMillis(2_000_000_000L)).isEqualTo(2_000L);
    }

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void convertsSampleCountsAtGivenRate() {
        assertThat(TimeUtils.samplesToMillis(16_000, 16_000)).isEqualTo(1_000L);
        assertThat(TimeUtils.samplesToMillis(8_000, 16_000)).isEqualTo(500L);
        assertThat(TimeUtils.samplesToMillis(900, 16_000)).isEqualTo(56L);
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThatThrownBy(() -> TimeUtils.samplesToMillis(100, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
