package com.phillippitts.presetgraph.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void sleepQuietlySkipsNonPositiveDelay() {
        assertThat(TimeUtils.sleepQuietly(0)).isTrue();
        assertThat(TimeUtils.sleepQuietly(-5)).isTrue();
    }

    @Test
    void sleepQuietlyReportsInterrupt() {
        Thread.currentThread().interrupt();
        try {
            assertThat(TimeUtils.sleepQuietly(50)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
