package com.driftguard.core.anomaly;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RollingStats}.
 */
class RollingStatsTest {

    @Test
    @DisplayName("Should keep running mean and deviation equal to a full recomputation across evictions")
    void shouldMatchDirectComputation() {
        RollingStats stats = new RollingStats(7);

        for (int i = 0; i < 53; i++) {
            stats.add(1000.0 + Math.sin(i) * 25 + (i % 4));

            double[] window = stats.values();
            assertThat(stats.mean()).isCloseTo(mean(window), within(1e-9));
            assertThat(stats.sampleStdDev()).isCloseTo(sampleStdDev(window), within(1e-9));
        }
        assertThat(stats.size()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should report exactly zero spread for a constant window")
    void shouldKeepConstantWindowAtZeroSpread() {
        RollingStats stats = new RollingStats(5);
        stats.add(3.0);
        for (int i = 0; i < 20; i++) {
            stats.add(0.1);
        }

        assertThat(stats.mean()).isCloseTo(0.1, within(1e-12));
        assertThat(stats.sampleStdDev()).isZero();
    }

    @Test
    @DisplayName("Should evict the oldest values first")
    void shouldEvictOldest() {
        RollingStats stats = new RollingStats(3);
        for (double v : new double[] {1, 2, 3, 4, 5}) {
            stats.add(v);
        }

        assertThat(stats.values()).containsExactly(3.0, 4.0, 5.0);
        assertThat(stats.last(2)).containsExactly(4.0, 5.0);
        assertThat(stats.last(10)).containsExactly(3.0, 4.0, 5.0);
        assertThat(stats.mean()).isCloseTo(4.0, within(1e-12));
    }

    @Test
    @DisplayName("Should report no mean and zero spread while too small")
    void shouldHandleSmallWindows() {
        RollingStats stats = new RollingStats(4);

        assertThat(stats.mean()).isNaN();
        stats.add(2.5);
        assertThat(stats.mean()).isEqualTo(2.5);
        assertThat(stats.sampleStdDev()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new RollingStats(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(Double.NaN);
    }

    private static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double m = mean(values);
        double sumSq = Arrays.stream(values).map(v -> (v - m) * (v - m)).sum();
        return Math.sqrt(sumSq / (values.length - 1));
    }
}
