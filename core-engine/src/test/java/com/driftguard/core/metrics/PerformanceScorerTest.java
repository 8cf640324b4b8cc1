package com.driftguard.core.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PerformanceScorer}.
 */
class PerformanceScorerTest {

    @Test
    @DisplayName("Should derive throughput and per-token latency")
    void shouldDeriveRates() {
        PerformanceMetrics metrics = PerformanceScorer.score(2.0, 100, 0.95);

        assertThat(metrics.getTokensPerSecond()).hasValueSatisfying(v -> assertThat(v).isCloseTo(50.0, within(1e-9)));
        assertThat(metrics.getTimePerToken()).hasValueSatisfying(v -> assertThat(v).isCloseTo(0.02, within(1e-9)));
        assertThat(metrics.getPerformanceCategory()).isEqualTo("acceptable");
        assertThat(metrics.getConfidenceCategory()).contains("very_high");
    }

    @Test
    @DisplayName("Should categorize fast high-throughput responses as excellent")
    void shouldCategorizeExcellent() {
        assertThat(PerformanceScorer.score(0.5, 100, null).getPerformanceCategory()).isEqualTo("excellent");
        assertThat(PerformanceScorer.score(2.0, 120, null).getPerformanceCategory()).isEqualTo("good");
        assertThat(PerformanceScorer.score(20.0, 100, null).getPerformanceCategory()).isEqualTo("poor");
    }

    @Test
    @DisplayName("Should leave throughput undefined for a zero response time")
    void shouldHandleZeroResponseTime() {
        PerformanceMetrics metrics = PerformanceScorer.score(0.0, 10, 0.1);

        assertThat(metrics.getTokensPerSecond()).isEmpty();
        assertThat(metrics.getPerformanceCategory()).isEqualTo(PerformanceScorer.UNKNOWN);
        assertThat(metrics.getConfidenceCategory()).contains("very_low");
        assertThat(metrics.toFields()).containsEntry("perf_tokens_per_second", null);
    }

    @Test
    @DisplayName("Should leave per-token latency undefined for zero tokens")
    void shouldHandleZeroTokens() {
        PerformanceMetrics metrics = PerformanceScorer.score(1.0, 0, 0.3);

        assertThat(metrics.getTimePerToken()).isEmpty();
        assertThat(metrics.getPerformanceCategory()).isEqualTo("poor");
        assertThat(metrics.getConfidenceCategory()).contains("low");
    }

    @Test
    @DisplayName("Should omit the confidence category when no confidence is given")
    void shouldOmitConfidence() {
        PerformanceMetrics metrics = PerformanceScorer.score(1.0, 10, null);

        assertThat(metrics.getConfidenceScore()).isEmpty();
        assertThat(metrics.getConfidenceCategory()).isEmpty();
    }
}
