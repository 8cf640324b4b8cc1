package com.driftguard.core.anomaly;

import com.driftguard.core.config.AnomalySettings;
import com.driftguard.core.model.FieldAnomaly;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the individual {@link AnomalyStrategy} implementations.
 */
class AnomalyStrategyTest {

    private static final String FIELD = "response_time";

    @Test
    @DisplayName("Should interpolate quantiles linearly")
    void shouldInterpolateQuantiles() {
        double[] sorted = {1, 2, 3, 4};

        assertThat(IqrStrategy.quantile(sorted, 0.25)).isCloseTo(1.75, within(1e-9));
        assertThat(IqrStrategy.quantile(sorted, 0.75)).isCloseTo(3.25, within(1e-9));
        assertThat(IqrStrategy.quantile(new double[0], 0.5)).isNaN();
    }

    @Test
    @DisplayName("Should flag values outside the IQR fences only")
    void shouldFlagOutsideFences() {
        Map<String, RollingStats> windows = windowOf(1, 2, 3, 4, 5, 6, 7, 8);
        IqrStrategy strategy = new IqrStrategy(1.5);

        FieldAnomaly inside = strategy.evaluate(context(8.0, windows)).get(0);
        FieldAnomaly outside = strategy.evaluate(context(20.0, windows)).get(0);

        assertThat(inside.isAnomalous()).isFalse();
        assertThat(inside.getScore()).isZero();
        assertThat(outside.isAnomalous()).isTrue();
        // q1 = 2.75, q3 = 6.25, iqr = 3.5, upper fence = 11.5
        assertThat(outside.getScore()).isCloseTo((20.0 - 11.5) / 3.5, within(1e-9));
    }

    @Test
    @DisplayName("Should skip IQR until the window holds minSamples values")
    void shouldSkipIqrWithoutHistory() {
        Map<String, RollingStats> windows = windowOf(1, 2);

        assertThat(new IqrStrategy(1.5).evaluate(context(100.0, windows))).isEmpty();
    }

    @Test
    @DisplayName("Should score a value on the fitted trend as normal")
    void shouldAcceptValueOnTrend() {
        Map<String, RollingStats> windows = windowOf(1.0, 2.1, 2.9, 4.0, 5.1);
        TrendStrategy strategy = new TrendStrategy(5);

        FieldAnomaly onTrend = strategy.evaluate(context(6.0, windows)).get(0);
        FieldAnomaly offTrend = strategy.evaluate(context(1.0, windows)).get(0);

        assertThat(onTrend.isAnomalous()).isFalse();
        assertThat(offTrend.isAnomalous()).isTrue();
        assertThat((Double) onTrend.getAnalysis().get("slope")).isCloseTo(1.01, within(1e-9));
    }

    @Test
    @DisplayName("Should apply the zero-spread rule to a perfectly linear trend")
    void shouldHandlePerfectLine() {
        Map<String, RollingStats> windows = windowOf(1, 2, 3, 4, 5);
        TrendStrategy strategy = new TrendStrategy(5);

        assertThat(strategy.evaluate(context(6.0, windows)).get(0).getScore()).isZero();
        assertThat(strategy.evaluate(context(6.5, windows)).get(0).getScore())
                .isEqualTo(AnomalyStrategy.ZERO_SPREAD_SCORE);
    }

    @Test
    @DisplayName("Should reject a trend window shorter than three")
    void shouldRejectShortTrendWindow() {
        assertThatThrownBy(() -> new TrendStrategy(2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trendWindow");
    }

    @Test
    @DisplayName("Should combine standardized distances as root mean square")
    void shouldCombineFieldsInIsolation() {
        Map<String, RollingStats> windows = new HashMap<>();
        windows.putAll(windowOf(FIELD, 1, 3));
        windows.putAll(windowOf("token_count", 10, 30));
        Map<String, Double> values = Map.of(FIELD, 2.0 + 3 * Math.sqrt(2), "token_count", 20.0);
        AnomalyContext context = new AnomalyContext("m1", values, windows, null, 2.0, 2);

        FieldAnomaly result = new IsolationStrategy().evaluate(context).get(0);

        // distances 3 and 0
        assertThat(result.getField()).isEqualTo(IsolationStrategy.FIELD);
        assertThat(result.getScore()).isCloseTo(Math.sqrt(4.5), within(1e-9));
        assertThat(result.isAnomalous()).isTrue();
    }

    @Test
    @DisplayName("Should build one strategy per method and four for 'all'")
    void shouldCreateStrategies() {
        AnomalySettings settings = new AnomalySettings();

        assertThat(AnomalyStrategyFactory.create(AnomalyMethod.IQR, settings))
                .singleElement()
                .isInstanceOf(IqrStrategy.class);
        assertThat(AnomalyStrategyFactory.create(AnomalyMethod.ALL, settings))
                .extracting(AnomalyStrategy::getMethodName)
                .containsExactly("zscore", "iqr", "isolation", "trend");
    }

    @Test
    @DisplayName("Should reject an unknown method name")
    void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> AnomalyMethod.fromName("magic"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown anomaly method");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyContext context(double value, Map<String, RollingStats> windows) {
        return new AnomalyContext("m1", Map.of(FIELD, value), windows, null, 2.0, 3);
    }

    private static Map<String, RollingStats> windowOf(double... values) {
        return windowOf(FIELD, values);
    }

    private static Map<String, RollingStats> windowOf(String field, double... values) {
        RollingStats stats = new RollingStats(100);
        for (double v : values) {
            stats.add(v);
        }
        Map<String, RollingStats> windows = new HashMap<>();
        windows.put(field, stats);
        return windows;
    }
}
