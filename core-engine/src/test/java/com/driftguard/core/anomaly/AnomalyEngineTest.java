package com.driftguard.core.anomaly;

import com.driftguard.core.baseline.BaselineSnapshot;
import com.driftguard.core.config.AnomalySettings;
import com.driftguard.core.model.AnomalyResult;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.FieldAnomaly;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.severity.AnomalySeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyEngine}.
 */
class AnomalyEngineTest {

    @Test
    @DisplayName("Should flag a response time ten deviations above the baseline as critical")
    void shouldFlagAgainstBaseline() {
        AnomalyEngine engine = new AnomalyEngine(settings("zscore", 2.0, 10));

        AnomalyResult result = engine.evaluate(rt("m1", 3.0), baseline(1.0, 0.2));
        Map<String, Object> fields = result.toFields(true);

        assertThat(result.isAnomalyDetected()).isTrue();
        assertThat(result.getMaxAnomalyScore()).isCloseTo(10.0, within(1e-9));
        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(fields).containsEntry("anomaly_detected", true)
                .containsEntry("anomaly_types", "response_time_zscore")
                .containsEntry("anomaly_severity", "critical")
                .containsKey("anomaly_score_response_time_zscore")
                .containsKey("anomaly_analysis");
        assertThat(result.getFlagged().get(0).getAnalysis()).containsEntry("reference", "baseline");
    }

    @Test
    @DisplayName("Should not flag values within the threshold")
    void shouldNotFlagNormalValue() {
        AnomalyEngine engine = new AnomalyEngine(settings("zscore", 2.0, 10));

        AnomalyResult result = engine.evaluate(rt("m1", 1.1), baseline(1.0, 0.2));

        assertThat(result.isAnomalyDetected()).isFalse();
        assertThat(result.getSeverity()).isEqualTo(AnomalySeverity.NONE);
        assertThat(result.toFields(true)).containsEntry("anomaly_count", 0)
                .containsEntry("max_anomaly_score", 0.0)
                .doesNotContainKey("anomaly_analysis");
    }

    @Test
    @DisplayName("Should score further values strictly higher")
    void shouldBeMonotonic() {
        BaselineSnapshot snapshot = baseline(1.0, 0.2);
        double previous = -1;
        for (double value = 1.0; value <= 3.0; value += 0.25) {
            AnomalyEngine engine = new AnomalyEngine(settings("zscore", 2.0, 10));
            double score = engine.evaluate(rt("m1", value), snapshot).getEvaluations().get(0).getScore();
            assertThat(score).isGreaterThan(previous);
            previous = score;
        }
    }

    @Test
    @DisplayName("Should treat a zero baseline deviation as anomalous only for a different value")
    void shouldHandleZeroStdDev() {
        BaselineSnapshot snapshot = baseline(1.0, 0.0);

        AnomalyResult same = new AnomalyEngine(settings("zscore", 2.0, 10)).evaluate(rt("m1", 1.0), snapshot);
        AnomalyResult different = new AnomalyEngine(settings("zscore", 2.0, 10)).evaluate(rt("m1", 1.01), snapshot);

        assertThat(same.isAnomalyDetected()).isFalse();
        assertThat(same.getEvaluations().get(0).getScore()).isZero();
        assertThat(different.isAnomalyDetected()).isTrue();
        assertThat(different.getMaxAnomalyScore()).isEqualTo(AnomalyStrategy.ZERO_SPREAD_SCORE);
    }

    @Test
    @DisplayName("Should wait for minSamples before scoring against the window")
    void shouldRequireMinSamplesWithoutBaseline() {
        AnomalyEngine engine = new AnomalyEngine(settings("zscore", 2.0, 5));
        BaselineSnapshot empty = BaselineSnapshot.empty();

        for (int i = 0; i < 5; i++) {
            AnomalyResult warmup = engine.evaluate(rt("m1", 1.0 + (i % 2) * 0.1), empty);
            assertThat(warmup.getEvaluations()).isEmpty();
        }
        AnomalyResult spike = engine.evaluate(rt("m1", 10.0), empty);

        assertThat(engine.windowSize("m1", LlmEvent.RESPONSE_TIME)).isEqualTo(6);
        assertThat(spike.isAnomalyDetected()).isTrue();
        assertThat(spike.getFlagged().get(0).getAnalysis()).containsEntry("reference", "window");
    }

    @Test
    @DisplayName("Should keep windows per model")
    void shouldIsolateModels() {
        AnomalyEngine engine = new AnomalyEngine(settings("zscore", 2.0, 2));
        engine.evaluate(rt("m1", 1.0), BaselineSnapshot.empty());
        engine.evaluate(rt("m1", 2.0), BaselineSnapshot.empty());

        AnomalyResult other = engine.evaluate(rt("m2", 100.0), BaselineSnapshot.empty());

        assertThat(other.getEvaluations()).isEmpty();
        assertThat(engine.windowSize("m2", LlmEvent.RESPONSE_TIME)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore absent and non-numeric fields")
    void shouldSkipMissingFields() {
        AnomalyEngine engine = new AnomalyEngine(settings("zscore", 2.0, 2));
        LlmEvent event = LlmEvent.builder().modelId("m1").field(LlmEvent.RESPONSE_TIME, "slow").build();

        AnomalyResult result = engine.evaluate(event, baseline(1.0, 0.2));

        assertThat(result.getEvaluations()).isEmpty();
        assertThat(engine.windowSize("m1", LlmEvent.RESPONSE_TIME)).isZero();
    }

    @Test
    @DisplayName("Should run every strategy for method 'all'")
    void shouldRunAllStrategies() {
        AnomalyEngine engine = new AnomalyEngine(settings("all", 2.0, 3));
        for (int i = 0; i < 10; i++) {
            engine.evaluate(rt("m1", 1.0 + 0.01 * (i % 3)), BaselineSnapshot.empty());
        }

        AnomalyResult result = engine.evaluate(rt("m1", 50.0), BaselineSnapshot.empty());

        assertThat(engine.getStrategies()).hasSize(4);
        assertThat(result.getEvaluations()).extracting(FieldAnomaly::getMethod)
                .contains("zscore", "iqr", "isolation", "trend");
        assertThat(result.getAnomalyTypes()).contains("response_time_zscore", "multivariate_isolation");
        assertThat(result.getMethod()).isEqualTo("all");
    }

    @Test
    @DisplayName("Should reject minSamples larger than the window")
    void shouldRejectInvalidSettings() {
        AnomalySettings settings = settings("zscore", 2.0, 10);
        settings.setWindow(5);

        assertThatThrownBy(() -> new AnomalyEngine(settings))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("minSamples");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalySettings settings(String method, double threshold, int minSamples) {
        AnomalySettings settings = new AnomalySettings();
        settings.setFields(List.of(LlmEvent.RESPONSE_TIME));
        settings.setMethod(method);
        settings.setThreshold(threshold);
        settings.setMinSamples(minSamples);
        settings.setTrendWindow(5);
        return settings;
    }

    private static LlmEvent rt(String modelId, double responseTime) {
        return LlmEvent.builder().modelId(modelId).responseTime(responseTime).build();
    }

    private static BaselineSnapshot baseline(double mean, double std) {
        BaselineRecord record = BaselineRecord.builder("m1")
                .responseTime(mean, std)
                .sampleCount(100)
                .baselineDate(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
        return BaselineSnapshot.of(1, Instant.parse("2024-01-01T00:00:00Z"), List.of(record));
    }
}
