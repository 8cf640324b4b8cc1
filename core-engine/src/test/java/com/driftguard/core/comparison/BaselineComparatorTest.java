package com.driftguard.core.comparison;

import com.driftguard.core.baseline.BaselineSnapshot;
import com.driftguard.core.config.ComparisonSettings;
import com.driftguard.core.model.BaselineComparison;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.model.ThresholdRecord;
import com.driftguard.core.model.ThresholdType;
import com.driftguard.core.severity.ComparisonStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineComparator}.
 */
class BaselineComparatorTest {

    private final BaselineComparator comparator =
            new BaselineComparator(new ComparisonSettings(), ThresholdTable.empty());

    @Test
    @DisplayName("Should rate a 50% increase as critical with default bands")
    void shouldFlagFiftyPercentIncrease() {
        BaselineComparison result = comparator.classify("response_time", "m1", 150, 100, null);

        assertThat(result.getPercentageChange()).hasValueSatisfying(p -> assertThat(p).isCloseTo(50.0, within(1e-9)));
        assertThat(result.getStatus()).contains(ComparisonStatus.CRITICAL);
        assertThat(result.alertMessage()).hasValueSatisfying(m -> assertThat(m)
                .startsWith("CRITICAL - Model m1: response_time has increased by 50.0%"));
    }

    @Test
    @DisplayName("Should rate a 20% increase as normal with default bands")
    void shouldAcceptTwentyPercentIncrease() {
        BaselineComparison result = comparator.classify("response_time", "m1", 120, 100, null);

        assertThat(result.getStatus()).contains(ComparisonStatus.NORMAL);
        assertThat(result.alertMessage()).isEmpty();
    }

    @Test
    @DisplayName("Should treat decreases symmetrically with default bands")
    void shouldFlagLargeDecrease() {
        assertThat(comparator.classify("response_time", "m1", 70, 100, null).getStatus())
                .contains(ComparisonStatus.WARNING);
    }

    @Test
    @DisplayName("Should rate any change from a zero baseline as critical without a percentage")
    void shouldHandleZeroReference() {
        BaselineComparison moved = comparator.classify("response_time", "m1", 5, 0, null);
        BaselineComparison unchanged = comparator.classify("response_time", "m1", 0, 0, null);

        assertThat(moved.getStatus()).contains(ComparisonStatus.CRITICAL);
        assertThat(moved.getPercentageChange()).isEmpty();
        assertThat(moved.toFields(true)).containsEntry("baseline_ratio", null)
                .containsKey("baseline_alert_message");
        assertThat(unchanged.getStatus()).contains(ComparisonStatus.NORMAL);
        assertThat(unchanged.getPercentageChange()).contains(0.0);
    }

    @Test
    @DisplayName("Should apply a lower-is-worse threshold record in its direction")
    void shouldUseThresholdRecord() {
        ThresholdRecord confidence = new ThresholdRecord("confidence_score", ThresholdType.LOWER, 10, 20, "", "");
        BaselineComparator withTable = new BaselineComparator(settings(List.of("confidence_score"), null),
                ThresholdTable.of(List.of(confidence)));

        BaselineComparison drop = withTable.classify("confidence_score", "m1", 0.75, 1.0, null);
        BaselineComparison rise = withTable.classify("confidence_score", "m1", 1.5, 1.0, null);

        assertThat(drop.getStatus()).contains(ComparisonStatus.CRITICAL);
        assertThat(drop.getAppliedThreshold()).contains(confidence);
        assertThat(drop.toFields(false)).containsEntry("baseline_threshold_type", "lower")
                .doesNotContainKey("baseline_alert_message");
        assertThat(rise.getStatus()).contains(ComparisonStatus.NORMAL);
    }

    @Test
    @DisplayName("Should let an explicit threshold override the table")
    void shouldPreferExplicitThreshold() {
        ThresholdRecord rt = new ThresholdRecord("response_time", ThresholdType.UPPER, 1, 2, "s", "");
        BaselineComparator explicit = new BaselineComparator(settings(List.of("response_time"), 10.0),
                ThresholdTable.of(List.of(rt)));

        assertThat(explicit.classify("response_time", "m1", 105, 100, null).getStatus())
                .contains(ComparisonStatus.NORMAL);
        assertThat(explicit.classify("response_time", "m1", 115, 100, null).getStatus())
                .contains(ComparisonStatus.WARNING);
        assertThat(explicit.classify("response_time", "m1", 125, 100, null).getStatus())
                .contains(ComparisonStatus.CRITICAL);
    }

    @Test
    @DisplayName("Should read the reference from the baseline snapshot by model")
    void shouldCompareAgainstSnapshot() {
        LlmEvent event = LlmEvent.builder().modelId("m1").responseTime(1.5).build();

        List<BaselineComparison> result = comparator.compare(event, snapshot(1.0, 0.25));
        Map<String, Object> fields = comparator.toFields(result);

        assertThat(result).hasSize(1);
        assertThat(fields).containsEntry("baseline_available", true)
                .containsEntry("baseline_comparison_status", "critical")
                .containsEntry("baseline_reference_value", 1.0)
                .containsEntry("baseline_z_score", 2.0);
    }

    @Test
    @DisplayName("Should mark the comparison unavailable when the model has no baseline")
    void shouldReportMissingBaseline() {
        LlmEvent event = LlmEvent.builder().modelId("m7").responseTime(1.5).build();

        Map<String, Object> fields = comparator.toFields(comparator.compare(event, BaselineSnapshot.empty()));

        assertThat(fields).containsEntry("baseline_available", false)
                .containsEntry("baseline_comparison_error",
                        "No baseline available for model 'm7' and metric 'response_time'")
                .doesNotContainKey("baseline_comparison_status");
    }

    @Test
    @DisplayName("Should prefer a reference carried on the record")
    void shouldUseBaselineField() {
        ComparisonSettings settings = settings(List.of("response_time"), null);
        settings.setBaselineField("expected_rt");
        BaselineComparator fromRecord = new BaselineComparator(settings, ThresholdTable.empty());
        LlmEvent event = LlmEvent.builder().modelId("m1").responseTime(1.1).field("expected_rt", 1.0).build();

        BaselineComparison result = fromRecord.compare(event, snapshot(5.0, 1.0)).get(0);

        assertThat(result.getReferenceValue()).contains(1.0);
        assertThat(result.getStatus()).contains(ComparisonStatus.NORMAL);
    }

    @Test
    @DisplayName("Should qualify fields per metric and report the worst status")
    void shouldQualifyMultipleMetrics() {
        BaselineComparator multi = new BaselineComparator(
                settings(List.of("response_time", "token_count"), null), ThresholdTable.empty());
        LlmEvent event = LlmEvent.builder().modelId("m1").responseTime(1.0).tokenCount(400).build();

        Map<String, Object> fields = multi.toFields(multi.compare(event, snapshot(1.0, 0.1)));

        assertThat(fields).containsEntry("baseline_response_time_comparison_status", "normal")
                .containsEntry("baseline_token_count_comparison_status", "critical")
                .containsEntry("baseline_comparison_status", "critical");
    }

    @Test
    @DisplayName("Should skip metrics the record does not carry")
    void shouldSkipAbsentMetric() {
        LlmEvent event = LlmEvent.builder().modelId("m1").build();

        assertThat(comparator.compare(event, snapshot(1.0, 0.1))).isEmpty();
        assertThat(comparator.toFields(List.of())).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ComparisonSettings settings(List<String> metrics, Double threshold) {
        ComparisonSettings settings = new ComparisonSettings();
        settings.setMetrics(metrics);
        settings.setThreshold(threshold);
        return settings;
    }

    private static BaselineSnapshot snapshot(double meanRt, double stdRt) {
        BaselineRecord record = BaselineRecord.builder("m1")
                .responseTime(meanRt, stdRt)
                .tokenCount(200, 20)
                .sampleCount(50)
                .build();
        return BaselineSnapshot.of(3, Instant.parse("2024-03-01T00:00:00Z"), List.of(record));
    }
}
