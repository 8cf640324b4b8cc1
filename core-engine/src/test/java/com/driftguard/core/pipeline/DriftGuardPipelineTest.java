package com.driftguard.core.pipeline;

import com.driftguard.core.baseline.BaselineSnapshot;
import com.driftguard.core.baseline.BaselineStore;
import com.driftguard.core.comparison.ThresholdTable;
import com.driftguard.core.config.DriftGuardConfig;
import com.driftguard.core.drift.TextReferenceSet;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.EnrichedRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.semantic.HashingTextEmbedder;
import com.driftguard.core.semantic.TextEmbedder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DriftGuardPipeline}.
 */
class DriftGuardPipelineTest {

    private DriftGuardPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    @Test
    @DisplayName("Should enrich a slow response with every enabled stage")
    void shouldEnrichEndToEnd() {
        pipeline = pipeline(new DriftGuardConfig(), new HashingTextEmbedder());

        BatchResult result = pipeline.process(List.of(event("m1", "r1", 3.0)));
        EnrichedRecord record = result.getRecords().get(0);

        assertThat(result.getBaselineVersion()).isEqualTo(1L);
        assertThat(record.getResult("input_valid")).contains(true);
        assertThat(record.getResult("anomaly_detected")).contains(true);
        assertThat(record.getResult("anomaly_severity")).contains("critical");
        assertThat(record.getResult("baseline_comparison_status")).contains("critical");
        assertThat(record.getResult("drift_unavailable_reason")).contains("insufficient_history");
        assertThat(record.getResults()).containsKey("overall_quality_score");
        assertThat(record.toFlatMap()).containsEntry("request_id", "r1");
    }

    @Test
    @DisplayName("Should flag malformed records in place and continue the batch")
    void shouldFlagRejectedRecords() {
        pipeline = pipeline(new DriftGuardConfig(), new HashingTextEmbedder());
        LlmEvent noModel = LlmEvent.builder().requestId("r2").responseTime(1.0).build();

        BatchResult result = pipeline.process(List.of(event("m1", "r1", 1.0), noModel, event("m1", "r3", 1.0)));

        List<EnrichedRecord> records = result.getRecords();
        assertThat(records).hasSize(3);
        assertThat(records.get(1).isRejected()).isTrue();
        assertThat(records.get(1).getResult("input_error")).contains("Missing required field 'model_id'");
        assertThat(records.get(1).getResults()).doesNotContainKey("anomaly_detected");
        assertThat(records.get(2).getResult("input_valid")).contains(true);

        BatchSummary summary = result.getSummary();
        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getValid()).isEqualTo(2);
        assertThat(summary.getRejected()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a record missing the numeric fields")
    void shouldRejectRecordWithoutMetrics() {
        pipeline = pipeline(new DriftGuardConfig(), new HashingTextEmbedder());
        LlmEvent textOnly = LlmEvent.builder().modelId("m1").requestId("r1").response("hello").build();

        EnrichedRecord record = pipeline.process(List.of(textOnly)).getRecords().get(0);

        assertThat(record.getResult("input_valid")).contains(false);
        assertThat(record.getResult("input_error")).contains("Missing required field 'response_time'");
        assertThat(record.getResults()).containsOnlyKeys("input_valid", "input_error");
    }

    @Test
    @DisplayName("Should summarize anomalies, drift availability and comparison statuses")
    void shouldSummarizeBatch() {
        pipeline = pipeline(new DriftGuardConfig(), new HashingTextEmbedder());

        BatchSummary summary = pipeline.process(List.of(event("m1", "r1", 3.0), event("m1", "r2", 1.0)))
                .getSummary();

        assertThat(summary.getAnomalyCount()).isEqualTo(1);
        assertThat(summary.getAnomalyRate()).isEqualTo(0.5);
        assertThat(summary.getComparisonStatusCounts())
                .containsEntry("critical", 1L)
                .containsEntry("normal", 1L);
        assertThat(summary.getDriftUnavailable()).isEqualTo(1);
        assertThat(summary.getAvgQualityScore()).isNotNull();
    }

    @Test
    @DisplayName("Should preserve input order when sharding across workers")
    void shouldPreserveOrderWithWorkers() {
        DriftGuardConfig config = new DriftGuardConfig();
        config.setWorkers(4);
        pipeline = pipeline(config, new HashingTextEmbedder());

        List<LlmEvent> events = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            events.add(event("model-" + (i % 7), "r" + i, 1.0 + (i % 5) * 0.1));
        }
        List<EnrichedRecord> records = pipeline.process(events).getRecords();

        assertThat(records.stream().map(r -> r.getEvent().getRequestId().orElse(null))
                .collect(Collectors.toList()))
                .isEqualTo(events.stream().map(e -> e.getRequestId().orElse(null)).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should route every record of a model to the same shard")
    void shouldShardByModel() {
        LlmEvent a = event("m1", "r1", 1.0);
        LlmEvent b = event("m1", "r2", 2.0);
        LlmEvent anonymous = LlmEvent.builder().responseTime(1.0).build();

        assertThat(DriftGuardPipeline.shardOf(a, 4)).isEqualTo(DriftGuardPipeline.shardOf(b, 4));
        assertThat(DriftGuardPipeline.shardOf(a, 4)).isBetween(0, 3);
        assertThat(DriftGuardPipeline.shardOf(anonymous, 4)).isEqualTo(DriftGuardPipeline.shardOf(null, 4));
    }

    @Test
    @DisplayName("Should attach semantic similarity when enabled")
    void shouldAttachSemantic() {
        DriftGuardConfig config = new DriftGuardConfig();
        config.getSemantic().setEnabled(true);
        pipeline = pipeline(config, new HashingTextEmbedder());

        EnrichedRecord record = pipeline.process(List.of(event("m1", "r1", 1.0))).getRecords().get(0);

        assertThat(record.getResults()).containsKeys("similarity_score", "similarity_method");
    }

    @Test
    @DisplayName("Should skip disabled stages")
    void shouldSkipDisabledStages() {
        DriftGuardConfig config = new DriftGuardConfig();
        config.getAnomaly().setEnabled(false);
        config.getDrift().setEnabled(false);
        config.getComparison().setEnabled(false);
        config.getMetrics().setEnabled(false);
        pipeline = pipeline(config, new HashingTextEmbedder());

        EnrichedRecord record = pipeline.process(List.of(event("m1", "r1", 3.0))).getRecords().get(0);

        assertThat(record.getResults()).containsOnlyKeys("input_valid");
    }

    @Test
    @DisplayName("Should abort the whole batch when a stage fails unexpectedly")
    void shouldAbortBatchOnFailure() {
        TextEmbedder failing = new TextEmbedder() {
            @Override
            public double[] embed(String text) {
                throw new IllegalArgumentException("embedding backend down");
            }

            @Override
            public int dimension() {
                return 8;
            }
        };
        pipeline = pipeline(new DriftGuardConfig(), failing);

        assertThatThrownBy(() -> pipeline.process(List.of(event("m1", "r1", 1.0))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to enrich record 0")
                .hasMessageContaining("embedding backend down");
    }

    @Test
    @DisplayName("Should build from a configuration that names no files")
    void shouldBuildFromConfigWithoutFiles() {
        pipeline = DriftGuardPipeline.fromConfig(new DriftGuardConfig());

        BatchResult result = pipeline.process(List.of(event("m1", "r1", 1.0)));

        assertThat(result.getBaselineVersion()).isZero();
        assertThat(result.getRecords().get(0).getResult("baseline_available")).contains(false);
    }

    @Test
    @DisplayName("Should reject an invalid configuration")
    void shouldRejectInvalidConfig() {
        DriftGuardConfig config = new DriftGuardConfig();
        config.setWorkers(0);

        assertThatThrownBy(() -> pipeline(config, new HashingTextEmbedder()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("workers");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DriftGuardPipeline pipeline(DriftGuardConfig config, TextEmbedder embedder) {
        BaselineRecord m1 = BaselineRecord.builder("m1")
                .responseTime(1.0, 0.2)
                .sampleCount(100)
                .baselineDate(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
        BaselineStore store = BaselineStore.of(
                BaselineSnapshot.of(1, Instant.parse("2024-01-01T00:00:00Z"), List.of(m1)));
        return new DriftGuardPipeline(config, store, ThresholdTable.empty(), TextReferenceSet.empty(), embedder);
    }

    private static LlmEvent event(String modelId, String requestId, double responseTime) {
        return LlmEvent.builder()
                .timestamp(Instant.parse("2024-06-01T10:00:00Z"))
                .modelId(modelId)
                .requestId(requestId)
                .prompt("Summarize the quarterly report")
                .response("Revenue grew. Costs fell in the same period.")
                .responseTime(responseTime)
                .tokenCount(40)
                .confidenceScore(0.85)
                .build();
    }
}
