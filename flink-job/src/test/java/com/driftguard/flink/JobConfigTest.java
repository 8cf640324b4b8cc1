package com.driftguard.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should use defaults when no variables are set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(Map.of());

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("llm-events");
        assertThat(config.getKafkaOutputTopic()).isEqualTo("llm-enriched");
        assertThat(config.getKafkaGroupId()).isEqualTo("driftguard");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getDriftguardConfigPath()).isEmpty();
        assertThat(config.getBaselineRefreshIntervalMs()).isEqualTo(300_000L);
    }

    @Test
    @DisplayName("Should read overrides and ignore blank values")
    void shouldReadOverrides() {
        JobConfig config = JobConfig.fromEnvironment(Map.of(
                "KAFKA_INPUT_TOPIC", "prod-llm-events",
                "KAFKA_GROUP_ID", " ",
                "FLINK_PARALLELISM", "4",
                "DRIFTGUARD_CONFIG_PATH", "/etc/driftguard.yml",
                "BASELINE_REFRESH_INTERVAL_MS", "0"));

        assertThat(config.getKafkaInputTopic()).isEqualTo("prod-llm-events");
        assertThat(config.getKafkaGroupId()).isEqualTo("driftguard");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getDriftguardConfigPath()).isEqualTo("/etc/driftguard.yml");
        assertThat(config.getBaselineRefreshIntervalMs()).isZero();
    }

    @Test
    @DisplayName("Should wrap unparseable numbers in IllegalStateException")
    void shouldRejectNonNumericParallelism() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("FLINK_PARALLELISM", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric environment variable");
    }

    @Test
    @DisplayName("Should reject zero parallelism")
    void shouldRejectZeroParallelism() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should reject a negative refresh interval")
    void shouldRejectNegativeRefreshInterval() {
        assertThatThrownBy(() -> new JobConfig.Builder().baselineRefreshIntervalMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baselineRefreshIntervalMs");
    }

    @Test
    @DisplayName("Should reject writing back to the input topic")
    void shouldRejectSameInputAndOutputTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder()
                .kafkaInputTopic("llm")
                .kafkaOutputTopic("llm")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should build consumer properties with group and offset reset")
    void shouldBuildConsumerProperties() {
        JobConfig config = new JobConfig.Builder()
                .kafkaBootstrapServers("kafka:9092")
                .kafkaGroupId("dg")
                .build();

        assertThat(config.kafkaConsumerProperties())
                .containsEntry("bootstrap.servers", "kafka:9092")
                .containsEntry("group.id", "dg")
                .containsEntry("auto.offset.reset", "earliest");
    }
}
