package com.driftguard.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable deployment settings for the DriftGuard Flink job.
 *
 * <p>
 * These cover the streaming plumbing only (Kafka topics, parallelism,
 * checkpointing, baseline refresh). Detection behaviour is configured
 * separately in {@code driftguard.yml}, located through
 * {@link #getDriftguardConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaOutputTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // DriftGuard
    // ---------------------------------------------------------------
    private final String driftguardConfigPath;
    private final long baselineRefreshIntervalMs;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaOutputTopic = b.kafkaOutputTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.driftguardConfigPath = b.driftguardConfigPath;
        this.baselineRefreshIntervalMs = b.baselineRefreshIntervalMs;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from the given variables. Blank values fall
     * back to the defaults.
     */
    static JobConfig fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(environment, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env(environment, "KAFKA_INPUT_TOPIC", "llm-events"))
                    .kafkaOutputTopic(env(environment, "KAFKA_OUTPUT_TOPIC", "llm-enriched"))
                    .kafkaGroupId(env(environment, "KAFKA_GROUP_ID", "driftguard"))
                    .parallelism(Integer.parseInt(env(environment, "FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(
                            env(environment, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .driftguardConfigPath(env(environment, "DRIFTGUARD_CONFIG_PATH", ""))
                    .baselineRefreshIntervalMs(Long.parseLong(
                            env(environment, "BASELINE_REFRESH_INTERVAL_MS", "300000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaOutputTopic() {
        return kafkaOutputTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the YAML detection config, or an empty string to use
     *         the classpath {@code driftguard.yml}
     */
    public String getDriftguardConfigPath() {
        return driftguardConfigPath;
    }

    /** @return how often each subtask re-reads the baseline table; 0 disables refresh */
    public long getBaselineRefreshIntervalMs() {
        return baselineRefreshIntervalMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks parallelism &gt; 0, checkpoint interval &gt; 0,
     * a non-negative refresh interval and non-blank topic names.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "llm-events";
        private String kafkaOutputTopic = "llm-enriched";
        private String kafkaGroupId = "driftguard";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String driftguardConfigPath = "";
        private long baselineRefreshIntervalMs = 300_000;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaOutputTopic(String v) {
            this.kafkaOutputTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder driftguardConfigPath(String v) {
            this.driftguardConfigPath = v;
            return this;
        }

        public Builder baselineRefreshIntervalMs(long v) {
            this.baselineRefreshIntervalMs = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaOutputTopic, "kafkaOutputTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            if (kafkaInputTopic.equals(kafkaOutputTopic)) {
                throw new IllegalArgumentException(
                        "kafkaOutputTopic must differ from kafkaInputTopic, both are '" + kafkaInputTopic + "'");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (baselineRefreshIntervalMs < 0) {
                throw new IllegalArgumentException(
                        "baselineRefreshIntervalMs must be >= 0, got: " + baselineRefreshIntervalMs);
            }
            if (driftguardConfigPath == null) {
                driftguardConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> environment, String name, String defaultValue) {
        String value = environment.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaOutputTopic='" + kafkaOutputTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", driftguardConfigPath='" + driftguardConfigPath + '\'' +
                ", baselineRefreshIntervalMs=" + baselineRefreshIntervalMs +
                '}';
    }
}
