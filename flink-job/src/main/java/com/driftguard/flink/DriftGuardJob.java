package com.driftguard.flink;

import com.driftguard.core.config.ConfigLoader;
import com.driftguard.core.config.DriftGuardConfig;
import com.driftguard.core.model.EnrichedRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.pipeline.DriftGuardPipeline;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the DriftGuard streaming job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (llm-events topic)
 *     → Deserialize JSON → LlmEvent
 *     → Key by model_id
 *     → EnrichmentProcessFunction (metrics, anomaly, drift, semantic, comparison)
 *     → Serialize EnrichedRecord → JSON
 *     → Kafka (llm-enriched topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * detection settings from {@code driftguard.yml} via {@link ConfigLoader}.
 * Both are validated here, before the job graph is submitted.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftGuardJob {

        private static final Logger LOG = LoggerFactory.getLogger(DriftGuardJob.class);

        static final String UNKNOWN_MODEL = "__unknown__";

        private DriftGuardJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting DriftGuard with config: {}", config);

                DriftGuardConfig driftguard = loadDriftGuardConfig(config);
                LOG.info("Loaded detection config: {}", driftguard);

                // 2. Fail fast on unreadable baseline, threshold or reference files
                try (DriftGuardPipeline probe = DriftGuardPipeline.fromConfig(driftguard)) {
                        LOG.info("Baseline version {} available at startup",
                                        probe.getBaselineStore().current().getVersion());
                }

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build and execute
                buildPipeline(env, config, driftguard);
                env.execute("DriftGuard - LLM Drift and Anomaly Enrichment");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        DriftGuardConfig driftguard) {
                KafkaSource<LlmEvent> kafkaSource = KafkaSource.<LlmEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new LlmEventDeserializationSchema())
                                .build();

                DataStream<LlmEvent> events = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-llm-events-source");

                DataStream<EnrichedRecord> enriched = events
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(DriftGuardJob::keyOf)
                                .process(new EnrichmentProcessFunction(driftguard,
                                                config.getBaselineRefreshIntervalMs()))
                                .name("driftguard-enrichment");

                KafkaSink<EnrichedRecord> kafkaSink = KafkaSink.<EnrichedRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaOutputTopic())
                                                                .setValueSerializationSchema(
                                                                                new EnrichedRecordSerializationSchema())
                                                                .build())
                                .build();

                enriched.sinkTo(kafkaSink).name("kafka-enriched-sink");
        }

        /**
         * Records without a {@code model_id} share one key; the pipeline rejects
         * them and they still reach the output topic.
         */
        static String keyOf(LlmEvent event) {
                return event.getModelId().orElse(UNKNOWN_MODEL);
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static DriftGuardConfig loadDriftGuardConfig(JobConfig config) {
                String path = config.getDriftguardConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
