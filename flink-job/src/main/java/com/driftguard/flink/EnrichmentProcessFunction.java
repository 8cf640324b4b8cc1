package com.driftguard.flink;

import com.driftguard.core.config.DriftGuardConfig;
import com.driftguard.core.model.EnrichedRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.pipeline.DriftGuardPipeline;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Keyed operator that enriches every {@link LlmEvent} through a
 * {@link DriftGuardPipeline}.
 *
 * <p>
 * The stream is keyed by {@code model_id}, so all records of one model reach
 * the same subtask in order. Each subtask owns one pipeline, built in
 * {@link #open(Configuration)} from the serialized {@link DriftGuardConfig}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Rolling windows (drift, anomaly and trend history) live inside the pipeline
 * and are not part of Flink checkpoints. After a restore they warm up again
 * from empty, which the detectors report as {@code insufficient_history} or
 * as window-less z-scores until enough records have arrived.
 * </p>
 *
 * <h3>Baseline refresh</h3>
 * <p>
 * When a refresh interval is set, the baseline table is re-read on the
 * processing-time path before a record is enriched. A newer version replaces
 * the current snapshot atomically; a failed read keeps the current one.
 * </p>
 *
 * @since 1.0.0
 */
public class EnrichmentProcessFunction
        extends KeyedProcessFunction<String, LlmEvent, EnrichedRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(EnrichmentProcessFunction.class);

    private final DriftGuardConfig config;
    private final long baselineRefreshIntervalMs;

    private transient DriftGuardPipeline pipeline;
    private transient DriftGuardMetrics metrics;
    private transient long lastRefreshMs;

    /**
     * @param config                    detection configuration; validated when
     *                                  the operator opens
     * @param baselineRefreshIntervalMs re-read interval for the baseline table,
     *                                  0 to never refresh
     */
    public EnrichmentProcessFunction(DriftGuardConfig config, long baselineRefreshIntervalMs) {
        this.config = Objects.requireNonNull(config, "DriftGuard config must not be null");
        if (baselineRefreshIntervalMs < 0) {
            throw new IllegalArgumentException(
                    "baselineRefreshIntervalMs must be >= 0, got: " + baselineRefreshIntervalMs);
        }
        this.baselineRefreshIntervalMs = baselineRefreshIntervalMs;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        pipeline = DriftGuardPipeline.fromConfig(config);
        metrics = new DriftGuardMetrics(getRuntimeContext().getMetricGroup());
        lastRefreshMs = System.currentTimeMillis();
        LOG.info("EnrichmentProcessFunction opened with baseline version {}",
                pipeline.getBaselineStore().current().getVersion());
    }

    @Override
    public void close() {
        LOG.info("EnrichmentProcessFunction closing");
        if (pipeline != null) {
            pipeline.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(LlmEvent event,
            KeyedProcessFunction<String, LlmEvent, EnrichedRecord>.Context ctx,
            Collector<EnrichedRecord> out) {
        long startNanos = System.nanoTime();
        refreshBaselineIfDue(ctx.timerService().currentProcessingTime());

        EnrichedRecord record = pipeline.enrich(event, pipeline.getBaselineStore().current());
        out.collect(record);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordProcessed(record, durationMs);
    }

    private void refreshBaselineIfDue(long nowMs) {
        if (baselineRefreshIntervalMs == 0 || nowMs - lastRefreshMs < baselineRefreshIntervalMs) {
            return;
        }
        lastRefreshMs = nowMs;
        try {
            pipeline.getBaselineStore().refresh();
        } catch (IllegalStateException e) {
            metrics.incrementBaselineRefreshFailures();
            LOG.error("Baseline refresh failed, keeping version {}",
                    pipeline.getBaselineStore().current().getVersion(), e);
        }
    }
}
