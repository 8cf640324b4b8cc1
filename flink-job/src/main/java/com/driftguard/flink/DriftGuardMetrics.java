package com.driftguard.flink;

import com.driftguard.core.model.EnrichedRecord;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metric definitions for the enrichment operator.
 * <p>
 * Reporters (e.g. Prometheus) are configured at cluster level in
 * {@code flink-conf.yaml}; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code events_processed_total}: every record enriched or rejected</li>
 *   <li>{@code records_rejected_total}: malformed records</li>
 *   <li>{@code anomalies_detected_total}: records with {@code anomaly_detected}</li>
 *   <li>{@code drift_detected_total}: records with {@code drift_detected}</li>
 *   <li>{@code baseline_refresh_failures_total}: failed baseline re-reads</li>
 *   <li>{@code processing_latency_ms}: histogram of per-record latency</li>
 * </ul>
 */
public class DriftGuardMetrics {

    private final Counter eventsProcessed;
    private final Counter recordsRejected;
    private final Counter anomaliesDetected;
    private final Counter driftDetected;
    private final Counter baselineRefreshFailures;
    private final Histogram processingLatency;

    public DriftGuardMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("driftguard");

        this.eventsProcessed = group.counter("events_processed_total");
        this.recordsRejected = group.counter("records_rejected_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.driftDetected = group.counter("drift_detected_total");
        this.baselineRefreshFailures = group.counter("baseline_refresh_failures_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    /**
     * Count one finished record and its detection outcome.
     */
    public void recordProcessed(EnrichedRecord record, long latencyMs) {
        eventsProcessed.inc();
        if (record.isRejected()) {
            recordsRejected.inc();
        }
        if (isTrue(record, "anomaly_detected")) {
            anomaliesDetected.inc();
        }
        if (isTrue(record, "drift_detected")) {
            driftDetected.inc();
        }
        processingLatency.update(latencyMs);
    }

    public void incrementBaselineRefreshFailures() {
        baselineRefreshFailures.inc();
    }

    private static boolean isTrue(EnrichedRecord record, String field) {
        return record.getResult(field).map(Boolean.TRUE::equals).orElse(false);
    }
}
