package com.driftguard.core.pipeline;

import com.driftguard.core.model.EnrichedRecord;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view of one processed batch.
 *
 * <p>
 * Rates are computed over the records a stage actually evaluated:
 * {@code anomaly_rate} over records with an anomaly result, {@code drift_rate}
 * over records with a drift score. A rate with nothing evaluated is 0.
 * </p>
 *
 * @since 1.0.0
 */
public final class BatchSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int total;
    private final int rejected;
    private final int anomalyEvaluated;
    private final int anomalyCount;
    private final int driftScored;
    private final int driftDetected;
    private final int driftUnavailable;
    private final Double avgDriftScore;
    private final Double avgQualityScore;
    private final Map<String, Long> comparisonStatusCounts;

    private BatchSummary(int total, int rejected, int anomalyEvaluated, int anomalyCount, int driftScored,
            int driftDetected, int driftUnavailable, Double avgDriftScore, Double avgQualityScore,
            Map<String, Long> comparisonStatusCounts) {
        this.total = total;
        this.rejected = rejected;
        this.anomalyEvaluated = anomalyEvaluated;
        this.anomalyCount = anomalyCount;
        this.driftScored = driftScored;
        this.driftDetected = driftDetected;
        this.driftUnavailable = driftUnavailable;
        this.avgDriftScore = avgDriftScore;
        this.avgQualityScore = avgQualityScore;
        this.comparisonStatusCounts = Collections.unmodifiableMap(comparisonStatusCounts);
    }

    /**
     * Summarise the result fields of {@code records}.
     */
    public static BatchSummary of(List<EnrichedRecord> records) {
        int rejected = 0;
        int anomalyEvaluated = 0;
        int anomalyCount = 0;
        int driftScored = 0;
        int driftDetected = 0;
        int driftUnavailable = 0;
        double driftSum = 0;
        int qualityCount = 0;
        double qualitySum = 0;
        Map<String, Long> statuses = new TreeMap<>();

        for (EnrichedRecord record : records) {
            if (record.isRejected()) {
                rejected++;
                continue;
            }
            Map<String, Object> r = record.getResults();
            if (r.get("anomaly_detected") instanceof Boolean detected) {
                anomalyEvaluated++;
                if (detected) {
                    anomalyCount++;
                }
            }
            if (r.get("drift_score") instanceof Number score) {
                driftScored++;
                driftSum += score.doubleValue();
                if (Boolean.TRUE.equals(r.get("drift_detected"))) {
                    driftDetected++;
                }
            } else if (r.containsKey("drift_unavailable_reason")) {
                driftUnavailable++;
            }
            if (r.get("overall_quality_score") instanceof Number quality) {
                qualityCount++;
                qualitySum += quality.doubleValue();
            }
            if (r.get("baseline_comparison_status") instanceof String status) {
                statuses.merge(status, 1L, Long::sum);
            }
        }
        return new BatchSummary(records.size(), rejected, anomalyEvaluated, anomalyCount, driftScored,
                driftDetected, driftUnavailable,
                driftScored > 0 ? driftSum / driftScored : null,
                qualityCount > 0 ? qualitySum / qualityCount : null,
                statuses);
    }

    public int getTotal() {
        return total;
    }

    public int getValid() {
        return total - rejected;
    }

    public int getRejected() {
        return rejected;
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    public double getAnomalyRate() {
        return anomalyEvaluated == 0 ? 0.0 : (double) anomalyCount / anomalyEvaluated;
    }

    public int getDriftDetected() {
        return driftDetected;
    }

    public double getDriftRate() {
        return driftScored == 0 ? 0.0 : (double) driftDetected / driftScored;
    }

    public int getDriftUnavailable() {
        return driftUnavailable;
    }

    public Double getAvgDriftScore() {
        return avgDriftScore;
    }

    public Double getAvgQualityScore() {
        return avgQualityScore;
    }

    public Map<String, Long> getComparisonStatusCounts() {
        return comparisonStatusCounts;
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("total_records", total);
        fields.put("valid_records", getValid());
        fields.put("rejected_records", rejected);
        fields.put("anomaly_count", anomalyCount);
        fields.put("anomaly_rate", getAnomalyRate());
        fields.put("drift_detected_count", driftDetected);
        fields.put("drift_rate", getDriftRate());
        fields.put("drift_unavailable_count", driftUnavailable);
        fields.put("avg_drift_score", avgDriftScore);
        fields.put("avg_quality_score", avgQualityScore);
        fields.put("comparison_status_counts", comparisonStatusCounts);
        return fields;
    }

    @Override
    public String toString() {
        return "BatchSummary" + toFields();
    }
}
