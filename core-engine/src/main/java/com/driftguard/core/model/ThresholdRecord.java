package com.driftguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Alert thresholds for one metric, expressed as adverse percentage change
 * relative to the baseline.
 *
 * <p>
 * Call {@link #validate()} after loading to verify the thresholds are usable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"metric_name", "threshold_type", "warning_threshold", "critical_threshold",
        "unit", "description"})
public final class ThresholdRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final ThresholdType thresholdType;
    private final double warningThreshold;
    private final double criticalThreshold;
    private final String unit;
    private final String description;

    @JsonCreator
    public ThresholdRecord(
            @JsonProperty("metric_name") String metricName,
            @JsonProperty("threshold_type") ThresholdType thresholdType,
            @JsonProperty("warning_threshold") double warningThreshold,
            @JsonProperty("critical_threshold") double criticalThreshold,
            @JsonProperty("unit") String unit,
            @JsonProperty("description") String description) {
        this.metricName = metricName;
        this.thresholdType = thresholdType != null ? thresholdType : ThresholdType.UPPER;
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
        this.unit = unit != null ? unit : "";
        this.description = description != null ? description : "";
    }

    /**
     * Validate the record.
     *
     * @throws IllegalStateException if the metric name is blank or the
     *                               thresholds are negative, non-finite or
     *                               out of order
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (metricName == null || metricName.isBlank()) {
            errors.add("'metric_name' is required");
        }
        if (!Double.isFinite(warningThreshold) || warningThreshold < 0) {
            errors.add("'warning_threshold' must be a finite value >= 0, got: " + warningThreshold);
        }
        if (!Double.isFinite(criticalThreshold) || criticalThreshold < 0) {
            errors.add("'critical_threshold' must be a finite value >= 0, got: " + criticalThreshold);
        }
        if (criticalThreshold < warningThreshold) {
            errors.add("'critical_threshold' (" + criticalThreshold
                    + ") must be >= 'warning_threshold' (" + warningThreshold + ")");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid threshold for metric '" + metricName + "': "
                    + String.join("; ", errors));
        }
    }

    @JsonProperty("metric_name")
    public String getMetricName() {
        return metricName;
    }

    @JsonProperty("threshold_type")
    public ThresholdType getThresholdType() {
        return thresholdType;
    }

    @JsonProperty("warning_threshold")
    public double getWarningThreshold() {
        return warningThreshold;
    }

    @JsonProperty("critical_threshold")
    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    @JsonProperty("unit")
    public String getUnit() {
        return unit;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdRecord that))
            return false;
        return Double.compare(warningThreshold, that.warningThreshold) == 0
                && Double.compare(criticalThreshold, that.criticalThreshold) == 0
                && Objects.equals(metricName, that.metricName)
                && thresholdType == that.thresholdType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, thresholdType, warningThreshold, criticalThreshold);
    }

    @Override
    public String toString() {
        return "ThresholdRecord{" +
                "metricName='" + metricName + '\'' +
                ", thresholdType=" + thresholdType +
                ", warningThreshold=" + warningThreshold +
                ", criticalThreshold=" + criticalThreshold +
                ", unit='" + unit + '\'' +
                '}';
    }
}
