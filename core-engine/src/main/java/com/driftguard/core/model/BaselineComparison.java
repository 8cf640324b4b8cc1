package com.driftguard.core.model;

import com.driftguard.core.severity.ComparisonStatus;
import com.driftguard.core.severity.DeviationCategory;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Current-versus-baseline comparison of a single metric.
 *
 * <p>
 * Either <em>available</em>, carrying the reference value, the deviation and a
 * {@link ComparisonStatus}, or <em>unavailable</em> when no reference value
 * exists for the record's model. The percentage change is undefined (empty)
 * when the reference value is zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineComparison implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final String modelId;
    private final double currentValue;
    private final Double referenceValue;
    private final Double percentageChange;
    private final Double zScore;
    private final ComparisonStatus status;
    private final ThresholdRecord appliedThreshold;
    private final String unavailableReason;

    private BaselineComparison(Builder b) {
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.modelId = b.modelId;
        this.currentValue = b.currentValue;
        this.referenceValue = b.referenceValue;
        this.percentageChange = b.percentageChange;
        this.zScore = b.zScore;
        this.status = b.status;
        this.appliedThreshold = b.appliedThreshold;
        this.unavailableReason = b.unavailableReason;
    }

    public static Builder builder(String metricName) {
        return new Builder(metricName);
    }

    public static BaselineComparison unavailable(String metricName, String modelId,
            double currentValue, String reason) {
        Builder b = new Builder(metricName);
        b.modelId = modelId;
        b.currentValue = currentValue;
        b.unavailableReason = Objects.requireNonNull(reason, "reason must not be null");
        return b.build();
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getModelId() {
        return modelId;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Optional<Double> getReferenceValue() {
        return Optional.ofNullable(referenceValue);
    }

    public Optional<Double> getPercentageChange() {
        return Optional.ofNullable(percentageChange);
    }

    public Optional<Double> getZScore() {
        return Optional.ofNullable(zScore);
    }

    public Optional<ComparisonStatus> getStatus() {
        return Optional.ofNullable(status);
    }

    public Optional<ThresholdRecord> getAppliedThreshold() {
        return Optional.ofNullable(appliedThreshold);
    }

    public Optional<String> getUnavailableReason() {
        return Optional.ofNullable(unavailableReason);
    }

    /**
     * Human-readable alert line, e.g.
     * {@code CRITICAL - Model m1: response_time has increased by 50.0% (current: 1.500, baseline: 1.000)}.
     *
     * @return the message, or empty for normal or unavailable comparisons
     */
    public Optional<String> alertMessage() {
        if (!isAvailable() || status == ComparisonStatus.NORMAL) {
            return Optional.empty();
        }
        String model = modelId != null ? modelId : "default";
        String change;
        if (percentageChange == null) {
            change = "moved away from a zero baseline";
        } else {
            String direction = percentageChange > 0 ? "increased" : "decreased";
            change = String.format(Locale.ROOT, "has %s by %.1f%%", direction, Math.abs(percentageChange));
        }
        return Optional.of(String.format(Locale.ROOT, "%s - Model %s: %s %s (current: %.3f, baseline: %.3f)",
                status.name(), model, metricName, change, currentValue, referenceValue));
    }

    /**
     * @param generateAlerts whether to add the alert message fields
     * @return output fields ({@code baseline_*})
     */
    public Map<String, Object> toFields(boolean generateAlerts) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (!isAvailable()) {
            fields.put("baseline_available", false);
            fields.put("baseline_comparison_error", unavailableReason);
            return fields;
        }
        fields.put("baseline_available", true);
        fields.put("baseline_comparison_status", status.label());
        fields.put("baseline_current_value", currentValue);
        fields.put("baseline_reference_value", referenceValue);
        fields.put("baseline_absolute_deviation", currentValue - referenceValue);
        fields.put("baseline_percentage_change", percentageChange);
        fields.put("baseline_ratio", referenceValue != 0 ? currentValue / referenceValue : null);
        fields.put("baseline_z_score", zScore);
        if (percentageChange != null) {
            fields.put("baseline_deviation_category", DeviationCategory.of(percentageChange).label());
            fields.put("baseline_trend", percentageChange > 5 ? "increasing"
                    : percentageChange < -5 ? "decreasing" : "stable");
        }
        if (appliedThreshold != null) {
            fields.put("baseline_warning_threshold", appliedThreshold.getWarningThreshold());
            fields.put("baseline_critical_threshold", appliedThreshold.getCriticalThreshold());
            fields.put("baseline_threshold_type", appliedThreshold.getThresholdType().label());
        }
        if (generateAlerts) {
            alertMessage().ifPresent(message -> {
                fields.put("baseline_alert_message", message);
                fields.put("baseline_alert_severity", status.label());
            });
        }
        return fields;
    }

    @Override
    public String toString() {
        return "BaselineComparison{" +
                "metric='" + metricName + '\'' +
                ", model='" + modelId + '\'' +
                ", current=" + currentValue +
                ", reference=" + referenceValue +
                ", change=" + percentageChange +
                ", status=" + status +
                (unavailableReason != null ? ", unavailable='" + unavailableReason + '\'' : "") +
                '}';
    }

    /**
     * Builder for available comparisons. {@code referenceValue} and
     * {@code status} are required.
     */
    public static class Builder {
        private final String metricName;
        private String modelId;
        private double currentValue;
        private Double referenceValue;
        private Double percentageChange;
        private Double zScore;
        private ComparisonStatus status;
        private ThresholdRecord appliedThreshold;
        private String unavailableReason;

        private Builder(String metricName) {
            this.metricName = metricName;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder referenceValue(double referenceValue) {
            this.referenceValue = referenceValue;
            return this;
        }

        public Builder percentageChange(Double percentageChange) {
            this.percentageChange = percentageChange;
            return this;
        }

        public Builder zScore(Double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder status(ComparisonStatus status) {
            this.status = status;
            return this;
        }

        public Builder appliedThreshold(ThresholdRecord appliedThreshold) {
            this.appliedThreshold = appliedThreshold;
            return this;
        }

        public BaselineComparison build() {
            if (unavailableReason == null) {
                Objects.requireNonNull(referenceValue, "referenceValue must not be null");
                Objects.requireNonNull(status, "status must not be null");
            }
            return new BaselineComparison(this);
        }
    }
}
