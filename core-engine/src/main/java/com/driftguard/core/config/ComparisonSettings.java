package com.driftguard.core.config;

import com.driftguard.core.model.LlmEvent;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the baseline comparison stage.
 *
 * <p>
 * {@code threshold} is an optional explicit warning level in percent (critical
 * at twice that); when absent, the threshold table entry for the metric
 * applies, and failing that the global 25% / 50% defaults.
 * </p>
 *
 * @since 1.0.0
 */
public class ComparisonSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;
    private List<String> metrics = new ArrayList<>(List.of(LlmEvent.RESPONSE_TIME));
    private Double threshold;
    private String baselineField;
    private String modelField = LlmEvent.MODEL_ID;
    private String thresholdFile;
    private boolean generateAlerts = true;

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (metrics == null || metrics.isEmpty()) {
            errors.add("'metrics' must list at least one metric");
        } else if (metrics.stream().anyMatch(m -> m == null || m.isBlank())) {
            errors.add("'metrics' must not contain blank names");
        }
        if (threshold != null && (!Double.isFinite(threshold) || threshold <= 0)) {
            errors.add("'threshold' must be > 0 when set, got: " + threshold);
        }
        if (modelField == null || modelField.isBlank()) {
            errors.add("'modelField' is required");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid comparison settings: " + String.join("; ", errors));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getBaselineField() {
        return baselineField;
    }

    public void setBaselineField(String baselineField) {
        this.baselineField = baselineField;
    }

    public String getModelField() {
        return modelField;
    }

    public void setModelField(String modelField) {
        this.modelField = modelField;
    }

    public String getThresholdFile() {
        return thresholdFile;
    }

    public void setThresholdFile(String thresholdFile) {
        this.thresholdFile = thresholdFile;
    }

    public boolean isGenerateAlerts() {
        return generateAlerts;
    }

    public void setGenerateAlerts(boolean generateAlerts) {
        this.generateAlerts = generateAlerts;
    }

    @Override
    public String toString() {
        return "ComparisonSettings{enabled=" + enabled + ", metrics=" + metrics
                + ", threshold=" + threshold + ", baselineField='" + baselineField + "'}";
    }
}
