package com.driftguard.core.config;

import com.driftguard.core.anomaly.AnomalyMethod;
import com.driftguard.core.model.LlmEvent;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the anomaly detection stage.
 *
 * <pre>
 * anomaly:
 *   fields: [response_time, token_count]
 *   method: zscore        # zscore | iqr | isolation | trend | all
 *   threshold: 2.0
 *   window: 100
 *   minSamples: 10
 *   trendWindow: 10
 * </pre>
 *
 * @since 1.0.0
 */
public class AnomalySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double MIN_THRESHOLD = 0.1;
    public static final double MAX_THRESHOLD = 10.0;

    private boolean enabled = true;
    private List<String> fields = new ArrayList<>(List.of(LlmEvent.RESPONSE_TIME, LlmEvent.TOKEN_COUNT));
    private String method = "zscore";
    private double threshold = 2.0;
    private int window = 100;
    private int minSamples = 10;
    private int trendWindow = 10;
    private double iqrMultiplier = 1.5;
    private boolean includeAnalysis;

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (fields == null || fields.isEmpty()) {
            errors.add("'fields' must list at least one field");
        } else if (fields.stream().anyMatch(f -> f == null || f.isBlank())) {
            errors.add("'fields' must not contain blank names");
        }
        try {
            AnomalyMethod.fromName(method);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!(threshold >= MIN_THRESHOLD && threshold <= MAX_THRESHOLD)) {
            errors.add("'threshold' must be in [" + MIN_THRESHOLD + ", " + MAX_THRESHOLD
                    + "], got: " + threshold);
        }
        if (window < 2) {
            errors.add("'window' must be >= 2, got: " + window);
        }
        if (minSamples < 2 || minSamples > window) {
            errors.add("'minSamples' must be in [2, window], got: " + minSamples);
        }
        if (trendWindow < 3 || trendWindow > window) {
            errors.add("'trendWindow' must be in [3, window], got: " + trendWindow);
        }
        if (!(iqrMultiplier > 0) || !Double.isFinite(iqrMultiplier)) {
            errors.add("'iqrMultiplier' must be > 0, got: " + iqrMultiplier);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid anomaly settings: " + String.join("; ", errors));
        }
    }

    public AnomalyMethod anomalyMethod() {
        return AnomalyMethod.fromName(method);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = fields != null ? new ArrayList<>(fields) : new ArrayList<>();
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindow() {
        return window;
    }

    public void setWindow(int window) {
        this.window = window;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public boolean isIncludeAnalysis() {
        return includeAnalysis;
    }

    public void setIncludeAnalysis(boolean includeAnalysis) {
        this.includeAnalysis = includeAnalysis;
    }

    @Override
    public String toString() {
        return "AnomalySettings{" +
                "enabled=" + enabled +
                ", fields=" + fields +
                ", method='" + method + '\'' +
                ", threshold=" + threshold +
                ", window=" + window +
                ", minSamples=" + minSamples +
                ", trendWindow=" + trendWindow +
                '}';
    }
}
