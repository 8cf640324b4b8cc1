package com.driftguard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict of one anomaly method on one field (or, for multivariate methods, on
 * a set of fields).
 *
 * @since 1.0.0
 */
public final class FieldAnomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String method;
    private final boolean anomalous;
    private final double score;
    private final Map<String, Object> analysis;

    public FieldAnomaly(String field, String method, boolean anomalous, double score,
            Map<String, Object> analysis) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        if (Double.isNaN(score) || score < 0) {
            throw new IllegalArgumentException("Anomaly score must be >= 0, got: " + score);
        }
        this.anomalous = anomalous;
        this.score = score;
        this.analysis = analysis != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(analysis))
                : Map.of();
    }

    public static FieldAnomaly normal(String field, String method, Map<String, Object> analysis) {
        return new FieldAnomaly(field, method, false, 0.0, analysis);
    }

    /**
     * @return the {@code field_method} tag used in {@code anomaly_types}
     */
    public String tag() {
        return field + "_" + method;
    }

    public String getField() {
        return field;
    }

    public String getMethod() {
        return method;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Object> getAnalysis() {
        return analysis;
    }

    @Override
    public String toString() {
        return "FieldAnomaly{" + tag() + ", anomalous=" + anomalous + ", score=" + score + '}';
    }
}
