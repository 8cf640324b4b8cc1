package com.driftguard.core.model;

import com.driftguard.core.severity.AnomalySeverity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate anomaly verdict for one record.
 *
 * <ul>
 * <li>{@code anomaly_detected} is the OR over all evaluations</li>
 * <li>{@code max_anomaly_score} is the highest score among flagged
 * evaluations</li>
 * <li>{@code anomaly_severity} bands that maximum, or is {@code none}</li>
 * <li>{@code anomaly_types} lists the {@code field_method} tags flagged</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class AnomalyResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<FieldAnomaly> evaluations;
    private final String method;
    private final double threshold;

    public AnomalyResult(List<FieldAnomaly> evaluations, String method, double threshold) {
        this.evaluations = Collections.unmodifiableList(new ArrayList<>(evaluations));
        this.method = method;
        this.threshold = threshold;
    }

    public List<FieldAnomaly> getEvaluations() {
        return evaluations;
    }

    public List<FieldAnomaly> getFlagged() {
        return evaluations.stream().filter(FieldAnomaly::isAnomalous).toList();
    }

    public boolean isAnomalyDetected() {
        return evaluations.stream().anyMatch(FieldAnomaly::isAnomalous);
    }

    public double getMaxAnomalyScore() {
        return evaluations.stream()
                .filter(FieldAnomaly::isAnomalous)
                .mapToDouble(FieldAnomaly::getScore)
                .max()
                .orElse(0.0);
    }

    public AnomalySeverity getSeverity() {
        return isAnomalyDetected() ? AnomalySeverity.of(getMaxAnomalyScore()) : AnomalySeverity.NONE;
    }

    public Set<String> getAnomalyTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (FieldAnomaly anomaly : evaluations) {
            if (anomaly.isAnomalous()) {
                types.add(anomaly.tag());
            }
        }
        return types;
    }

    public String getMethod() {
        return method;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @param includeAnalysis whether to add the per-evaluation analysis map
     * @return output fields
     */
    public Map<String, Object> toFields(boolean includeAnalysis) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Set<String> types = getAnomalyTypes();
        fields.put("anomaly_detected", !types.isEmpty());
        fields.put("anomaly_count", types.size());
        fields.put("anomaly_types", String.join(",", types));
        fields.put("anomaly_severity", getSeverity().label());
        fields.put("max_anomaly_score", getMaxAnomalyScore());
        for (FieldAnomaly anomaly : getFlagged()) {
            fields.put("anomaly_score_" + anomaly.tag(), anomaly.getScore());
        }
        if (includeAnalysis) {
            Map<String, Object> analysis = new LinkedHashMap<>();
            for (FieldAnomaly anomaly : getFlagged()) {
                analysis.put(anomaly.tag(), anomaly.getAnalysis());
            }
            if (!analysis.isEmpty()) {
                fields.put("anomaly_analysis", analysis);
            }
        }
        fields.put("anomaly_detection_method", method);
        fields.put("anomaly_threshold", threshold);
        return fields;
    }

    @Override
    public String toString() {
        return "AnomalyResult{detected=" + isAnomalyDetected()
                + ", types=" + getAnomalyTypes()
                + ", severity=" + getSeverity() + '}';
    }
}
