package com.driftguard.core.metrics;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Output of the {@link MetricsCalculator} for one record: quality metrics,
 * performance metrics when response time and token count are known, and
 * optional trend fields. A record without response text carries only an
 * error.
 *
 * @since 1.0.0
 */
public final class LlmMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String EMPTY_RESPONSE_ERROR = "Empty response field";

    private final QualityMetrics quality;
    private final PerformanceMetrics performance;
    private final Map<String, Object> trends;
    private final String error;

    private LlmMetrics(QualityMetrics quality, PerformanceMetrics performance,
            Map<String, Object> trends, String error) {
        this.quality = quality;
        this.performance = performance;
        this.trends = trends;
        this.error = error;
    }

    static LlmMetrics of(QualityMetrics quality, PerformanceMetrics performance, Map<String, Object> trends) {
        return new LlmMetrics(Objects.requireNonNull(quality), performance,
                trends != null ? Map.copyOf(trends) : Map.of(), null);
    }

    static LlmMetrics error(String error) {
        return new LlmMetrics(null, null, Map.of(), error);
    }

    public Optional<QualityMetrics> getQuality() {
        return Optional.ofNullable(quality);
    }

    public Optional<PerformanceMetrics> getPerformance() {
        return Optional.ofNullable(performance);
    }

    public Map<String, Object> getTrends() {
        return trends;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (error != null) {
            fields.put("llm_metrics_error", error);
            return fields;
        }
        fields.putAll(quality.toFields());
        if (performance != null) {
            fields.putAll(performance.toFields());
        }
        fields.putAll(new TreeMap<>(trends));
        return fields;
    }

    @Override
    public String toString() {
        return error != null ? "LlmMetrics{error='" + error + "'}"
                : "LlmMetrics{quality=" + quality + ", performance=" + performance + '}';
    }
}
