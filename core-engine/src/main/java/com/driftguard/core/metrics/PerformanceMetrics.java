package com.driftguard.core.metrics;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Throughput and confidence metrics of one response. Ratios whose divisor is
 * zero are absent rather than infinite.
 *
 * @since 1.0.0
 */
public final class PerformanceMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double responseTime;
    private final double tokenCount;
    private final Double tokensPerSecond;
    private final Double timePerToken;
    private final String performanceCategory;
    private final Double confidenceScore;
    private final String confidenceCategory;

    PerformanceMetrics(double responseTime, double tokenCount, Double tokensPerSecond, Double timePerToken,
            String performanceCategory, Double confidenceScore, String confidenceCategory) {
        this.responseTime = responseTime;
        this.tokenCount = tokenCount;
        this.tokensPerSecond = tokensPerSecond;
        this.timePerToken = timePerToken;
        this.performanceCategory = performanceCategory;
        this.confidenceScore = confidenceScore;
        this.confidenceCategory = confidenceCategory;
    }

    public double getResponseTime() {
        return responseTime;
    }

    public double getTokenCount() {
        return tokenCount;
    }

    public Optional<Double> getTokensPerSecond() {
        return Optional.ofNullable(tokensPerSecond);
    }

    public Optional<Double> getTimePerToken() {
        return Optional.ofNullable(timePerToken);
    }

    public String getPerformanceCategory() {
        return performanceCategory;
    }

    public Optional<Double> getConfidenceScore() {
        return Optional.ofNullable(confidenceScore);
    }

    public Optional<String> getConfidenceCategory() {
        return Optional.ofNullable(confidenceCategory);
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("perf_response_time", responseTime);
        fields.put("perf_token_count", tokenCount);
        fields.put("perf_tokens_per_second", tokensPerSecond);
        fields.put("perf_time_per_token", timePerToken);
        fields.put("perf_performance_category", performanceCategory);
        fields.put("perf_confidence_score", confidenceScore);
        fields.put("perf_confidence_category", confidenceCategory);
        return fields;
    }

    @Override
    public String toString() {
        return "PerformanceMetrics{responseTime=" + responseTime + ", tokenCount=" + tokenCount
                + ", tokensPerSecond=" + tokensPerSecond + ", category='" + performanceCategory + "'}";
    }
}
