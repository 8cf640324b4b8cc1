package com.driftguard.core.metrics;

import com.driftguard.core.severity.SeverityBands;

import java.util.List;

/**
 * Derives throughput metrics and performance/confidence categories.
 *
 * @since 1.0.0
 */
public final class PerformanceScorer {

    public static final String UNKNOWN = "unknown";

    private static final SeverityBands<String> CONFIDENCE_BANDS = SeverityBands.of(
            List.of(0.3, 0.5, 0.7, 0.9),
            List.of("very_low", "low", "medium", "high", "very_high"));

    private PerformanceScorer() {
    }

    /**
     * @param responseTime seconds, {@code >= 0}
     * @param tokenCount   tokens, {@code >= 0}
     * @param confidence   confidence score, may be {@code null}
     */
    public static PerformanceMetrics score(double responseTime, double tokenCount, Double confidence) {
        Double tokensPerSecond = responseTime > 0 ? tokenCount / responseTime : null;
        Double timePerToken = tokenCount > 0 ? responseTime / tokenCount : null;
        return new PerformanceMetrics(responseTime, tokenCount, tokensPerSecond, timePerToken,
                categorize(responseTime, tokensPerSecond),
                confidence,
                confidence != null ? CONFIDENCE_BANDS.classify(confidence) : null);
    }

    static String categorize(double responseTime, Double tokensPerSecond) {
        if (tokensPerSecond == null) {
            return UNKNOWN;
        }
        if (responseTime < 1.0 && tokensPerSecond > 100) {
            return "excellent";
        }
        if (responseTime < 3.0 && tokensPerSecond > 50) {
            return "good";
        }
        if (responseTime < 10.0 && tokensPerSecond > 20) {
            return "acceptable";
        }
        return "poor";
    }
}
