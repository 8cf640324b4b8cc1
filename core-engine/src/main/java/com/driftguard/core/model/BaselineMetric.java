package com.driftguard.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Metrics summarised in a {@link BaselineRecord}, with the event field they are
 * computed from and their column names in the baseline table.
 *
 * @since 1.0.0
 */
public enum BaselineMetric {
    RESPONSE_TIME(LlmEvent.RESPONSE_TIME, "avg_response_time", "std_response_time"),
    TOKEN_COUNT(LlmEvent.TOKEN_COUNT, "avg_token_count", "std_token_count"),
    CONFIDENCE(LlmEvent.CONFIDENCE_SCORE, "avg_confidence", "std_confidence");

    private final String fieldName;
    private final String meanColumn;
    private final String stdColumn;

    BaselineMetric(String fieldName, String meanColumn, String stdColumn) {
        this.fieldName = fieldName;
        this.meanColumn = meanColumn;
        this.stdColumn = stdColumn;
    }

    public String fieldName() {
        return fieldName;
    }

    public String meanColumn() {
        return meanColumn;
    }

    public String stdColumn() {
        return stdColumn;
    }

    /**
     * Resolve a metric or column name. Leading {@code current_} / {@code avg_} /
     * {@code std_} prefixes are ignored and {@code confidence} is accepted as an
     * alias of {@code confidence_score}.
     *
     * @param name metric name such as {@code response_time} or
     *             {@code avg_response_time}
     * @return the metric, or empty if {@code name} is not a baseline metric
     */
    public static Optional<BaselineMetric> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (String prefix : new String[] {"current_", "avg_", "std_"}) {
            if (key.startsWith(prefix)) {
                key = key.substring(prefix.length());
                break;
            }
        }
        if ("confidence".equals(key)) {
            return Optional.of(CONFIDENCE);
        }
        for (BaselineMetric metric : values()) {
            if (metric.fieldName.equals(key)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
