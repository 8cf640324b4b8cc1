package com.driftguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction in which a metric deteriorates.
 *
 * @since 1.0.0
 */
public enum ThresholdType {
    /** Higher values are worse (e.g. latency). */
    UPPER,
    /** Lower values are worse (e.g. confidence). */
    LOWER;

    /**
     * @param value {@code upper} or {@code lower}, case-insensitive
     * @return the threshold type
     * @throws IllegalArgumentException if {@code value} is neither
     */
    @JsonCreator
    public static ThresholdType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("threshold_type must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "upper" -> UPPER;
            case "lower" -> LOWER;
            default -> throw new IllegalArgumentException(
                    "Unknown threshold_type: '" + value + "'. Supported types: upper, lower");
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
