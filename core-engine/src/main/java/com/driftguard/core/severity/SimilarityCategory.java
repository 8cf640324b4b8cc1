package com.driftguard.core.severity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Coarse label for a similarity score in {@code [0, 1]}.
 *
 * @since 1.0.0
 */
public enum SimilarityCategory {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    private static final SeverityBands<SimilarityCategory> BANDS = SeverityBands.of(
            List.of(0.3, 0.5, 0.7, 0.9),
            List.of(VERY_LOW, LOW, MEDIUM, HIGH, VERY_HIGH));

    public static SimilarityCategory of(double similarity) {
        return BANDS.classify(similarity);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
