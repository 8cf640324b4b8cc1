package com.driftguard.core.severity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Magnitude of a percentage change, independent of direction or thresholds.
 *
 * @since 1.0.0
 */
public enum DeviationCategory {
    MINIMAL,
    SMALL,
    MODERATE,
    LARGE,
    EXTREME;

    private static final SeverityBands<DeviationCategory> BANDS = SeverityBands.of(
            List.of(5.0, 15.0, 30.0, 50.0),
            List.of(MINIMAL, SMALL, MODERATE, LARGE, EXTREME));

    /**
     * @param percentageChange signed change in percent
     * @return category of {@code |percentageChange|}
     */
    public static DeviationCategory of(double percentageChange) {
        return BANDS.classify(Math.abs(percentageChange));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
