package com.driftguard.core.severity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of comparing a current value against its baseline.
 *
 * @since 1.0.0
 */
public enum ComparisonStatus {
    NORMAL,
    WARNING,
    CRITICAL;

    /**
     * Build the bands for an adverse change: warning from {@code warning},
     * critical from {@code critical} (both inclusive).
     *
     * @param warning  warning cut, percent
     * @param critical critical cut, percent; must be {@code >= warning}
     * @return band set over the adverse change
     */
    public static SeverityBands<ComparisonStatus> bands(double warning, double critical) {
        return SeverityBands.of(List.of(warning, critical), List.of(NORMAL, WARNING, CRITICAL));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
