package com.driftguard.core.severity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Aggregate severity of a record's anomalies, banded on the maximum anomaly
 * score across flagged fields: low below 2, medium [2, 3), high [3, 5),
 * critical from 5. {@link #NONE} is reserved for records with no flagged field.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    private static final SeverityBands<AnomalySeverity> BANDS = SeverityBands.of(
            List.of(2.0, 3.0, 5.0),
            List.of(LOW, MEDIUM, HIGH, CRITICAL));

    /**
     * @param maxAnomalyScore highest score among flagged fields
     * @return severity band, never {@link #NONE}
     */
    public static AnomalySeverity of(double maxAnomalyScore) {
        return BANDS.classify(maxAnomalyScore);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
