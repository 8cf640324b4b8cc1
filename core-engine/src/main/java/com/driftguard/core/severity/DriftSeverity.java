package com.driftguard.core.severity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Severity of a drift score.
 *
 * <table>
 * <caption>Drift bands</caption>
 * <tr><th>band</th><th>range</th></tr>
 * <tr><td>minimal</td><td>[0, 0.1)</td></tr>
 * <tr><td>low</td><td>[0.1, 0.3)</td></tr>
 * <tr><td>medium</td><td>[0.3, 0.5)</td></tr>
 * <tr><td>high</td><td>[0.5, 0.7)</td></tr>
 * <tr><td>critical</td><td>[0.7, +inf)</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum DriftSeverity {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    private static final SeverityBands<DriftSeverity> BANDS = SeverityBands.of(
            List.of(0.1, 0.3, 0.5, 0.7),
            List.of(MINIMAL, LOW, MEDIUM, HIGH, CRITICAL));

    /**
     * @param driftScore drift score, {@code >= 0}
     * @return the band containing {@code driftScore}
     */
    public static DriftSeverity of(double driftScore) {
        return BANDS.classify(driftScore);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
