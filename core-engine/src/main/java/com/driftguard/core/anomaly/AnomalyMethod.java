package com.driftguard.core.anomaly;

import java.util.Locale;

/**
 * Anomaly detection methods selectable by name.
 *
 * @since 1.0.0
 */
public enum AnomalyMethod {
    ZSCORE,
    IQR,
    ISOLATION,
    TREND,
    /** Every method above; flags are unioned. */
    ALL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name method name, case-insensitive
     * @return the method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AnomalyMethod fromName(String name) {
        String key = name != null ? name.trim().toLowerCase(Locale.ROOT) : "";
        return switch (key) {
            case "zscore", "z-score" -> ZSCORE;
            case "iqr" -> IQR;
            case "isolation", "multivariate" -> ISOLATION;
            case "trend" -> TREND;
            case "all" -> ALL;
            default -> throw new IllegalArgumentException("Unknown anomaly method: '" + name
                    + "'. Supported methods: zscore, iqr, isolation, trend, all");
        };
    }
}
