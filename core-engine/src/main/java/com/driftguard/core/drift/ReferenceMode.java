package com.driftguard.core.drift;

import java.util.Locale;

/**
 * Where the {@link DriftDetector} takes its reference from.
 *
 * @since 1.0.0
 */
public enum ReferenceMode {
    /** Stored per-model reference texts or embeddings. */
    BASELINE,
    /** The last {@code windowSize} texts seen for the same model. */
    ROLLING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name {@code baseline} or {@code rolling} (also {@code rolling_window})
     * @return the mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ReferenceMode fromName(String name) {
        String key = name != null ? name.trim().toLowerCase(Locale.ROOT) : "";
        return switch (key) {
            case "baseline", "baseline_file" -> BASELINE;
            case "rolling", "rolling_window" -> ROLLING;
            default -> throw new IllegalArgumentException("Unknown drift reference mode: '" + name
                    + "'. Supported modes: baseline, rolling");
        };
    }
}
