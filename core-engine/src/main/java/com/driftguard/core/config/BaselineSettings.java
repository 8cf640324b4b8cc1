package com.driftguard.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Location of the baseline table and the historical window used to recompute
 * it.
 *
 * @since 1.0.0
 */
public class BaselineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String file;
    private int lookbackDays = 30;
    private int excludeRecentDays = 1;

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (lookbackDays < 1) {
            errors.add("'lookbackDays' must be >= 1, got: " + lookbackDays);
        }
        if (excludeRecentDays < 0 || excludeRecentDays > lookbackDays) {
            errors.add("'excludeRecentDays' must be in [0, lookbackDays], got: " + excludeRecentDays);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid baseline settings: " + String.join("; ", errors));
        }
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public int getExcludeRecentDays() {
        return excludeRecentDays;
    }

    public void setExcludeRecentDays(int excludeRecentDays) {
        this.excludeRecentDays = excludeRecentDays;
    }

    @Override
    public String toString() {
        return "BaselineSettings{file='" + file + "', lookbackDays=" + lookbackDays
                + ", excludeRecentDays=" + excludeRecentDays + '}';
    }
}
