package com.driftguard.core.config;

import com.driftguard.core.drift.ReferenceMode;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.semantic.SimilarityMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the drift detection stage.
 *
 * <pre>
 * drift:
 *   enabled: true
 *   field: response
 *   mode: rolling          # or: baseline
 *   referenceFile: /data/lookups/drift_references.csv
 *   threshold: 0.3
 *   windowSize: 50
 *   method: cosine
 * </pre>
 *
 * <h3>Score range per method</h3>
 * <p>
 * The hashing embedder yields unit-length vectors with non-negative
 * components, so their euclidean distance to a window centroid is at most
 * {@code sqrt(2)}. With {@code euclidean} the
 * drift score therefore never exceeds {@link #EUCLIDEAN_MAX_DRIFT_SCORE}
 * (about 0.586) and never reaches the {@code critical} band; thresholds should
 * be chosen within that range. {@code cosine} and {@code manhattan} can reach
 * every band.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_THRESHOLD = 0.3;
    public static final int DEFAULT_WINDOW_SIZE = 50;

    /** Upper bound of the euclidean drift score, {@code 1 - 1 / (1 + sqrt(2))}. */
    public static final double EUCLIDEAN_MAX_DRIFT_SCORE = 1.0 - 1.0 / (1.0 + Math.sqrt(2.0));

    private boolean enabled = true;
    private String field = LlmEvent.RESPONSE;
    private String mode = "rolling";
    private String referenceFile;
    private double threshold = DEFAULT_THRESHOLD;
    private int windowSize = DEFAULT_WINDOW_SIZE;
    private String method = "cosine";

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (field == null || field.isBlank()) {
            errors.add("'field' is required");
        }
        if (!Double.isFinite(threshold) || threshold < 0 || threshold > 1) {
            errors.add("'threshold' must be in [0, 1], got: " + threshold);
        }
        if (windowSize < 1) {
            errors.add("'windowSize' must be >= 1, got: " + windowSize);
        }
        try {
            ReferenceMode.fromName(mode);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            if (!SimilarityMethod.fromName(method).isVectorBased()) {
                errors.add("'method' must be a vector method (cosine, euclidean, manhattan), got: "
                        + method);
            }
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid drift settings: " + String.join("; ", errors));
        }
    }

    public ReferenceMode referenceMode() {
        return ReferenceMode.fromName(mode);
    }

    public SimilarityMethod similarityMethod() {
        return SimilarityMethod.fromName(method);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getReferenceFile() {
        return referenceFile;
    }

    public void setReferenceFile(String referenceFile) {
        this.referenceFile = referenceFile;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    @Override
    public String toString() {
        return "DriftSettings{" +
                "enabled=" + enabled +
                ", field='" + field + '\'' +
                ", mode='" + mode + '\'' +
                ", threshold=" + threshold +
                ", windowSize=" + windowSize +
                ", method='" + method + '\'' +
                '}';
    }
}
