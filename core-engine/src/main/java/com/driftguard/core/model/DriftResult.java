package com.driftguard.core.model;

import com.driftguard.core.severity.DriftSeverity;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of scoring one text against its drift reference.
 *
 * <p>
 * When no reference exists the result is <em>unavailable</em>: the score and
 * severity are {@code null}, {@code drift_detected} is {@code false} and
 * {@link #getUnavailableReason()} says why. An unavailable result is never
 * reported as a score of zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String REASON_BASELINE_UNAVAILABLE = "baseline_unavailable";
    public static final String REASON_INSUFFICIENT_HISTORY = "insufficient_history";
    public static final String REASON_EMPTY_TEXT = "empty_text";

    private final Double driftScore;
    private final boolean driftDetected;
    private final DriftSeverity severity;
    private final Double recentSimilarity;
    private final String reference;
    private final String unavailableReason;

    private DriftResult(Double driftScore, boolean driftDetected, DriftSeverity severity,
            Double recentSimilarity, String reference, String unavailableReason) {
        this.driftScore = driftScore;
        this.driftDetected = driftDetected;
        this.severity = severity;
        this.recentSimilarity = recentSimilarity;
        this.reference = reference;
        this.unavailableReason = unavailableReason;
    }

    /**
     * @param driftScore       score, {@code >= 0}
     * @param threshold        detection threshold; detected iff score exceeds it
     * @param recentSimilarity similarity to the rolling window, may be {@code null}
     * @param reference        reference mode label
     * @return scored result
     */
    public static DriftResult scored(double driftScore, double threshold, Double recentSimilarity,
            String reference) {
        if (Double.isNaN(driftScore) || driftScore < 0) {
            throw new IllegalArgumentException("driftScore must be >= 0, got: " + driftScore);
        }
        return new DriftResult(driftScore, driftScore > threshold, DriftSeverity.of(driftScore),
                recentSimilarity, reference, null);
    }

    public static DriftResult unavailable(String reason, Double recentSimilarity, String reference) {
        return new DriftResult(null, false, null, recentSimilarity, reference,
                Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isAvailable() {
        return driftScore != null;
    }

    public Optional<Double> getDriftScore() {
        return Optional.ofNullable(driftScore);
    }

    public boolean isDriftDetected() {
        return driftDetected;
    }

    public Optional<DriftSeverity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<Double> getRecentSimilarity() {
        return Optional.ofNullable(recentSimilarity);
    }

    public String getReference() {
        return reference;
    }

    public Optional<String> getUnavailableReason() {
        return Optional.ofNullable(unavailableReason);
    }

    /**
     * @return output fields ({@code drift_*}, {@code baseline_similarity},
     *         {@code recent_similarity})
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("drift_score", driftScore);
        fields.put("drift_detected", driftDetected);
        fields.put("drift_severity", severity != null ? severity.label() : null);
        fields.put("baseline_similarity", driftScore != null ? Math.max(0.0, 1.0 - driftScore) : null);
        fields.put("recent_similarity", recentSimilarity);
        fields.put("drift_reference", reference);
        fields.put("drift_unavailable_reason", unavailableReason);
        return fields;
    }

    @Override
    public String toString() {
        return "DriftResult{" +
                "driftScore=" + driftScore +
                ", driftDetected=" + driftDetected +
                ", severity=" + severity +
                ", reference='" + reference + '\'' +
                ", unavailableReason='" + unavailableReason + '\'' +
                '}';
    }
}
