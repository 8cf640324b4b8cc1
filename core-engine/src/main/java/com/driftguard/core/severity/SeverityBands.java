package com.driftguard.core.severity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maps a continuous, non-negative score onto an ordered set of labels.
 *
 * <p>
 * A band set is defined by {@code k} cutpoints in non-decreasing order and
 * {@code k + 1} labels. Label {@code i} covers the half-open interval
 * {@code [cutpoint(i-1), cutpoint(i))}; the first label also absorbs every score
 * below the first cutpoint and the last label is unbounded above. The result is
 * a total, non-overlapping partition of {@code [0, +inf)}.
 * </p>
 *
 * <pre>
 * SeverityBands&lt;DriftSeverity&gt; bands = SeverityBands.of(
 *         List.of(0.1, 0.3, 0.5, 0.7),
 *         List.of(MINIMAL, LOW, MEDIUM, HIGH, CRITICAL));
 * bands.classify(0.3); // MEDIUM
 * </pre>
 *
 * @param <L> label type
 * @since 1.0.0
 */
public final class SeverityBands<L> implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] cutpoints;
    private final List<L> labels;

    private SeverityBands(double[] cutpoints, List<L> labels) {
        this.cutpoints = cutpoints;
        this.labels = labels;
    }

    /**
     * Create a band set.
     *
     * @param cutpoints band boundaries, non-decreasing, finite
     * @param labels    one more label than cutpoints, lowest band first
     * @param <L>       label type
     * @return the band set
     * @throws NullPointerException     if an argument or a label is {@code null}
     * @throws IllegalArgumentException if the cutpoints are unordered or not
     *                                  finite, or the label count does not match
     */
    public static <L> SeverityBands<L> of(List<Double> cutpoints, List<L> labels) {
        Objects.requireNonNull(cutpoints, "cutpoints must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (labels.size() != cutpoints.size() + 1) {
            throw new IllegalArgumentException("Expected " + (cutpoints.size() + 1)
                    + " labels for " + cutpoints.size() + " cutpoints, got: " + labels.size());
        }

        double[] points = new double[cutpoints.size()];
        for (int i = 0; i < points.length; i++) {
            double c = Objects.requireNonNull(cutpoints.get(i), "cutpoint " + i + " is null");
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Cutpoint " + i + " must be finite, got: " + c);
            }
            if (i > 0 && c < points[i - 1]) {
                throw new IllegalArgumentException("Cutpoints must be non-decreasing: "
                        + points[i - 1] + " followed by " + c);
            }
            points[i] = c;
        }

        List<L> copy = new ArrayList<>(labels.size());
        for (L label : labels) {
            copy.add(Objects.requireNonNull(label, "labels must not contain null"));
        }
        return new SeverityBands<>(points, Collections.unmodifiableList(copy));
    }

    /**
     * Classify a score.
     *
     * @param score the score; {@code +inf} maps to the highest label
     * @return the label of the band containing {@code score}
     * @throws IllegalArgumentException if {@code score} is NaN
     */
    public L classify(double score) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Cannot classify NaN score");
        }
        int band = 0;
        while (band < cutpoints.length && score >= cutpoints[band]) {
            band++;
        }
        return labels.get(band);
    }

    /**
     * @return the labels, lowest band first (unmodifiable)
     */
    public List<L> labels() {
        return labels;
    }

    /**
     * @return a copy of the cutpoints
     */
    public double[] cutpoints() {
        return cutpoints.clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SeverityBands{");
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) {
                sb.append(" | ").append(cutpoints[i - 1]).append(" <= ");
            }
            sb.append(labels.get(i));
        }
        return sb.append('}').toString();
    }
}
