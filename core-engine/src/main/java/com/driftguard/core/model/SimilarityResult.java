package com.driftguard.core.model;

import com.driftguard.core.severity.SimilarityCategory;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Similarity between two texts, optionally with a lexical breakdown.
 *
 * @since 1.0.0
 */
public final class SimilarityResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String EMPTY_TEXT_ERROR = "Empty text fields";

    private final double similarityScore;
    private final String method;
    private final String error;
    private final Analysis analysis;

    private SimilarityResult(double similarityScore, String method, String error, Analysis analysis) {
        this.similarityScore = similarityScore;
        this.method = method;
        this.error = error;
        this.analysis = analysis;
    }

    public static SimilarityResult of(double similarityScore, String method, Analysis analysis) {
        if (Double.isNaN(similarityScore) || similarityScore < 0 || similarityScore > 1) {
            throw new IllegalArgumentException(
                    "similarityScore must be in [0, 1], got: " + similarityScore);
        }
        return new SimilarityResult(similarityScore, method, null, analysis);
    }

    /**
     * Zero-similarity result for an empty or blank side.
     */
    public static SimilarityResult emptyText(String method) {
        return new SimilarityResult(0.0, method, EMPTY_TEXT_ERROR, null);
    }

    public double getSimilarityScore() {
        return similarityScore;
    }

    public double getSemanticDistance() {
        return 1.0 - similarityScore;
    }

    public String getMethod() {
        return method;
    }

    public SimilarityCategory getCategory() {
        return SimilarityCategory.of(similarityScore);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Analysis> getAnalysis() {
        return Optional.ofNullable(analysis);
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("similarity_score", similarityScore);
        if (error != null) {
            fields.put("semantic_comparison_error", error);
            return fields;
        }
        fields.put("similarity_method", method);
        fields.put("semantic_distance", getSemanticDistance());
        if (analysis != null) {
            fields.put("semantic_shift", getSemanticDistance());
            fields.put("word_overlap", analysis.wordOverlap);
            fields.put("length_ratio", analysis.lengthRatio);
            fields.put("shift_magnitude", Math.abs(getSemanticDistance()));
            fields.put("shift_direction", analysis.shiftDirection);
        }
        fields.put("similarity_category", getCategory().label());
        return fields;
    }

    @Override
    public String toString() {
        return "SimilarityResult{score=" + similarityScore + ", method='" + method + '\''
                + (error != null ? ", error='" + error + '\'' : "") + '}';
    }

    /**
     * Lexical breakdown of a comparison.
     */
    public static final class Analysis implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double wordOverlap;
        private final double lengthRatio;
        private final String shiftDirection;

        public Analysis(double wordOverlap, double lengthRatio, String shiftDirection) {
            this.wordOverlap = wordOverlap;
            this.lengthRatio = lengthRatio;
            this.shiftDirection = shiftDirection;
        }

        /** Jaccard overlap of the two word sets. */
        public double getWordOverlap() {
            return wordOverlap;
        }

        /** Length of the second text over the length of the first. */
        public double getLengthRatio() {
            return lengthRatio;
        }

        /** {@code expansion}, {@code contraction} or {@code stable}. */
        public String getShiftDirection() {
            return shiftDirection;
        }
    }
}
