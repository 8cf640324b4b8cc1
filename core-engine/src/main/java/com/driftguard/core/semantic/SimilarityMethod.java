package com.driftguard.core.semantic;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Similarity methods understood by the {@link SemanticComparator}.
 *
 * <p>
 * Vector methods compare {@link TextEmbedder} embeddings; lexical methods work
 * on the preprocessed text and are the fallback when no meaningful embedding
 * is available. Every method is symmetric and returns 1 for identical input.
 * </p>
 *
 * @since 1.0.0
 */
public enum SimilarityMethod {
    COSINE(true),
    EUCLIDEAN(true),
    MANHATTAN(true),
    JACCARD(false),
    LEVENSHTEIN(false);

    private final boolean vectorBased;

    SimilarityMethod(boolean vectorBased) {
        this.vectorBased = vectorBased;
    }

    public boolean isVectorBased() {
        return vectorBased;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name method name, case-insensitive
     * @return the method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SimilarityMethod fromName(String name) {
        if (name != null) {
            for (SimilarityMethod method : values()) {
                if (method.label().equals(name.trim().toLowerCase(Locale.ROOT))) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown similarity method: '" + name
                + "'. Supported methods: " + Arrays.stream(values())
                        .map(SimilarityMethod::label)
                        .collect(Collectors.joining(", ")));
    }
}
