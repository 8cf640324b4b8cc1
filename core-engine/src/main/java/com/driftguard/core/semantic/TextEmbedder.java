package com.driftguard.core.semantic;

/**
 * Maps text to a fixed-length vector.
 *
 * <p>
 * Implementations must be deterministic and thread-safe, and must return
 * vectors of {@link #dimension()} components for every input.
 * </p>
 *
 * @since 1.0.0
 */
public interface TextEmbedder {

    /**
     * @param text input text, never blank
     * @return the embedding
     */
    double[] embed(String text);

    int dimension();
}
