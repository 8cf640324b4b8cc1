package com.driftguard.core.semantic;

import java.util.List;

/**
 * Feature-hashing bag-of-words embedder.
 *
 * <p>
 * Word unigrams (weight 1.0) and character trigrams of each word
 * (weight 0.5) are hashed into a fixed number of buckets, and the vector is
 * L2-normalised. Texts sharing vocabulary end up close under cosine
 * similarity; character trigrams add tolerance to inflection and typos. No
 * model files are needed and results are reproducible across JVMs.
 * </p>
 *
 * @since 1.0.0
 */
public class HashingTextEmbedder implements TextEmbedder {

    public static final int DEFAULT_DIMENSION = 384;

    private static final double WORD_WEIGHT = 1.0;
    private static final double TRIGRAM_WEIGHT = 0.5;

    private final int dimension;

    public HashingTextEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashingTextEmbedder(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1, got: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] v = new double[dimension];
        List<String> words = TextPreprocessor.tokenize(text);
        for (String word : words) {
            v[bucket(word)] += WORD_WEIGHT;
            String padded = "^" + word + "$";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                v[bucket("#" + padded.substring(i, i + 3))] += TRIGRAM_WEIGHT;
            }
        }
        double norm = 0.0;
        for (double x : v) {
            norm += x * x;
        }
        if (norm > 0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < v.length; i++) {
                v[i] /= norm;
            }
        }
        return v;
    }

    private int bucket(String token) {
        return Math.floorMod(token.hashCode(), dimension);
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
