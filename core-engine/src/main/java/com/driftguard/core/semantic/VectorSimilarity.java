package com.driftguard.core.semantic;

import java.util.Arrays;

/**
 * Similarity functions over embedding vectors, each mapped into {@code [0, 1]}
 * with 1 meaning identical.
 *
 * @since 1.0.0
 */
public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * @throws IllegalArgumentException if {@code method} is not vector-based or
     *                                  the vectors differ in length
     */
    public static double similarity(SimilarityMethod method, double[] a, double[] b) {
        return switch (method) {
            case COSINE -> cosine(a, b);
            case EUCLIDEAN -> euclidean(a, b);
            case MANHATTAN -> manhattan(a, b);
            default -> throw new IllegalArgumentException(
                    "Similarity method '" + method.label() + "' does not operate on vectors");
        };
    }

    /**
     * Cosine similarity clamped to {@code [0, 1]}; 0 if either vector is zero.
     */
    public static double cosine(double[] a, double[] b) {
        checkLengths(a, b);
        if (Arrays.equals(a, b)) {
            return isZero(a) ? 0.0 : 1.0;
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return clamp(dot / Math.sqrt(na * nb));
    }

    /** {@code 1 / (1 + ||a - b||)}. */
    public static double euclidean(double[] a, double[] b) {
        checkLengths(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return clamp(1.0 / (1.0 + Math.sqrt(sum)));
    }

    /** {@code 1 / (1 + sum |a - b|)}. */
    public static double manhattan(double[] a, double[] b) {
        checkLengths(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs(a[i] - b[i]);
        }
        return clamp(1.0 / (1.0 + sum));
    }

    private static boolean isZero(double[] v) {
        for (double x : v) {
            if (x != 0) {
                return false;
            }
        }
        return true;
    }

    private static void checkLengths(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vector dimensions differ: " + a.length + " vs " + b.length);
        }
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
