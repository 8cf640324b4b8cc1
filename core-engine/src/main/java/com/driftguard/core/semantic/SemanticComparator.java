package com.driftguard.core.semantic;

import com.driftguard.core.model.SimilarityResult;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Scores the similarity of two texts.
 *
 * <p>
 * Vector methods compare {@link TextEmbedder} embeddings, {@code jaccard}
 * compares word sets and {@code levenshtein} uses the normalised edit distance
 * of the preprocessed texts. Every method is symmetric and returns 1 for
 * identical non-empty input. Empty or blank text on either side yields a zero
 * result flagged with {@link SimilarityResult#EMPTY_TEXT_ERROR}, not an
 * exception.
 * </p>
 *
 * <p>
 * Text that normalises to nothing (punctuation only, such as {@code "???"})
 * is not blank: it is scored by the edit distance of the trimmed raw strings,
 * whatever the method.
 * </p>
 *
 * <p>
 * Thread-safe if the embedder is.
 * </p>
 *
 * @since 1.0.0
 */
public class SemanticComparator {

    private static final double EXPANSION_RATIO = 1.2;
    private static final double CONTRACTION_RATIO = 0.8;

    private final TextEmbedder embedder;

    public SemanticComparator(TextEmbedder embedder) {
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
    }

    /**
     * @param includeAnalysis whether to add the lexical breakdown
     */
    public SimilarityResult compare(String text1, String text2, SimilarityMethod method,
            boolean includeAnalysis) {
        Objects.requireNonNull(method, "method must not be null");
        if (text1 == null || text1.isBlank() || text2 == null || text2.isBlank()) {
            return SimilarityResult.emptyText(method.label());
        }
        String norm1 = TextPreprocessor.normalize(text1);
        String norm2 = TextPreprocessor.normalize(text2);
        double score = norm1.isEmpty() || norm2.isEmpty()
                ? levenshteinSimilarity(text1.trim(), text2.trim())
                : similarity(norm1, norm2, method);
        SimilarityResult.Analysis analysis = includeAnalysis ? analyze(text1, text2) : null;
        return SimilarityResult.of(score, method.label(), analysis);
    }

    private double similarity(String norm1, String norm2, SimilarityMethod method) {
        return switch (method) {
            case JACCARD -> jaccard(TextPreprocessor.wordSet(norm1), TextPreprocessor.wordSet(norm2));
            case LEVENSHTEIN -> levenshteinSimilarity(norm1, norm2);
            default -> VectorSimilarity.similarity(method, embedder.embed(norm1), embedder.embed(norm2));
        };
    }

    private static SimilarityResult.Analysis analyze(String text1, String text2) {
        double overlap = jaccard(TextPreprocessor.wordSet(text1), TextPreprocessor.wordSet(text2));
        double lengthRatio = (double) text2.trim().length() / Math.max(text1.trim().length(), 1);
        String direction;
        if (lengthRatio > EXPANSION_RATIO) {
            direction = "expansion";
        } else if (lengthRatio < CONTRACTION_RATIO) {
            direction = "contraction";
        } else {
            direction = "stable";
        }
        return new SimilarityResult.Analysis(overlap, lengthRatio, direction);
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static double levenshteinSimilarity(String a, String b) {
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 0.0;
        }
        return VectorSimilarity.clamp(1.0 - (double) levenshtein(a, b) / maxLen);
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    public TextEmbedder getEmbedder() {
        return embedder;
    }
}
