package com.driftguard.core.drift;

import com.driftguard.core.semantic.TextEmbedder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-model reference centroids for baseline-mode drift detection.
 *
 * <p>
 * Models without an entry of their own fall back to the
 * {@value #DEFAULT_MODEL} centroid when one exists. Immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class TextReferenceSet {

    public static final String DEFAULT_MODEL = "default";

    private static final TextReferenceSet EMPTY = new TextReferenceSet(Map.of());

    private final Map<String, double[]> centroids;

    private TextReferenceSet(Map<String, double[]> centroids) {
        this.centroids = Collections.unmodifiableMap(new LinkedHashMap<>(centroids));
    }

    public static TextReferenceSet empty() {
        return EMPTY;
    }

    /**
     * @param centroids reference vector per model id
     */
    public static TextReferenceSet ofCentroids(Map<String, double[]> centroids) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        centroids.forEach((model, v) -> copy.put(model, v.clone()));
        return new TextReferenceSet(copy);
    }

    /**
     * Embed each model's representative texts and average them.
     *
     * @param texts    representative texts per model id; blank texts are ignored
     * @param embedder the embedder used by the drift detector
     */
    public static TextReferenceSet fromTexts(Map<String, List<String>> texts, TextEmbedder embedder) {
        Objects.requireNonNull(embedder, "embedder must not be null");
        Map<String, double[]> centroids = new LinkedHashMap<>();
        texts.forEach((model, list) -> {
            double[] sum = new double[embedder.dimension()];
            int n = 0;
            for (String text : list) {
                if (text == null || text.isBlank()) {
                    continue;
                }
                double[] v = embedder.embed(text);
                for (int i = 0; i < sum.length; i++) {
                    sum[i] += v[i];
                }
                n++;
            }
            if (n > 0) {
                for (int i = 0; i < sum.length; i++) {
                    sum[i] /= n;
                }
                centroids.put(model, sum);
            }
        });
        return new TextReferenceSet(centroids);
    }

    /**
     * @param modelId model id, may be {@code null}
     * @return a copy of the reference centroid, or empty if none applies
     */
    public Optional<double[]> find(String modelId) {
        double[] c = modelId != null ? centroids.get(modelId) : null;
        if (c == null) {
            c = centroids.get(DEFAULT_MODEL);
        }
        return c == null ? Optional.empty() : Optional.of(c.clone());
    }

    public Set<String> models() {
        return centroids.keySet();
    }

    public boolean isEmpty() {
        return centroids.isEmpty();
    }
}
