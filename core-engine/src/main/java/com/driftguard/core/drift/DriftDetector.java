package com.driftguard.core.drift;

import com.driftguard.core.config.DriftSettings;
import com.driftguard.core.model.DriftResult;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.semantic.SimilarityMethod;
import com.driftguard.core.semantic.TextEmbedder;
import com.driftguard.core.semantic.TextPreprocessor;
import com.driftguard.core.semantic.VectorSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores how far a record's text has moved away from a reference.
 *
 * <h3>Reference</h3>
 * <ul>
 * <li><b>baseline</b>: the model's centroid in the {@link TextReferenceSet};
 * without one the result is unavailable ({@code baseline_unavailable}).</li>
 * <li><b>rolling</b>: the centroid of the model's last {@code windowSize}
 * texts; an empty window yields {@code insufficient_history}.</li>
 * </ul>
 *
 * <p>
 * {@code drift_score = 1 - similarity(text, reference)}, and drift is detected
 * when the score exceeds the threshold. In both modes the text is appended to
 * the model's rolling window after scoring, and its similarity to the window
 * centroid is reported as {@code recent_similarity}. Blank text is reported as
 * unavailable ({@code empty_text}) and does not enter the window.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Windows are created through a concurrent map, but each model's window must
 * have a single writer. The pipeline guarantees this by sharding records by
 * model id.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    private static final String DEFAULT_KEY = "default";

    private final DriftSettings settings;
    private final TextEmbedder embedder;
    private final TextReferenceSet references;
    private final ReferenceMode mode;
    private final SimilarityMethod method;
    private final Map<String, RollingTextWindow> windows = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public DriftDetector(DriftSettings settings, TextEmbedder embedder, TextReferenceSet references) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
        this.references = Objects.requireNonNull(references, "references must not be null");
        settings.validate();
        this.mode = settings.referenceMode();
        this.method = settings.similarityMethod();
        if (mode == ReferenceMode.BASELINE && references.isEmpty()) {
            LOG.warn("Drift detection runs in baseline mode without reference texts; "
                    + "every record will be reported as {}", DriftResult.REASON_BASELINE_UNAVAILABLE);
        }
    }

    public DriftResult evaluate(LlmEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String reference = mode.label();
        String text = TextPreprocessor.normalize(event.getStringField(settings.getField()).orElse(null));
        if (text.isEmpty()) {
            LOG.trace("No text in field '{}' for drift detection", settings.getField());
            return DriftResult.unavailable(DriftResult.REASON_EMPTY_TEXT, null, reference);
        }

        String modelId = event.getModelId().orElse(DEFAULT_KEY);
        double[] embedding = embedder.embed(text);
        RollingTextWindow window = windows.computeIfAbsent(modelId,
                k -> new RollingTextWindow(settings.getWindowSize(), embedder.dimension()));
        Double recent = window.centroid()
                .map(c -> VectorSimilarity.similarity(method, embedding, c))
                .orElse(null);

        DriftResult result;
        if (mode == ReferenceMode.BASELINE) {
            Optional<double[]> centroid = references.find(modelId);
            result = centroid
                    .map(c -> DriftResult.scored(driftScore(embedding, c), settings.getThreshold(),
                            recent, reference))
                    .orElseGet(() -> DriftResult.unavailable(
                            DriftResult.REASON_BASELINE_UNAVAILABLE, recent, reference));
        } else if (recent == null) {
            result = DriftResult.unavailable(DriftResult.REASON_INSUFFICIENT_HISTORY, null, reference);
        } else {
            result = DriftResult.scored(Math.max(0.0, 1.0 - recent), settings.getThreshold(),
                    recent, reference);
        }
        window.add(embedding);

        if (result.isDriftDetected()) {
            LOG.debug("Drift detected for model '{}': {}", modelId, result);
        }
        return result;
    }

    private double driftScore(double[] embedding, double[] centroid) {
        return Math.max(0.0, 1.0 - VectorSimilarity.similarity(method, embedding, centroid));
    }

    /**
     * @return number of texts currently buffered for {@code modelId}
     */
    public int windowSize(String modelId) {
        RollingTextWindow window = windows.get(modelId);
        return window == null ? 0 : window.size();
    }

    public ReferenceMode getMode() {
        return mode;
    }
}
