package com.driftguard.core.anomaly;

import com.driftguard.core.baseline.BaselineSnapshot;
import com.driftguard.core.config.AnomalySettings;
import com.driftguard.core.model.AnomalyResult;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.FieldAnomaly;
import com.driftguard.core.model.LlmEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the configured {@link AnomalyStrategy strategies} over the selected
 * numeric fields of each record.
 *
 * <h3>State</h3>
 * <p>
 * Keeps one {@link RollingStats} window per (model, field). A record is
 * evaluated against the windows as they were before it, and its values are
 * appended afterwards, so a value never influences its own evaluation.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Windows of different models may be updated concurrently; each model's
 * windows must have a single writer.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    private static final String DEFAULT_KEY = "default";

    private final AnomalySettings settings;
    private final List<AnomalyStrategy> strategies;
    private final Map<String, Map<String, RollingStats>> windows = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public AnomalyEngine(AnomalySettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        settings.validate();
        this.strategies = AnomalyStrategyFactory.create(settings);
    }

    /**
     * @param event    the record
     * @param snapshot baseline snapshot of the current batch
     * @return the combined result of every strategy
     */
    public AnomalyResult evaluate(LlmEvent event, BaselineSnapshot snapshot) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        String modelId = event.getModelId().orElse(DEFAULT_KEY);

        Map<String, Double> values = new LinkedHashMap<>();
        for (String field : settings.getFields()) {
            event.getNumericField(field)
                    .filter(Double::isFinite)
                    .ifPresentOrElse(v -> values.put(field, v),
                            () -> LOG.trace("Field '{}' absent or not numeric - skipping", field));
        }

        Map<String, RollingStats> modelWindows = windows.computeIfAbsent(modelId, k -> new ConcurrentHashMap<>());
        BaselineRecord baseline = snapshot.find(modelId).filter(BaselineRecord::isAvailable).orElse(null);
        AnomalyContext context = new AnomalyContext(modelId, values, modelWindows, baseline,
                settings.getThreshold(), settings.getMinSamples());

        List<FieldAnomaly> evaluations = new ArrayList<>();
        for (AnomalyStrategy strategy : strategies) {
            evaluations.addAll(strategy.evaluate(context));
        }

        values.forEach((field, value) -> modelWindows
                .computeIfAbsent(field, k -> new RollingStats(settings.getWindow()))
                .add(value));

        AnomalyResult result = new AnomalyResult(evaluations, settings.anomalyMethod().label(),
                settings.getThreshold());
        if (result.isAnomalyDetected()) {
            LOG.debug("Anomaly detected for model '{}': types={} maxScore={}", modelId,
                    result.getAnomalyTypes(), result.getMaxAnomalyScore());
        }
        return result;
    }

    /**
     * @return number of values buffered for (model, field)
     */
    public int windowSize(String modelId, String field) {
        Map<String, RollingStats> modelWindows = windows.get(modelId);
        RollingStats stats = modelWindows != null ? modelWindows.get(field) : null;
        return stats == null ? 0 : stats.size();
    }

    public List<AnomalyStrategy> getStrategies() {
        return strategies;
    }
}
