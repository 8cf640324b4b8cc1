package com.driftguard.core.metrics;

import com.driftguard.core.config.MetricsSettings;
import com.driftguard.core.model.LlmEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes derived quality, performance and (optionally) trend metrics for a
 * record, reading the fields named in {@link MetricsSettings}.
 *
 * @since 1.0.0
 */
public class MetricsCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsCalculator.class);

    private static final String DEFAULT_KEY = "default";

    private final MetricsSettings settings;
    private final TrendTracker trends;

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public MetricsCalculator(MetricsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        settings.validate();
        this.trends = new TrendTracker(settings.getTrendHistorySize());
    }

    public LlmMetrics calculate(LlmEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String response = event.getStringField(settings.getResponseField()).orElse("");
        if (response.isBlank()) {
            LOG.trace("No response text in field '{}'", settings.getResponseField());
            return LlmMetrics.error(LlmMetrics.EMPTY_RESPONSE_ERROR);
        }
        String prompt = optionalText(event, settings.getPromptField()).orElse(null);
        QualityMetrics quality = QualityScorer.score(response, prompt);

        Optional<Double> responseTime = optionalNumber(event, settings.getTimeField());
        Optional<Double> tokenCount = optionalNumber(event, settings.getTokenField());
        Optional<Double> confidence = optionalNumber(event, settings.getConfidenceField());

        PerformanceMetrics performance = null;
        if (responseTime.isPresent() && tokenCount.isPresent()) {
            performance = PerformanceScorer.score(responseTime.get(), tokenCount.get(), confidence.orElse(null));
        }

        Map<String, Object> trendFields = null;
        if (settings.isIncludeTrends()) {
            Map<String, Double> snapshot = new LinkedHashMap<>();
            responseTime.ifPresent(v -> snapshot.put(LlmEvent.RESPONSE_TIME, v));
            tokenCount.ifPresent(v -> snapshot.put(LlmEvent.TOKEN_COUNT, v));
            confidence.ifPresent(v -> snapshot.put(LlmEvent.CONFIDENCE_SCORE, v));
            snapshot.put("coherence_score", quality.getCoherenceScore());
            trendFields = trends.update(event.getModelId().orElse(DEFAULT_KEY), snapshot);
        }
        return LlmMetrics.of(quality, performance, trendFields);
    }

    private static Optional<String> optionalText(LlmEvent event, String field) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        return event.getStringField(field).filter(s -> !s.isBlank());
    }

    private static Optional<Double> optionalNumber(LlmEvent event, String field) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        return event.getNumericField(field).filter(Double::isFinite);
    }
}
