package com.driftguard.core.comparison;

import com.driftguard.core.baseline.BaselineSnapshot;
import com.driftguard.core.config.ComparisonSettings;
import com.driftguard.core.model.BaselineComparison;
import com.driftguard.core.model.BaselineMetric;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.model.ThresholdRecord;
import com.driftguard.core.model.ThresholdType;
import com.driftguard.core.severity.ComparisonStatus;
import com.driftguard.core.severity.SeverityBands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Classifies how far a record's metrics deviate from their baseline.
 *
 * <h3>Percentage change</h3>
 * <p>
 * {@code change = (current - reference) / reference * 100}. With a zero
 * reference the change is undefined: a zero current value is normal, any other
 * value is critical.
 * </p>
 *
 * <h3>Thresholds</h3>
 * <ol>
 * <li>An explicit {@code threshold} T in the settings: warning from |change|
 * &gt;= T, critical from |change| &gt;= 2T.</li>
 * <li>Otherwise the metric's {@link ThresholdRecord}, applied to the adverse
 * change (the change for {@code upper}, its negation for {@code lower}).</li>
 * <li>Otherwise warning from |change| &gt;= 25, critical from &gt;= 50.</li>
 * </ol>
 *
 * <h3>Reference</h3>
 * <p>
 * The per-record {@code baselineField} when configured and present,
 * otherwise the baseline snapshot entry of the record's model. Without a
 * reference the comparison is reported as unavailable.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineComparator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineComparator.class);

    public static final double DEFAULT_WARNING = 25.0;
    public static final double DEFAULT_CRITICAL = 50.0;

    private static final SeverityBands<ComparisonStatus> DEFAULT_BANDS =
            ComparisonStatus.bands(DEFAULT_WARNING, DEFAULT_CRITICAL);

    private final ComparisonSettings settings;
    private final ThresholdTable thresholds;
    private final SeverityBands<ComparisonStatus> explicitBands;

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public BaselineComparator(ComparisonSettings settings, ThresholdTable thresholds) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        settings.validate();
        Double t = settings.getThreshold();
        this.explicitBands = t != null ? ComparisonStatus.bands(t, 2 * t) : null;
    }

    /**
     * Compare every configured metric present on the record.
     *
     * @return one comparison per metric with a current value
     */
    public List<BaselineComparison> compare(LlmEvent event, BaselineSnapshot snapshot) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        String modelId = event.getStringField(settings.getModelField()).filter(s -> !s.isBlank()).orElse(null);

        List<BaselineComparison> comparisons = new ArrayList<>();
        for (String metric : settings.getMetrics()) {
            Optional<Double> current = currentValue(event, metric);
            if (current.isEmpty()) {
                LOG.trace("Metric '{}' not present on record - skipping comparison", metric);
                continue;
            }
            comparisons.add(compare(metric, modelId, current.get(), event, snapshot));
        }
        return comparisons;
    }

    private BaselineComparison compare(String metric, String modelId, double current, LlmEvent event,
            BaselineSnapshot snapshot) {
        Double reference = null;
        Double std = null;
        if (settings.getBaselineField() != null && !settings.getBaselineField().isBlank()) {
            reference = event.getNumericField(settings.getBaselineField()).filter(Double::isFinite).orElse(null);
        }
        if (reference == null) {
            Optional<BaselineMetric> baselineMetric = BaselineMetric.fromName(metric);
            Optional<BaselineRecord> record = snapshot.find(modelId).filter(BaselineRecord::isAvailable);
            if (baselineMetric.isPresent() && record.isPresent()) {
                OptionalDouble mean = record.get().mean(baselineMetric.get());
                OptionalDouble sd = record.get().stdDev(baselineMetric.get());
                reference = mean.isPresent() ? mean.getAsDouble() : null;
                std = sd.isPresent() ? sd.getAsDouble() : null;
            }
        }
        if (reference == null) {
            return BaselineComparison.unavailable(metric, modelId, current,
                    "No baseline available for model '" + (modelId != null ? modelId : BaselineSnapshot.DEFAULT_MODEL)
                            + "' and metric '" + metric + "'");
        }
        return classify(metric, modelId, current, reference, std);
    }

    /**
     * The record field named by the metric, or for baseline metric aliases
     * such as {@code avg_response_time} the canonical field.
     */
    private static Optional<Double> currentValue(LlmEvent event, String metric) {
        Optional<Double> value = event.getNumericField(metric);
        if (value.isEmpty()) {
            value = BaselineMetric.fromName(metric).flatMap(m -> event.getNumericField(m.fieldName()));
        }
        return value.filter(Double::isFinite);
    }

    /**
     * Classify {@code current} against {@code reference}.
     *
     * @param std baseline standard deviation for the z-score, may be {@code null}
     */
    public BaselineComparison classify(String metric, String modelId, double current, double reference, Double std) {
        BaselineComparison.Builder builder = BaselineComparison.builder(metric)
                .modelId(modelId)
                .currentValue(current)
                .referenceValue(reference)
                .zScore(std != null && std > 0 ? (current - reference) / std : null);

        if (reference == 0) {
            boolean unchanged = current == 0;
            return builder.percentageChange(unchanged ? 0.0 : null)
                    .status(unchanged ? ComparisonStatus.NORMAL : ComparisonStatus.CRITICAL)
                    .build();
        }

        double change = (current - reference) / reference * 100;
        builder.percentageChange(change);
        ComparisonStatus status;
        if (explicitBands != null) {
            status = explicitBands.classify(Math.abs(change));
        } else {
            Optional<ThresholdRecord> record = thresholds.find(metric);
            if (record.isPresent()) {
                ThresholdRecord r = record.get();
                double adverse = r.getThresholdType() == ThresholdType.LOWER ? -change : change;
                status = ComparisonStatus.bands(r.getWarningThreshold(), r.getCriticalThreshold()).classify(adverse);
                builder.appliedThreshold(r);
            } else {
                status = DEFAULT_BANDS.classify(Math.abs(change));
            }
        }
        BaselineComparison comparison = builder.status(status).build();
        if (status != ComparisonStatus.NORMAL) {
            LOG.debug("Baseline deviation: {}", comparison);
        }
        return comparison;
    }

    /**
     * Flatten comparisons into output fields. A single comparison uses the
     * plain {@code baseline_*} names; with several metrics each field is
     * qualified as {@code baseline_<metric>_*} and
     * {@code baseline_comparison_status} holds the worst available status.
     */
    public Map<String, Object> toFields(List<BaselineComparison> comparisons) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (comparisons.isEmpty()) {
            return fields;
        }
        if (comparisons.size() == 1) {
            fields.putAll(comparisons.get(0).toFields(settings.isGenerateAlerts()));
            return fields;
        }
        for (BaselineComparison comparison : comparisons) {
            String prefix = "baseline_" + comparison.getMetricName() + "_";
            comparison.toFields(settings.isGenerateAlerts())
                    .forEach((key, value) -> fields.put(prefix + key.substring("baseline_".length()), value));
        }
        comparisons.stream()
                .map(BaselineComparison::getStatus)
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder())
                .ifPresent(worst -> fields.put("baseline_comparison_status", worst.label()));
        return fields;
    }
}
