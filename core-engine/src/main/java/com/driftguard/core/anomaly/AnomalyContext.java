package com.driftguard.core.anomaly;

import com.driftguard.core.model.BaselineMetric;
import com.driftguard.core.model.BaselineRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * What an {@link AnomalyStrategy} sees of one record: the values of the
 * selected fields, each field's rolling window as it was before this record,
 * and the model's baseline when one is available.
 *
 * @since 1.0.0
 */
public final class AnomalyContext {

    private final String modelId;
    private final Map<String, Double> values;
    private final Map<String, RollingStats> windows;
    private final BaselineRecord baseline;
    private final double threshold;
    private final int minSamples;

    AnomalyContext(String modelId, Map<String, Double> values, Map<String, RollingStats> windows,
            BaselineRecord baseline, double threshold, int minSamples) {
        this.modelId = modelId;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.windows = Objects.requireNonNull(windows);
        this.baseline = baseline;
        this.threshold = threshold;
        this.minSamples = minSamples;
    }

    public String getModelId() {
        return modelId;
    }

    /**
     * @return present, finite values of the selected fields in configured order
     */
    public Map<String, Double> getValues() {
        return values;
    }

    public Optional<RollingStats> window(String field) {
        return Optional.ofNullable(windows.get(field));
    }

    public Optional<BaselineRecord> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMinSamples() {
        return minSamples;
    }

    /**
     * Mean and standard deviation to standardise {@code field} against: the
     * baseline when the field is a baseline metric with a stored mean and
     * standard deviation, otherwise the rolling window once it holds
     * {@code minSamples} values.
     *
     * @return the reference, or empty if neither source is usable
     */
    public Optional<Reference> reference(String field) {
        if (baseline != null) {
            Optional<BaselineMetric> metric = BaselineMetric.fromName(field);
            if (metric.isPresent()) {
                OptionalDouble mean = baseline.mean(metric.get());
                OptionalDouble std = baseline.stdDev(metric.get());
                if (mean.isPresent() && std.isPresent()) {
                    return Optional.of(new Reference(mean.getAsDouble(), std.getAsDouble(), "baseline"));
                }
            }
        }
        RollingStats window = windows.get(field);
        if (window != null && window.size() >= minSamples) {
            return Optional.of(new Reference(window.mean(), window.sampleStdDev(), "window"));
        }
        return Optional.empty();
    }

    /**
     * Location and spread a value is standardised against.
     */
    public static final class Reference {

        private final double mean;
        private final double stdDev;
        private final String source;

        Reference(double mean, double stdDev, String source) {
            this.mean = mean;
            this.stdDev = stdDev;
            this.source = source;
        }

        public double getMean() {
            return mean;
        }

        public double getStdDev() {
            return stdDev;
        }

        /** {@code baseline} or {@code window}. */
        public String getSource() {
            return source;
        }

        /**
         * {@code |value - mean| / stdDev}, with the zero-spread rule applied.
         */
        public double standardize(double value) {
            return AnomalyStrategy.standardizedDistance(value, mean, stdDev);
        }
    }
}
