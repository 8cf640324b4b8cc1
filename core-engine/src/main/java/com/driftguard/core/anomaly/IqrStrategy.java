package com.driftguard.core.anomaly;

import com.driftguard.core.model.FieldAnomaly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interquartile-range fences over the rolling window. A value outside
 * {@code [Q1 - k * IQR, Q3 + k * IQR]} is flagged; its score is the distance
 * beyond the fence in units of IQR.
 *
 * @since 1.0.0
 */
public class IqrStrategy implements AnomalyStrategy {

    public static final String NAME = "iqr";

    /** Lower bound on the IQR used as score divisor. */
    static final double MIN_IQR = 0.001;

    private final double multiplier;

    public IqrStrategy(double multiplier) {
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public List<FieldAnomaly> evaluate(AnomalyContext context) {
        List<FieldAnomaly> results = new ArrayList<>();
        context.getValues().forEach((field, value) -> context.window(field)
                .filter(w -> w.size() >= context.getMinSamples())
                .ifPresent(window -> {
                    double[] sorted = window.values();
                    Arrays.sort(sorted);
                    double q1 = quantile(sorted, 0.25);
                    double q3 = quantile(sorted, 0.75);
                    double iqr = q3 - q1;
                    double lower = q1 - multiplier * iqr;
                    double upper = q3 + multiplier * iqr;

                    double excess = value < lower ? lower - value : value > upper ? value - upper : 0.0;
                    boolean anomalous = value < lower || value > upper;
                    double score = anomalous ? excess / Math.max(iqr, MIN_IQR) : 0.0;

                    Map<String, Object> analysis = new LinkedHashMap<>();
                    analysis.put("value", value);
                    analysis.put("q1", q1);
                    analysis.put("q3", q3);
                    analysis.put("iqr", iqr);
                    analysis.put("lower_bound", lower);
                    analysis.put("upper_bound", upper);
                    results.add(new FieldAnomaly(field, NAME, anomalous, score, analysis));
                }));
        return results;
    }

    /**
     * Linear-interpolated quantile of sorted values.
     */
    static double quantile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double pos = p * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    @Override
    public String getMethodName() {
        return NAME;
    }
}
