package com.driftguard.core.anomaly;

import com.driftguard.core.model.FieldAnomaly;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trend-break test: fits a least-squares line through the last
 * {@code trendWindow} values, projects it one step ahead and scores the
 * deviation of the current value from the projection in units of the
 * residual standard deviation.
 *
 * @since 1.0.0
 */
public class TrendStrategy implements AnomalyStrategy {

    public static final String NAME = "trend";

    private static final double EPSILON = 1e-9;

    private final int trendWindow;

    public TrendStrategy(int trendWindow) {
        if (trendWindow < 3) {
            throw new IllegalArgumentException("trendWindow must be >= 3, got: " + trendWindow);
        }
        this.trendWindow = trendWindow;
    }

    @Override
    public List<FieldAnomaly> evaluate(AnomalyContext context) {
        List<FieldAnomaly> results = new ArrayList<>();
        context.getValues().forEach((field, value) -> context.window(field)
                .filter(w -> w.size() >= trendWindow)
                .ifPresent(window -> {
                    double[] y = window.last(trendWindow);
                    int n = y.length;
                    double meanX = (n - 1) / 2.0;
                    double meanY = 0;
                    for (double v : y) {
                        meanY += v;
                    }
                    meanY /= n;
                    double sxy = 0;
                    double sxx = 0;
                    for (int i = 0; i < n; i++) {
                        sxy += (i - meanX) * (y[i] - meanY);
                        sxx += (i - meanX) * (i - meanX);
                    }
                    double slope = sxy / sxx;
                    double intercept = meanY - slope * meanX;

                    double ssr = 0;
                    for (int i = 0; i < n; i++) {
                        double r = y[i] - (intercept + slope * i);
                        ssr += r * r;
                    }
                    double residualStd = Math.sqrt(ssr / (n - 2));
                    double projection = intercept + slope * n;

                    double score;
                    if (residualStd <= EPSILON * Math.max(1.0, Math.abs(meanY))) {
                        boolean exact = Math.abs(value - projection) <= EPSILON * Math.max(1.0, Math.abs(projection));
                        score = exact ? 0.0 : ZERO_SPREAD_SCORE;
                    } else {
                        score = AnomalyStrategy.standardizedDistance(value, projection, residualStd);
                    }

                    Map<String, Object> analysis = new LinkedHashMap<>();
                    analysis.put("value", value);
                    analysis.put("projection", projection);
                    analysis.put("slope", slope);
                    analysis.put("residual_std", residualStd);
                    results.add(new FieldAnomaly(field, NAME, score > context.getThreshold(), score, analysis));
                }));
        return results;
    }

    @Override
    public String getMethodName() {
        return NAME;
    }
}
