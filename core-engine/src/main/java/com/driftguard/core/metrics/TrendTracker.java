package com.driftguard.core.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model history of metric snapshots, used to report how the current
 * record compares with the recent past.
 *
 * <p>
 * For each tracked metric present in both the current snapshot and the
 * history: {@code trend_<metric>_pct} (change against the historical mean,
 * omitted when that mean is 0), {@code trend_<metric>_direction}
 * (improving above +5%, declining below -5%, else stable) and, with at least
 * two historical values, {@code trend_<metric>_volatility} (population
 * standard deviation).
 * </p>
 *
 * <p>
 * Each model's history must have a single writer.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendTracker {

    private final int historySize;
    private final Map<String, Deque<Map<String, Double>>> histories = new ConcurrentHashMap<>();

    public TrendTracker(int historySize) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, got: " + historySize);
        }
        this.historySize = historySize;
    }

    /**
     * Compute the trend fields of {@code current} and then append it to the
     * model's history.
     *
     * @return trend fields; empty for the first snapshot of a model
     */
    public Map<String, Object> update(String modelId, Map<String, Double> current) {
        Objects.requireNonNull(current, "current must not be null");
        Deque<Map<String, Double>> history = histories.computeIfAbsent(modelId, k -> new ArrayDeque<>());
        Map<String, Object> trends = new LinkedHashMap<>();

        current.forEach((metric, value) -> {
            double sum = 0;
            double sumSq = 0;
            int n = 0;
            for (Map<String, Double> past : history) {
                Double v = past.get(metric);
                if (v != null) {
                    sum += v;
                    sumSq += v * v;
                    n++;
                }
            }
            if (n == 0) {
                return;
            }
            double mean = sum / n;
            if (mean != 0) {
                double pct = (value - mean) / mean * 100;
                trends.put("trend_" + metric + "_pct", pct);
                trends.put("trend_" + metric + "_direction",
                        pct > 5 ? "improving" : pct < -5 ? "declining" : "stable");
            }
            if (n > 1) {
                trends.put("trend_" + metric + "_volatility", Math.sqrt(Math.max(0.0, sumSq / n - mean * mean)));
            }
        });

        history.addLast(Map.copyOf(current));
        while (history.size() > historySize) {
            history.removeFirst();
        }
        return trends;
    }

    public int historySize(String modelId) {
        Deque<Map<String, Double>> history = histories.get(modelId);
        return history == null ? 0 : history.size();
    }
}
