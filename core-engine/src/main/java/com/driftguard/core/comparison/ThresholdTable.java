package com.driftguard.core.comparison;

import com.driftguard.core.model.BaselineMetric;
import com.driftguard.core.model.ThresholdRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookup of {@link ThresholdRecord}s by metric name. At most one
 * record per metric.
 *
 * @since 1.0.0
 */
public final class ThresholdTable {

    private static final ThresholdTable EMPTY = new ThresholdTable(Map.of());

    private final Map<String, ThresholdRecord> byMetric;

    private ThresholdTable(Map<String, ThresholdRecord> byMetric) {
        this.byMetric = Collections.unmodifiableMap(new LinkedHashMap<>(byMetric));
    }

    public static ThresholdTable empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalStateException if a record is invalid or a metric
     *                               appears twice; all problems are reported
     */
    public static ThresholdTable of(Collection<ThresholdRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<String> errors = new ArrayList<>();
        Map<String, ThresholdRecord> byMetric = new LinkedHashMap<>();
        for (ThresholdRecord record : records) {
            try {
                record.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
                continue;
            }
            if (byMetric.putIfAbsent(record.getMetricName(), record) != null) {
                errors.add("Duplicate threshold for metric '" + record.getMetricName() + "'");
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Threshold table validation failed:\n  - "
                    + String.join("\n  - ", errors));
        }
        return new ThresholdTable(byMetric);
    }

    /**
     * Look up the record for {@code metricName}, trying the exact name first
     * and then the canonical field name of a baseline metric (so
     * {@code avg_response_time} finds {@code response_time}).
     */
    public Optional<ThresholdRecord> find(String metricName) {
        if (metricName == null) {
            return Optional.empty();
        }
        ThresholdRecord record = byMetric.get(metricName);
        if (record == null) {
            record = BaselineMetric.fromName(metricName)
                    .map(m -> byMetric.get(m.fieldName()))
                    .orElse(null);
        }
        return Optional.ofNullable(record);
    }

    public int size() {
        return byMetric.size();
    }

    @Override
    public String toString() {
        return "ThresholdTable" + byMetric.keySet();
    }
}
