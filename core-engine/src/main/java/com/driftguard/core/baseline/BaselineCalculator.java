package com.driftguard.core.baseline;

import com.driftguard.core.config.BaselineSettings;
import com.driftguard.core.model.BaselineMetric;
import com.driftguard.core.model.BaselineRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.model.RecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Recomputes per-model baselines from historical records and publishes them
 * as a new {@link BaselineSnapshot}.
 *
 * <h3>Window</h3>
 * <p>
 * Records with a timestamp in
 * {@code [startOfToday - lookbackDays, startOfToday - excludeRecentDays + 1 day)}
 * (UTC) are used; with the defaults that is the 30 whole days before today.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * The new snapshot is built completely in memory before anything is written.
 * A failure while iterating the history, aggregating or persisting raises
 * {@link BaselinePublishException}; the persisted table and the snapshot
 * served by the {@link BaselineStore} are then unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineCalculator.class);

    private final BaselineStore store;
    private final BaselineSettings settings;
    private final Clock clock;

    public BaselineCalculator(BaselineStore store, BaselineSettings settings) {
        this(store, settings, Clock.systemUTC());
    }

    public BaselineCalculator(BaselineStore store, BaselineSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        settings.validate();
    }

    /**
     * @return start (inclusive) of the historical window
     */
    public Instant windowStart() {
        return startOfToday().minus(Duration.ofDays(settings.getLookbackDays()));
    }

    /**
     * @return end (exclusive) of the historical window
     */
    public Instant windowEnd() {
        return startOfToday().minus(Duration.ofDays(settings.getExcludeRecentDays() - 1L));
    }

    private Instant startOfToday() {
        return clock.instant().truncatedTo(ChronoUnit.DAYS);
    }

    /**
     * Aggregate {@code history} and publish the result.
     *
     * @param history historical records; iterated exactly once
     * @return report of the published snapshot
     * @throws BaselinePublishException if anything fails; nothing is changed
     */
    public BaselineCalculationReport recompute(Iterable<LlmEvent> history) {
        Objects.requireNonNull(history, "history must not be null");
        Instant start = windowStart();
        Instant end = windowEnd();
        BaselineSnapshot previous = store.current();

        Map<String, Map<BaselineMetric, MetricAccumulator>> byModel = new TreeMap<>();
        Map<String, Long> samples = new TreeMap<>();
        long read = 0;
        long skipped = 0;
        long outside = 0;

        try {
            for (LlmEvent event : history) {
                read++;
                Optional<Instant> ts = event != null ? event.getTimestamp() : Optional.empty();
                if (ts.isEmpty() || !RecordValidator.isValid(event)) {
                    skipped++;
                    LOG.trace("Skipping malformed history record {}", event);
                    continue;
                }
                if (ts.get().isBefore(start) || !ts.get().isBefore(end)) {
                    outside++;
                    continue;
                }
                String modelId = event.getModelId().orElseThrow();
                Map<BaselineMetric, MetricAccumulator> accumulators =
                        byModel.computeIfAbsent(modelId, k -> new EnumMap<>(BaselineMetric.class));
                for (BaselineMetric metric : BaselineMetric.values()) {
                    event.getNumericField(metric.fieldName()).ifPresent(value ->
                            accumulators.computeIfAbsent(metric, k -> new MetricAccumulator()).add(value));
                }
                samples.merge(modelId, 1L, Long::sum);
            }
        } catch (RuntimeException e) {
            LOG.error("Baseline recomputation failed after {} record(s); keeping version {}",
                    read, previous.getVersion(), e);
            throw new BaselinePublishException("Failed to read baseline history after " + read
                    + " record(s); keeping version " + previous.getVersion(), e);
        }

        Instant now = clock.instant();
        List<BaselineRecord> records = new ArrayList<>();
        byModel.forEach((modelId, accumulators) -> {
            BaselineRecord.Builder builder = BaselineRecord.builder(modelId)
                    .baselineDate(now)
                    .sampleCount(samples.get(modelId));
            MetricAccumulator rt = accumulators.get(BaselineMetric.RESPONSE_TIME);
            if (rt != null) {
                builder.responseTime(rt.mean(), rt.sampleStdDev());
            }
            MetricAccumulator tokens = accumulators.get(BaselineMetric.TOKEN_COUNT);
            if (tokens != null) {
                builder.tokenCount(tokens.mean(), tokens.sampleStdDev());
            }
            MetricAccumulator confidence = accumulators.get(BaselineMetric.CONFIDENCE);
            if (confidence != null) {
                builder.confidence(confidence.mean(), confidence.sampleStdDev());
            }
            records.add(builder.build());
        });

        long version = previous.getVersion() + 1;
        BaselineSnapshot next = BaselineSnapshot.of(version, now, records);
        store.publish(next);

        long used = read - skipped - outside;
        BaselineCalculationReport report = new BaselineCalculationReport(version, start, end,
                read, used, skipped, outside, records.size());
        LOG.info("Baseline recomputed: {}", report);
        if (skipped > 0) {
            LOG.warn("Skipped {} malformed history record(s) during baseline recomputation", skipped);
        }
        return report;
    }
}
