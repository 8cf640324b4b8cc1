package com.driftguard.core.pipeline;

import com.driftguard.core.anomaly.AnomalyEngine;
import com.driftguard.core.baseline.BaselineSnapshot;
import com.driftguard.core.baseline.BaselineStore;
import com.driftguard.core.baseline.CsvBaselineRepository;
import com.driftguard.core.comparison.BaselineComparator;
import com.driftguard.core.comparison.ThresholdTable;
import com.driftguard.core.comparison.ThresholdTableLoader;
import com.driftguard.core.config.DriftGuardConfig;
import com.driftguard.core.config.SemanticSettings;
import com.driftguard.core.drift.DriftDetector;
import com.driftguard.core.drift.TextReferenceLoader;
import com.driftguard.core.drift.TextReferenceSet;
import com.driftguard.core.metrics.MetricsCalculator;
import com.driftguard.core.model.EnrichedRecord;
import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.model.RecordValidator;
import com.driftguard.core.semantic.HashingTextEmbedder;
import com.driftguard.core.semantic.SemanticComparator;
import com.driftguard.core.semantic.SimilarityMethod;
import com.driftguard.core.semantic.TextEmbedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the enabled detection stages over batches of records.
 *
 * <h3>Stages</h3>
 * <p>
 * Each valid record passes metrics, anomaly detection, drift detection,
 * semantic comparison and baseline comparison, in that order; each stage
 * attaches its complete result to the {@link EnrichedRecord}. A record failing
 * {@link RecordValidator} is flagged with {@code input_error} and skipped by
 * every stage; the rest of the batch continues.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * A batch reads one {@link BaselineSnapshot} reference for its whole
 * duration, so a concurrent baseline publish never mixes versions within a
 * batch. With {@code workers > 1} records are sharded by model id onto a
 * fixed thread pool: every rolling window has exactly one writer and the
 * per-model order of records is preserved. Output order equals input order.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * Configuration errors surface from the constructor. An unexpected failure
 * while enriching aborts the whole batch with {@link IllegalStateException};
 * no partial output is returned.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftGuardPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DriftGuardPipeline.class);

    private static final String DEFAULT_KEY = "default";

    private final DriftGuardConfig config;
    private final BaselineStore baselineStore;
    private final MetricsCalculator metrics;
    private final AnomalyEngine anomalies;
    private final DriftDetector drift;
    private final SemanticComparator semantic;
    private final BaselineComparator comparator;
    private final ExecutorService executor;

    public DriftGuardPipeline(DriftGuardConfig config, BaselineStore baselineStore, ThresholdTable thresholds,
            TextReferenceSet references) {
        this(config, baselineStore, thresholds, references, new HashingTextEmbedder());
    }

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public DriftGuardPipeline(DriftGuardConfig config, BaselineStore baselineStore, ThresholdTable thresholds,
            TextReferenceSet references, TextEmbedder embedder) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.baselineStore = Objects.requireNonNull(baselineStore, "baselineStore must not be null");
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        Objects.requireNonNull(references, "references must not be null");
        Objects.requireNonNull(embedder, "embedder must not be null");
        config.validate();

        this.metrics = config.getMetrics().isEnabled() ? new MetricsCalculator(config.getMetrics()) : null;
        this.anomalies = config.getAnomaly().isEnabled() ? new AnomalyEngine(config.getAnomaly()) : null;
        this.drift = config.getDrift().isEnabled()
                ? new DriftDetector(config.getDrift(), embedder, references)
                : null;
        this.semantic = config.getSemantic().isEnabled() ? new SemanticComparator(embedder) : null;
        this.comparator = config.getComparison().isEnabled()
                ? new BaselineComparator(config.getComparison(), thresholds)
                : null;
        this.executor = config.getWorkers() > 1 ? Executors.newFixedThreadPool(config.getWorkers()) : null;

        LOG.info("DriftGuard pipeline ready: metrics={} anomaly={} drift={} semantic={} comparison={} workers={}",
                metrics != null, anomalies != null, drift != null, semantic != null, comparator != null,
                config.getWorkers());
    }

    /**
     * Build a pipeline from the files named in {@code config}: the baseline
     * table ({@code baseline.file}), the threshold table
     * ({@code comparison.thresholdFile}) and the drift references
     * ({@code drift.referenceFile}). Absent entries mean an in-memory empty
     * baseline, no thresholds and no references.
     *
     * @throws IllegalArgumentException if a named file does not exist
     * @throws IllegalStateException    if a file is malformed or the
     *                                  configuration is invalid
     */
    public static DriftGuardPipeline fromConfig(DriftGuardConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        TextEmbedder embedder = new HashingTextEmbedder();

        BaselineStore store = isSet(config.getBaseline().getFile())
                ? BaselineStore.open(new CsvBaselineRepository(Path.of(config.getBaseline().getFile())))
                : BaselineStore.of(BaselineSnapshot.empty());
        ThresholdTable thresholds = isSet(config.getComparison().getThresholdFile())
                ? ThresholdTableLoader.fromFile(Path.of(config.getComparison().getThresholdFile()))
                : ThresholdTable.empty();
        TextReferenceSet references = isSet(config.getDrift().getReferenceFile())
                ? TextReferenceLoader.load(Path.of(config.getDrift().getReferenceFile()), embedder)
                : TextReferenceSet.empty();
        return new DriftGuardPipeline(config, store, thresholds, references, embedder);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Enrich a batch.
     *
     * @param events records in arrival order
     * @return enriched records in the same order, with the batch summary
     * @throws IllegalStateException if enrichment fails unexpectedly
     */
    public BatchResult process(List<LlmEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        BaselineSnapshot snapshot = baselineStore.current();
        EnrichedRecord[] out = new EnrichedRecord[events.size()];

        if (executor == null || events.size() < 2) {
            for (int i = 0; i < events.size(); i++) {
                out[i] = enrichAt(events, i, snapshot);
            }
        } else {
            processSharded(events, snapshot, out);
        }

        BatchResult result = new BatchResult(List.of(out), snapshot.getVersion());
        LOG.info("Processed batch of {} record(s) against baseline version {}: {}",
                events.size(), snapshot.getVersion(), result.getSummary());
        return result;
    }

    private void processSharded(List<LlmEvent> events, BaselineSnapshot snapshot, EnrichedRecord[] out) {
        int workers = config.getWorkers();
        List<List<Integer>> shards = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            shards.add(new ArrayList<>());
        }
        for (int i = 0; i < events.size(); i++) {
            shards.get(shardOf(events.get(i), workers)).add(i);
        }

        List<Future<?>> futures = new ArrayList<>();
        for (List<Integer> shard : shards) {
            if (shard.isEmpty()) {
                continue;
            }
            futures.add(executor.submit(() -> {
                for (int i : shard) {
                    out[i] = enrichAt(events, i, snapshot);
                }
            }));
        }
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof IllegalStateException ise) {
                throw ise;
            }
            throw new IllegalStateException("Batch processing failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing batch", e);
        }
    }

    static int shardOf(LlmEvent event, int workers) {
        String key = event != null ? event.getModelId().orElse(DEFAULT_KEY) : DEFAULT_KEY;
        return Math.floorMod(key.hashCode(), workers);
    }

    private EnrichedRecord enrichAt(List<LlmEvent> events, int index, BaselineSnapshot snapshot) {
        try {
            return enrich(events.get(index), snapshot);
        } catch (RuntimeException e) {
            LOG.error("Enrichment failed at record {} of batch", index, e);
            throw new IllegalStateException("Failed to enrich record " + index + ": " + e.getMessage(), e);
        }
    }

    /**
     * Enrich one record against {@code snapshot}. Callers must ensure that
     * records of the same model are not enriched concurrently.
     *
     * @return the enriched record, or a rejected one for malformed input
     */
    public EnrichedRecord enrich(LlmEvent event, BaselineSnapshot snapshot) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Optional<String> invalid = RecordValidator.validate(event);
        if (invalid.isPresent()) {
            LOG.warn("Rejected record {}: {}", event.getRequestId().orElse("<no request_id>"), invalid.get());
            return EnrichedRecord.rejected(event, invalid.get());
        }

        EnrichedRecord record = new EnrichedRecord(event);
        record.attach(Map.of(EnrichedRecord.INPUT_VALID, true));
        if (metrics != null) {
            record.attach(metrics.calculate(event).toFields());
        }
        if (anomalies != null) {
            record.attach(anomalies.evaluate(event, snapshot).toFields(config.getAnomaly().isIncludeAnalysis()));
        }
        if (drift != null) {
            record.attach(drift.evaluate(event).toFields());
        }
        if (semantic != null) {
            SemanticSettings s = config.getSemantic();
            SimilarityMethod method = s.similarityMethod();
            record.attach(semantic.compare(
                    event.getStringField(s.getField1()).orElse(null),
                    event.getStringField(s.getField2()).orElse(null),
                    method, s.isIncludeAnalysis()).toFields());
        }
        if (comparator != null) {
            record.attach(comparator.toFields(comparator.compare(event, snapshot)));
        }
        return record;
    }

    public BaselineStore getBaselineStore() {
        return baselineStore;
    }

    public DriftGuardConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
