package com.driftguard.flink;

import com.driftguard.core.baseline.BaselineCalculationReport;
import com.driftguard.core.baseline.BaselineCalculator;
import com.driftguard.core.baseline.BaselineStore;
import com.driftguard.core.baseline.CsvBaselineRepository;
import com.driftguard.core.config.ConfigLoader;
import com.driftguard.core.config.DriftGuardConfig;
import com.driftguard.core.model.LlmEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Batch entry point that rebuilds the per-model baseline table from a history
 * of LLM events stored as JSON lines.
 *
 * <pre>
 *   BaselineRecomputeJob &lt;history.jsonl&gt; [driftguard.yml]
 * </pre>
 *
 * <p>
 * The table is written to {@code baseline.file} of the detection config and
 * replaces the previous one only when the whole history was read; running
 * streaming subtasks adopt the new version on their next refresh.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineRecomputeJob {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineRecomputeJob.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private BaselineRecomputeJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 1 || args.length > 2) {
            throw new IllegalArgumentException(
                    "Usage: BaselineRecomputeJob <history.jsonl> [driftguard.yml]");
        }
        DriftGuardConfig config = args.length == 2 ? ConfigLoader.fromFile(args[1]) : ConfigLoader.load();
        BaselineCalculationReport report = recompute(config, Path.of(args[0]));
        LOG.info("Baseline recomputation finished: {}", report);
    }

    /**
     * Recompute the baseline table named by {@code config} from
     * {@code history}.
     *
     * @throws IllegalStateException    if {@code baseline.file} is not set
     * @throws IllegalArgumentException if {@code history} does not exist
     * @throws com.driftguard.core.baseline.BaselinePublishException if the
     *         history cannot be read or the table cannot be written
     */
    static BaselineCalculationReport recompute(DriftGuardConfig config, Path history) throws IOException {
        String file = config.getBaseline().getFile();
        if (file == null || file.isBlank()) {
            throw new IllegalStateException("baseline.file must be set to recompute the baseline table");
        }
        if (!Files.isRegularFile(history)) {
            throw new IllegalArgumentException("History file not found: " + history);
        }

        BaselineStore store = BaselineStore.open(new CsvBaselineRepository(Path.of(file)));
        BaselineCalculator calculator = new BaselineCalculator(store, config.getBaseline());
        LOG.info("Recomputing baseline from {} over [{}, {})", history,
                calculator.windowStart(), calculator.windowEnd());

        try (MappingIterator<LlmEvent> events = MAPPER.readerFor(LlmEvent.class).readValues(history.toFile())) {
            return calculator.recompute(() -> events);
        }
    }
}
