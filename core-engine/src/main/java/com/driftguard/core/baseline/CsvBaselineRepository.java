package com.driftguard.core.baseline;

import com.driftguard.core.model.BaselineRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Baseline table stored as a flat CSV file with one row per model.
 *
 * <h3>File Layout</h3>
 *
 * <pre>
 * # driftguard-baseline version=3 created_at=2026-10-16T02:00:00Z
 * model_id,avg_response_time,avg_token_count,avg_confidence,std_response_time,...
 * gpt-4,1.21,412.0,0.87,0.31,...
 * </pre>
 *
 * <p>
 * The leading comment carries the snapshot version; a file without it (for
 * example one maintained by hand) is read as version 0.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * {@link #save(BaselineSnapshot)} writes the complete table to a temporary
 * file in the target directory and moves it over the target in one step, so
 * readers see either the old or the new file, never a partial one.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvBaselineRepository implements BaselineRepository {

    private static final Logger LOG = LoggerFactory.getLogger(CsvBaselineRepository.class);

    static final String HEADER_PREFIX = "# driftguard-baseline";

    private final Path file;
    private final CsvMapper mapper;

    public CsvBaselineRepository(Path file) {
        this.file = Objects.requireNonNull(file, "Baseline file path must not be null");
        this.mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addModule(new JavaTimeModule())
                .build();
    }

    @Override
    public Optional<BaselineSnapshot> load() throws IOException {
        if (!Files.exists(file)) {
            LOG.info("Baseline file {} does not exist yet", file);
            return Optional.empty();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        long version = 0L;
        Instant createdAt = Instant.EPOCH;
        String firstLine = content.lines().findFirst().orElse("");
        if (firstLine.startsWith(HEADER_PREFIX)) {
            for (String token : firstLine.substring(HEADER_PREFIX.length()).trim().split("\\s+")) {
                int eq = token.indexOf('=');
                if (eq < 0) {
                    continue;
                }
                String key = token.substring(0, eq);
                String value = token.substring(eq + 1);
                try {
                    if ("version".equals(key)) {
                        version = Long.parseLong(value);
                    } else if ("created_at".equals(key)) {
                        createdAt = Instant.parse(value);
                    }
                } catch (NumberFormatException | DateTimeParseException e) {
                    throw new IOException("Malformed baseline header in " + file + ": " + firstLine, e);
                }
            }
        }

        ObjectReader reader = mapper.readerFor(BaselineRecord.class)
                .with(CsvSchema.emptySchema().withHeader().withComments());
        List<BaselineRecord> records;
        try (MappingIterator<BaselineRecord> it = reader.readValues(content)) {
            records = it.readAll();
        } catch (RuntimeException e) {
            throw new IOException("Malformed baseline table " + file + ": " + e.getMessage(), e);
        }
        BaselineSnapshot snapshot;
        try {
            snapshot = BaselineSnapshot.of(version, createdAt, records);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid baseline table " + file + ": " + e.getMessage(), e);
        }
        LOG.info("Loaded baseline version {} with {} model(s) from {}",
                version, snapshot.getRecords().size(), file);
        return Optional.of(snapshot);
    }

    @Override
    public void save(BaselineSnapshot snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        CsvSchema schema = mapper.schemaFor(BaselineRecord.class).withHeader();
        String body = mapper.writer(schema).writeValueAsString(List.copyOf(snapshot.getRecords().values()));
        String content = HEADER_PREFIX + " version=" + snapshot.getVersion()
                + " created_at=" + snapshot.getCreatedAt() + "\n" + body;

        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warn("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.info("Persisted baseline version {} ({} model(s)) to {}",
                snapshot.getVersion(), snapshot.getRecords().size(), file);
    }

    @Override
    public String describe() {
        return file.toString();
    }

    public Path getFile() {
        return file;
    }
}
