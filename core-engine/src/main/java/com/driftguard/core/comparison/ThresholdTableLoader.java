package com.driftguard.core.comparison;

import com.driftguard.core.model.ThresholdRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads a {@link ThresholdTable} from a CSV file with the columns
 * {@code metric_name, threshold_type, warning_threshold, critical_threshold,
 * unit, description}.
 *
 * @since 1.0.0
 */
public final class ThresholdTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdTableLoader.class);

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ThresholdTableLoader() {
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ThresholdTable fromFile(Path path) {
        Objects.requireNonNull(path, "Threshold file path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ThresholdTable table = read(reader, path.toString());
            LOG.info("Loaded {} threshold(s) from {}", table.size(), path);
            return table;
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new IllegalArgumentException("Threshold file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read threshold file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ThresholdTable fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ThresholdTableLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return read(reader, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static ThresholdTable read(Reader reader, String source) {
        List<ThresholdRecord> records;
        try (MappingIterator<ThresholdRecord> it = MAPPER.readerFor(ThresholdRecord.class)
                .with(CsvSchema.emptySchema().withHeader().withComments())
                .readValues(reader)) {
            records = it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Malformed threshold table " + source + ": " + e.getMessage(), e);
        }
        return ThresholdTable.of(records);
    }
}
