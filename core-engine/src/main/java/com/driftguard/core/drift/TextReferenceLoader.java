package com.driftguard.core.drift;

import com.driftguard.core.semantic.TextEmbedder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a {@link TextReferenceSet} from a CSV table.
 *
 * <pre>
 * model_id,text
 * gpt-4,"Paris is the capital of France."
 * ,"Generic reference answer used by every other model."
 * </pre>
 *
 * <p>
 * Instead of {@code text}, a row may carry a precomputed {@code embedding}
 * column of space-separated numbers of the embedder's dimension. Rows
 * without a {@code model_id} belong to the {@code default} reference.
 * </p>
 *
 * @since 1.0.0
 */
public final class TextReferenceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TextReferenceLoader.class);

    private TextReferenceLoader() {
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or is
     *                                  malformed
     */
    public static TextReferenceSet load(Path path, TextEmbedder embedder) {
        Objects.requireNonNull(path, "Reference file path must not be null");
        Objects.requireNonNull(embedder, "embedder must not be null");
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .build();

        Map<String, List<double[]>> vectors = new LinkedHashMap<>();
        int row = 0;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                        .with(CsvSchema.emptySchema().withHeader().withComments())
                        .readValues(reader)) {
            while (it.hasNext()) {
                row++;
                Map<String, String> columns = it.next();
                String model = columns.get("model_id");
                if (model == null || model.isBlank()) {
                    model = TextReferenceSet.DEFAULT_MODEL;
                }
                String embedding = columns.get("embedding");
                String text = columns.get("text");
                if (embedding != null) {
                    vectors.computeIfAbsent(model, k -> new ArrayList<>())
                            .add(parseVector(embedding, embedder.dimension(), row));
                } else if (text != null) {
                    vectors.computeIfAbsent(model, k -> new ArrayList<>()).add(embedder.embed(text));
                } else {
                    LOG.trace("Reference row {} has neither text nor embedding", row);
                }
            }
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new IllegalArgumentException("Reference file not found: " + path, e);
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed to read reference file " + path
                    + " at row " + row + ": " + e.getMessage(), e);
        }

        Map<String, double[]> centroids = new LinkedHashMap<>();
        vectors.forEach((model, list) -> centroids.put(model, mean(list, embedder.dimension())));

        LOG.info("Loaded drift references for {} model(s) from {}", centroids.size(), path);
        return TextReferenceSet.ofCentroids(centroids);
    }

    private static double[] parseVector(String raw, int dimension, int row) {
        String[] parts = raw.trim().split("[\\s;]+");
        if (parts.length != dimension) {
            throw new IllegalStateException("Embedding at row " + row + " has " + parts.length
                    + " components, expected " + dimension);
        }
        double[] v = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            v[i] = Double.parseDouble(parts[i]);
        }
        return v;
    }

    private static double[] mean(List<double[]> vectors, int dimension) {
        double[] sum = new double[dimension];
        for (double[] v : vectors) {
            for (int i = 0; i < dimension; i++) {
                sum[i] += v[i];
            }
        }
        for (int i = 0; i < dimension; i++) {
            sum[i] /= vectors.size();
        }
        return sum;
    }
}
