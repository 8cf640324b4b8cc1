package com.driftguard.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single LLM interaction record.
 *
 * <p>
 * Records arrive as free-form JSON. All properties are kept in an ordered map
 * so that detectors configured with arbitrary {@code field} names can read
 * them; the standard fields have typed accessors.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * Once ingested a record is never changed by the engine. Fields are populated
 * either through {@link #builder()} or by Jackson during deserialization;
 * {@link #getFields()} returns an unmodifiable view. Detection results are kept
 * alongside the event in an {@link EnrichedRecord}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String TIMESTAMP = "timestamp";
    public static final String MODEL_ID = "model_id";
    public static final String REQUEST_ID = "request_id";
    public static final String PROMPT = "prompt";
    public static final String RESPONSE = "response";
    public static final String RESPONSE_TIME = "response_time";
    public static final String TOKEN_COUNT = "token_count";
    public static final String CONFIDENCE_SCORE = "confidence_score";
    public static final String METADATA = "metadata";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public LlmEvent() {
    }

    private LlmEvent(Map<String, Object> source) {
        fields.putAll(source);
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    @JsonAnySetter
    void putField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all fields in arrival order
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Generic accessors
    // ---------------------------------------------------------------

    public boolean hasField(String fieldName) {
        return fields.get(fieldName) != null;
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field value, coercing common JSON number types.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers.
     * </p>
     *
     * @param fieldName the JSON key
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    // ---------------------------------------------------------------
    // Standard fields
    // ---------------------------------------------------------------

    /**
     * Parse the record timestamp. ISO-8601 strings and epoch milliseconds
     * (numeric or string-encoded) are accepted.
     *
     * @return the timestamp, or empty if absent or unparseable
     */
    public Optional<Instant> getTimestamp() {
        Object raw = fields.get(TIMESTAMP);
        if (raw instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (raw instanceof Number n) {
            return Optional.of(Instant.ofEpochMilli(n.longValue()));
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Instant.parse(s.trim()));
            } catch (DateTimeParseException e) {
                return getNumericField(TIMESTAMP).map(ms -> Instant.ofEpochMilli(ms.longValue()));
            }
        }
        return Optional.empty();
    }

    public Optional<String> getModelId() {
        return getStringField(MODEL_ID).filter(s -> !s.isBlank());
    }

    public Optional<String> getRequestId() {
        return getStringField(REQUEST_ID);
    }

    public Optional<String> getPrompt() {
        return getStringField(PROMPT);
    }

    public Optional<String> getResponse() {
        return getStringField(RESPONSE);
    }

    public Optional<Double> getResponseTime() {
        return getNumericField(RESPONSE_TIME);
    }

    public Optional<Double> getTokenCount() {
        return getNumericField(TOKEN_COUNT);
    }

    public Optional<Double> getConfidenceScore() {
        return getNumericField(CONFIDENCE_SCORE);
    }

    /**
     * @return the metadata map, or an empty map when absent or not an object
     */
    public Map<String, Object> getMetadata() {
        Object raw = fields.get(METADATA);
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return Collections.unmodifiableMap(copy);
        }
        return Map.of();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder, mainly for tests and programmatic producers.
     */
    public static class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder timestamp(Instant timestamp) {
            return field(TIMESTAMP, timestamp != null ? timestamp.toString() : null);
        }

        public Builder modelId(String modelId) {
            return field(MODEL_ID, modelId);
        }

        public Builder requestId(String requestId) {
            return field(REQUEST_ID, requestId);
        }

        public Builder prompt(String prompt) {
            return field(PROMPT, prompt);
        }

        public Builder response(String response) {
            return field(RESPONSE, response);
        }

        public Builder responseTime(double responseTime) {
            return field(RESPONSE_TIME, responseTime);
        }

        public Builder tokenCount(long tokenCount) {
            return field(TOKEN_COUNT, tokenCount);
        }

        public Builder confidenceScore(double confidenceScore) {
            return field(CONFIDENCE_SCORE, confidenceScore);
        }

        public Builder metadata(Map<String, Object> metadata) {
            return field(METADATA, metadata != null ? new LinkedHashMap<>(metadata) : null);
        }

        public Builder field(String key, Object value) {
            Objects.requireNonNull(key, "Field key must not be null");
            fields.put(key, value);
            return this;
        }

        public LlmEvent build() {
            return new LlmEvent(fields);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LlmEvent that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "LlmEvent" + fields;
    }
}
