package com.driftguard.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An ingested {@link LlmEvent} together with the result fields attached by the
 * detection stages.
 *
 * <p>
 * The event is never modified; results live in a separate ordered map. A stage
 * hands over its complete output in a single {@link #attach(Map)} call, so a
 * record never carries part of one stage's result. Serialized to JSON as a flat
 * object: event fields first, then result fields.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A record is enriched by exactly one worker.
 * </p>
 *
 * @since 1.0.0
 */
public class EnrichedRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String INPUT_VALID = "input_valid";
    public static final String INPUT_ERROR = "input_error";

    private final LlmEvent event;
    private final Map<String, Object> results = new LinkedHashMap<>();

    public EnrichedRecord(LlmEvent event) {
        this.event = Objects.requireNonNull(event, "event must not be null");
    }

    /**
     * Create a record flagged as malformed input. No stage output is attached.
     *
     * @param event  the rejected event
     * @param reason human-readable rejection reason
     * @return flagged record
     */
    public static EnrichedRecord rejected(LlmEvent event, String reason) {
        EnrichedRecord record = new EnrichedRecord(event);
        Map<String, Object> flag = new LinkedHashMap<>();
        flag.put(INPUT_VALID, false);
        flag.put(INPUT_ERROR, reason);
        record.attach(flag);
        return record;
    }

    /**
     * Attach a stage's complete result.
     *
     * @param stageResult result fields; {@code null} values are skipped
     * @throws IllegalStateException if a result field would shadow an event
     *                               field
     */
    public void attach(Map<String, ?> stageResult) {
        Objects.requireNonNull(stageResult, "stageResult must not be null");
        for (String key : stageResult.keySet()) {
            if (event.getFields().containsKey(key)) {
                throw new IllegalStateException(
                        "Result field '" + key + "' would overwrite an input field");
            }
        }
        stageResult.forEach((key, value) -> {
            if (value != null) {
                results.put(key, value);
            }
        });
    }

    @JsonIgnore
    public LlmEvent getEvent() {
        return event;
    }

    /**
     * @return unmodifiable view of the attached result fields
     */
    @JsonIgnore
    public Map<String, Object> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public Optional<Object> getResult(String name) {
        return Optional.ofNullable(results.get(name));
    }

    @JsonIgnore
    public boolean isRejected() {
        return Boolean.FALSE.equals(results.get(INPUT_VALID));
    }

    /**
     * @return event fields followed by result fields
     */
    @JsonAnyGetter
    public Map<String, Object> toFlatMap() {
        Map<String, Object> flat = new LinkedHashMap<>(event.getFields());
        flat.putAll(results);
        return flat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnrichedRecord that))
            return false;
        return event.equals(that.event) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, results);
    }

    @Override
    public String toString() {
        return "EnrichedRecord{event=" + event + ", results=" + results + '}';
    }
}
