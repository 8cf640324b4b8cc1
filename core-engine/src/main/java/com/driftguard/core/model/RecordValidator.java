package com.driftguard.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Structural checks on an ingested {@link LlmEvent}.
 *
 * <p>
 * {@code model_id} and the numeric standard fields are mandatory. The numeric
 * fields must be numbers within their domain: {@code response_time >= 0},
 * {@code token_count} a non-negative integer and {@code confidence_score}
 * within {@code [0, 1]}. An explicit JSON {@code null} counts as missing.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordValidator {

    private static final List<String> REQUIRED_NUMERIC_FIELDS = List.of(
            LlmEvent.RESPONSE_TIME, LlmEvent.TOKEN_COUNT, LlmEvent.CONFIDENCE_SCORE);

    private RecordValidator() {
    }

    /**
     * @param event the record to check
     * @return the rejection reason, or empty if the record is valid
     */
    public static Optional<String> validate(LlmEvent event) {
        if (event == null) {
            return Optional.of("Record is null");
        }
        if (event.getModelId().isEmpty()) {
            return Optional.of("Missing required field '" + LlmEvent.MODEL_ID + "'");
        }
        for (String field : REQUIRED_NUMERIC_FIELDS) {
            if (!event.hasField(field)) {
                return Optional.of("Missing required field '" + field + "'");
            }
        }
        Optional<String> error = checkNumber(event, LlmEvent.RESPONSE_TIME);
        if (error.isEmpty()) {
            error = checkNumber(event, LlmEvent.TOKEN_COUNT);
        }
        if (error.isEmpty()) {
            error = checkNumber(event, LlmEvent.CONFIDENCE_SCORE);
        }
        if (error.isPresent()) {
            return error;
        }

        double rt = event.getResponseTime().orElseThrow();
        if (rt < 0) {
            return Optional.of("'" + LlmEvent.RESPONSE_TIME + "' must be >= 0, got: " + rt);
        }
        Optional<Double> tokens = event.getTokenCount();
        if (tokens.isPresent() && (tokens.get() < 0 || tokens.get() != Math.rint(tokens.get()))) {
            return Optional.of("'" + LlmEvent.TOKEN_COUNT + "' must be a non-negative integer, got: "
                    + tokens.get());
        }
        Optional<Double> confidence = event.getConfidenceScore();
        if (confidence.isPresent() && (confidence.get() < 0 || confidence.get() > 1)) {
            return Optional.of("'" + LlmEvent.CONFIDENCE_SCORE + "' must be in [0, 1], got: "
                    + confidence.get());
        }
        return Optional.empty();
    }

    public static boolean isValid(LlmEvent event) {
        return validate(event).isEmpty();
    }

    private static Optional<String> checkNumber(LlmEvent event, String field) {
        Optional<Double> value = event.getNumericField(field);
        if (value.isEmpty() || !Double.isFinite(value.get())) {
            return Optional.of("'" + field + "' is not a finite number: " + event.getField(field).orElse(null));
        }
        return Optional.empty();
    }
}
