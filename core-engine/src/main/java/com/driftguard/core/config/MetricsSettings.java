package com.driftguard.core.config;

import com.driftguard.core.model.LlmEvent;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the derived-metrics stage. Field names point at the record
 * fields holding the response text and the numeric inputs; a blank optional
 * field disables the metrics that depend on it.
 *
 * @since 1.0.0
 */
public class MetricsSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;
    private String responseField = LlmEvent.RESPONSE;
    private String promptField = LlmEvent.PROMPT;
    private String timeField = LlmEvent.RESPONSE_TIME;
    private String tokenField = LlmEvent.TOKEN_COUNT;
    private String confidenceField = LlmEvent.CONFIDENCE_SCORE;
    private boolean includeTrends;
    private int trendHistorySize = 100;

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (responseField == null || responseField.isBlank()) {
            errors.add("'responseField' is required");
        }
        if (trendHistorySize < 1) {
            errors.add("'trendHistorySize' must be >= 1, got: " + trendHistorySize);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid metrics settings: " + String.join("; ", errors));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getResponseField() {
        return responseField;
    }

    public void setResponseField(String responseField) {
        this.responseField = responseField;
    }

    public String getPromptField() {
        return promptField;
    }

    public void setPromptField(String promptField) {
        this.promptField = promptField;
    }

    public String getTimeField() {
        return timeField;
    }

    public void setTimeField(String timeField) {
        this.timeField = timeField;
    }

    public String getTokenField() {
        return tokenField;
    }

    public void setTokenField(String tokenField) {
        this.tokenField = tokenField;
    }

    public String getConfidenceField() {
        return confidenceField;
    }

    public void setConfidenceField(String confidenceField) {
        this.confidenceField = confidenceField;
    }

    public boolean isIncludeTrends() {
        return includeTrends;
    }

    public void setIncludeTrends(boolean includeTrends) {
        this.includeTrends = includeTrends;
    }

    public int getTrendHistorySize() {
        return trendHistorySize;
    }

    public void setTrendHistorySize(int trendHistorySize) {
        this.trendHistorySize = trendHistorySize;
    }

    @Override
    public String toString() {
        return "MetricsSettings{enabled=" + enabled + ", responseField='" + responseField
                + "', includeTrends=" + includeTrends + '}';
    }
}
