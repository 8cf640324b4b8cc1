package com.driftguard.core.config;

import com.driftguard.core.model.LlmEvent;
import com.driftguard.core.semantic.SimilarityMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the semantic comparison stage, which scores the similarity of
 * two text fields of the same record (by default prompt and response).
 *
 * @since 1.0.0
 */
public class SemanticSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled;
    private String field1 = LlmEvent.PROMPT;
    private String field2 = LlmEvent.RESPONSE;
    private String method = "cosine";
    private boolean includeAnalysis = true;

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (field1 == null || field1.isBlank()) {
            errors.add("'field1' is required");
        }
        if (field2 == null || field2.isBlank()) {
            errors.add("'field2' is required");
        }
        try {
            SimilarityMethod.fromName(method);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid semantic settings: " + String.join("; ", errors));
        }
    }

    public SimilarityMethod similarityMethod() {
        return SimilarityMethod.fromName(method);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getField1() {
        return field1;
    }

    public void setField1(String field1) {
        this.field1 = field1;
    }

    public String getField2() {
        return field2;
    }

    public void setField2(String field2) {
        this.field2 = field2;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public boolean isIncludeAnalysis() {
        return includeAnalysis;
    }

    public void setIncludeAnalysis(boolean includeAnalysis) {
        this.includeAnalysis = includeAnalysis;
    }

    @Override
    public String toString() {
        return "SemanticSettings{enabled=" + enabled + ", field1='" + field1 + "', field2='" + field2
                + "', method='" + method + "', includeAnalysis=" + includeAnalysis + '}';
    }
}
