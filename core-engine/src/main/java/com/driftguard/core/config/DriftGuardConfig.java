package com.driftguard.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the DriftGuard YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section is optional and falls back to its
 * defaults):
 * </p>
 *
 * <pre>
 * workers: 4
 * baseline:
 *   file: /data/lookups/llm_baselines.csv
 * drift:
 *   mode: rolling
 *   threshold: 0.3
 * anomaly:
 *   fields: [response_time, token_count]
 *   method: all
 * comparison:
 *   metrics: [response_time, token_count]
 *   thresholdFile: /data/lookups/llm_thresholds.csv
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link ConfigLoader} does so.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftGuardConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int workers = 1;
    private BaselineSettings baseline = new BaselineSettings();
    private DriftSettings drift = new DriftSettings();
    private SemanticSettings semantic = new SemanticSettings();
    private MetricsSettings metrics = new MetricsSettings();
    private AnomalySettings anomaly = new AnomalySettings();
    private ComparisonSettings comparison = new ComparisonSettings();

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects the errors of all sections and throws a single exception if any
     * is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (workers < 1) {
            errors.add("'workers' must be >= 1, got: " + workers);
        }
        collect(errors, baseline::validate);
        collect(errors, drift::validate);
        collect(errors, semantic::validate);
        collect(errors, metrics::validate);
        collect(errors, anomaly::validate);
        collect(errors, comparison::validate);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException | IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML binding; null sections keep defaults)
    // ---------------------------------------------------------------

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public BaselineSettings getBaseline() {
        return baseline;
    }

    public void setBaseline(BaselineSettings baseline) {
        this.baseline = baseline != null ? baseline : new BaselineSettings();
    }

    public DriftSettings getDrift() {
        return drift;
    }

    public void setDrift(DriftSettings drift) {
        this.drift = drift != null ? drift : new DriftSettings();
    }

    public SemanticSettings getSemantic() {
        return semantic;
    }

    public void setSemantic(SemanticSettings semantic) {
        this.semantic = semantic != null ? semantic : new SemanticSettings();
    }

    public MetricsSettings getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsSettings metrics) {
        this.metrics = metrics != null ? metrics : new MetricsSettings();
    }

    public AnomalySettings getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly != null ? anomaly : new AnomalySettings();
    }

    public ComparisonSettings getComparison() {
        return comparison;
    }

    public void setComparison(ComparisonSettings comparison) {
        this.comparison = comparison != null ? comparison : new ComparisonSettings();
    }

    @Override
    public String toString() {
        return "DriftGuardConfig{" +
                "workers=" + workers +
                ", baseline=" + baseline +
                ", drift=" + drift +
                ", semantic=" + semantic +
                ", metrics=" + metrics +
                ", anomaly=" + anomaly +
                ", comparison=" + comparison +
                '}';
    }
}
