package com.driftguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Statistical summary of one model's historical behaviour.
 *
 * <p>
 * A record with {@code sample_count == 0} carries no baseline: every
 * {@link #mean(BaselineMetric)} and {@link #stdDev(BaselineMetric)} lookup
 * returns empty, whatever values are stored. Callers must treat this as "no
 * baseline", never as a baseline of zero.
 * </p>
 *
 * <p>
 * Instances are immutable. Column names match the flat baseline table.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"model_id", "avg_response_time", "avg_token_count", "avg_confidence",
        "std_response_time", "std_token_count", "std_confidence", "baseline_date", "sample_count"})
public final class BaselineRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final Double avgResponseTime;
    private final Double avgTokenCount;
    private final Double avgConfidence;
    private final Double stdResponseTime;
    private final Double stdTokenCount;
    private final Double stdConfidence;
    private final Instant baselineDate;
    private final long sampleCount;

    @JsonCreator
    public BaselineRecord(
            @JsonProperty("model_id") String modelId,
            @JsonProperty("avg_response_time") Double avgResponseTime,
            @JsonProperty("avg_token_count") Double avgTokenCount,
            @JsonProperty("avg_confidence") Double avgConfidence,
            @JsonProperty("std_response_time") Double stdResponseTime,
            @JsonProperty("std_token_count") Double stdTokenCount,
            @JsonProperty("std_confidence") Double stdConfidence,
            @JsonProperty("baseline_date") Instant baselineDate,
            @JsonProperty("sample_count") Long sampleCount) {
        this.modelId = Objects.requireNonNull(modelId, "model_id must not be null");
        this.avgResponseTime = avgResponseTime;
        this.avgTokenCount = avgTokenCount;
        this.avgConfidence = avgConfidence;
        this.stdResponseTime = stdResponseTime;
        this.stdTokenCount = stdTokenCount;
        this.stdConfidence = stdConfidence;
        this.baselineDate = baselineDate;
        this.sampleCount = sampleCount != null ? sampleCount : 0L;
        if (this.sampleCount < 0) {
            throw new IllegalArgumentException(
                    "sample_count must be >= 0 for model '" + modelId + "', got: " + sampleCount);
        }
    }

    public static Builder builder(String modelId) {
        return new Builder(modelId);
    }

    /**
     * @return {@code true} if the record holds a usable baseline
     */
    @JsonIgnore
    public boolean isAvailable() {
        return sampleCount > 0;
    }

    /**
     * @param metric the metric
     * @return the baseline mean, empty if unavailable
     */
    public OptionalDouble mean(BaselineMetric metric) {
        return defined(switch (metric) {
            case RESPONSE_TIME -> avgResponseTime;
            case TOKEN_COUNT -> avgTokenCount;
            case CONFIDENCE -> avgConfidence;
        });
    }

    /**
     * @param metric the metric
     * @return the baseline standard deviation, empty if unavailable
     */
    public OptionalDouble stdDev(BaselineMetric metric) {
        return defined(switch (metric) {
            case RESPONSE_TIME -> stdResponseTime;
            case TOKEN_COUNT -> stdTokenCount;
            case CONFIDENCE -> stdConfidence;
        });
    }

    private OptionalDouble defined(Double value) {
        if (!isAvailable() || value == null || !Double.isFinite(value)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value);
    }

    // ---------------------------------------------------------------
    // Getters (column view)
    // ---------------------------------------------------------------

    @JsonProperty("model_id")
    public String getModelId() {
        return modelId;
    }

    @JsonProperty("avg_response_time")
    public Double getAvgResponseTime() {
        return avgResponseTime;
    }

    @JsonProperty("avg_token_count")
    public Double getAvgTokenCount() {
        return avgTokenCount;
    }

    @JsonProperty("avg_confidence")
    public Double getAvgConfidence() {
        return avgConfidence;
    }

    @JsonProperty("std_response_time")
    public Double getStdResponseTime() {
        return stdResponseTime;
    }

    @JsonProperty("std_token_count")
    public Double getStdTokenCount() {
        return stdTokenCount;
    }

    @JsonProperty("std_confidence")
    public Double getStdConfidence() {
        return stdConfidence;
    }

    @JsonProperty("baseline_date")
    public Instant getBaselineDate() {
        return baselineDate;
    }

    @JsonProperty("sample_count")
    public long getSampleCount() {
        return sampleCount;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private final String modelId;
        private Double avgResponseTime;
        private Double avgTokenCount;
        private Double avgConfidence;
        private Double stdResponseTime;
        private Double stdTokenCount;
        private Double stdConfidence;
        private Instant baselineDate;
        private long sampleCount;

        private Builder(String modelId) {
            this.modelId = modelId;
        }

        public Builder responseTime(double mean, double stdDev) {
            this.avgResponseTime = mean;
            this.stdResponseTime = stdDev;
            return this;
        }

        public Builder tokenCount(double mean, double stdDev) {
            this.avgTokenCount = mean;
            this.stdTokenCount = stdDev;
            return this;
        }

        public Builder confidence(double mean, double stdDev) {
            this.avgConfidence = mean;
            this.stdConfidence = stdDev;
            return this;
        }

        public Builder baselineDate(Instant baselineDate) {
            this.baselineDate = baselineDate;
            return this;
        }

        public Builder sampleCount(long sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public BaselineRecord build() {
            return new BaselineRecord(modelId, avgResponseTime, avgTokenCount, avgConfidence,
                    stdResponseTime, stdTokenCount, stdConfidence, baselineDate, sampleCount);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineRecord that))
            return false;
        return sampleCount == that.sampleCount
                && modelId.equals(that.modelId)
                && Objects.equals(avgResponseTime, that.avgResponseTime)
                && Objects.equals(avgTokenCount, that.avgTokenCount)
                && Objects.equals(avgConfidence, that.avgConfidence)
                && Objects.equals(stdResponseTime, that.stdResponseTime)
                && Objects.equals(stdTokenCount, that.stdTokenCount)
                && Objects.equals(stdConfidence, that.stdConfidence)
                && Objects.equals(baselineDate, that.baselineDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, avgResponseTime, avgTokenCount, avgConfidence,
                stdResponseTime, stdTokenCount, stdConfidence, baselineDate, sampleCount);
    }

    @Override
    public String toString() {
        return "BaselineRecord{" +
                "modelId='" + modelId + '\'' +
                ", avgResponseTime=" + avgResponseTime +
                ", avgTokenCount=" + avgTokenCount +
                ", avgConfidence=" + avgConfidence +
                ", sampleCount=" + sampleCount +
                ", baselineDate=" + baselineDate +
                '}';
    }
}
