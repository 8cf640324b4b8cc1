package com.driftguard.core.metrics;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text statistics and quality sub-scores of one response. All scores are in
 * {@code [0, 1]}.
 *
 * @since 1.0.0
 */
public final class QualityMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int responseLength;
    private final int wordCount;
    private final int sentenceCount;
    private final double avgWordLength;
    private final double readabilityScore;
    private final double coherenceScore;
    private final double completenessScore;
    private final double languageQuality;
    private final double informationDensity;

    QualityMetrics(int responseLength, int wordCount, int sentenceCount, double avgWordLength,
            double readabilityScore, double coherenceScore, double completenessScore,
            double languageQuality, double informationDensity) {
        this.responseLength = responseLength;
        this.wordCount = wordCount;
        this.sentenceCount = sentenceCount;
        this.avgWordLength = avgWordLength;
        this.readabilityScore = readabilityScore;
        this.coherenceScore = coherenceScore;
        this.completenessScore = completenessScore;
        this.languageQuality = languageQuality;
        this.informationDensity = informationDensity;
    }

    /**
     * Mean of coherence, completeness and language quality.
     */
    public double getOverallQualityScore() {
        return (coherenceScore + completenessScore + languageQuality) / 3.0;
    }

    public int getResponseLength() {
        return responseLength;
    }

    public int getWordCount() {
        return wordCount;
    }

    public int getSentenceCount() {
        return sentenceCount;
    }

    public double getAvgWordLength() {
        return avgWordLength;
    }

    public double getReadabilityScore() {
        return readabilityScore;
    }

    public double getCoherenceScore() {
        return coherenceScore;
    }

    public double getCompletenessScore() {
        return completenessScore;
    }

    public double getLanguageQuality() {
        return languageQuality;
    }

    public double getInformationDensity() {
        return informationDensity;
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("quality_response_length", responseLength);
        fields.put("quality_word_count", wordCount);
        fields.put("quality_sentence_count", sentenceCount);
        fields.put("quality_avg_word_length", avgWordLength);
        fields.put("quality_readability_score", readabilityScore);
        fields.put("quality_coherence_score", coherenceScore);
        fields.put("quality_completeness_score", completenessScore);
        fields.put("quality_language_quality", languageQuality);
        fields.put("quality_information_density", informationDensity);
        fields.put("overall_quality_score", getOverallQualityScore());
        return fields;
    }

    @Override
    public String toString() {
        return "QualityMetrics{overall=" + getOverallQualityScore() +
                ", coherence=" + coherenceScore +
                ", completeness=" + completenessScore +
                ", languageQuality=" + languageQuality +
                ", words=" + wordCount + '}';
    }
}
