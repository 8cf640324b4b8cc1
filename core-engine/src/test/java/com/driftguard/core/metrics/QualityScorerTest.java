package com.driftguard.core.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link QualityScorer}.
 */
class QualityScorerTest {

    @Test
    @DisplayName("Should count words and sentences")
    void shouldCountStructure() {
        QualityMetrics metrics = QualityScorer.score("Hello world. This is a test!", null);

        assertThat(metrics.getWordCount()).isEqualTo(6);
        assertThat(metrics.getSentenceCount()).isEqualTo(2);
        assertThat(metrics.getResponseLength()).isEqualTo(28);
    }

    @Test
    @DisplayName("Should treat a single sentence as fully coherent")
    void shouldScoreSingleSentenceCoherent() {
        QualityMetrics metrics = QualityScorer.score("Hello world.", null);

        assertThat(metrics.getCoherenceScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should combine grammar, diversity and repetition into language quality")
    void shouldScoreLanguageQuality() {
        QualityMetrics metrics = QualityScorer.score("Hello world.", null);

        // grammar 1.0, diversity 1.0, repetition 0.5 - 0.1
        assertThat(metrics.getLanguageQuality()).isCloseTo(0.92, within(1e-9));
        assertThat(metrics.getCompletenessScore()).isEqualTo(0.0);
        assertThat(metrics.getOverallQualityScore()).isCloseTo((1.0 + 0.0 + 0.92) / 3, within(1e-9));
    }

    @Test
    @DisplayName("Should reward conclusion and example markers in multi-sentence answers")
    void shouldScoreCompletenessMarkers() {
        QualityMetrics metrics = QualityScorer.score(
                "For example, caching helps. In conclusion, use a cache.", null);

        assertThat(metrics.getCompletenessScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should average completeness with prompt keyword overlap")
    void shouldBlendPromptOverlap() {
        QualityMetrics metrics = QualityScorer.score("Capital France", "capital france");

        assertThat(metrics.getCompletenessScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should measure repetition beyond the tolerated share")
    void shouldMeasureRepetition() {
        assertThat(QualityScorer.repetition("spam spam spam spam")).isCloseTo(0.9, within(1e-9));
        assertThat(QualityScorer.repetition("single")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should compute information density from non-stop words")
    void shouldComputeInformationDensity() {
        QualityMetrics metrics = QualityScorer.score("the cat and the dog", null);

        assertThat(metrics.getInformationDensity()).isCloseTo(0.4, within(1e-9));
    }

    @Test
    @DisplayName("Should keep every score within the unit interval")
    void shouldBoundScores() {
        QualityMetrics metrics = QualityScorer.score(
                "However, this is long. Therefore it matters. Moreover they agree. "
                        + "Furthermore those results, such as these, hold in summary.", "results");

        assertThat(metrics.getReadabilityScore()).isBetween(0.0, 1.0);
        assertThat(metrics.getCoherenceScore()).isBetween(0.0, 1.0);
        assertThat(metrics.getCompletenessScore()).isBetween(0.0, 1.0);
        assertThat(metrics.getLanguageQuality()).isBetween(0.0, 1.0);
        assertThat(metrics.getOverallQualityScore()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should expose prefixed quality fields")
    void shouldExposeFields() {
        assertThat(QualityScorer.score("Hello world.", null).toFields())
                .containsEntry("quality_word_count", 2)
                .containsKey("overall_quality_score");
    }
}
