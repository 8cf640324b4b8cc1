package com.driftguard.core.semantic;

import com.driftguard.core.model.SimilarityResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SemanticComparator}.
 */
class SemanticComparatorTest {

    private static final String PROMPT = "Explain how photosynthesis converts light into chemical energy";
    private static final String RESPONSE = "Plants capture sunlight and store the energy as glucose";

    private final SemanticComparator comparator = new SemanticComparator(new HashingTextEmbedder());

    @ParameterizedTest
    @EnumSource(SimilarityMethod.class)
    @DisplayName("Should score identical texts as fully similar")
    void shouldBeReflexive(SimilarityMethod method) {
        SimilarityResult result = comparator.compare(PROMPT, PROMPT, method, false);

        assertThat(result.getSimilarityScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getSemanticDistance()).isCloseTo(0.0, within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(SimilarityMethod.class)
    @DisplayName("Should score symmetrically within [0, 1]")
    void shouldBeSymmetric(SimilarityMethod method) {
        double forward = comparator.compare(PROMPT, RESPONSE, method, false).getSimilarityScore();
        double backward = comparator.compare(RESPONSE, PROMPT, method, false).getSimilarityScore();

        assertThat(forward).isCloseTo(backward, within(1e-9));
        assertThat(forward).isBetween(0.0, 1.0);
    }

    @ParameterizedTest
    @EnumSource(SimilarityMethod.class)
    @DisplayName("Should score punctuation-only texts as fully similar to themselves")
    void shouldBeReflexiveForPunctuation(SimilarityMethod method) {
        for (String text : List.of("???", "...", " !?! ")) {
            SimilarityResult result = comparator.compare(text, text, method, false);

            assertThat(result.getError()).isEmpty();
            assertThat(result.getSimilarityScore()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Should compare punctuation-only texts by their raw characters")
    void shouldCompareRawPunctuation() {
        SimilarityResult different = comparator.compare("???", "...", SimilarityMethod.COSINE, false);
        SimilarityResult partial = comparator.compare("?!", "??", SimilarityMethod.COSINE, false);

        assertThat(different.getError()).isEmpty();
        assertThat(different.getSimilarityScore()).isZero();
        assertThat(partial.getSimilarityScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should report empty text instead of a score")
    void shouldFlagEmptyText() {
        SimilarityResult result = comparator.compare("   ", RESPONSE, SimilarityMethod.COSINE, true);
        Map<String, Object> fields = result.toFields();

        assertThat(result.getError()).contains(SimilarityResult.EMPTY_TEXT_ERROR);
        assertThat(fields).containsEntry("similarity_score", 0.0)
                .containsEntry("semantic_comparison_error", "Empty text fields")
                .doesNotContainKey("shift_direction");
    }

    @Test
    @DisplayName("Should describe a much longer second text as an expansion")
    void shouldDetectExpansion() {
        SimilarityResult result = comparator.compare("short prompt",
                "a considerably longer response that keeps going", SimilarityMethod.JACCARD, true);

        assertThat(result.getAnalysis()).isPresent();
        assertThat(result.getAnalysis().get().getShiftDirection()).isEqualTo("expansion");
        assertThat(result.toFields()).containsKeys("word_overlap", "length_ratio", "shift_magnitude");
    }

    @Test
    @DisplayName("Should compute Jaccard overlap over distinct words")
    void shouldComputeJaccard() {
        double score = SemanticComparator.jaccard(Set.of("a", "b", "c"), Set.of("b", "c", "d"));

        assertThat(score).isCloseTo(0.5, within(1e-9));
        assertThat(SemanticComparator.jaccard(Set.of(), Set.of())).isZero();
    }

    @Test
    @DisplayName("Should compute edit distance")
    void shouldComputeLevenshtein() {
        assertThat(SemanticComparator.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(SemanticComparator.levenshteinSimilarity("kitten", "sitting"))
                .isCloseTo(1.0 - 3.0 / 7.0, within(1e-9));
    }

    @Test
    @DisplayName("Should rate related texts above unrelated ones")
    void shouldRankRelatedTextsHigher() {
        double related = comparator.compare("the model answered the billing question",
                "the model answered a billing question quickly", SimilarityMethod.COSINE, false)
                .getSimilarityScore();
        double unrelated = comparator.compare("the model answered the billing question",
                "volcanic eruptions reshape tropical islands", SimilarityMethod.COSINE, false)
                .getSimilarityScore();

        assertThat(related).isGreaterThan(unrelated);
    }
}
