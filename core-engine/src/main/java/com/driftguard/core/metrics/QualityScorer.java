package com.driftguard.core.metrics;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heuristic text-quality scoring.
 *
 * <ul>
 * <li><b>coherence</b>: transition-phrase and pronoun density per sentence;
 * a single sentence is fully coherent.</li>
 * <li><b>completeness</b>: conclusion marker 0.4, example marker 0.3, at least
 * two sentences 0.3; averaged with the prompt keyword overlap when a prompt is
 * given.</li>
 * <li><b>language quality</b>: 0.5 grammar + 0.3 vocabulary diversity + 0.2
 * (1 - repetition).</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class QualityScorer {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<String> TRANSITIONS = List.of("however", "therefore", "furthermore",
            "additionally", "moreover", "consequently", "meanwhile", "similarly", "in contrast",
            "for example");
    private static final Set<String> PRONOUNS = Set.of("it", "this", "that", "these", "those", "they", "them");
    private static final List<String> CONCLUSION_MARKERS = List.of("conclusion", "summary", "finally", "therefore");
    private static final List<String> EXAMPLE_MARKERS = List.of("example", "instance", "such as");
    private static final Set<String> STOP_WORDS = Set.of("the", "a", "an", "and", "or", "but", "in", "on",
            "at", "to", "for", "of", "with", "by", "is", "are", "was", "were");

    private QualityScorer() {
    }

    /**
     * @param response non-blank response text
     * @param prompt   prompt text, may be {@code null}
     */
    public static QualityMetrics score(String response, String prompt) {
        String text = response.trim();
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> words = words(text);
        List<String> sentences = sentences(text);

        double avgWordLength = words.stream().mapToInt(String::length).average().orElse(0.0);
        return new QualityMetrics(
                text.length(),
                words.size(),
                sentences.size(),
                avgWordLength,
                readability(words, sentences, avgWordLength),
                coherence(lower, sentences),
                completeness(lower, sentences, prompt),
                languageQuality(text, sentences),
                informationDensity(words));
    }

    static List<String> words(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(WHITESPACE.split(trimmed));
    }

    static List<String> sentences(String text) {
        return Arrays.stream(SENTENCE_END.split(text))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static double readability(List<String> words, List<String> sentences, double avgWordLength) {
        if (words.isEmpty() || sentences.isEmpty()) {
            return 0.0;
        }
        double avgSentenceLength = (double) words.size() / sentences.size();
        double readability = 1.0 - Math.min(1.0, (avgSentenceLength / 20 + avgWordLength / 6) / 2);
        return Math.max(0.0, readability);
    }

    static double coherence(String lower, List<String> sentences) {
        if (sentences.isEmpty()) {
            return 0.0;
        }
        if (sentences.size() < 2) {
            return 1.0;
        }
        long transitions = TRANSITIONS.stream().filter(lower::contains).count();
        Set<String> wordSet = new HashSet<>(words(lower));
        long pronouns = PRONOUNS.stream().filter(wordSet::contains).count();
        return Math.min(1.0, (transitions * 0.1 + pronouns * 0.05) / sentences.size());
    }

    static double completeness(String lower, List<String> sentences, String prompt) {
        double completeness = 0.0;
        if (CONCLUSION_MARKERS.stream().anyMatch(lower::contains)) {
            completeness += 0.4;
        }
        if (EXAMPLE_MARKERS.stream().anyMatch(lower::contains)) {
            completeness += 0.3;
        }
        if (sentences.size() >= 2) {
            completeness += 0.3;
        }
        if (prompt != null && !prompt.isBlank()) {
            Set<String> promptWords = new HashSet<>(words(prompt.toLowerCase(Locale.ROOT)));
            Set<String> responseWords = new HashSet<>(words(lower));
            Set<String> shared = new HashSet<>(promptWords);
            shared.retainAll(responseWords);
            double overlap = (double) shared.size() / Math.max(promptWords.size(), 1);
            completeness = (completeness + overlap) / 2;
        }
        return Math.min(1.0, completeness);
    }

    static double languageQuality(String text, List<String> sentences) {
        double quality = grammar(text, sentences) * 0.5
                + vocabularyDiversity(text) * 0.3
                + (1 - repetition(text)) * 0.2;
        return Math.max(0.0, Math.min(1.0, quality));
    }

    static double grammar(String text, List<String> sentences) {
        double score = 0.0;
        if (!text.isEmpty() && Character.isUpperCase(text.charAt(0))) {
            score += 0.3;
        }
        if (text.endsWith(".") || text.endsWith("!") || text.endsWith("?")) {
            score += 0.3;
        }
        long proper = sentences.stream().filter(s -> Character.isUpperCase(s.charAt(0))).count();
        score += (double) proper / Math.max(sentences.size(), 1) * 0.4;
        return Math.min(1.0, score);
    }

    static double vocabularyDiversity(String text) {
        List<String> words = words(text.toLowerCase(Locale.ROOT));
        if (words.isEmpty()) {
            return 0.0;
        }
        return (double) new HashSet<>(words).size() / words.size();
    }

    /**
     * Share of the most frequent word beyond a tolerated 10%.
     */
    static double repetition(String text) {
        List<String> words = words(text.toLowerCase(Locale.ROOT));
        if (words.size() < 2) {
            return 0.0;
        }
        Map<String, Integer> counts = new HashMap<>();
        words.forEach(w -> counts.merge(w, 1, Integer::sum));
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return Math.max(0.0, (double) max / words.size() - 0.1);
    }

    static double informationDensity(List<String> words) {
        if (words.isEmpty()) {
            return 0.0;
        }
        long content = words.stream()
                .filter(w -> !STOP_WORDS.contains(w.toLowerCase(Locale.ROOT)))
                .count();
        return (double) content / words.size();
    }
}
