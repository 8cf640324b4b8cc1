package com.driftguard.core.semantic;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalisation shared by the embedder and the lexical similarity
 * methods: lower-case, punctuation stripped, whitespace collapsed.
 *
 * @since 1.0.0
 */
public final class TextPreprocessor {

    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextPreprocessor() {
    }

    /**
     * @param input raw text, may be {@code null}
     * @return the normalised text; empty for {@code null} or blank input
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String lowered = input.toLowerCase(Locale.ROOT);
        String cleaned = NON_ALNUM.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    /**
     * @return the words of the normalised text, in order
     */
    public static List<String> tokenize(String input) {
        String normalized = normalize(input);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }

    /**
     * @return the distinct words of the normalised text
     */
    public static Set<String> wordSet(String input) {
        return new LinkedHashSet<>(tokenize(input));
    }
}
