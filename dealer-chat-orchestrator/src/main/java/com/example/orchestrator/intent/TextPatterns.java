package com.example.orchestrator.intent;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the classifier and the command parser.
 */
public final class TextPatterns {

    private static final Pattern NOISE = Pattern.compile("[^\\p{L}\\p{N}/\\-\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextPatterns() {
    }

    /** Lower-cases, drops punctuation other than {@code /} and {@code -}, collapses whitespace. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = NOISE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }

    /** Whole-word phrase containment on normalized text. */
    public static boolean containsPhrase(String normalized, String phrase) {
        return (" " + normalized + " ").contains(" " + phrase + " ");
    }

    public static boolean containsAnyPhrase(String normalized, Collection<String> phrases) {
        for (String phrase : phrases) {
            if (containsPhrase(normalized, phrase)) {
                return true;
            }
        }
        return false;
    }

    /** Every word of the phrase occurs in the message, in any order. */
    public static boolean containsAllWords(Set<String> tokens, String phrase) {
        return tokens.containsAll(Arrays.asList(phrase.split(" ")));
    }

    /** First token without a leading slash, or an empty string. */
    public static String commandWord(List<String> tokens) {
        if (tokens.isEmpty()) {
            return "";
        }
        String first = tokens.get(0);
        return first.startsWith("/") ? first.substring(1) : first;
    }
}
