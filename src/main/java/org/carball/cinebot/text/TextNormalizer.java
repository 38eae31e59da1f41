package org.carball.cinebot.text;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalization and tokenization shared by the catalog lookups and the fuzzy scorer.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    private static final Set<String> STOP_WORDS = Set.of(
            // English
            "a", "an", "the", "of", "and", "or", "in", "on", "at", "to", "for", "with", "by",
            "from", "is", "are", "was", "it", "its", "as", "into", "his", "her", "their",
            // Russian
            "и", "в", "во", "на", "с", "со", "о", "об", "по", "к", "у", "из", "за", "не", "а", "но", "что", "это"
    );

    private TextNormalizer() {
    }

    /**
     * Lowercases, trims and collapses internal whitespace. Null becomes the empty string.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Whitespace-split lowercase tokens with edge punctuation and stop words removed.
     */
    public static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(WHITESPACE.split(normalized))
                .map(token -> EDGE_PUNCTUATION.matcher(token).replaceAll(""))
                .filter(token -> !token.isEmpty())
                .filter(token -> !STOP_WORDS.contains(token))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Classic dynamic-programming edit distance with two rolling rows.
     */
    public static int levenshtein(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int insert = current[j - 1] + 1;
                int delete = previous[j] + 1;
                int replace = previous[j - 1] + (ca == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(Math.min(insert, delete), replace);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
