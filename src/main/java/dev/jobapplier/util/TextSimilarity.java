package dev.jobapplier.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalization and token-overlap scoring shared by field matching, question matching and the
 * learned answer store.
 */
public final class TextSimilarity {

    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSimilarity() {
    }

    /**
     * Lowercases, strips punctuation and collapses whitespace.
     * Apostrophes are dropped ("it's" becomes "its"); any other punctuation, including the underscores and
     * hyphens of attribute names, becomes a word break.
     *
     * @param text raw text, may be null
     * @return normalized text, never null
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String noApostrophes = APOSTROPHES.matcher(lower).replaceAll("");
        String spaced = NON_WORD.matcher(noApostrophes).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /**
     * Token set of the normalized text.
     */
    public static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }

    /**
     * Jaccard similarity of the two token sets: |A n B| / |A u B|.
     * Returns 0.0 when either side has no tokens.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    /**
     * True when both texts normalize to the same non-empty string.
     */
    public static boolean sameNormalized(String a, String b) {
        String left = normalize(a);
        return !left.isEmpty() && left.equals(normalize(b));
    }

    /**
     * Keyword test used by heuristics: single words must appear as a token, phrases as a substring of the
     * normalized text, so "cv" does not match "cvv".
     */
    public static boolean containsKeyword(String text, String keyword) {
        String normalizedKeyword = normalize(keyword);
        if (normalizedKeyword.isEmpty()) {
            return false;
        }
        if (normalizedKeyword.indexOf(' ') >= 0) {
            return (" " + normalize(text) + " ").contains(" " + normalizedKeyword + " ");
        }
        return tokens(text).contains(normalizedKeyword);
    }
}
