package com.flagship.interunit_recon.matching.similarity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Jaccard similarity of two narrations' token sets.
 *
 * Tokens are lower-cased word runs in any script, longer than two characters, that are
 * not stop words.
 * The score is symmetric, lies in [0, 1], and is 1.0 for identical narrations with at
 * least one qualifying token.
 */
public final class JaccardSimilarity {

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");

    private JaccardSimilarity() {
    }

    public static double similarity(String first, String second) {
        if (first == null || first.isBlank() || second == null || second.isBlank()) {
            return 0.0;
        }
        Set<String> firstTokens = tokens(first);
        Set<String> secondTokens = tokens(second);

        Set<String> union = new HashSet<>(firstTokens);
        union.addAll(secondTokens);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(firstTokens);
        intersection.retainAll(secondTokens);
        return (double) intersection.size() / union.size();
    }

    public static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    /**
     * Score rounded to three decimals for audit display.
     */
    public static double rounded(double score) {
        return BigDecimal.valueOf(score).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
