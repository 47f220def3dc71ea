package com.flagship.interunit_recon.matching.extract;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds long runs of text (insurance certificates, vehicle details, ...) copied
 * verbatim into both narrations.
 *
 * A phrase is a window of {@code minWords..maxWords} tokens joined by single spaces
 * and at least {@code minChars} characters long. Tokens are word runs and single
 * punctuation marks of the lower-cased narration.
 */
@Slf4j
public class CommonTextExtractor {

    private static final Pattern TOKEN = Pattern.compile("\\w+|[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final double OVERLAP_RATIO_LIMIT = 0.7;
    private static final int MAX_PHRASES = 2;

    private final int minWords;
    private final int maxWords;
    private final int minChars;

    public CommonTextExtractor(int minWords, int maxWords, int minChars) {
        if (minWords < 1 || maxWords < minWords) {
            throw new IllegalArgumentException(
                String.format("Invalid phrase window: minWords=%d, maxWords=%d", minWords, maxWords));
        }
        this.minWords = minWords;
        this.maxWords = maxWords;
        this.minChars = minChars;
    }

    public Optional<CommonText> extract(String first, String second) {
        if (first == null || first.isBlank() || second == null || second.isBlank()) {
            return Optional.empty();
        }
        Set<String> common = phrases(first);
        common.retainAll(phrases(second));
        if (common.isEmpty()) {
            return Optional.empty();
        }

        List<String> ordered = new ArrayList<>(common);
        ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));

        List<String> selected = new ArrayList<>();
        for (String phrase : ordered) {
            if (selected.stream().noneMatch(kept -> overlaps(phrase, kept))) {
                selected.add(phrase);
                if (selected.size() >= MAX_PHRASES) {
                    break;
                }
            }
        }
        List<CommonText.Phrase> result = selected.stream()
            .map(phrase -> new CommonText.Phrase(phrase, phrase.split(" ").length))
            .toList();
        return Optional.of(new CommonText(result));
    }

    /**
     * All qualifying phrases of one narration.
     */
    public Set<String> phrases(String narration) {
        List<String> tokens = tokenize(narration);
        Set<String> phrases = new HashSet<>();
        for (int start = 0; start + minWords <= tokens.size(); start++) {
            int longest = Math.min(maxWords, tokens.size() - start);
            for (int length = minWords; length <= longest; length++) {
                String phrase = String.join(" ", tokens.subList(start, start + length));
                if (phrase.length() >= minChars) {
                    phrases.add(phrase);
                }
            }
        }
        return phrases;
    }

    private List<String> tokenize(String narration) {
        List<String> tokens = new ArrayList<>();
        try {
            Matcher matcher = TOKEN.matcher(narration.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                tokens.add(matcher.group());
            }
        } catch (RuntimeException e) {
            log.warn("Tokenizing narration failed, treating as no phrases: error={}", e.toString());
            return List.of();
        }
        return tokens;
    }

    private static boolean overlaps(String phrase, String kept) {
        if (kept.contains(phrase) || phrase.contains(kept)) {
            return true;
        }
        Set<String> words = new HashSet<>(Arrays.asList(phrase.split(" ")));
        Set<String> keptWords = new HashSet<>(Arrays.asList(kept.split(" ")));
        int largest = Math.max(words.size(), keptWords.size());
        words.retainAll(keptWords);
        return (double) words.size() / largest > OVERLAP_RATIO_LIMIT;
    }
}
