package com.flagship.interunit_recon.matching.extract;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex helpers shared by the narration extractors.
 *
 * A failure while matching is logged and reported as "no match" so that one odd
 * narration never aborts a reconciliation run.
 */
@Slf4j
final class PatternSupport {

    private PatternSupport() {
    }

    /**
     * Applies {@code mapper} to the first match of {@code pattern} in {@code text}.
     */
    static <T> Optional<T> findFirst(String extractor, Pattern pattern, String text,
                                     Function<Matcher, T> mapper) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        try {
            Matcher matcher = pattern.matcher(text);
            return matcher.find() ? Optional.ofNullable(mapper.apply(matcher)) : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Pattern evaluation failed, treating as no match: extractor={}, pattern={}, error={}",
                extractor, pattern.pattern(), e.toString());
            return Optional.empty();
        }
    }

    static Optional<String> findGroup(String extractor, Pattern pattern, String text) {
        return findFirst(extractor, pattern, text, Matcher::group);
    }

    static boolean contains(String extractor, Pattern pattern, String text) {
        return findFirst(extractor, pattern, text, matcher -> Boolean.TRUE).isPresent();
    }
}
