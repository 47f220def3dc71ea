package com.flagship.interunit_recon.matching.extract;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Letter of credit references: {@code L/C-123/456}, {@code LC 123}, {@code LC-123/456}.
 */
public class LcExtractor {

    private static final Pattern LC_PATTERN = Pattern.compile("\\b(?:L/C|LC)[-\\s]?\\d+[/\\s]?\\d*\\b");

    /**
     * LC token as it appears in the upper-cased narration, without surrounding whitespace.
     */
    public Optional<String> extract(String narration) {
        if (narration == null) {
            return Optional.empty();
        }
        return PatternSupport.findGroup("lc", LC_PATTERN, narration.toUpperCase(Locale.ROOT))
            .map(String::trim);
    }

    /**
     * Comparable form of an LC token: {@code L/C-123/456} and {@code LC-123/456} both become {@code LC-123/456}.
     */
    public static String normalize(String lcNumber) {
        if (lcNumber == null) {
            return "";
        }
        return lcNumber.trim().toUpperCase(Locale.ROOT).replace("L/C", "LC");
    }
}
