package com.flagship.interunit_recon.matching.extract;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Purchase order references such as {@code ABC/PO/123/456}.
 * Tokens are returned upper-cased and compared by exact equality.
 */
public class PoExtractor {

    private static final Pattern PO_PATTERN = Pattern.compile("\\b[A-Z]{2,4}/PO/\\d+/\\d+\\b");

    public Optional<String> extract(String narration) {
        if (narration == null) {
            return Optional.empty();
        }
        return PatternSupport.findGroup("po", PO_PATTERN, narration.toUpperCase(Locale.ROOT));
    }
}
