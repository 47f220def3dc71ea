package com.flagship.interunit_recon.matching;

/**
 * Coarse evidence category of a match, stored with both legs for filtering and reporting.
 */
public enum MatchMethod {
    REFERENCE_MATCH("reference_match"),
    CROSS_REFERENCE("cross_reference"),
    SIMILARITY_MATCH("similarity_match"),
    FALLBACK_MATCH("fallback_match");

    private final String tag;

    MatchMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
