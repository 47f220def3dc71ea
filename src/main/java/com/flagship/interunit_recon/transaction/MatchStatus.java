package com.flagship.interunit_recon.transaction;

import java.util.Arrays;

/**
 * Persisted match lifecycle of a ledger leg.
 *
 * Transitions:
 * - UNMATCHED → MATCHED / CONFIRMED / PENDING_VERIFICATION (engine run)
 * - MATCHED / PENDING_VERIFICATION → CONFIRMED (accept)
 * - any matched state → UNMATCHED (reject or reset)
 *
 * Both legs of a match always carry the same status.
 */
public enum MatchStatus {
    UNMATCHED("unmatched"),
    MATCHED("matched"),
    CONFIRMED("confirmed"),
    PENDING_VERIFICATION("pending_verification");

    private final String dbValue;

    MatchStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isMatched() {
        return this == MATCHED || this == CONFIRMED || this == PENDING_VERIFICATION;
    }

    /**
     * Resolves a stored or user supplied value. A missing value means the leg was never matched.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static MatchStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return UNMATCHED;
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown match status: " + value));
    }
}
