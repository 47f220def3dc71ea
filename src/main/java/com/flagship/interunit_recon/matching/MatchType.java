package com.flagship.interunit_recon.matching;

import com.flagship.interunit_recon.transaction.MatchStatus;

/**
 * Classification of a lender/borrower pairing by the evidence that produced it.
 *
 * Reference and cross-reference types are confident enough to be confirmed
 * automatically. Similarity types wait for a reviewer, and manual verification
 * matches are always parked as pending verification.
 */
public enum MatchType {
    PO(MatchMethod.REFERENCE_MATCH, true),
    LC(MatchMethod.REFERENCE_MATCH, true),
    LOAN_ID(MatchMethod.REFERENCE_MATCH, true),
    FINAL_SETTLEMENT(MatchMethod.REFERENCE_MATCH, true),
    INTERUNIT_LOAN(MatchMethod.CROSS_REFERENCE, true),
    SALARY(MatchMethod.SIMILARITY_MATCH, false),
    COMMON_TEXT(MatchMethod.SIMILARITY_MATCH, false),
    MANUAL_VERIFICATION(MatchMethod.FALLBACK_MATCH, false);

    private final MatchMethod method;
    private final boolean autoAccepted;

    MatchType(MatchMethod method, boolean autoAccepted) {
        this.method = method;
        this.autoAccepted = autoAccepted;
    }

    public MatchMethod getMethod() {
        return method;
    }

    public boolean isAutoAccepted() {
        return autoAccepted;
    }

    /**
     * Status both legs receive when the match is first recorded.
     */
    public MatchStatus initialStatus() {
        if (this == MANUAL_VERIFICATION) {
            return MatchStatus.PENDING_VERIFICATION;
        }
        return autoAccepted ? MatchStatus.CONFIRMED : MatchStatus.MATCHED;
    }
}
