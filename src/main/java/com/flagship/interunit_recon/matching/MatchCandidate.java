package com.flagship.interunit_recon.matching;

import com.flagship.interunit_recon.transaction.MatchStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One lender/borrower pairing produced by a matching run.
 *
 * Key invariants:
 * - the lender debit equals the borrower credit, and both equal {@code amount}
 * - created once per run and never modified
 */
@Value
@Builder
public class MatchCandidate {
    String lenderUid;
    String borrowerUid;
    MatchType matchType;
    BigDecimal amount;
    AuditTrail auditTrail;
    /**
     * Name of the rule that fired; two rules share the LOAN_ID type.
     */
    String rule;

    public MatchMethod getMatchMethod() {
        return matchType.getMethod();
    }

    public boolean isAutoAccepted() {
        return matchType.isAutoAccepted();
    }

    public MatchStatus getInitialStatus() {
        return matchType.initialStatus();
    }
}
