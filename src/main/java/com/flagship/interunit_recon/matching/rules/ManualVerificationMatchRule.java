package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Same amount entered by the same operator on both sides. Weak evidence, always reviewed.
 */
public class ManualVerificationMatchRule implements MatchRule {

    @Override
    public String name() {
        return "manual_verification";
    }

    @Override
    public MatchType matchType() {
        return MatchType.MANUAL_VERIFICATION;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        String enteredBy = lender.getEnteredBy();
        if (enteredBy == null || enteredBy.isBlank() || !enteredBy.equals(borrower.getEnteredBy())) {
            return Optional.empty();
        }
        return Optional.of(AuditTrail.builder()
            .put("entered_by", enteredBy)
            .put("match_reason", "Exact match on debit, credit, and entered_by fields")
            .put("requires_verification", true)
            .build());
    }
}
