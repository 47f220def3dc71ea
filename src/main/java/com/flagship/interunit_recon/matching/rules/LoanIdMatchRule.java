package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.LoanIdExtractor;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Both legs quote the same loan id token.
 */
public class LoanIdMatchRule implements MatchRule {

    private final LoanIdExtractor extractor = new LoanIdExtractor();

    @Override
    public String name() {
        return "loan_id";
    }

    @Override
    public MatchType matchType() {
        return MatchType.LOAN_ID;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        Optional<String> lenderLoanId = extractor.extract(lender.narration());
        if (lenderLoanId.isEmpty()) {
            return Optional.empty();
        }
        return extractor.extract(borrower.narration())
            .filter(lenderLoanId.get()::equals)
            .map(loanId -> AuditTrail.builder()
                .put("loan_id", loanId)
                .build());
    }
}
