package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.LoanIdExtractor;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Principal and interest repayments of a time loan naming the same loan after the repayment phrase.
 */
public class TimeLoanIdMatchRule implements MatchRule {

    private final LoanIdExtractor extractor = new LoanIdExtractor();

    @Override
    public String name() {
        return "time_loan_id";
    }

    @Override
    public MatchType matchType() {
        return MatchType.LOAN_ID;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        if (!extractor.hasTimeLoanPhrase(lender.narration()) || !extractor.hasTimeLoanPhrase(borrower.narration())) {
            return Optional.empty();
        }
        Optional<String> lenderLoanId = extractor.extractAfterTimeLoanPhrase(lender.narration());
        if (lenderLoanId.isEmpty()) {
            return Optional.empty();
        }
        return extractor.extractAfterTimeLoanPhrase(borrower.narration())
            .filter(lenderLoanId.get()::equals)
            .map(loanId -> AuditTrail.builder()
                .put("loan_id", loanId)
                .put("match_reason", "Time Loan phrase + matching Loan ID after phrase")
                .put("phrase_detected", true)
                .build());
    }
}
