package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.LcExtractor;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Both legs quote the same letter of credit once {@code L/C} and {@code LC} are unified.
 */
public class LcMatchRule implements MatchRule {

    private final LcExtractor extractor = new LcExtractor();

    @Override
    public String name() {
        return "lc";
    }

    @Override
    public MatchType matchType() {
        return MatchType.LC;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        Optional<String> lenderLc = extractor.extract(lender.narration());
        Optional<String> borrowerLc = extractor.extract(borrower.narration());
        if (lenderLc.isEmpty() || borrowerLc.isEmpty()) {
            return Optional.empty();
        }
        String normalized = LcExtractor.normalize(lenderLc.get());
        if (!normalized.equals(LcExtractor.normalize(borrowerLc.get()))) {
            return Optional.empty();
        }
        return Optional.of(AuditTrail.builder()
            .put("lc", lenderLc.get())
            .put("borrower_lc", borrowerLc.get())
            .put("normalized_lc", normalized)
            .build());
    }
}
