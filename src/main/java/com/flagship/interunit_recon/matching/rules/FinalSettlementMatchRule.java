package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.FinalSettlementExtractor;
import com.flagship.interunit_recon.matching.extract.PersonReference;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Both legs settle the final dues of the same named employee.
 */
public class FinalSettlementMatchRule implements MatchRule {

    private final FinalSettlementExtractor extractor;

    public FinalSettlementMatchRule() {
        this(new FinalSettlementExtractor());
    }

    public FinalSettlementMatchRule(FinalSettlementExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "final_settlement";
    }

    @Override
    public MatchType matchType() {
        return MatchType.FINAL_SETTLEMENT;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        Optional<PersonReference> lenderPerson = extractor.extract(lender.narration());
        if (lenderPerson.isEmpty()) {
            return Optional.empty();
        }
        Optional<PersonReference> borrowerPerson = extractor.extract(borrower.narration());
        if (borrowerPerson.isEmpty() || !lenderPerson.get().getName().equals(borrowerPerson.get().getName())) {
            return Optional.empty();
        }
        return Optional.of(AuditTrail.builder()
            .put("match_reason", "Final settlement match")
            .put("person", lenderPerson.get().combined())
            .put("lender_person", lenderPerson.get().combined())
            .put("borrower_person", borrowerPerson.get().combined())
            .put("person_name", lenderPerson.get().getName())
            .put("person_id", lenderPerson.get().getId())
            .build());
    }
}
