package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.PoExtractor;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Both legs quote the same purchase order number.
 */
public class PoMatchRule implements MatchRule {

    private final PoExtractor extractor = new PoExtractor();

    @Override
    public String name() {
        return "po";
    }

    @Override
    public MatchType matchType() {
        return MatchType.PO;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        Optional<String> lenderPo = extractor.extract(lender.narration());
        if (lenderPo.isEmpty()) {
            return Optional.empty();
        }
        return extractor.extract(borrower.narration())
            .filter(lenderPo.get()::equals)
            .map(po -> AuditTrail.builder()
                .put("po", po)
                .put("match_reason", "Identical purchase order reference")
                .build());
    }
}
