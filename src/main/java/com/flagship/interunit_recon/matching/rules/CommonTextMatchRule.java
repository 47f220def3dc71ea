package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.CommonText;
import com.flagship.interunit_recon.matching.extract.CommonTextExtractor;
import com.flagship.interunit_recon.matching.similarity.JaccardSimilarity;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * Last resort: both narrations share a long verbatim passage.
 */
public class CommonTextMatchRule implements MatchRule {

    private final CommonTextExtractor extractor;

    public CommonTextMatchRule(CommonTextExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "common_text";
    }

    @Override
    public MatchType matchType() {
        return MatchType.COMMON_TEXT;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        Optional<CommonText> common = extractor.extract(lender.narration(), borrower.narration());
        if (common.isEmpty()) {
            return Optional.empty();
        }
        double score = JaccardSimilarity.similarity(lender.narration(), borrower.narration());
        return Optional.of(AuditTrail.builder()
            .put("matched_phrase", common.get().summary())
            .put("word_count", common.get().longest().getWordCount())
            .put("jaccard_score", JaccardSimilarity.rounded(score))
            .build());
    }
}
