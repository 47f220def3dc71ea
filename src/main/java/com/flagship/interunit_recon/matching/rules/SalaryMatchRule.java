package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.SalaryDetails;
import com.flagship.interunit_recon.matching.extract.SalaryExtractor;
import com.flagship.interunit_recon.matching.similarity.JaccardSimilarity;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Both legs describe a salary payment, and either the same person and period are named
 * on both sides or the narrations are similar enough.
 *
 * An absent person or period on both sides counts as equal.
 */
public class SalaryMatchRule implements MatchRule {

    private final SalaryExtractor extractor;
    private final double jaccardThreshold;

    public SalaryMatchRule(double jaccardThreshold) {
        this(new SalaryExtractor(), jaccardThreshold);
    }

    public SalaryMatchRule(SalaryExtractor extractor, double jaccardThreshold) {
        this.extractor = extractor;
        this.jaccardThreshold = jaccardThreshold;
    }

    @Override
    public String name() {
        return "salary";
    }

    @Override
    public MatchType matchType() {
        return MatchType.SALARY;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        Optional<SalaryDetails> lenderSalary = extractor.extract(lender.narration());
        if (lenderSalary.isEmpty()) {
            return Optional.empty();
        }
        Optional<SalaryDetails> borrowerSalary = extractor.extract(borrower.narration());
        if (borrowerSalary.isEmpty()) {
            return Optional.empty();
        }
        SalaryDetails lenderDetails = lenderSalary.get();
        SalaryDetails borrowerDetails = borrowerSalary.get();

        boolean exact = lenderDetails.isSalary() && borrowerDetails.isSalary()
            && Objects.equals(lenderDetails.getPersonName(), borrowerDetails.getPersonName())
            && Objects.equals(lenderDetails.getPeriod(), borrowerDetails.getPeriod());
        double score = JaccardSimilarity.similarity(lender.narration(), borrower.narration());
        if (!exact && score < jaccardThreshold) {
            return Optional.empty();
        }
        return Optional.of(AuditTrail.builder()
            .put("match_method", exact ? "exact" : "jaccard")
            .put("jaccard_score", JaccardSimilarity.rounded(score))
            .put("person", lenderDetails.personLabel())
            .put("period", lenderDetails.getPeriod())
            .put("lender_keywords", String.join(", ", lenderDetails.getMatchedKeywords()))
            .put("borrower_keywords", String.join(", ", borrowerDetails.getMatchedKeywords()))
            .build());
    }
}
