package com.flagship.interunit_recon.matching;

import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.Optional;

/**
 * One step of the matching rule chain.
 *
 * A rule looks at a lender leg and a borrower leg whose amounts are already known to be
 * equal and either fires, returning the evidence it relied on, or stays silent.
 * Rules are stateless and pure.
 */
public interface MatchRule {

    /**
     * Stable identifier, recorded on every match the rule produces.
     */
    String name();

    MatchType matchType();

    Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower);
}
