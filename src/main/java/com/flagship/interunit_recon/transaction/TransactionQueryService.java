package com.flagship.interunit_recon.transaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the ledger table: what is still waiting to be reconciled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionQueryService {

    private final TransactionRepository repository;

    /**
     * Unmatched legs of the scope, in the order a run would consider them. Legs that can
     * never match (no single positive amount) are included.
     */
    public List<TransactionRecord> listUnmatched(ReconciliationScope scope) {
        List<TransactionRecord> legs = repository.findUnmatched(scope);
        log.debug("Listed unmatched legs: scope={}, count={}", scope.describe(), legs.size());
        return legs;
    }

    public List<CompanyPair> unreconciledCompanyPairs() {
        List<CompanyPair> pairs = repository.findUnreconciledCompanyPairs();
        log.debug("Detected unreconciled company pairs: count={}", pairs.size());
        return pairs;
    }
}
