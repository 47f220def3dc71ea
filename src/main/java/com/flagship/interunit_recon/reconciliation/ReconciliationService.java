package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.matching.MatchingEngine;
import com.flagship.interunit_recon.matching.MatchingResult;
import com.flagship.interunit_recon.observability.CorrelationContext;
import com.flagship.interunit_recon.observability.ReconciliationMetrics;
import com.flagship.interunit_recon.transaction.ReconciliationScope;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import com.flagship.interunit_recon.transaction.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Runs the matching engine over stored ledger legs.
 *
 * A run:
 * 1. Loads the unmatched legs of the scope in a stable order
 * 2. Matches them in memory
 * 3. Stores every match on both legs in the same transaction
 *
 * The engine never sees legs that are already matched, so re-running a scope only
 * pairs what is left over.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final TransactionRepository repository;
    private final MatchingEngine matchingEngine;
    private final MatchPersistenceService persistenceService;
    private final ReconciliationMetrics metrics;

    @Transactional
    public ReconciliationSummary reconcile(ReconciliationScope scope) {
        long startTime = System.currentTimeMillis();
        String runId = UUID.randomUUID().toString();
        MDC.put(CorrelationContext.RUN_ID_MDC_KEY, runId);

        log.info("Starting reconciliation run: scope={}", scope.describe());

        try {
            List<TransactionRecord> legs = repository.findUnmatched(scope);
            MatchingResult result = matchingEngine.match(legs);
            persistenceService.persist(result.getMatches());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordResult(result);
            metrics.recordRun("success", duration);

            ReconciliationSummary summary = ReconciliationSummary.of(runId, scope.describe(), legs.size(), result, duration);
            log.info("Reconciliation run completed: legs={}, matches={}, byType={}, unmatchedLenders={}, unmatchedBorrowers={}, duration={}ms",
                legs.size(), summary.getMatches(), summary.getMatchesByType(),
                summary.getUnmatchedLenders(), summary.getUnmatchedBorrowers(), duration);
            return summary;

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRun("error", duration);
            log.error("Reconciliation run failed: scope={}, error={}, duration={}ms", scope.describe(), e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.RUN_ID_MDC_KEY);
        }
    }

    @Transactional
    public ReconciliationSummary reconcilePair(String pairId) {
        return reconcile(ReconciliationScope.forPair(pairId));
    }

    /**
     * Matches the given records without touching the database.
     */
    public MatchingResult preview(List<TransactionRecord> records) {
        MatchingResult result = matchingEngine.match(records);
        log.info("Preview run: records={}, matches={}", records.size(), result.getMatches().size());
        return result;
    }
}
