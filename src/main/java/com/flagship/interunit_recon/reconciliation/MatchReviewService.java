package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.observability.CorrelationContext;
import com.flagship.interunit_recon.observability.ReconciliationMetrics;
import com.flagship.interunit_recon.reconciliation.exception.TransactionNotFoundException;
import com.flagship.interunit_recon.transaction.LedgerLeg;
import com.flagship.interunit_recon.transaction.MatchStatus;
import com.flagship.interunit_recon.transaction.MatchedLeg;
import com.flagship.interunit_recon.transaction.ReconciliationScope;
import com.flagship.interunit_recon.transaction.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Human review of stored matches.
 *
 * Every decision is applied to both legs in one transaction, guarded on the legs still
 * pointing at each other. Either leg's uid identifies the match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchReviewService {

    private final TransactionRepository repository;
    private final ReconciliationMetrics metrics;

    /**
     * Confirms a match. Accepting an already confirmed match is a no-op.
     *
     * @throws TransactionNotFoundException if no leg has this uid
     * @throws IllegalStateException if the leg is not matched
     */
    @Transactional
    public ReviewOutcome accept(String uid, String reviewedBy) {
        MDC.put(CorrelationContext.UID_MDC_KEY, uid);
        try {
            LedgerLeg leg = requireMatchedLeg(uid);
            String counterpart = leg.getMatchedWith();

            if (leg.getStatus() == MatchStatus.CONFIRMED) {
                log.info("Match already confirmed: counterpart={}", counterpart);
                return new ReviewOutcome(uid, counterpart, MatchStatus.CONFIRMED);
            }

            int updated = repository.updateStatus(uid, counterpart, MatchStatus.CONFIRMED)
                + repository.updateStatus(counterpart, uid, MatchStatus.CONFIRMED);
            requireBothLegs(updated, uid, counterpart);

            metrics.recordReview("accepted");
            log.info("Match accepted: counterpart={}, previousStatus={}, reviewedBy={}",
                counterpart, leg.getStatus().dbValue(), reviewedBy);
            return new ReviewOutcome(uid, counterpart, MatchStatus.CONFIRMED);
        } finally {
            MDC.remove(CorrelationContext.UID_MDC_KEY);
        }
    }

    /**
     * Breaks a match up. Both legs go back to unmatched and can be paired again by a later run.
     *
     * @throws TransactionNotFoundException if no leg has this uid
     * @throws IllegalStateException if the leg is not matched
     */
    @Transactional
    public ReviewOutcome reject(String uid, String reviewedBy) {
        MDC.put(CorrelationContext.UID_MDC_KEY, uid);
        try {
            LedgerLeg leg = requireMatchedLeg(uid);
            String counterpart = leg.getMatchedWith();

            int updated = repository.clearMatch(uid, counterpart) + repository.clearMatch(counterpart, uid);
            requireBothLegs(updated, uid, counterpart);

            metrics.recordReview("rejected");
            log.info("Match rejected: counterpart={}, previousStatus={}, reviewedBy={}",
                counterpart, leg.getStatus().dbValue(), reviewedBy);
            return new ReviewOutcome(uid, counterpart, MatchStatus.UNMATCHED);
        } finally {
            MDC.remove(CorrelationContext.UID_MDC_KEY);
        }
    }

    /**
     * Clears every match in the scope.
     *
     * @return number of legs returned to unmatched
     */
    @Transactional
    public int reset(ReconciliationScope scope) {
        int legs = repository.resetMatches(scope);
        metrics.recordReview("reset", legs);
        log.info("Matches reset: scope={}, legs={}", scope.describe(), legs);
        return legs;
    }

    /**
     * @throws IllegalArgumentException if the status is not a matched state
     */
    public List<MatchedLeg> listMatches(MatchStatus status) {
        if (!status.isMatched()) {
            throw new IllegalArgumentException("Not a matched status: " + status.dbValue());
        }
        return repository.findMatchedLegs(status);
    }

    private LedgerLeg requireMatchedLeg(String uid) {
        LedgerLeg leg = repository.findByUid(uid)
            .orElseThrow(() -> new TransactionNotFoundException(uid));
        if (!leg.getStatus().isMatched() || leg.getMatchedWith() == null) {
            throw new IllegalStateException("Transaction is not matched: " + uid);
        }
        return leg;
    }

    private static void requireBothLegs(int updated, String uid, String counterpart) {
        if (updated != 2) {
            throw new IllegalStateException(String.format(
                "Match legs out of sync: uid=%s, counterpart=%s, legsUpdated=%d", uid, counterpart, updated));
        }
    }
}
