package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.matching.MatchCandidate;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.MatchingResult;
import com.flagship.interunit_recon.transaction.MatchStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counts reported for one persisted reconciliation run.
 */
@Value
@Builder
public class ReconciliationSummary {
    String runId;
    String scope;
    int legsConsidered;
    int matches;
    int confirmed;
    int pendingVerification;
    Map<MatchType, Integer> matchesByType;
    int unmatchedLenders;
    int unmatchedBorrowers;
    int excluded;
    long durationMs;

    public static ReconciliationSummary of(String runId, String scope, int legsConsidered,
                                           MatchingResult result, long durationMs) {
        return ReconciliationSummary.builder()
            .runId(runId)
            .scope(scope)
            .legsConsidered(legsConsidered)
            .matches(result.getMatches().size())
            .confirmed(countWithStatus(result, MatchStatus.CONFIRMED))
            .pendingVerification(countWithStatus(result, MatchStatus.PENDING_VERIFICATION))
            .matchesByType(result.countsByType())
            .unmatchedLenders(result.getUnmatchedLenders().size())
            .unmatchedBorrowers(result.getUnmatchedBorrowers().size())
            .excluded(result.getExcluded().size())
            .durationMs(durationMs)
            .build();
    }

    private static int countWithStatus(MatchingResult result, MatchStatus status) {
        return (int) result.getMatches().stream()
            .map(MatchCandidate::getInitialStatus)
            .filter(status::equals)
            .count();
    }
}
