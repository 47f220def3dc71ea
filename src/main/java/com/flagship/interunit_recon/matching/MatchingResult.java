package com.flagship.interunit_recon.matching;

import com.flagship.interunit_recon.transaction.TransactionRecord;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one matching run. All lists keep input order.
 */
@Value
public class MatchingResult {
    List<MatchCandidate> matches;
    List<TransactionRecord> unmatchedLenders;
    List<TransactionRecord> unmatchedBorrowers;
    /**
     * Records with no usable amount, or a positive debit and credit at once.
     */
    List<TransactionRecord> excluded;

    public static MatchingResult empty() {
        return new MatchingResult(List.of(), List.of(), List.of(), List.of());
    }

    public Map<MatchType, Integer> countsByType() {
        Map<MatchType, Integer> counts = new EnumMap<>(MatchType.class);
        matches.forEach(match -> counts.merge(match.getMatchType(), 1, Integer::sum));
        return counts;
    }
}
