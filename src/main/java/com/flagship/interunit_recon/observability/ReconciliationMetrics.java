package com.flagship.interunit_recon.observability;

import com.flagship.interunit_recon.matching.MatchCandidate;
import com.flagship.interunit_recon.matching.MatchingResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for reconciliation runs and match reviews.
 *
 * Metrics exposed:
 * - reconciliation.runs{status}: runs by outcome (success, error)
 * - reconciliation.matches{match_type, match_method}: persisted matches
 * - reconciliation.unmatched{role}: legs left unmatched by a run
 * - reconciliation.duration: run latency
 * - reconciliation.reviews{decision}: accepted, rejected and reset matches
 */
@Component
public class ReconciliationMetrics {

    private final MeterRegistry registry;
    private final Timer runTimer;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.runTimer = Timer.builder("reconciliation.duration")
                .description("Time taken by a reconciliation run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordRun(String status, long durationMs) {
        registry.counter("reconciliation.runs", "status", sanitizeTag(status)).increment();
        runTimer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Records the matches and leftovers of a persisted run.
     */
    public void recordResult(MatchingResult result) {
        for (MatchCandidate match : result.getMatches()) {
            registry.counter("reconciliation.matches",
                    "match_type", sanitizeTag(match.getMatchType().name()),
                    "match_method", sanitizeTag(match.getMatchMethod().tag())
            ).increment();
        }
        registry.counter("reconciliation.unmatched", "role", "lender")
                .increment(result.getUnmatchedLenders().size());
        registry.counter("reconciliation.unmatched", "role", "borrower")
                .increment(result.getUnmatchedBorrowers().size());
    }

    public void recordReview(String decision) {
        registry.counter("reconciliation.reviews", "decision", sanitizeTag(decision)).increment();
    }

    public void recordReview(String decision, int count) {
        registry.counter("reconciliation.reviews", "decision", sanitizeTag(decision)).increment(count);
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
