package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.reconciliation.ReconciliationSummary;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ReconcileResponse {

    @JsonProperty("run_id")
    String runId;

    @JsonProperty("scope")
    String scope;

    @JsonProperty("legs_considered")
    int legsConsidered;

    @JsonProperty("matches")
    int matches;

    @JsonProperty("confirmed")
    int confirmed;

    @JsonProperty("pending_verification")
    int pendingVerification;

    @JsonProperty("matches_by_type")
    Map<MatchType, Integer> matchesByType;

    @JsonProperty("unmatched_lenders")
    int unmatchedLenders;

    @JsonProperty("unmatched_borrowers")
    int unmatchedBorrowers;

    @JsonProperty("excluded")
    int excluded;

    @JsonProperty("duration_ms")
    long durationMs;

    public static ReconcileResponse from(ReconciliationSummary summary) {
        return ReconcileResponse.builder()
            .runId(summary.getRunId())
            .scope(summary.getScope())
            .legsConsidered(summary.getLegsConsidered())
            .matches(summary.getMatches())
            .confirmed(summary.getConfirmed())
            .pendingVerification(summary.getPendingVerification())
            .matchesByType(summary.getMatchesByType())
            .unmatchedLenders(summary.getUnmatchedLenders())
            .unmatchedBorrowers(summary.getUnmatchedBorrowers())
            .excluded(summary.getExcluded())
            .durationMs(summary.getDurationMs())
            .build();
    }
}
