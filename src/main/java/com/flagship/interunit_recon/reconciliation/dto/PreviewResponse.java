package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.matching.MatchingResult;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PreviewResponse {

    @JsonProperty("matches")
    List<MatchResponse> matches;

    @JsonProperty("unmatched_lender_uids")
    List<String> unmatchedLenderUids;

    @JsonProperty("unmatched_borrower_uids")
    List<String> unmatchedBorrowerUids;

    @JsonProperty("excluded_uids")
    List<String> excludedUids;

    public static PreviewResponse from(MatchingResult result) {
        return PreviewResponse.builder()
            .matches(result.getMatches().stream().map(MatchResponse::from).toList())
            .unmatchedLenderUids(uids(result.getUnmatchedLenders()))
            .unmatchedBorrowerUids(uids(result.getUnmatchedBorrowers()))
            .excludedUids(uids(result.getExcluded()))
            .build();
    }

    private static List<String> uids(List<TransactionRecord> records) {
        return records.stream().map(TransactionRecord::getUid).toList();
    }
}
