package com.flagship.interunit_recon.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.transaction.IngestionResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestResponse {

    @JsonProperty("received")
    int received;

    @JsonProperty("stored")
    int stored;

    @JsonProperty("duplicate_uids")
    List<String> duplicateUids;

    @JsonProperty("not_matchable_uids")
    List<String> notMatchableUids;

    public static IngestResponse from(IngestionResult result) {
        return IngestResponse.builder()
            .received(result.getReceived())
            .stored(result.getStored())
            .duplicateUids(result.getDuplicateUids())
            .notMatchableUids(result.getNotMatchableUids())
            .build();
    }
}
