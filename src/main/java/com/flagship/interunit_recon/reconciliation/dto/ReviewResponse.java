package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.reconciliation.ReviewOutcome;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReviewResponse {

    @JsonProperty("uid")
    String uid;

    @JsonProperty("counterpart_uid")
    String counterpartUid;

    @JsonProperty("status")
    String status;

    public static ReviewResponse from(ReviewOutcome outcome) {
        return ReviewResponse.builder()
            .uid(outcome.getUid())
            .counterpartUid(outcome.getCounterpartUid())
            .status(outcome.getStatus().dbValue())
            .build();
    }
}
