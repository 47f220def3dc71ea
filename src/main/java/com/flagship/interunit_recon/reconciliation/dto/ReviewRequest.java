package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ReviewRequest {

    @Size(max = 64, message = "Reviewer name is too long")
    @JsonProperty("reviewed_by")
    String reviewedBy;
}
