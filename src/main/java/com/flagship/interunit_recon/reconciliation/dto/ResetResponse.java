package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ResetResponse {

    @JsonProperty("scope")
    String scope;

    @JsonProperty("legs_reset")
    int legsReset;
}
