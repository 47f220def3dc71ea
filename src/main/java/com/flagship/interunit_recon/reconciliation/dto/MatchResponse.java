package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.matching.MatchCandidate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One engine match, as returned by a preview run.
 */
@Value
@Builder
public class MatchResponse {

    @JsonProperty("lender_uid")
    String lenderUid;

    @JsonProperty("borrower_uid")
    String borrowerUid;

    @JsonProperty("match_type")
    String matchType;

    @JsonProperty("match_method")
    String matchMethod;

    @JsonProperty("rule")
    String rule;

    @JsonProperty("auto_accepted")
    boolean autoAccepted;

    @JsonProperty("status")
    String status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("audit_trail")
    Map<String, Object> auditTrail;

    public static MatchResponse from(MatchCandidate match) {
        return MatchResponse.builder()
            .lenderUid(match.getLenderUid())
            .borrowerUid(match.getBorrowerUid())
            .matchType(match.getMatchType().name())
            .matchMethod(match.getMatchMethod().tag())
            .rule(match.getRule())
            .autoAccepted(match.isAutoAccepted())
            .status(match.getInitialStatus().dbValue())
            .amount(match.getAmount())
            .auditTrail(match.getAuditTrail().asMap())
            .build();
    }
}
