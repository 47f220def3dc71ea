package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.interunit_recon.transaction.LedgerLeg;
import com.flagship.interunit_recon.transaction.MatchedLeg;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A stored match seen from its lender leg.
 */
@Value
@Builder
public class MatchedLegResponse {

    @JsonProperty("lender_uid")
    String lenderUid;

    @JsonProperty("borrower_uid")
    String borrowerUid;

    @JsonProperty("lender_company")
    String lenderCompany;

    @JsonProperty("borrower_company")
    String borrowerCompany;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    String status;

    @JsonProperty("match_method")
    String matchMethod;

    @JsonProperty("date_matched")
    Instant dateMatched;

    @JsonProperty("lender_particulars")
    String lenderParticulars;

    @JsonProperty("borrower_particulars")
    String borrowerParticulars;

    @JsonRawValue
    @JsonProperty("audit_info")
    String auditInfo;

    public static MatchedLegResponse from(MatchedLeg matched) {
        LedgerLeg leg = matched.getLeg();
        TransactionRecord lender = leg.getRecord();
        TransactionRecord borrower = matched.getCounterpart();
        return MatchedLegResponse.builder()
            .lenderUid(lender.getUid())
            .borrowerUid(leg.getMatchedWith())
            .lenderCompany(lender.getLenderCompany())
            .borrowerCompany(lender.getBorrowerCompany())
            .amount(lender.getLegAmount())
            .status(leg.getStatus().dbValue())
            .matchMethod(leg.getMatchMethod())
            .dateMatched(leg.getDateMatched())
            .lenderParticulars(lender.getParticulars())
            .borrowerParticulars(borrower != null ? borrower.getParticulars() : null)
            .auditInfo(leg.getAuditInfo())
            .build();
    }
}
