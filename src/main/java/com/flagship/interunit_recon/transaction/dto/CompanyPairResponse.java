package com.flagship.interunit_recon.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.transaction.CompanyPair;
import lombok.Value;

@Value
public class CompanyPairResponse {

    @JsonProperty("lender_company")
    String lenderCompany;

    @JsonProperty("borrower_company")
    String borrowerCompany;

    @JsonProperty("month")
    String month;

    @JsonProperty("year")
    String year;

    @JsonProperty("unmatched_legs")
    long unmatchedLegs;

    @JsonProperty("description")
    String description;

    public static CompanyPairResponse from(CompanyPair pair) {
        return new CompanyPairResponse(pair.getLenderCompany(), pair.getBorrowerCompany(), pair.getMonth(),
            pair.getYear(), pair.getUnmatchedLegs(), pair.toScope().describe());
    }
}
