package com.flagship.interunit_recon.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.transaction.ReconciliationScope;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Scope of a reconciliation run or reset. Every field is optional, but the two
 * companies must be given together.
 */
@Value
public class ReconcileRequest {

    @JsonProperty("lender_company")
    String lenderCompany;

    @JsonProperty("borrower_company")
    String borrowerCompany;

    @JsonProperty("month")
    String month;

    @Pattern(regexp = "^\\d{4}$", message = "Year must have four digits")
    @JsonProperty("year")
    String year;

    public ReconciliationScope toScope() {
        return ReconciliationScope.forCompanies(lenderCompany, borrowerCompany, month, year);
    }
}
