package com.flagship.interunit_recon.transaction;

import lombok.Value;

/**
 * Two companies with unmatched legs against each other in one statement period.
 */
@Value
public class CompanyPair {
    String lenderCompany;
    String borrowerCompany;
    String month;
    String year;
    long unmatchedLegs;

    public ReconciliationScope toScope() {
        return ReconciliationScope.forCompanies(lenderCompany, borrowerCompany, month, year);
    }
}
