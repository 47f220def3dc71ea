package com.flagship.interunit_recon.transaction;

import lombok.Builder;
import lombok.Value;

/**
 * Selects the ledger legs a reconciliation run (or reset) works on.
 *
 * A company pair matches in either direction, since the lender of one statement is the
 * borrower of the other. All filters are optional; an empty scope covers every leg.
 */
@Value
@Builder
public class ReconciliationScope {
    String lenderCompany;
    String borrowerCompany;
    String month;
    String year;
    String pairId;

    public static ReconciliationScope all() {
        return ReconciliationScope.builder().build();
    }

    public static ReconciliationScope forPair(String pairId) {
        if (isBlank(pairId)) {
            throw new IllegalArgumentException("Pair id is required");
        }
        return ReconciliationScope.builder().pairId(pairId.trim()).build();
    }

    /**
     * @throws IllegalArgumentException if only one company of the pair is given
     */
    public static ReconciliationScope forCompanies(String lenderCompany, String borrowerCompany,
                                                   String month, String year) {
        if (isBlank(lenderCompany) != isBlank(borrowerCompany)) {
            throw new IllegalArgumentException("Lender and borrower company must be given together");
        }
        return ReconciliationScope.builder()
            .lenderCompany(trimToNull(lenderCompany))
            .borrowerCompany(trimToNull(borrowerCompany))
            .month(trimToNull(month))
            .year(trimToNull(year))
            .build();
    }

    public boolean hasCompanies() {
        return !isBlank(lenderCompany) && !isBlank(borrowerCompany);
    }

    public String describe() {
        if (!isBlank(pairId)) {
            return "pair=" + pairId;
        }
        StringBuilder description = new StringBuilder();
        description.append(hasCompanies() ? lenderCompany + "<->" + borrowerCompany : "all companies");
        if (!isBlank(month)) {
            description.append(" month=").append(month);
        }
        if (!isBlank(year)) {
            description.append(" year=").append(year);
        }
        return description.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
