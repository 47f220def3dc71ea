package com.flagship.interunit_recon.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One normalized ledger line, as produced by the ledger parser.
 *
 * Only {@code uid}, {@code particulars}, the two amounts and {@code enteredBy}
 * take part in matching. Company and period attributes are used for filtering
 * before the matching engine sees the data.
 *
 * Key invariant: a matchable record has exactly one positive amount.
 */
@Value
@Builder(toBuilder = true)
public class TransactionRecord {
    String uid;
    String particulars;
    BigDecimal debit;
    BigDecimal credit;
    String enteredBy;

    String lenderCompany;
    String borrowerCompany;
    String statementMonth;
    String statementYear;
    LocalDate txnDate;
    String voucherType;
    String voucherNo;
    String pairId;

    public LegRole getRole() {
        boolean lends = isPositive(debit);
        boolean borrows = isPositive(credit);
        if (lends == borrows) {
            return LegRole.NONE;
        }
        return lends ? LegRole.LENDER : LegRole.BORROWER;
    }

    /**
     * The positive amount of this leg, or null when the record is not matchable.
     */
    public BigDecimal getLegAmount() {
        return switch (getRole()) {
            case LENDER -> debit;
            case BORROWER -> credit;
            case NONE -> null;
        };
    }

    /**
     * Narration, never null.
     */
    public String narration() {
        return particulars != null ? particulars : "";
    }

    private static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }
}
