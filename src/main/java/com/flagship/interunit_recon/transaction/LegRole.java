package com.flagship.interunit_recon.transaction;

/**
 * Side of an interunit loan a ledger line represents.
 * Derived from which amount column is positive.
 */
public enum LegRole {
    /**
     * Positive debit: funds sent to the counterparty.
     */
    LENDER,

    /**
     * Positive credit: funds received from the counterparty.
     */
    BORROWER,

    /**
     * Neither or both amounts positive. Never considered for pairing.
     */
    NONE
}
