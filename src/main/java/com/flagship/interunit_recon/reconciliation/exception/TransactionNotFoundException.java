package com.flagship.interunit_recon.reconciliation.exception;

/**
 * No ledger leg exists with the requested uid.
 */
public class TransactionNotFoundException extends RuntimeException {

    private final String uid;

    public TransactionNotFoundException(String uid) {
        super("Transaction not found: " + uid);
        this.uid = uid;
    }

    public String getUid() {
        return uid;
    }
}
