package com.flagship.interunit_recon.matching.extract;

import lombok.Value;

/**
 * A bank account number found in a narration.
 */
@Value
public class AccountReference {
    /**
     * Account number as written, hyphens included.
     */
    String accountNumber;
    /**
     * Words in front of the number that name the bank, or null.
     */
    String bankCode;
    /**
     * Canonical bank name, or the raw code when the bank is unknown.
     */
    String bankName;
    /**
     * Name of the pattern that found the number.
     */
    String patternName;

    /**
     * Last five digits of the account number (four when it is shorter).
     * Counterparty narrations usually quote only this tail.
     */
    public String trailingDigits() {
        String digits = accountNumber.replaceAll("\\D", "");
        int length = digits.length() >= 5 ? 5 : Math.min(4, digits.length());
        return digits.substring(digits.length() - length);
    }

    /**
     * {@code <bank code>-<account number>} for audit display.
     */
    public String displayReference() {
        return (bankCode != null ? bankCode : "Unknown") + "-" + accountNumber;
    }
}
