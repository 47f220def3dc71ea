package com.flagship.interunit_recon.transaction;

import lombok.Value;

/**
 * A matched lender leg joined with the borrower leg it points at.
 * The counterpart is null if the referenced row no longer exists.
 */
@Value
public class MatchedLeg {
    LedgerLeg leg;
    TransactionRecord counterpart;
}
