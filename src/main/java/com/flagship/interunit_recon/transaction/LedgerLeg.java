package com.flagship.interunit_recon.transaction;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A stored ledger line together with its match columns.
 */
@Value
@Builder
public class LedgerLeg {
    TransactionRecord record;
    MatchStatus status;
    String matchedWith;
    String matchMethod;
    Instant dateMatched;
    /**
     * Raw audit JSON as stored, or null for unmatched legs.
     */
    String auditInfo;

    public String getUid() {
        return record.getUid();
    }
}
