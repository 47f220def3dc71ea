package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.transaction.MatchStatus;
import lombok.Value;

/**
 * State of a match after a review decision.
 */
@Value
public class ReviewOutcome {
    String uid;
    String counterpartUid;
    MatchStatus status;
}
