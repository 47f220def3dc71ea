package com.flagship.interunit_recon.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchStatusTest {

    @Test
    @DisplayName("Stored values resolve case-insensitively")
    void testFromDbValue() {
        assertEquals(MatchStatus.PENDING_VERIFICATION, MatchStatus.fromDbValue("Pending_Verification"));
        assertEquals(MatchStatus.UNMATCHED, MatchStatus.fromDbValue(null));
        assertThrows(IllegalArgumentException.class, () -> MatchStatus.fromDbValue("lost"));
        assertThrows(IllegalArgumentException.class, () -> MatchStatus.fromDbValue("rejected"));
    }

    @Test
    @DisplayName("Only the three match states count as matched")
    void testIsMatched() {
        assertTrue(MatchStatus.MATCHED.isMatched());
        assertTrue(MatchStatus.CONFIRMED.isMatched());
        assertTrue(MatchStatus.PENDING_VERIFICATION.isMatched());
        assertFalse(MatchStatus.UNMATCHED.isMatched());
    }
}
