package com.flagship.interunit_recon.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRecordsTest {

    @Test
    @DisplayName("Parser mapping is converted into a lender leg")
    void testFromMap() {
        Map<String, Object> row = new HashMap<>();
        row.put("uid", "A-1");
        row.put("particulars", "ABC/PO/1/2");
        row.put("debit", "1,250.50");
        row.put("credit", "");
        row.put("entered_by", "opuser1");
        row.put("lender_company", "GEL");
        row.put("borrower_company", "GPL");
        row.put("date", "2024-03-31");
        row.put("pair_id", "P-7");

        TransactionRecord record = TransactionRecords.fromMap(row);

        assertEquals("A-1", record.getUid());
        assertEquals(new BigDecimal("1250.50"), record.getDebit());
        assertNull(record.getCredit());
        assertEquals(LegRole.LENDER, record.getRole());
        assertEquals(new BigDecimal("1250.50"), record.getLegAmount());
        assertEquals(LocalDate.of(2024, 3, 31), record.getTxnDate());
        assertEquals("P-7", record.getPairId());
    }

    @Test
    @DisplayName("Unusable amounts leave the record unmatchable instead of failing")
    void testUnusableAmounts() {
        TransactionRecord record = TransactionRecords.fromMap(Map.of("uid", "A-2", "debit", "n/a", "credit", "-5"));

        assertNull(record.getDebit());
        assertEquals(LegRole.NONE, record.getRole());
        assertNull(record.getLegAmount());
        assertEquals("", record.narration());
    }

    @Test
    @DisplayName("Numbers of any type are accepted as amounts")
    void testNumericAmounts() {
        assertEquals(Optional.of(new BigDecimal("3000")), TransactionRecords.parseAmount("u", "credit", 3000));
        assertEquals(Optional.of(new BigDecimal("12.5")), TransactionRecords.parseAmount("u", "credit", 12.5d));
        assertTrue(TransactionRecords.parseAmount("u", "credit", null).isEmpty());
        assertTrue(TransactionRecords.parseAmount("u", "credit", "  ").isEmpty());
    }

    @Test
    @DisplayName("Non-finite numbers leave the leg unmatchable instead of failing")
    void testNonFiniteAmounts() {
        assertTrue(TransactionRecords.parseAmount("u", "debit", Double.NaN).isEmpty());
        assertTrue(TransactionRecords.parseAmount("u", "credit", Double.POSITIVE_INFINITY).isEmpty());

        TransactionRecord record = TransactionRecords.fromMap(Map.of("uid", "A-5", "debit", Double.NaN));
        assertNull(record.getDebit());
        assertEquals(LegRole.NONE, record.getRole());
    }

    @Test
    @DisplayName("Invalid dates are dropped")
    void testInvalidDate() {
        assertNull(TransactionRecords.fromMap(Map.of("uid", "A-3", "date", "31/03/2024")).getTxnDate());
    }

    @Test
    @DisplayName("A record needs a uid")
    void testMissingUid() {
        assertThrows(IllegalArgumentException.class, () -> TransactionRecords.fromMap(Map.of("debit", "10")));
    }

    @Test
    @DisplayName("Positive debit and credit at once is not a leg")
    void testBothAmounts() {
        TransactionRecord record = TransactionRecord.builder()
            .uid("A-4").debit(BigDecimal.TEN).credit(BigDecimal.ONE).build();

        assertEquals(LegRole.NONE, record.getRole());
    }
}
