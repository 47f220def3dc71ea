package com.flagship.interunit_recon.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest {

    @Test
    @DisplayName("Entries keep insertion order and skip nulls")
    void testOrderAndNulls() {
        AuditTrail trail = AuditTrail.builder()
            .put("b", "first")
            .put("a", 2)
            .put("skipped", null)
            .put("c", true)
            .build();

        assertEquals(List.of("b", "a", "c"), List.copyOf(trail.asMap().keySet()));
        assertFalse(trail.containsKey("skipped"));
    }

    @Test
    @DisplayName("Decimal amounts are stored as plain strings")
    void testDecimals() {
        AuditTrail trail = AuditTrail.builder().put("amount", new BigDecimal("1E+6")).build();

        assertEquals("1000000", trail.get("amount"));
    }

    @Test
    @DisplayName("Only strings, numbers and booleans are accepted")
    void testRejectsOtherValues() {
        AuditTrail.Builder builder = AuditTrail.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.put("list", List.of("x")));
    }

    @Test
    @DisplayName("The trail cannot be modified")
    void testImmutable() {
        AuditTrail trail = AuditTrail.builder().put("k", "v").build();

        assertThrows(UnsupportedOperationException.class, () -> trail.asMap().put("x", "y"));
    }
}
