package com.flagship.interunit_recon.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationScopeTest {

    @Test
    @DisplayName("Company pair with period")
    void testCompanies() {
        ReconciliationScope scope = ReconciliationScope.forCompanies(" GEL ", "GPL", "March", "2024");

        assertTrue(scope.hasCompanies());
        assertEquals("GEL", scope.getLenderCompany());
        assertEquals("GEL<->GPL month=March year=2024", scope.describe());
    }

    @Test
    @DisplayName("Blank filters are dropped")
    void testBlankFilters() {
        ReconciliationScope scope = ReconciliationScope.forCompanies("", null, " ", null);

        assertFalse(scope.hasCompanies());
        assertNull(scope.getMonth());
        assertEquals("all companies", scope.describe());
    }

    @Test
    @DisplayName("Companies must be given together")
    void testSingleCompany() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconciliationScope.forCompanies("GEL", null, null, null));
    }

    @Test
    @DisplayName("Pair scope needs a pair id")
    void testPair() {
        assertEquals("pair=P-1", ReconciliationScope.forPair("P-1").describe());
        assertThrows(IllegalArgumentException.class, () -> ReconciliationScope.forPair(" "));
    }
}
