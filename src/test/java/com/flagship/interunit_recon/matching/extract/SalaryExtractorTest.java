package com.flagship.interunit_recon.matching.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SalaryExtractorTest {

    private final SalaryExtractor extractor = new SalaryExtractor();

    @Test
    @DisplayName("Salary narration yields person, period and matched keywords")
    void testSalaryNarration() {
        SalaryDetails details = extractor.extract("Salary of John Doe for March 2024").orElseThrow();

        assertTrue(details.isSalary());
        assertEquals("john doe", details.getPersonName());
        assertEquals("March 2024", details.getPeriod());
        assertEquals(List.of("salary", "sal", "march", "mar"), details.getMatchedKeywords());
        assertEquals("john doe", details.personLabel());
    }

    @Test
    @DisplayName("Numeric periods are recognized")
    void testNumericPeriods() {
        assertEquals("03/2024", extractor.extract("Payroll 03/2024").orElseThrow().getPeriod());
        assertEquals("2024-05", extractor.extract("Wage-2024-05").orElseThrow().getPeriod());
    }

    @Test
    @DisplayName("Business terms disqualify a salary keyword")
    void testDenyList() {
        assertTrue(extractor.extract("Salary advance adjusted against office rent").isEmpty());
        assertTrue(extractor.extract("Payroll software invoice").isEmpty());
    }

    @Test
    @DisplayName("An explicit employee reference overrides the deny list")
    void testExplicitPersonOverridesDenyList() {
        SalaryDetails details = extractor.extract(
            "Amount paid as Inter Unit Loan final settlement (Md. Karim Hossain - ID: 5521) interest adjusted")
            .orElseThrow();

        assertEquals("Md. Karim Hossain", details.getPersonName());
        assertEquals("5521", details.getPersonId());
        assertEquals("Md. Karim Hossain-ID : 5521", details.personLabel());
    }

    @Test
    @DisplayName("Narrations without a salary keyword are not salary")
    void testNoKeyword() {
        assertTrue(extractor.extract("Office supplies").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }
}
