package com.flagship.interunit_recon.matching.extract;

import com.flagship.interunit_recon.bank.BankDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AccountReferenceExtractorTest {

    private final AccountReferenceExtractor extractor = new AccountReferenceExtractor(BankDirectory.of(Map.of(
        "MDBL", "Midland Bank",
        "BRAC BANK", "BRAC Bank")));

    @Test
    @DisplayName("Long account number with a bank code in front")
    void testLongAccountNumber() {
        AccountReference account = extractor.extract("Amount paid as interunit loan to MDBL-0012345678901234")
            .orElseThrow();

        assertEquals("0012345678901234", account.getAccountNumber());
        assertEquals("MDBL", account.getBankCode());
        assertEquals("MIDLAND BANK", account.getBankName());
        assertEquals("long", account.getPatternName());
        assertEquals("01234", account.trailingDigits());
        assertEquals("MDBL-0012345678901234", account.displayReference());
    }

    @Test
    @DisplayName("Hyphenated account number after an A/C No. marker resolves a multi-word bank name")
    void testHyphenatedAccountNumber() {
        AccountReference account = extractor.extract("Transfer to BRAC Bank A/C No. 150-1234567890").orElseThrow();

        assertEquals("150-1234567890", account.getAccountNumber());
        assertEquals("BRAC Bank", account.getBankCode());
        assertEquals("BRAC BANK", account.getBankName());
        assertEquals("hyphenated", account.getPatternName());
        assertEquals("67890", account.trailingDigits());
    }

    @Test
    @DisplayName("Unknown bank codes pass through unchanged")
    void testUnknownBank() {
        AccountReference account = extractor.extract("Deposit 1234567890 main").orElseThrow();

        assertEquals("fallback", account.getPatternName());
        assertEquals("Deposit", account.getBankCode());
        assertEquals("Deposit", account.getBankName());
    }

    @Test
    @DisplayName("Long numbers are preferred over hyphenated ones regardless of position")
    void testPatternOrder() {
        AccountReference account = extractor.extract("A/C 123-4567890123 and 12345678901234").orElseThrow();

        assertEquals("12345678901234", account.getAccountNumber());
        assertEquals("long", account.getPatternName());
    }

    @Test
    @DisplayName("Narrations without an account number yield nothing")
    void testAbsent() {
        assertTrue(extractor.extract("cash deposit 12345").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    @DisplayName("Short references take four or five digits after '#'")
    void testShortReference() {
        assertEquals(Optional.of("01234"), extractor.extractShortReference("received #01234"));
        assertEquals(Optional.of("5678"), extractor.extractShortReference("ref #5678 ok"));
        assertTrue(extractor.extractShortReference("ref #123").isEmpty());
        assertTrue(extractor.extractShortReference("ref #123456").isEmpty());
    }

    @Test
    @DisplayName("Short account numbers keep their last four digits")
    void testTrailingDigitsOfShortNumber() {
        assertEquals("4567", new AccountReference("4567", null, null, "test").trailingDigits());
        assertEquals("Unknown-4567", new AccountReference("4567", null, null, "test").displayReference());
    }
}
