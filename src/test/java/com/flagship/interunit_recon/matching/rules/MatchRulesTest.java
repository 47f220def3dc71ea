package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.bank.BankDirectory;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.MatchingSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flagship.interunit_recon.matching.Legs.borrower;
import static com.flagship.interunit_recon.matching.Legs.lender;
import static org.junit.jupiter.api.Assertions.*;

class MatchRulesTest {

    @Test
    @DisplayName("Default chain evaluates structured references before text similarity")
    void testDefaultChainOrder() {
        List<MatchRule> chain = MatchRules.defaultChain(BankDirectory.empty(), MatchingSettings.defaults());

        assertEquals(
            List.of("po", "final_settlement", "salary", "lc", "interunit_loan", "time_loan_id", "loan_id",
                "manual_verification", "common_text"),
            chain.stream().map(MatchRule::name).toList());
        assertEquals(MatchType.LOAN_ID, chain.get(5).matchType());
        assertEquals(MatchType.LOAN_ID, chain.get(6).matchType());
    }

    @Test
    @DisplayName("Different PO numbers do not match")
    void testPoMismatch() {
        assertTrue(new PoMatchRule().evaluate(
            lender("L1", "ABC/PO/1/2", "10"), borrower("B1", "ABC/PO/1/3", "10")).isEmpty());
    }

    @Test
    @DisplayName("Different LC numbers do not match")
    void testLcMismatch() {
        assertTrue(new LcMatchRule().evaluate(
            lender("L1", "LC-100/1", "10"), borrower("B1", "LC-100/2", "10")).isEmpty());
    }

    @Test
    @DisplayName("Final settlements of different employees do not match")
    void testFinalSettlementDifferentPeople() {
        assertTrue(new FinalSettlementMatchRule().evaluate(
            lender("L1", "Amount paid as Inter Unit Loan (Md. Karim Hossain - ID: 5521)", "10"),
            borrower("B1", "Payable to Md. Rahim Uddin - ID: 1234 final settlement", "10")).isEmpty());
    }

    @Test
    @DisplayName("Time loan ids must agree after the phrase")
    void testTimeLoanIdMismatch() {
        assertTrue(new TimeLoanIdMatchRule().evaluate(
            lender("L1", "Amount being paid as Principal & Interest of Time Loan LD-1", "10"),
            borrower("B1", "Amount being paid as Principal & Interest of Time Loan LD-2", "10")).isEmpty());
    }

    @Test
    @DisplayName("Manual verification needs the same non-blank operator")
    void testManualVerification() {
        ManualVerificationMatchRule rule = new ManualVerificationMatchRule();

        assertTrue(rule.evaluate(lender("L1", "x", "10", " "), borrower("B1", "y", "10", " ")).isEmpty());
        assertTrue(rule.evaluate(lender("L1", "x", "10", "op1"), borrower("B1", "y", "10", "op2")).isEmpty());
        assertTrue(rule.evaluate(lender("L1", "x", "10"), borrower("B1", "y", "10")).isEmpty());
        assertTrue(rule.evaluate(lender("L1", "x", "10", "op1"), borrower("B1", "y", "10", "op1")).isPresent());
    }
}
