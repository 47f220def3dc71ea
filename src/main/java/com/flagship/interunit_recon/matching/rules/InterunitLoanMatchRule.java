package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.matching.extract.AccountReference;
import com.flagship.interunit_recon.matching.extract.AccountReferenceExtractor;
import com.flagship.interunit_recon.matching.extract.InterunitLoanPhrases;
import com.flagship.interunit_recon.transaction.TransactionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Interunit loan transfers confirmed by a two-way account cross-reference.
 *
 * Each leg names the account it moved money through. A leg's reference digits are
 * the trailing digits of that account number, or its {@code #12345} short reference
 * when no full number is written. The match requires both directions:
 * - lender digits appear in the borrower narration (or the borrower short reference is part of them)
 * - borrower digits appear in the lender narration (or the lender short reference is part of them)
 */
public class InterunitLoanMatchRule implements MatchRule {

    private final AccountReferenceExtractor accounts;

    public InterunitLoanMatchRule(AccountReferenceExtractor accounts) {
        this.accounts = accounts;
    }

    @Override
    public String name() {
        return "interunit_loan";
    }

    @Override
    public MatchType matchType() {
        return MatchType.INTERUNIT_LOAN;
    }

    @Override
    public Optional<AuditTrail> evaluate(TransactionRecord lender, TransactionRecord borrower) {
        String lenderText = lender.narration();
        String borrowerText = borrower.narration();

        List<String> lenderPhrases = InterunitLoanPhrases.lenderPhrases(lenderText);
        List<String> borrowerPhrases = InterunitLoanPhrases.borrowerPhrases(borrowerText);
        if (lenderPhrases.isEmpty() || borrowerPhrases.isEmpty()) {
            return Optional.empty();
        }

        Optional<AccountReference> lenderAccount = accounts.extract(lenderText);
        Optional<AccountReference> borrowerAccount = accounts.extract(borrowerText);
        Optional<String> lenderShortRef = accounts.extractShortReference(lenderText);
        Optional<String> borrowerShortRef = accounts.extractShortReference(borrowerText);

        Optional<String> lenderDigits = lenderAccount.map(AccountReference::trailingDigits).or(() -> lenderShortRef);
        Optional<String> borrowerDigits = borrowerAccount.map(AccountReference::trailingDigits).or(() -> borrowerShortRef);
        if (lenderDigits.isEmpty() || borrowerDigits.isEmpty()) {
            return Optional.empty();
        }

        boolean lenderToBorrower = crossReferenced(lenderDigits.get(), borrowerText, borrowerShortRef);
        boolean borrowerToLender = crossReferenced(borrowerDigits.get(), lenderText, lenderShortRef);
        if (!lenderToBorrower || !borrowerToLender) {
            return Optional.empty();
        }

        AuditTrail.Builder audit = AuditTrail.builder()
            .put("match_reason", String.format("Interunit loan cross-reference match: %s <-> %s",
                lenderDigits.get(), borrowerDigits.get()))
            .put("lender_last_digits", lenderDigits.get())
            .put("borrower_last_digits", borrowerDigits.get())
            .put("cross_reference_1", true)
            .put("cross_reference_2", true)
            .put("lender_keywords", String.join(", ", lenderPhrases))
            .put("borrower_keywords", String.join(", ", borrowerPhrases));
        lenderAccount.ifPresent(account -> audit
            .put("lender_account", account.getAccountNumber())
            .put("lender_reference", account.displayReference())
            .put("lender_bank", account.getBankName()));
        borrowerAccount.ifPresent(account -> audit
            .put("borrower_account", account.getAccountNumber())
            .put("borrower_reference", account.displayReference())
            .put("borrower_bank", account.getBankName()));
        lenderShortRef.ifPresent(ref -> audit.put("lender_short_reference", ref));
        borrowerShortRef.ifPresent(ref -> audit.put("borrower_short_reference", ref));
        return Optional.of(audit.build());
    }

    private static boolean crossReferenced(String digits, String otherText, Optional<String> otherShortRef) {
        return otherText.contains(digits) || otherShortRef.map(digits::contains).orElse(false);
    }
}
