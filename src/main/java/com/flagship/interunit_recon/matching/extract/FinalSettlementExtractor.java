package com.flagship.interunit_recon.matching.extract;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Employee final settlements paid through the interunit loan account.
 *
 * Recognized shapes:
 * - lender side: "... Amount paid as Inter Unit Loan ... (Md. Name - ID: 1234)"
 * - borrower side: "... Payable to Md. Name - ID: 1234 ... final settlement ..."
 *
 * Both ASCII and full-width colons are accepted after {@code ID}.
 */
public class FinalSettlementExtractor {

    static final String LENDER_PHRASE = "amount paid as inter unit loan";
    static final String PAYABLE_PHRASE = "payable to";
    static final String FINAL_SETTLEMENT_PHRASE = "final settlement";

    private static final Pattern LENDER_PERSON = Pattern.compile(
        "\\(\\s*(?<name>[^()]+?)\\s*-\\s*ID\\s*[:\\uFF1A]\\s*(?<id>\\d+)\\s*\\)",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern BORROWER_PERSON = Pattern.compile(
        "payable\\s+to\\s+(?<name>[^\\r\\n-]+?)\\s*-\\s*ID\\s*[:\\uFF1A]\\s*(?<id>\\d+)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public Optional<PersonReference> extract(String narration) {
        if (narration == null || narration.isEmpty()) {
            return Optional.empty();
        }
        String lower = narration.toLowerCase(Locale.ROOT);

        if (lower.contains(LENDER_PHRASE)) {
            Optional<PersonReference> person =
                PatternSupport.findFirst("final_settlement_lender", LENDER_PERSON, narration, this::toPerson);
            if (person.isPresent()) {
                return person;
            }
        }
        if (lower.contains(PAYABLE_PHRASE) && lower.contains(FINAL_SETTLEMENT_PHRASE)) {
            return PatternSupport.findFirst("final_settlement_borrower", BORROWER_PERSON, narration, this::toPerson);
        }
        return Optional.empty();
    }

    private PersonReference toPerson(Matcher matcher) {
        return new PersonReference(matcher.group("name").trim(), matcher.group("id").trim());
    }
}
