package com.flagship.interunit_recon.matching.extract;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loan identifiers ({@code LD123}, {@code ID-456}, {@code LOAN 789}).
 *
 * Two modes:
 * - generic: first loan id anywhere in the narration, returned verbatim
 * - phrase-scoped: first loan id after the time loan repayment phrase, normalized to {@code LD-<digits>}
 */
public class LoanIdExtractor {

    private static final Pattern LOAN_ID_PATTERN = Pattern.compile("\\b(?:LD|ID|LOAN)[-\\s]?(\\d+)\\b");

    // "Amount being paid as Principal & Interest [repayment] [of] Time Loan"
    private static final Pattern TIME_LOAN_PHRASE = Pattern.compile(
        "amount\\s+being\\s+paid\\s+as\\s*principal\\s*&?\\s*interest"
            + "(?:\\s+repayment)?"
            + "\\s+(?:of\\s+)?time\\s+loan",
        Pattern.CASE_INSENSITIVE);

    public Optional<String> extract(String narration) {
        if (narration == null) {
            return Optional.empty();
        }
        return PatternSupport.findGroup("loan_id", LOAN_ID_PATTERN, narration.toUpperCase(Locale.ROOT));
    }

    public boolean hasTimeLoanPhrase(String narration) {
        return PatternSupport.contains("time_loan_phrase", TIME_LOAN_PHRASE, narration);
    }

    public Optional<String> extractAfterTimeLoanPhrase(String narration) {
        return PatternSupport.findFirst("time_loan_phrase", TIME_LOAN_PHRASE, narration,
                matcher -> narration.substring(matcher.end()))
            .flatMap(tail -> PatternSupport.findFirst("loan_id_after_phrase", LOAN_ID_PATTERN,
                tail.toUpperCase(Locale.ROOT), matcher -> "LD-" + matcher.group(1)));
    }
}
