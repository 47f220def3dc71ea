package com.flagship.interunit_recon.matching.extract;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Phrasing that marks a narration as an interunit loan transfer.
 */
public final class InterunitLoanPhrases {

    static final List<String> SHARED = List.of(
        "interunit fund transfer", "inter unit fund transfer", "interunit loan");

    static final String LENDER_ONLY = "amount paid as interunit loan";
    static final String BORROWER_ONLY = "amount received as interunit loan";

    private InterunitLoanPhrases() {
    }

    /**
     * Interunit phrases present in a lender narration; empty when none.
     */
    public static List<String> lenderPhrases(String narration) {
        return present(narration, LENDER_ONLY);
    }

    /**
     * Interunit phrases present in a borrower narration; empty when none.
     */
    public static List<String> borrowerPhrases(String narration) {
        return present(narration, BORROWER_ONLY);
    }

    private static List<String> present(String narration, String sidePhrase) {
        if (narration == null || narration.isEmpty()) {
            return List.of();
        }
        String lower = narration.toLowerCase(Locale.ROOT);
        return Stream.concat(Stream.of(sidePhrase), SHARED.stream())
            .filter(lower::contains)
            .toList();
    }
}
