package com.flagship.interunit_recon.matching.extract;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Salary, payroll and final settlement payments.
 *
 * A narration qualifies when it contains a primary salary keyword or the phrase
 * "final settlement", and none of the non-salary business terms. An explicit
 * employee reference (see {@link FinalSettlementExtractor}) overrides the deny list.
 */
public class SalaryExtractor {

    static final List<String> PRIMARY_KEYWORDS = List.of(
        "salary", "sal", "wage", "payroll", "remuneration", "compensation");

    static final List<String> SECONDARY_KEYWORDS = List.of(
        "monthly", "month", "january", "february", "march", "april", "may", "june",
        "july", "august", "september", "october", "november", "december",
        "jan", "feb", "mar", "apr", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    static final List<String> NON_SALARY_TERMS = List.of(
        "payment for", "purchase of", "rent", "electricity", "transportation", "marketing",
        "maintenance", "equipment", "insurance", "legal", "consulting", "training",
        "travel", "software", "security", "cleaning", "bank charges", "interest",
        "loan repayment", "tax payment", "bill payment", "expenses for", "fees for",
        "vendor payment", "po no", "work order", "invoice", "challan", "tds deduction",
        "vds deduction", "duty", "taxes", "port", "shipping", "carrying charges",
        "l/c", "letter of credit", "margin", "collateral", "acceptance commission",
        "retirement value", "principal", "time loan", "usance loan");

    // Applied to the lower-cased narration, first match wins.
    private static final List<Pattern> PERSON_PATTERNS = Stream.of(
            "salary\\s+of\\s+([a-z\\s]+?)(?:\\s+for|\\s+month|\\s+period|$)",
            "([a-z\\s]+?)\\s+salary",
            "payroll\\s+for\\s+([a-z\\s]+?)(?:\\s+for|\\s+month|\\s+period|$)",
            "([a-z\\s]+?)\\s+payroll",
            "\\(([a-z]+\\.\\s+[a-z\\s]+?)-id\\s*:\\s*\\d+\\)",
            "([a-z]+\\.\\s+[a-z\\s]+?)-id\\s*:\\s*\\d+",
            "payable\\s+to\\s+([a-z]+\\.\\s+[a-z\\s]+?)-id\\s*:\\s*\\d+",
            "amount\\s+paid\\s+to\\s+([a-z]+\\.\\s+[a-z\\s]+?)(?:\\s*,|\\s+for|\\s+employee|\\s+office|\\s+human"
                + "|\\s+resources|\\s+administration|\\s+final|\\s+settlement|\\s*$)",
            "([a-z]+\\.\\s+[a-z\\s]+?)(?:\\s+for|\\s+month|\\s+period|\\s+employee|\\s+id|\\s*,|\\s*$)",
            "\\(([a-z]+\\.\\s+[a-z\\s]+?)\\)")
        .map(Pattern::compile)
        .toList();

    // Applied to the narration as written, first match wins.
    private static final List<Pattern> PERIOD_PATTERNS = Stream.of(
            "(\\w+\\s+\\d{4})",
            "(\\d{1,2}/\\d{4})",
            "(\\d{4}-\\d{2})")
        .map(Pattern::compile)
        .toList();

    private final FinalSettlementExtractor finalSettlementExtractor;

    public SalaryExtractor() {
        this(new FinalSettlementExtractor());
    }

    public SalaryExtractor(FinalSettlementExtractor finalSettlementExtractor) {
        this.finalSettlementExtractor = finalSettlementExtractor;
    }

    public Optional<SalaryDetails> extract(String narration) {
        if (narration == null || narration.isEmpty()) {
            return Optional.empty();
        }
        String lower = narration.toLowerCase(Locale.ROOT);

        boolean hasPrimaryKeyword = PRIMARY_KEYWORDS.stream().anyMatch(lower::contains)
            || lower.contains(FinalSettlementExtractor.FINAL_SETTLEMENT_PHRASE);
        if (!hasPrimaryKeyword) {
            return Optional.empty();
        }

        Optional<PersonReference> explicitPerson = finalSettlementExtractor.extract(narration);
        boolean hasDeniedTerm = NON_SALARY_TERMS.stream().anyMatch(lower::contains);
        if (hasDeniedTerm && explicitPerson.isEmpty()) {
            return Optional.empty();
        }

        SalaryDetails.SalaryDetailsBuilder details = SalaryDetails.builder()
            .salary(true)
            .period(extractPeriod(narration))
            .matchedKeywords(matchedKeywords(lower));

        if (explicitPerson.isPresent()) {
            PersonReference person = explicitPerson.get();
            return Optional.of(details
                .personName(person.getName())
                .personId(person.getId())
                .personCombined(person.combined())
                .build());
        }
        return Optional.of(details.personName(extractPersonName(lower)).build());
    }

    private String extractPersonName(String lower) {
        for (Pattern pattern : PERSON_PATTERNS) {
            Optional<String> name = PatternSupport.findFirst("salary_person", pattern, lower,
                matcher -> matcher.group(1).trim());
            if (name.isPresent()) {
                return name.get();
            }
        }
        return extractParenthesizedName(lower);
    }

    // "(md. name-id : 1234)" written with unusual spacing
    private String extractParenthesizedName(String lower) {
        int start = lower.indexOf('(');
        if (start == -1) {
            return null;
        }
        int end = lower.indexOf("-id :", start);
        if (end == -1) {
            return null;
        }
        String candidate = lower.substring(start + 1, end).trim();
        if (candidate.contains(".") && candidate.split("\\s+").length >= 2) {
            return candidate;
        }
        return null;
    }

    private String extractPeriod(String narration) {
        for (Pattern pattern : PERIOD_PATTERNS) {
            Optional<String> period = PatternSupport.findFirst("salary_period", pattern, narration,
                matcher -> matcher.group(1));
            if (period.isPresent()) {
                return period.get();
            }
        }
        return null;
    }

    private List<String> matchedKeywords(String lower) {
        return Stream.concat(PRIMARY_KEYWORDS.stream(), SECONDARY_KEYWORDS.stream())
            .filter(lower::contains)
            .toList();
    }
}
