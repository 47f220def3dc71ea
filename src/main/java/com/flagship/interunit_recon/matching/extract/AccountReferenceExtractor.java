package com.flagship.interunit_recon.matching.extract;

import com.flagship.interunit_recon.bank.BankNameLookup;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds bank account numbers and short account references in narrations.
 *
 * Account number patterns are tried in a fixed order and the first hit wins:
 * - {@code long}: 13 to 16 contiguous digits
 * - {@code hyphenated}: {@code ddd-dddddddddd}
 * - {@code fallback}: any run of 10 or more digits
 *
 * The bank is taken from the words right before the number and resolved through
 * the injected {@link BankNameLookup}. Unknown codes are kept as written.
 */
public class AccountReferenceExtractor {

    private static final Map<String, Pattern> ACCOUNT_PATTERNS = new LinkedHashMap<>();

    static {
        ACCOUNT_PATTERNS.put("long", Pattern.compile("(?<!\\d)\\d{13,16}(?!\\d)"));
        ACCOUNT_PATTERNS.put("hyphenated", Pattern.compile("(?<!\\d)\\d{3}-\\d{10}(?!\\d)"));
        ACCOUNT_PATTERNS.put("fallback", Pattern.compile("(?<!\\d)\\d{10,}(?!\\d)"));
    }

    private static final Pattern SHORT_REFERENCE = Pattern.compile("#(\\d{4,5})(?!\\d)");

    // Separators and "A/C No." style markers between a bank name and its account number.
    private static final Pattern TRAILING_NOISE = Pattern.compile(
        "(?:[\\s#:/.,-]+|\\b(?:A/C|AC|ACCT|ACCOUNT)(?:\\s*NO)?)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_WORDS = Pattern.compile("([A-Za-z]+(?:\\s+[A-Za-z]+){0,2})$");

    private final BankNameLookup bankLookup;

    public AccountReferenceExtractor(BankNameLookup bankLookup) {
        this.bankLookup = bankLookup;
    }

    public Optional<AccountReference> extract(String narration) {
        if (narration == null || narration.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, Pattern> entry : ACCOUNT_PATTERNS.entrySet()) {
            Optional<AccountReference> reference = PatternSupport.findFirst(
                "account_" + entry.getKey(), entry.getValue(), narration,
                matcher -> toReference(narration, matcher, entry.getKey()));
            if (reference.isPresent()) {
                return reference;
            }
        }
        return Optional.empty();
    }

    /**
     * Digits of a {@code #12345} style short reference.
     */
    public Optional<String> extractShortReference(String narration) {
        return PatternSupport.findFirst("account_short_reference", SHORT_REFERENCE, narration,
            matcher -> matcher.group(1));
    }

    private AccountReference toReference(String narration, Matcher matcher, String patternName) {
        String bankCode = bankCodeBefore(narration.substring(0, matcher.start()));
        return new AccountReference(matcher.group(), bankCode, bankLookup.normalize(bankCode), patternName);
    }

    private String bankCodeBefore(String prefix) {
        String trimmed = stripTrailingNoise(prefix);
        Matcher words = TRAILING_WORDS.matcher(trimmed);
        if (!words.find()) {
            return null;
        }
        List<String> tokens = Arrays.asList(words.group(1).trim().split("\\s+"));
        // Longest known bank name wins, e.g. "MIDLAND BANK" over "BANK".
        for (int size = tokens.size(); size >= 1; size--) {
            String candidate = String.join(" ", tokens.subList(tokens.size() - size, tokens.size()));
            if (bankLookup.find(candidate).isPresent()) {
                return candidate;
            }
        }
        return tokens.get(tokens.size() - 1);
    }

    private static String stripTrailingNoise(String prefix) {
        String current = prefix;
        while (true) {
            String next = TRAILING_NOISE.matcher(current).replaceFirst("");
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }
}
