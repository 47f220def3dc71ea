package com.flagship.interunit_recon.matching.rules;

import com.flagship.interunit_recon.bank.BankNameLookup;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchingSettings;
import com.flagship.interunit_recon.matching.extract.AccountReferenceExtractor;
import com.flagship.interunit_recon.matching.extract.CommonTextExtractor;

import java.util.List;

/**
 * The standard rule chain, strongest evidence first.
 *
 * Structured identifiers run before fuzzy text rules so a weak signal never
 * claims a pair a strong one would have matched.
 */
public final class MatchRules {

    private MatchRules() {
    }

    public static List<MatchRule> defaultChain(BankNameLookup bankLookup, MatchingSettings settings) {
        return List.of(
            new PoMatchRule(),
            new FinalSettlementMatchRule(),
            new SalaryMatchRule(settings.getSalaryJaccardThreshold()),
            new LcMatchRule(),
            new InterunitLoanMatchRule(new AccountReferenceExtractor(bankLookup)),
            new TimeLoanIdMatchRule(),
            new LoanIdMatchRule(),
            new ManualVerificationMatchRule(),
            new CommonTextMatchRule(new CommonTextExtractor(
                settings.getCommonTextMinWords(),
                settings.getCommonTextMaxWords(),
                settings.getCommonTextMinChars())));
    }
}
