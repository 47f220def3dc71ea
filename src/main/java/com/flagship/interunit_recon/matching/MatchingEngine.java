package com.flagship.interunit_recon.matching;

import com.flagship.interunit_recon.bank.BankNameLookup;
import com.flagship.interunit_recon.matching.rules.MatchRules;
import com.flagship.interunit_recon.transaction.LegRole;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pairs lender legs with borrower legs of the same amount.
 *
 * Algorithm (greedy, priority ordered):
 * 1. Split the records into lenders (positive debit) and borrowers (positive credit)
 * 2. For each lender in input order, scan the unused borrowers in input order
 * 3. For a borrower with an equal amount, evaluate the rule chain in order
 * 4. The first rule that fires records a match and consumes both legs
 *
 * The pairing is not globally optimal: once a borrower is taken by a weaker rule it
 * stays taken even if a later lender would have matched it more strongly. Results
 * depend only on the input order, so identical input gives identical output.
 *
 * The engine performs no I/O and holds no state between runs.
 */
@Slf4j
public class MatchingEngine {

    private final List<MatchRule> rules;

    public MatchingEngine(List<MatchRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Matching engine needs at least one rule");
        }
        this.rules = List.copyOf(rules);
    }

    public static MatchingEngine withDefaultRules(BankNameLookup bankLookup, MatchingSettings settings) {
        return new MatchingEngine(MatchRules.defaultChain(bankLookup, settings));
    }

    public List<MatchRule> getRules() {
        return rules;
    }

    public MatchingResult match(List<TransactionRecord> records) {
        if (records == null || records.isEmpty()) {
            log.info("No transactions to match");
            return MatchingResult.empty();
        }

        List<TransactionRecord> lenders = new ArrayList<>();
        List<TransactionRecord> borrowers = new ArrayList<>();
        List<TransactionRecord> excluded = new ArrayList<>();
        for (TransactionRecord record : records) {
            if (record == null) {
                continue;
            }
            LegRole role = record.getRole();
            if (role == LegRole.LENDER) {
                lenders.add(record);
            } else if (role == LegRole.BORROWER) {
                borrowers.add(record);
            } else {
                log.debug("Excluding record without a single positive amount: uid={}", record.getUid());
                excluded.add(record);
            }
        }

        List<MatchCandidate> matches = new ArrayList<>();
        Set<String> usedLenders = new HashSet<>();
        Set<String> usedBorrowers = new HashSet<>();

        for (TransactionRecord lender : lenders) {
            if (usedLenders.contains(lender.getUid()) || usedBorrowers.contains(lender.getUid())) {
                continue;
            }
            BigDecimal amount = lender.getDebit();

            for (TransactionRecord borrower : borrowers) {
                if (usedBorrowers.contains(borrower.getUid())
                        || usedLenders.contains(borrower.getUid())
                        || borrower.getUid().equals(lender.getUid())
                        || amount.compareTo(borrower.getCredit()) != 0) {
                    continue;
                }

                Optional<MatchCandidate> match = firstFiringRule(lender, borrower);
                if (match.isPresent()) {
                    matches.add(match.get());
                    usedLenders.add(lender.getUid());
                    usedBorrowers.add(borrower.getUid());
                    log.debug("Matched legs: lender={}, borrower={}, type={}, rule={}",
                        lender.getUid(), borrower.getUid(), match.get().getMatchType(), match.get().getRule());
                    break;
                }
            }
        }

        List<TransactionRecord> unmatchedLenders = lenders.stream()
            .filter(lender -> !usedLenders.contains(lender.getUid()))
            .toList();
        List<TransactionRecord> unmatchedBorrowers = borrowers.stream()
            .filter(borrower -> !usedBorrowers.contains(borrower.getUid()))
            .toList();

        log.info("Matching finished: lenders={}, borrowers={}, excluded={}, matches={}, unmatchedLenders={}, unmatchedBorrowers={}",
            lenders.size(), borrowers.size(), excluded.size(), matches.size(),
            unmatchedLenders.size(), unmatchedBorrowers.size());

        return new MatchingResult(List.copyOf(matches), unmatchedLenders, unmatchedBorrowers, List.copyOf(excluded));
    }

    private Optional<MatchCandidate> firstFiringRule(TransactionRecord lender, TransactionRecord borrower) {
        for (MatchRule rule : rules) {
            Optional<AuditTrail> evidence = rule.evaluate(lender, borrower);
            if (evidence.isPresent()) {
                return Optional.of(MatchCandidate.builder()
                    .lenderUid(lender.getUid())
                    .borrowerUid(borrower.getUid())
                    .matchType(rule.matchType())
                    .amount(lender.getDebit())
                    .auditTrail(evidence.get())
                    .rule(rule.name())
                    .build());
            }
        }
        return Optional.empty();
    }
}
