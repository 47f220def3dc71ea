package com.flagship.interunit_recon.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.interunit_recon.matching.MatchCandidate;
import com.flagship.interunit_recon.transaction.MatchStatus;
import com.flagship.interunit_recon.transaction.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes engine matches to the ledger table.
 *
 * Both legs of a match are written with the same status, method and audit JSON, each
 * pointing at the other through {@code matched_with}. A leg that is no longer unmatched
 * (taken by a concurrent run) fails the whole batch, so a run is stored completely or
 * not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchPersistenceService {

    private final TransactionRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Must run inside the caller's transaction.
     *
     * @throws IllegalStateException if either leg of a match is no longer unmatched
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void persist(List<MatchCandidate> matches) {
        Instant matchedAt = Instant.now();
        for (MatchCandidate match : matches) {
            String auditJson = serializeAudit(match);
            MatchStatus status = match.getInitialStatus();
            String method = match.getMatchMethod().tag();

            int borrowerRows = repository.markMatched(match.getBorrowerUid(), match.getLenderUid(),
                status, method, auditJson, matchedAt);
            int lenderRows = repository.markMatched(match.getLenderUid(), match.getBorrowerUid(),
                status, method, auditJson, matchedAt);

            if (borrowerRows != 1 || lenderRows != 1) {
                throw new IllegalStateException(String.format(
                    "Leg already matched or missing: lender=%s, borrower=%s", match.getLenderUid(), match.getBorrowerUid()));
            }
            log.debug("Stored match: lender={}, borrower={}, type={}, status={}",
                match.getLenderUid(), match.getBorrowerUid(), match.getMatchType(), status.dbValue());
        }
    }

    /**
     * Audit document stored on both legs: classification first, then the rule's evidence,
     * then the amounts.
     */
    Map<String, Object> auditDocument(MatchCandidate match) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("match_type", match.getMatchType().name());
        document.put("match_method", match.getMatchMethod().tag());
        document.put("rule", match.getRule());
        document.putAll(match.getAuditTrail().asMap());
        document.put("lender_amount", match.getAmount());
        document.put("borrower_amount", match.getAmount());
        return document;
    }

    private String serializeAudit(MatchCandidate match) {
        try {
            return objectMapper.writeValueAsString(auditDocument(match));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit info for lender " + match.getLenderUid(), e);
        }
    }
}
