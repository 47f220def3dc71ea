package com.flagship.interunit_recon.reconciliation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.interunit_recon.config.JacksonConfig;
import com.flagship.interunit_recon.matching.AuditTrail;
import com.flagship.interunit_recon.matching.MatchCandidate;
import com.flagship.interunit_recon.matching.MatchType;
import com.flagship.interunit_recon.transaction.MatchStatus;
import com.flagship.interunit_recon.transaction.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Persistence of engine matches against a mocked repository.
 */
class MatchPersistenceServiceTest {

    private TransactionRepository repository;
    private MatchPersistenceService service;

    private final MatchCandidate poMatch = MatchCandidate.builder()
        .lenderUid("L1")
        .borrowerUid("B1")
        .matchType(MatchType.PO)
        .amount(new BigDecimal("5000.00"))
        .auditTrail(AuditTrail.builder().put("po", "ABC/PO/123/456").build())
        .rule("po")
        .build();

    @BeforeEach
    void setUp() {
        repository = mock(TransactionRepository.class);
        ObjectMapper objectMapper = new JacksonConfig().objectMapper();
        service = new MatchPersistenceService(repository, objectMapper);
    }

    @Test
    @DisplayName("Both legs receive the same status, method and audit JSON")
    void testBothLegsWritten() {
        when(repository.markMatched(anyString(), anyString(), any(), anyString(), anyString(), any(Instant.class)))
            .thenReturn(1);

        service.persist(List.of(poMatch));

        ArgumentCaptor<String> lenderAudit = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> borrowerAudit = ArgumentCaptor.forClass(String.class);
        verify(repository).markMatched(eq("B1"), eq("L1"), eq(MatchStatus.CONFIRMED), eq("reference_match"),
            borrowerAudit.capture(), any(Instant.class));
        verify(repository).markMatched(eq("L1"), eq("B1"), eq(MatchStatus.CONFIRMED), eq("reference_match"),
            lenderAudit.capture(), any(Instant.class));

        assertEquals(lenderAudit.getValue(), borrowerAudit.getValue());
        assertEquals(
            "{\"match_type\":\"PO\",\"match_method\":\"reference_match\",\"rule\":\"po\"," +
            "\"po\":\"ABC/PO/123/456\",\"lender_amount\":5000.00,\"borrower_amount\":5000.00}",
            lenderAudit.getValue());
    }

    @Test
    @DisplayName("Audit document lists classification, evidence, then amounts")
    void testAuditDocumentOrder() {
        Map<String, Object> document = service.auditDocument(poMatch);

        assertEquals(List.of("match_type", "match_method", "rule", "po", "lender_amount", "borrower_amount"),
            List.copyOf(document.keySet()));
    }

    @Test
    @DisplayName("A leg taken by someone else fails the batch")
    void testLegAlreadyMatched() {
        when(repository.markMatched(eq("B1"), anyString(), any(), anyString(), anyString(), any(Instant.class)))
            .thenReturn(1);
        when(repository.markMatched(eq("L1"), anyString(), any(), anyString(), anyString(), any(Instant.class)))
            .thenReturn(0);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> service.persist(List.of(poMatch)));
        assertTrue(e.getMessage().contains("lender=L1"));
    }
}
