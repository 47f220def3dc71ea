package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.bank.BankDirectory;
import com.flagship.interunit_recon.matching.MatchingEngine;
import com.flagship.interunit_recon.matching.MatchingResult;
import com.flagship.interunit_recon.matching.MatchingSettings;
import com.flagship.interunit_recon.reconciliation.exception.TransactionNotFoundException;
import com.flagship.interunit_recon.transaction.IngestionResult;
import com.flagship.interunit_recon.transaction.MatchStatus;
import com.flagship.interunit_recon.transaction.ReconciliationScope;
import com.flagship.interunit_recon.transaction.TransactionController;
import com.flagship.interunit_recon.transaction.CompanyPair;
import com.flagship.interunit_recon.transaction.TransactionIngestService;
import com.flagship.interunit_recon.transaction.TransactionQueryService;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests: request mapping, validation and error translation.
 */
@WebMvcTest(controllers = {ReconciliationController.class, MatchController.class, TransactionController.class})
class ReconciliationControllerTest {

    private final MatchingEngine engine = MatchingEngine.withDefaultRules(
        BankDirectory.of(Map.of("MDBL", "Midland Bank")), MatchingSettings.defaults());

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconciliationService reconciliationService;

    @MockBean
    private MatchReviewService reviewService;

    @MockBean
    private TransactionIngestService ingestService;

    @MockBean
    private TransactionQueryService queryService;

    private static ReconciliationSummary emptySummary(String scope) {
        return ReconciliationSummary.of("run-1", scope, 0, MatchingResult.empty(), 3);
    }

    @Test
    @DisplayName("Run request is turned into a company scope and the correlation id is echoed")
    void testRunWithScope() throws Exception {
        when(reconciliationService.reconcile(any())).thenReturn(emptySummary("GEL<->GPL year=2024"));

        mockMvc.perform(post("/api/reconciliation/runs")
                .header("X-Correlation-ID", "corr-42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lender_company\":\"GEL\",\"borrower_company\":\"GPL\",\"year\":\"2024\"}"))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Correlation-ID", "corr-42"))
            .andExpect(jsonPath("$.run_id").value("run-1"))
            .andExpect(jsonPath("$.matches").value(0));

        ArgumentCaptor<ReconciliationScope> scope = ArgumentCaptor.forClass(ReconciliationScope.class);
        verify(reconciliationService).reconcile(scope.capture());
        assertEquals("GEL", scope.getValue().getLenderCompany());
        assertEquals("GPL", scope.getValue().getBorrowerCompany());
        assertEquals("2024", scope.getValue().getYear());
    }

    @Test
    @DisplayName("Run without a body covers every leg")
    void testRunWithoutBody() throws Exception {
        when(reconciliationService.reconcile(any())).thenReturn(emptySummary("all companies"));

        mockMvc.perform(post("/api/reconciliation/runs"))
            .andExpect(status().isOk())
            .andExpect(header().exists("X-Correlation-ID"));

        verify(reconciliationService).reconcile(ReconciliationScope.all());
    }

    @Test
    @DisplayName("A single company is rejected")
    void testSingleCompanyRejected() throws Exception {
        mockMvc.perform(post("/api/reconciliation/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lender_company\":\"GEL\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));

        verify(reconciliationService, never()).reconcile(any());
    }

    @Test
    @DisplayName("A malformed year fails validation")
    void testInvalidYear() throws Exception {
        mockMvc.perform(post("/api/reconciliation/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"year\":\"24\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.year").value("Year must have four digits"));
    }

    @Test
    @DisplayName("Preview matches the posted records")
    void testPreview() throws Exception {
        when(reconciliationService.preview(anyList()))
            .thenAnswer(invocation -> engine.match(invocation.<List<TransactionRecord>>getArgument(0)));

        mockMvc.perform(post("/api/reconciliation/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[" +
                    "{\"uid\":\"L1\",\"particulars\":\"ABC/PO/123/456 payment\",\"debit\":5000}," +
                    "{\"uid\":\"B1\",\"particulars\":\"Settling ABC/PO/123/456\",\"credit\":\"5,000.00\"}," +
                    "{\"uid\":\"X1\",\"particulars\":\"Opening balance\"}" +
                    "]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matches[0].lender_uid").value("L1"))
            .andExpect(jsonPath("$.matches[0].borrower_uid").value("B1"))
            .andExpect(jsonPath("$.matches[0].match_type").value("PO"))
            .andExpect(jsonPath("$.matches[0].status").value("confirmed"))
            .andExpect(jsonPath("$.matches[0].audit_trail.po").value("ABC/PO/123/456"))
            .andExpect(jsonPath("$.excluded_uids[0]").value("X1"));
    }

    @Test
    @DisplayName("Preview refuses records without a uid")
    void testPreviewMissingUid() throws Exception {
        mockMvc.perform(post("/api/reconciliation/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"particulars\":\"no uid\",\"debit\":10}]"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Reset reports the number of legs cleared")
    void testReset() throws Exception {
        when(reviewService.reset(any())).thenReturn(6);

        mockMvc.perform(post("/api/reconciliation/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("all companies"))
            .andExpect(jsonPath("$.legs_reset").value(6));
    }

    @Test
    @DisplayName("Accepting an unknown uid returns 404")
    void testAcceptNotFound() throws Exception {
        when(reviewService.accept(eq("NOPE"), isNull())).thenThrow(new TransactionNotFoundException("NOPE"));

        mockMvc.perform(post("/api/matches/NOPE/accept"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Transaction not found: NOPE"));
    }

    @Test
    @DisplayName("Rejecting an unmatched leg returns 409")
    void testRejectConflict() throws Exception {
        when(reviewService.reject(eq("L4"), eq("auditor")))
            .thenThrow(new IllegalStateException("Transaction is not matched: L4"));

        mockMvc.perform(post("/api/matches/L4/reject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reviewed_by\":\"auditor\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Invalid State"));
    }

    @Test
    @DisplayName("Accepting returns the confirmed pair")
    void testAccept() throws Exception {
        when(reviewService.accept(eq("B3"), eq("auditor")))
            .thenReturn(new ReviewOutcome("B3", "L3", MatchStatus.CONFIRMED));

        mockMvc.perform(post("/api/matches/B3/accept")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reviewed_by\":\"auditor\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.counterpart_uid").value("L3"))
            .andExpect(jsonPath("$.status").value("confirmed"));
    }

    @Test
    @DisplayName("Unknown status filter returns 400")
    void testUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/matches").param("status", "lost"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Ingestion returns 201 with the stored count")
    void testIngest() throws Exception {
        when(ingestService.ingest(anyList())).thenReturn(new IngestionResult(2, 1, List.of("L1"), List.of()));

        mockMvc.perform(post("/api/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"uid\":\"L1\",\"debit\":10},{\"uid\":\"L9\",\"debit\":20}]"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.stored").value(1))
            .andExpect(jsonPath("$.duplicate_uids[0]").value("L1"));
    }

    @Test
    @DisplayName("Unmatched legs are listed for a company pair")
    void testListUnmatched() throws Exception {
        when(queryService.listUnmatched(any())).thenReturn(List.of(
            TransactionRecord.builder().uid("L4").particulars("ref A123").debit(new java.math.BigDecimal("700"))
                .lenderCompany("GEL").borrowerCompany("GPL").build()));

        mockMvc.perform(get("/api/transactions/unmatched")
                .param("lender_company", "GEL")
                .param("borrower_company", "GPL")
                .param("month", "March"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].uid").value("L4"))
            .andExpect(jsonPath("$[0].role").value("lender"))
            .andExpect(jsonPath("$[0].debit").value(700));

        verify(queryService).listUnmatched(ReconciliationScope.forCompanies("GEL", "GPL", "March", null));
    }

    @Test
    @DisplayName("Unmatched listing needs both companies or none")
    void testListUnmatchedSingleCompany() throws Exception {
        mockMvc.perform(get("/api/transactions/unmatched").param("lender_company", "GEL"))
            .andExpect(status().isBadRequest());

        verify(queryService, never()).listUnmatched(any());
    }

    @Test
    @DisplayName("Unmatched legs are listed for an upload pair")
    void testListUnmatchedForPair() throws Exception {
        when(queryService.listUnmatched(ReconciliationScope.forPair("P-1"))).thenReturn(List.of());

        mockMvc.perform(get("/api/transactions/pairs/P-1/unmatched"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("Unreconciled company pairs are described with their scope")
    void testCompanyPairs() throws Exception {
        when(queryService.unreconciledCompanyPairs())
            .thenReturn(List.of(new CompanyPair("GEL", "GPL", "March", "2024", 3)));

        mockMvc.perform(get("/api/transactions/company-pairs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].lender_company").value("GEL"))
            .andExpect(jsonPath("$[0].unmatched_legs").value(3))
            .andExpect(jsonPath("$[0].description").value("GEL<->GPL month=March year=2024"));
    }
}
