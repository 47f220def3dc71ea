package com.flagship.interunit_recon.transaction;

import com.flagship.interunit_recon.transaction.dto.CompanyPairResponse;
import com.flagship.interunit_recon.transaction.dto.IngestResponse;
import com.flagship.interunit_recon.transaction.dto.UnmatchedLegResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Ingestion of parsed ledger statements, and the legs still waiting for a match.
 *
 * Records use the parser's field names (uid, particulars, debit, credit, entered_by,
 * lender_company, borrower_company, statement_month, statement_year, date, voucher_type,
 * voucher_no, pair_id). Amounts may be numbers or numeric strings.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionIngestService ingestService;
    private final TransactionQueryService queryService;

    @PostMapping
    public ResponseEntity<IngestResponse> ingest(@RequestBody List<Map<String, Object>> records) {
        log.info("Received transactions for ingestion: count={}", records.size());
        IngestionResult result = ingestService.ingest(records);
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.from(result));
    }

    /**
     * Unmatched legs, optionally narrowed to a company pair (either direction) and period.
     */
    @GetMapping("/unmatched")
    public ResponseEntity<List<UnmatchedLegResponse>> unmatched(
            @RequestParam(value = "lender_company", required = false) String lenderCompany,
            @RequestParam(value = "borrower_company", required = false) String borrowerCompany,
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "year", required = false) String year) {
        ReconciliationScope scope = ReconciliationScope.forCompanies(lenderCompany, borrowerCompany, month, year);
        return ResponseEntity.ok(toResponses(queryService.listUnmatched(scope)));
    }

    @GetMapping("/pairs/{pairId}/unmatched")
    public ResponseEntity<List<UnmatchedLegResponse>> unmatchedForPair(@PathVariable("pairId") String pairId) {
        return ResponseEntity.ok(toResponses(queryService.listUnmatched(ReconciliationScope.forPair(pairId))));
    }

    @GetMapping("/company-pairs")
    public ResponseEntity<List<CompanyPairResponse>> companyPairs() {
        List<CompanyPairResponse> pairs = queryService.unreconciledCompanyPairs().stream()
            .map(CompanyPairResponse::from)
            .toList();
        return ResponseEntity.ok(pairs);
    }

    private static List<UnmatchedLegResponse> toResponses(List<TransactionRecord> legs) {
        return legs.stream().map(UnmatchedLegResponse::from).toList();
    }
}
