package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.reconciliation.dto.PreviewResponse;
import com.flagship.interunit_recon.reconciliation.dto.ReconcileRequest;
import com.flagship.interunit_recon.reconciliation.dto.ReconcileResponse;
import com.flagship.interunit_recon.reconciliation.dto.ResetResponse;
import com.flagship.interunit_recon.transaction.ReconciliationScope;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import com.flagship.interunit_recon.transaction.TransactionRecords;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Starts reconciliation runs.
 *
 * Runs work on stored legs and persist their matches. The preview endpoint matches the
 * records in the request body only and stores nothing.
 */
@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final MatchReviewService reviewService;

    @PostMapping("/runs")
    public ResponseEntity<ReconcileResponse> run(@Valid @RequestBody(required = false) ReconcileRequest request) {
        ReconciliationScope scope = request != null ? request.toScope() : ReconciliationScope.all();
        log.info("Received reconciliation request: scope={}", scope.describe());
        return ResponseEntity.ok(ReconcileResponse.from(reconciliationService.reconcile(scope)));
    }

    @PostMapping("/pairs/{pairId}/runs")
    public ResponseEntity<ReconcileResponse> runPair(@PathVariable("pairId") String pairId) {
        log.info("Received reconciliation request: pair={}", pairId);
        return ResponseEntity.ok(ReconcileResponse.from(reconciliationService.reconcilePair(pairId)));
    }

    @PostMapping("/preview")
    public ResponseEntity<PreviewResponse> preview(@RequestBody List<Map<String, Object>> records) {
        List<TransactionRecord> parsed = records.stream()
            .map(TransactionRecords::fromMap)
            .toList();
        return ResponseEntity.ok(PreviewResponse.from(reconciliationService.preview(parsed)));
    }

    @PostMapping("/reset")
    public ResponseEntity<ResetResponse> reset(@Valid @RequestBody(required = false) ReconcileRequest request) {
        ReconciliationScope scope = request != null ? request.toScope() : ReconciliationScope.all();
        int legs = reviewService.reset(scope);
        return ResponseEntity.ok(new ResetResponse(scope.describe(), legs));
    }
}
