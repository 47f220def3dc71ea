package com.flagship.interunit_recon.transaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stores normalized ledger records handed over by the statement parser.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionIngestService {

    private final TransactionRepository repository;

    /**
     * Converts and stores a batch. Duplicate uids are skipped, not overwritten.
     *
     * @throws IllegalArgumentException if a record has no uid; nothing is stored then
     */
    @Transactional
    public IngestionResult ingest(List<Map<String, Object>> rows) {
        long startTime = System.currentTimeMillis();
        List<TransactionRecord> records = rows.stream()
            .map(TransactionRecords::fromMap)
            .toList();

        int stored = 0;
        List<String> duplicates = new ArrayList<>();
        List<String> notMatchable = new ArrayList<>();
        for (TransactionRecord record : records) {
            if (repository.insert(record) == 1) {
                stored++;
            } else {
                duplicates.add(record.getUid());
                continue;
            }
            if (record.getRole() == LegRole.NONE) {
                notMatchable.add(record.getUid());
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Ingested transactions: received={}, stored={}, duplicates={}, notMatchable={}, duration={}ms",
            records.size(), stored, duplicates.size(), notMatchable.size(), duration);
        if (!notMatchable.isEmpty()) {
            log.warn("Records without a single positive amount: uids={}", notMatchable);
        }
        return new IngestionResult(records.size(), stored, List.copyOf(duplicates), List.copyOf(notMatchable));
    }
}
