package com.flagship.interunit_recon.transaction;

import lombok.Value;

import java.util.List;

@Value
public class IngestionResult {
    int received;
    int stored;
    List<String> duplicateUids;
    /**
     * Stored, but without exactly one positive amount; no run will ever pair them.
     */
    List<String> notMatchableUids;
}
