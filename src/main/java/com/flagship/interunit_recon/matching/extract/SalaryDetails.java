package com.flagship.interunit_recon.matching.extract;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Salary descriptor extracted from a narration.
 * Person and period are best-effort and may be null.
 */
@Value
@Builder
public class SalaryDetails {
    String personName;
    String personId;
    String personCombined;
    String period;
    boolean salary;
    @Builder.Default
    List<String> matchedKeywords = List.of();

    /**
     * The most specific person label available: {@code <Name>-ID : <id>} when known, else the name.
     */
    public String personLabel() {
        return personCombined != null ? personCombined : personName;
    }
}
