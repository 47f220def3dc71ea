package com.flagship.interunit_recon.matching;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed thresholds of the rule chain.
 */
@Value
@Builder
public class MatchingSettings {
    @Builder.Default
    double salaryJaccardThreshold = 0.3;
    @Builder.Default
    int commonTextMinWords = 20;
    @Builder.Default
    int commonTextMaxWords = 50;
    @Builder.Default
    int commonTextMinChars = 50;

    public static MatchingSettings defaults() {
        return MatchingSettings.builder().build();
    }
}
