package com.flagship.interunit_recon.config;

import com.flagship.interunit_recon.matching.MatchingSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rule chain thresholds ({@code recon.matching}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "recon.matching")
public class MatchingProperties {

    private double salaryJaccardThreshold = 0.3;
    private CommonText commonText = new CommonText();

    public MatchingSettings toSettings() {
        return MatchingSettings.builder()
            .salaryJaccardThreshold(salaryJaccardThreshold)
            .commonTextMinWords(commonText.getMinWords())
            .commonTextMaxWords(commonText.getMaxWords())
            .commonTextMinChars(commonText.getMinChars())
            .build();
    }

    @Getter
    @Setter
    public static class CommonText {
        private int minWords = 20;
        private int maxWords = 50;
        private int minChars = 50;
    }
}
