package com.flagship.interunit_recon.config;

import com.flagship.interunit_recon.bank.BankDirectory;
import com.flagship.interunit_recon.bank.BankProperties;
import com.flagship.interunit_recon.matching.MatchRule;
import com.flagship.interunit_recon.matching.MatchingEngine;
import com.flagship.interunit_recon.matching.MatchingSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the matching engine from configuration.
 *
 * The bank directory is built once at startup and injected into the engine, so the
 * engine itself never reads global state.
 */
@Configuration
@EnableConfigurationProperties({BankProperties.class, MatchingProperties.class})
@Slf4j
public class MatchingConfig {

    @Bean
    public BankDirectory bankDirectory(BankProperties properties) {
        BankDirectory directory = BankDirectory.fromBanks(properties.getBanks());
        log.info("Bank directory loaded: banks={}, aliases={}", properties.getBanks().size(), directory.size());
        return directory;
    }

    @Bean
    public MatchingSettings matchingSettings(MatchingProperties properties) {
        MatchingSettings settings = properties.toSettings();
        log.info("Matching settings: salaryJaccardThreshold={}, commonText={}..{} words, minChars={}",
            settings.getSalaryJaccardThreshold(), settings.getCommonTextMinWords(),
            settings.getCommonTextMaxWords(), settings.getCommonTextMinChars());
        return settings;
    }

    @Bean
    public MatchingEngine matchingEngine(BankDirectory bankDirectory, MatchingSettings settings) {
        MatchingEngine engine = MatchingEngine.withDefaultRules(bankDirectory, settings);
        log.info("Matching engine ready: rules={}", engine.getRules().stream().map(MatchRule::name).toList());
        return engine;
    }
}
