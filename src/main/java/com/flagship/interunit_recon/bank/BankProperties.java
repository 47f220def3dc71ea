package com.flagship.interunit_recon.bank;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Bank alias configuration ({@code recon.banks}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "recon")
public class BankProperties {

    private List<Bank> banks = new ArrayList<>();

    @Getter
    @Setter
    public static class Bank {
        private String name;
        private List<String> aliases = new ArrayList<>();
    }
}
