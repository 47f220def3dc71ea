package com.flagship.interunit_recon.bank;

import java.util.Optional;

/**
 * Resolves the bank codes and names found in narrations to a canonical bank name.
 */
public interface BankNameLookup {

    /**
     * Canonical name for a known code or name.
     */
    Optional<String> find(String codeOrName);

    /**
     * Canonical name, or the input unchanged when the code is unknown. Null stays null.
     */
    default String normalize(String codeOrName) {
        if (codeOrName == null) {
            return null;
        }
        return find(codeOrName).orElse(codeOrName);
    }
}
