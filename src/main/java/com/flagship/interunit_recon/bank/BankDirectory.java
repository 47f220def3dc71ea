package com.flagship.interunit_recon.bank;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable bank alias table.
 *
 * Built once from configuration and injected into the extractors that need it.
 * Lookups are case-insensitive and ignore surrounding whitespace.
 */
public final class BankDirectory implements BankNameLookup {

    private final Map<String, String> canonicalByAlias;

    private BankDirectory(Map<String, String> canonicalByAlias) {
        this.canonicalByAlias = Collections.unmodifiableMap(canonicalByAlias);
    }

    public static BankDirectory empty() {
        return new BankDirectory(Map.of());
    }

    public static BankDirectory of(Map<String, String> aliases) {
        Map<String, String> table = new LinkedHashMap<>();
        aliases.forEach((alias, name) -> table.put(key(alias), name.trim().toUpperCase(Locale.ROOT)));
        return new BankDirectory(table);
    }

    /**
     * Builds the table from configured banks. Every bank is also reachable by its own name.
     *
     * @throws IllegalArgumentException if a bank has no name or an alias points at two banks
     */
    public static BankDirectory fromBanks(List<BankProperties.Bank> banks) {
        Map<String, String> table = new LinkedHashMap<>();
        for (BankProperties.Bank bank : banks) {
            if (bank.getName() == null || bank.getName().isBlank()) {
                throw new IllegalArgumentException("Configured bank is missing a name");
            }
            String canonical = bank.getName().trim().toUpperCase(Locale.ROOT);
            register(table, canonical, canonical);
            for (String alias : bank.getAliases()) {
                register(table, alias, canonical);
            }
        }
        return new BankDirectory(table);
    }

    @Override
    public Optional<String> find(String codeOrName) {
        if (codeOrName == null || codeOrName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByAlias.get(key(codeOrName)));
    }

    public int size() {
        return canonicalByAlias.size();
    }

    private static void register(Map<String, String> table, String alias, String canonical) {
        String previous = table.putIfAbsent(key(alias), canonical);
        if (previous != null && !previous.equals(canonical)) {
            throw new IllegalArgumentException(
                String.format("Bank alias %s maps to both %s and %s", alias, previous, canonical));
        }
    }

    private static String key(String alias) {
        return alias.trim().toUpperCase(Locale.ROOT);
    }
}
