package com.flagship.interunit_recon.transaction;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Converts loosely typed record mappings from the ledger parser into {@link TransactionRecord}s.
 *
 * Amounts may arrive as numbers, numeric strings, null or empty strings. Anything that
 * does not parse is treated as absent, which leaves the record unmatchable instead of
 * failing the batch.
 */
@Slf4j
public final class TransactionRecords {

    private TransactionRecords() {
    }

    /**
     * @throws IllegalArgumentException if the mapping has no uid
     */
    public static TransactionRecord fromMap(Map<String, ?> row) {
        String uid = text(row, "uid");
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("Transaction record is missing a uid");
        }
        return TransactionRecord.builder()
            .uid(uid.trim())
            .particulars(text(row, "particulars"))
            .debit(parseAmount(uid, "debit", row.get("debit")).orElse(null))
            .credit(parseAmount(uid, "credit", row.get("credit")).orElse(null))
            .enteredBy(text(row, "entered_by"))
            .lenderCompany(text(row, "lender_company"))
            .borrowerCompany(text(row, "borrower_company"))
            .statementMonth(text(row, "statement_month"))
            .statementYear(text(row, "statement_year"))
            .txnDate(parseDate(uid, text(row, "date")))
            .voucherType(text(row, "voucher_type"))
            .voucherNo(text(row, "voucher_no"))
            .pairId(text(row, "pair_id"))
            .build();
    }

    /**
     * Parses an amount cell. Empty for null, blank or non-numeric values.
     */
    public static Optional<BigDecimal> parseAmount(String uid, String column, Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        String value = raw.toString().replace(",", "").trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric amount: uid={}, column={}, value={}", uid, column, raw);
            return Optional.empty();
        }
    }

    private static LocalDate parseDate(String uid, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable date: uid={}, value={}", uid, value);
            return null;
        }
    }

    private static String text(Map<String, ?> row, String key) {
        Object value = row.get(key);
        return value != null ? value.toString() : null;
    }
}
