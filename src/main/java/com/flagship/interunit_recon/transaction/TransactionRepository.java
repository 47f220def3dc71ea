package com.flagship.interunit_recon.transaction;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JDBC access to {@code ledger_transactions}.
 *
 * Match columns are always written for both legs of a pair by the calling service,
 * inside one transaction. Every update is guarded by the state it expects, and the
 * returned row count tells the caller whether the guard held.
 */
@Repository
public class TransactionRepository {

    private static final String RECORD_COLUMNS =
        "uid, lender_company, borrower_company, statement_month, statement_year, txn_date, particulars, " +
        "voucher_type, voucher_no, debit, credit, entered_by, pair_id";

    private static final String LEG_COLUMNS = RECORD_COLUMNS +
        ", match_status, matched_with, match_method, date_matched, audit_info::text AS audit_info";

    private static final String CLEAR_MATCH =
        "match_status = 'unmatched', matched_with = NULL, match_method = NULL, audit_info = NULL, date_matched = NULL";

    private final JdbcTemplate jdbcTemplate;

    public TransactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Stores a normalized record as an unmatched leg.
     *
     * @return 1 if stored, 0 if a row with the same uid already exists
     */
    public int insert(TransactionRecord record) {
        return jdbcTemplate.update(
            "INSERT INTO ledger_transactions (" + RECORD_COLUMNS + ", role) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT (uid) DO NOTHING",
            record.getUid(),
            record.getLenderCompany(),
            record.getBorrowerCompany(),
            record.getStatementMonth(),
            record.getStatementYear(),
            record.getTxnDate(),
            record.getParticulars(),
            record.getVoucherType(),
            record.getVoucherNo(),
            record.getDebit(),
            record.getCredit(),
            record.getEnteredBy(),
            record.getPairId(),
            record.getRole().name().toLowerCase(Locale.ROOT)
        );
    }

    /**
     * Unmatched legs in the scope, ordered by lender company, newest date first, then uid.
     * The order is what makes greedy matching runs repeatable.
     */
    public List<TransactionRecord> findUnmatched(ReconciliationScope scope) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT " + RECORD_COLUMNS + " FROM ledger_transactions WHERE match_status = 'unmatched'" +
            scopeFilter(scope, args) +
            " ORDER BY lender_company ASC, txn_date DESC NULLS LAST, uid ASC";
        return jdbcTemplate.query(sql, (rs, rowNum) -> mapRecord(rs, ""), args.toArray());
    }

    public Optional<LedgerLeg> findByUid(String uid) {
        List<LedgerLeg> legs = jdbcTemplate.query(
            "SELECT " + LEG_COLUMNS + " FROM ledger_transactions WHERE uid = ?",
            LEG_ROW_MAPPER,
            uid
        );
        return legs.stream().findFirst();
    }

    /**
     * Matched lender legs with the given status, each joined with its borrower leg.
     */
    public List<MatchedLeg> findMatchedLegs(MatchStatus status) {
        String sql =
            "SELECT t1.uid, t1.lender_company, t1.borrower_company, t1.statement_month, t1.statement_year, " +
            "t1.txn_date, t1.particulars, t1.voucher_type, t1.voucher_no, t1.debit, t1.credit, t1.entered_by, " +
            "t1.pair_id, t1.match_status, t1.matched_with, t1.match_method, t1.date_matched, " +
            "t1.audit_info::text AS audit_info, " +
            "t2.uid AS c_uid, t2.lender_company AS c_lender_company, t2.borrower_company AS c_borrower_company, " +
            "t2.statement_month AS c_statement_month, t2.statement_year AS c_statement_year, " +
            "t2.txn_date AS c_txn_date, t2.particulars AS c_particulars, t2.voucher_type AS c_voucher_type, " +
            "t2.voucher_no AS c_voucher_no, t2.debit AS c_debit, t2.credit AS c_credit, " +
            "t2.entered_by AS c_entered_by, t2.pair_id AS c_pair_id " +
            "FROM ledger_transactions t1 " +
            "LEFT JOIN ledger_transactions t2 ON t1.matched_with = t2.uid " +
            "WHERE t1.match_status = ? AND t1.role = 'lender' " +
            "ORDER BY t1.date_matched DESC, t1.uid ASC";

        return jdbcTemplate.query(sql, (rs, rowNum) -> new MatchedLeg(
            LEG_ROW_MAPPER.mapRow(rs, rowNum),
            rs.getString("c_uid") != null ? mapRecord(rs, "c_") : null
        ), status.dbValue());
    }

    /**
     * Company pairs with at least two unmatched legs in a statement period. A pair is reported
     * once, with its companies in alphabetical order.
     */
    public List<CompanyPair> findUnreconciledCompanyPairs() {
        return jdbcTemplate.query(
            "SELECT LEAST(lender_company, borrower_company) AS company1, " +
            "GREATEST(lender_company, borrower_company) AS company2, " +
            "statement_month, statement_year, COUNT(*) AS leg_count " +
            "FROM ledger_transactions " +
            "WHERE match_status = 'unmatched' AND lender_company IS NOT NULL AND borrower_company IS NOT NULL " +
            "AND lender_company <> borrower_company " +
            "GROUP BY LEAST(lender_company, borrower_company), GREATEST(lender_company, borrower_company), " +
            "statement_month, statement_year " +
            "HAVING COUNT(*) >= 2 " +
            "ORDER BY statement_year ASC, statement_month ASC, company1 ASC, company2 ASC",
            (rs, rowNum) -> new CompanyPair(
                rs.getString("company1"),
                rs.getString("company2"),
                rs.getString("statement_month"),
                rs.getString("statement_year"),
                rs.getLong("leg_count"))
        );
    }

    public long countByStatus(MatchStatus status) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE match_status = ?",
            Long.class,
            status.dbValue()
        );
        return count != null ? count : 0L;
    }

    /**
     * Marks one leg as matched, only if it is still unmatched.
     *
     * @return number of rows updated (0 when the leg was already taken or does not exist)
     */
    public int markMatched(String uid, String matchedWith, MatchStatus status, String matchMethod,
                           String auditJson, Instant matchedAt) {
        return jdbcTemplate.update(
            "UPDATE ledger_transactions SET match_status = ?, matched_with = ?, match_method = ?, " +
            "audit_info = ?::jsonb, date_matched = ? WHERE uid = ? AND match_status = 'unmatched'",
            status.dbValue(),
            matchedWith,
            matchMethod,
            auditJson,
            Timestamp.from(matchedAt),
            uid
        );
    }

    /**
     * Changes the status of a leg that still points at the given counterpart.
     */
    public int updateStatus(String uid, String matchedWith, MatchStatus status) {
        return jdbcTemplate.update(
            "UPDATE ledger_transactions SET match_status = ? WHERE uid = ? AND matched_with = ?",
            status.dbValue(),
            uid,
            matchedWith
        );
    }

    /**
     * Returns a leg that still points at the given counterpart to the unmatched state.
     */
    public int clearMatch(String uid, String matchedWith) {
        return jdbcTemplate.update(
            "UPDATE ledger_transactions SET " + CLEAR_MATCH + " WHERE uid = ? AND matched_with = ?",
            uid,
            matchedWith
        );
    }

    /**
     * Clears every match in the scope. Counterparts outside the scope are cleared too,
     * so no leg is left pointing at an unmatched partner.
     *
     * @return number of legs reset
     */
    public int resetMatches(ReconciliationScope scope) {
        List<Object> args = new ArrayList<>();
        String scoped = "SELECT uid FROM ledger_transactions WHERE match_status <> 'unmatched'" +
            scopeFilter(scope, args);
        List<Object> allArgs = new ArrayList<>(args);
        allArgs.addAll(args);
        return jdbcTemplate.update(
            "UPDATE ledger_transactions SET " + CLEAR_MATCH +
            " WHERE uid IN (" + scoped + ") OR matched_with IN (" + scoped + ")",
            allArgs.toArray()
        );
    }

    private static String scopeFilter(ReconciliationScope scope, List<Object> args) {
        StringBuilder filter = new StringBuilder();
        if (scope.hasCompanies()) {
            filter.append(" AND ((lender_company = ? AND borrower_company = ?)")
                .append(" OR (lender_company = ? AND borrower_company = ?))");
            args.add(scope.getLenderCompany());
            args.add(scope.getBorrowerCompany());
            args.add(scope.getBorrowerCompany());
            args.add(scope.getLenderCompany());
        }
        if (scope.getMonth() != null) {
            filter.append(" AND statement_month = ?");
            args.add(scope.getMonth());
        }
        if (scope.getYear() != null) {
            filter.append(" AND statement_year = ?");
            args.add(scope.getYear());
        }
        if (scope.getPairId() != null) {
            filter.append(" AND pair_id = ?");
            args.add(scope.getPairId());
        }
        return filter.toString();
    }

    private static final RowMapper<LedgerLeg> LEG_ROW_MAPPER = (rs, rowNum) -> {
        Timestamp dateMatched = rs.getTimestamp("date_matched");
        return LedgerLeg.builder()
            .record(mapRecord(rs, ""))
            .status(MatchStatus.fromDbValue(rs.getString("match_status")))
            .matchedWith(rs.getString("matched_with"))
            .matchMethod(rs.getString("match_method"))
            .dateMatched(dateMatched != null ? dateMatched.toInstant() : null)
            .auditInfo(rs.getString("audit_info"))
            .build();
    };

    private static TransactionRecord mapRecord(ResultSet rs, String prefix) throws SQLException {
        java.sql.Date txnDate = rs.getDate(prefix + "txn_date");
        LocalDate date = txnDate != null ? txnDate.toLocalDate() : null;
        return TransactionRecord.builder()
            .uid(rs.getString(prefix + "uid"))
            .lenderCompany(rs.getString(prefix + "lender_company"))
            .borrowerCompany(rs.getString(prefix + "borrower_company"))
            .statementMonth(rs.getString(prefix + "statement_month"))
            .statementYear(rs.getString(prefix + "statement_year"))
            .txnDate(date)
            .particulars(rs.getString(prefix + "particulars"))
            .voucherType(rs.getString(prefix + "voucher_type"))
            .voucherNo(rs.getString(prefix + "voucher_no"))
            .debit(rs.getBigDecimal(prefix + "debit"))
            .credit(rs.getBigDecimal(prefix + "credit"))
            .enteredBy(rs.getString(prefix + "entered_by"))
            .pairId(rs.getString(prefix + "pair_id"))
            .build();
    }
}
