package com.eon.credit.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Loan records, collateral records and per-subject aggregate counters.
 * Counter updates are relative ({@code col = col + ?}) and never recomputed from history.
 */
@Repository
@RequiredArgsConstructor
public class LedgerRepository {

    private final JdbcTemplate jdbc;

    /** Monotonic id per named sequence, starting at 1. */
    public long nextId(String sequence) {
        int updated = jdbc.update("UPDATE id_sequences SET next_value = next_value + 1 WHERE name = ?", sequence);
        if (updated == 0) {
            jdbc.update("INSERT INTO id_sequences (name, next_value) VALUES (?, ?)", sequence, 2L);
            return 1L;
        }
        Long next = jdbc.queryForObject("SELECT next_value FROM id_sequences WHERE name = ?", Long.class, sequence);
        return next - 1;
    }

    // ---- loans

    public void insertLoan(LoanRecord loan) {
        jdbc.update("""
            INSERT INTO loan_records (id, subject, principal, repaid_principal, opened_at, status, counterparty)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """, loan.id(), loan.subject(), loan.principal(), loan.repaidPrincipal(),
                loan.openedAt().getEpochSecond(), loan.status().name(), loan.counterparty());
    }

    public Optional<LoanRecord> findLoan(long loanId) {
        return jdbc.query("""
            SELECT id, subject, principal, repaid_principal, opened_at, status, counterparty
            FROM loan_records WHERE id = ?
        """, loanMapper(), loanId).stream().findFirst();
    }

    public List<LoanRecord> findLoansBySubject(String subject) {
        return jdbc.query("""
            SELECT id, subject, principal, repaid_principal, opened_at, status, counterparty
            FROM loan_records WHERE subject = ? ORDER BY id
        """, loanMapper(), subject);
    }

    public List<Long> findLoanIdsBySubject(String subject) {
        return jdbc.queryForList("SELECT id FROM loan_records WHERE subject = ? ORDER BY id", Long.class, subject);
    }

    public void updateRepayment(long loanId, BigDecimal repaidPrincipal, LoanStatus status) {
        jdbc.update("UPDATE loan_records SET repaid_principal = ?, status = ? WHERE id = ?",
                repaidPrincipal, status.name(), loanId);
    }

    public void updateStatus(long loanId, LoanStatus status) {
        jdbc.update("UPDATE loan_records SET status = ? WHERE id = ?", status.name(), loanId);
    }

    // ---- collateral

    public void insertCollateral(CollateralRecord record) {
        jdbc.update("""
            INSERT INTO collateral_records (loan_id, collateral_asset, collateral_value_usd, score_at_origination)
            VALUES (?, ?, ?, ?)
        """, record.loanId(), record.collateralAsset(), record.collateralValueUsd(), record.scoreAtOrigination());
    }

    public Optional<CollateralRecord> findCollateral(long loanId) {
        return jdbc.query("""
            SELECT loan_id, collateral_asset, collateral_value_usd, score_at_origination
            FROM collateral_records WHERE loan_id = ?
        """, (rs, i) -> new CollateralRecord(
                rs.getLong("loan_id"),
                rs.getString("collateral_asset"),
                rs.getBigDecimal("collateral_value_usd"),
                rs.getInt("score_at_origination")
        ), loanId).stream().findFirst();
    }

    /** Records the asset for the subject; false when it was already known. */
    public boolean markAssetUsed(String subject, String asset) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM subject_collateral_assets WHERE subject = ? AND asset = ?",
                Integer.class, subject, asset);
        if (n != null && n > 0) {
            return false;
        }
        jdbc.update("INSERT INTO subject_collateral_assets (subject, asset) VALUES (?, ?)", subject, asset);
        return true;
    }

    // ---- aggregate counters

    public AggregateCounters findCounters(String subject) {
        return jdbc.query("""
            SELECT subject, total_loans, repaid_loans, liquidated_loans, active_loans,
                   total_collateral_usd, total_borrowed_usd, max_ltv_borrow_count, unique_collateral_assets
            FROM aggregate_counters WHERE subject = ?
        """, countersMapper(), subject).stream().findFirst().orElseGet(() -> AggregateCounters.empty(subject));
    }

    public void ensureCounters(String subject) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM aggregate_counters WHERE subject = ?", Integer.class, subject);
        if (n == null || n == 0) {
            jdbc.update("""
                INSERT INTO aggregate_counters (subject, total_loans, repaid_loans, liquidated_loans, active_loans,
                    total_collateral_usd, total_borrowed_usd, max_ltv_borrow_count, unique_collateral_assets)
                VALUES (?, 0, 0, 0, 0, 0, 0, 0, 0)
            """, subject);
        }
    }

    public void countLoanOpened(String subject, BigDecimal principal) {
        jdbc.update("""
            UPDATE aggregate_counters
            SET total_loans = total_loans + 1, active_loans = active_loans + 1,
                total_borrowed_usd = total_borrowed_usd + ?
            WHERE subject = ?
        """, principal, subject);
    }

    public void countLoanRepaid(String subject) {
        jdbc.update("""
            UPDATE aggregate_counters
            SET repaid_loans = repaid_loans + 1, active_loans = active_loans - 1
            WHERE subject = ?
        """, subject);
    }

    public void countLoanLiquidated(String subject) {
        jdbc.update("""
            UPDATE aggregate_counters
            SET liquidated_loans = liquidated_loans + 1, active_loans = active_loans - 1
            WHERE subject = ?
        """, subject);
    }

    public void countCollateral(String subject, BigDecimal valueUsd, boolean atMaxLeverage, boolean newAsset) {
        jdbc.update("""
            UPDATE aggregate_counters
            SET total_collateral_usd = total_collateral_usd + ?,
                max_ltv_borrow_count = max_ltv_borrow_count + ?,
                unique_collateral_assets = unique_collateral_assets + ?
            WHERE subject = ?
        """, valueUsd, atMaxLeverage ? 1 : 0, newAsset ? 1 : 0, subject);
    }

    private RowMapper<LoanRecord> loanMapper() {
        return (rs, i) -> new LoanRecord(
                rs.getLong("id"),
                rs.getString("subject"),
                rs.getBigDecimal("principal"),
                rs.getBigDecimal("repaid_principal"),
                Instant.ofEpochSecond(rs.getLong("opened_at")),
                LoanStatus.valueOf(rs.getString("status")),
                rs.getString("counterparty")
        );
    }

    private RowMapper<AggregateCounters> countersMapper() {
        return (rs, i) -> new AggregateCounters(
                rs.getString("subject"),
                rs.getLong("total_loans"),
                rs.getLong("repaid_loans"),
                rs.getLong("liquidated_loans"),
                rs.getLong("active_loans"),
                rs.getBigDecimal("total_collateral_usd"),
                rs.getBigDecimal("total_borrowed_usd"),
                rs.getLong("max_ltv_borrow_count"),
                rs.getInt("unique_collateral_assets")
        );
    }
}
