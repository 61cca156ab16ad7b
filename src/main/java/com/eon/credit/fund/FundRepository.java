package com.eon.credit.fund;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class FundRepository {

    private final JdbcTemplate jdbc;

    public Totals findTotals(String asset) {
        return jdbc.query("""
            SELECT total_deposited, total_revenue, total_covered, default_count FROM fund_state WHERE asset = ?
        """, (rs, i) -> new Totals(
                rs.getBigDecimal("total_deposited"),
                rs.getBigDecimal("total_revenue"),
                rs.getBigDecimal("total_covered"),
                rs.getLong("default_count")
        ), asset).stream().findFirst().orElse(Totals.ZERO);
    }

    public void addDeposit(String asset, BigDecimal amount) {
        ensure(asset);
        jdbc.update("UPDATE fund_state SET total_deposited = total_deposited + ? WHERE asset = ?", amount, asset);
    }

    public void addRevenue(String asset, BigDecimal amount) {
        ensure(asset);
        jdbc.update("UPDATE fund_state SET total_revenue = total_revenue + ? WHERE asset = ?", amount, asset);
    }

    public void addCoverage(String asset, BigDecimal covered) {
        ensure(asset);
        jdbc.update("""
            UPDATE fund_state SET total_covered = total_covered + ?, default_count = default_count + 1 WHERE asset = ?
        """, covered, asset);
    }

    public void insertDefault(DefaultRecord r) {
        jdbc.update("""
            INSERT INTO default_history (loan_id, subject, lender, principal, loss_amount, covered_amount, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """, r.loanId(), r.subject(), r.lender(), r.principal(), r.lossAmount(), r.coveredAmount(),
                r.recordedAt().getEpochSecond());
    }

    public Optional<DefaultRecord> findDefault(long loanId) {
        return jdbc.query("""
            SELECT loan_id, subject, lender, principal, loss_amount, covered_amount, recorded_at
            FROM default_history WHERE loan_id = ?
        """, (rs, i) -> new DefaultRecord(
                rs.getLong("loan_id"),
                rs.getString("subject"),
                rs.getString("lender"),
                rs.getBigDecimal("principal"),
                rs.getBigDecimal("loss_amount"),
                rs.getBigDecimal("covered_amount"),
                Instant.ofEpochSecond(rs.getLong("recorded_at"))
        ), loanId).stream().findFirst();
    }

    private void ensure(String asset) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM fund_state WHERE asset = ?", Integer.class, asset);
        if (n == null || n == 0) {
            jdbc.update("""
                INSERT INTO fund_state (asset, total_deposited, total_revenue, total_covered, default_count)
                VALUES (?, 0, 0, 0, 0)
            """, asset);
        }
    }

    public record Totals(BigDecimal totalDeposited, BigDecimal totalRevenue, BigDecimal totalCovered, long defaultCount) {
        static final Totals ZERO = new Totals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);
    }
}
