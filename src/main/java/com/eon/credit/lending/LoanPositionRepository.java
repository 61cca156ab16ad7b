package com.eon.credit.lending;

import com.eon.credit.ledger.LoanStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class LoanPositionRepository {

    private static final String COLUMNS = """
            loan_id, subject, borrow_asset, collateral_asset, collateral_amount, outstanding_principal,
            accrued_interest, interest_rate, liquidation_threshold, opened_at, interest_checkpoint, status
            """;

    private final JdbcTemplate jdbc;

    public void insert(LoanPosition p) {
        jdbc.update("INSERT INTO loan_positions (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                p.loanId(), p.subject(), p.borrowAsset(), p.collateralAsset(), p.collateralAmount(),
                p.outstandingPrincipal(), p.accruedInterest(), p.interestRate(), p.liquidationThreshold(),
                p.openedAt().getEpochSecond(), p.interestCheckpoint().getEpochSecond(), p.status().name());
    }

    public void update(LoanPosition p) {
        jdbc.update("""
            UPDATE loan_positions
            SET collateral_amount = ?, outstanding_principal = ?, accrued_interest = ?,
                interest_checkpoint = ?, status = ?
            WHERE loan_id = ?
        """, p.collateralAmount(), p.outstandingPrincipal(), p.accruedInterest(),
                p.interestCheckpoint().getEpochSecond(), p.status().name(), p.loanId());
    }

    public Optional<LoanPosition> find(long loanId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM loan_positions WHERE loan_id = ?", rm(), loanId)
                .stream().findFirst();
    }

    public List<LoanPosition> findActive() {
        return jdbc.query("SELECT " + COLUMNS + " FROM loan_positions WHERE status = ? ORDER BY loan_id",
                rm(), LoanStatus.ACTIVE.name());
    }

    public List<LoanPosition> findBySubject(String subject) {
        return jdbc.query("SELECT " + COLUMNS + " FROM loan_positions WHERE subject = ? ORDER BY loan_id", rm(), subject);
    }

    private RowMapper<LoanPosition> rm() {
        return (rs, i) -> new LoanPosition(
                rs.getLong("loan_id"),
                rs.getString("subject"),
                rs.getString("borrow_asset"),
                rs.getString("collateral_asset"),
                rs.getBigDecimal("collateral_amount"),
                rs.getBigDecimal("outstanding_principal"),
                rs.getBigDecimal("accrued_interest"),
                rs.getBigDecimal("interest_rate"),
                rs.getBigDecimal("liquidation_threshold"),
                Instant.ofEpochSecond(rs.getLong("opened_at")),
                Instant.ofEpochSecond(rs.getLong("interest_checkpoint")),
                LoanStatus.valueOf(rs.getString("status"))
        );
    }
}
