package com.eon.credit.liquidation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AuctionRepository {

    private static final String COLUMNS = """
            id, loan_id, subject, debt_amount, collateral_amount, started_at, grace_ends_at, status,
            executor, executed_at, recovered_amount, cancel_reason
            """;

    private final JdbcTemplate jdbc;

    public void insert(Auction a) {
        jdbc.update("""
            INSERT INTO auctions (id, loan_id, subject, debt_amount, collateral_amount, started_at, grace_ends_at, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """, a.id(), a.loanId(), a.subject(), a.debtAmount(), a.collateralAmount(),
                a.startedAt().getEpochSecond(), a.graceEndsAt().getEpochSecond(), a.status().name());
    }

    public Optional<Auction> find(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM auctions WHERE id = ?", rm(), id).stream().findFirst();
    }

    public Optional<Auction> findOpenByLoan(long loanId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM auctions WHERE loan_id = ? AND status = ?",
                rm(), loanId, AuctionStatus.OPEN.name()).stream().findFirst();
    }

    public List<Auction> findByLoan(long loanId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM auctions WHERE loan_id = ? ORDER BY id", rm(), loanId);
    }

    public List<Auction> findOpen() {
        return jdbc.query("SELECT " + COLUMNS + " FROM auctions WHERE status = ? ORDER BY id", rm(), AuctionStatus.OPEN.name());
    }

    public void markExecuted(long id, String executor, Instant executedAt, BigDecimal recovered) {
        jdbc.update("UPDATE auctions SET status = ?, executor = ?, executed_at = ?, recovered_amount = ? WHERE id = ?",
                AuctionStatus.EXECUTED.name(), executor, executedAt.getEpochSecond(), recovered, id);
    }

    public void markCancelled(long id, String reason) {
        jdbc.update("UPDATE auctions SET status = ?, cancel_reason = ? WHERE id = ?",
                AuctionStatus.CANCELLED.name(), reason, id);
    }

    private RowMapper<Auction> rm() {
        return (rs, i) -> {
            long executedAt = rs.getLong("executed_at");
            boolean notExecuted = rs.wasNull();
            return new Auction(
                    rs.getLong("id"),
                    rs.getLong("loan_id"),
                    rs.getString("subject"),
                    rs.getBigDecimal("debt_amount"),
                    rs.getBigDecimal("collateral_amount"),
                    Instant.ofEpochSecond(rs.getLong("started_at")),
                    Instant.ofEpochSecond(rs.getLong("grace_ends_at")),
                    AuctionStatus.valueOf(rs.getString("status")),
                    rs.getString("executor"),
                    notExecuted ? null : Instant.ofEpochSecond(executedAt),
                    rs.getBigDecimal("recovered_amount"),
                    rs.getString("cancel_reason")
            );
        };
    }
}
