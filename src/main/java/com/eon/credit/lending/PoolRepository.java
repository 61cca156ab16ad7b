package com.eon.credit.lending;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;

@Repository
@RequiredArgsConstructor
public class PoolRepository {

    private final JdbcTemplate jdbc;

    public PoolState find(String asset) {
        return jdbc.query("""
            SELECT asset, total_shares, total_borrowed, total_interest_earned FROM pool_state WHERE asset = ?
        """, (rs, i) -> new PoolState(
                rs.getString("asset"),
                rs.getBigDecimal("total_shares"),
                rs.getBigDecimal("total_borrowed"),
                rs.getBigDecimal("total_interest_earned")
        ), asset).stream().findFirst().orElseGet(() -> PoolState.empty(asset));
    }

    public void save(PoolState s) {
        int updated = jdbc.update("""
            UPDATE pool_state SET total_shares = ?, total_borrowed = ?, total_interest_earned = ? WHERE asset = ?
        """, s.totalShares(), s.totalBorrowed(), s.totalInterestEarned(), s.asset());
        if (updated == 0) {
            jdbc.update("""
                INSERT INTO pool_state (asset, total_shares, total_borrowed, total_interest_earned) VALUES (?, ?, ?, ?)
            """, s.asset(), s.totalShares(), s.totalBorrowed(), s.totalInterestEarned());
        }
    }

    public BigDecimal findShares(String provider, String asset) {
        return jdbc.queryForList("SELECT shares FROM lp_positions WHERE provider = ? AND asset = ?",
                BigDecimal.class, provider, asset).stream().findFirst().orElse(BigDecimal.ZERO);
    }

    public void saveShares(String provider, String asset, BigDecimal shares) {
        int updated = jdbc.update("UPDATE lp_positions SET shares = ? WHERE provider = ? AND asset = ?", shares, provider, asset);
        if (updated == 0) {
            jdbc.update("INSERT INTO lp_positions (provider, asset, shares) VALUES (?, ?, ?)", provider, asset, shares);
        }
    }

    public record PoolState(String asset, BigDecimal totalShares, BigDecimal totalBorrowed, BigDecimal totalInterestEarned) {

        static PoolState empty(String asset) {
            return new PoolState(asset, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        }
    }
}
