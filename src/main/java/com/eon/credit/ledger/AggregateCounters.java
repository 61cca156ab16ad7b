package com.eon.credit.ledger;

import java.math.BigDecimal;

/**
 * Running per-subject totals. Maintained in the same transaction as each ledger event so that
 * scoring reads one row instead of the subject's history. Always
 * {@code totalLoans == repaidLoans + liquidatedLoans + activeLoans}.
 */
public record AggregateCounters(
        String subject,
        long totalLoans,
        long repaidLoans,
        long liquidatedLoans,
        long activeLoans,
        BigDecimal totalCollateralUsd,
        BigDecimal totalBorrowedUsd,
        long maxLtvBorrowCount,
        int uniqueCollateralAssets
) {
    public static AggregateCounters empty(String subject) {
        return new AggregateCounters(subject, 0, 0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);
    }

    public boolean isConsistent() {
        return totalLoans == repaidLoans + liquidatedLoans + activeLoans;
    }
}
