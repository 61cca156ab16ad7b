package com.eon.credit.lending;

import com.eon.credit.ledger.LoanStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Lending-side view of a loan: collateral held in escrow, outstanding principal, and simple
 * interest accrued up to {@code interestCheckpoint}.
 */
public record LoanPosition(
        long loanId,
        String subject,
        String borrowAsset,
        String collateralAsset,
        BigDecimal collateralAmount,
        BigDecimal outstandingPrincipal,
        BigDecimal accruedInterest,
        BigDecimal interestRate,
        BigDecimal liquidationThreshold,
        Instant openedAt,
        Instant interestCheckpoint,
        LoanStatus status
) {
    static final BigDecimal SECONDS_PER_YEAR = BigDecimal.valueOf(Duration.ofDays(365).getSeconds());

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    /** Interest owed at {@code now}: stored accrual plus simple interest since the checkpoint. */
    public BigDecimal interestDue(Instant now) {
        if (!isActive()) {
            return BigDecimal.ZERO;
        }
        long elapsed = Math.max(0, now.getEpochSecond() - interestCheckpoint.getEpochSecond());
        BigDecimal sinceCheckpoint = outstandingPrincipal.multiply(interestRate).multiply(BigDecimal.valueOf(elapsed))
                .divide(SECONDS_PER_YEAR, 18, RoundingMode.HALF_UP);
        return accruedInterest.add(sinceCheckpoint);
    }

    public BigDecimal debt(Instant now) {
        if (!isActive()) {
            return BigDecimal.ZERO;
        }
        return outstandingPrincipal.add(interestDue(now));
    }

    LoanPosition afterPayment(BigDecimal principalPaid, BigDecimal interestLeft, BigDecimal collateralReleased, Instant now) {
        BigDecimal remaining = outstandingPrincipal.subtract(principalPaid);
        LoanStatus next = remaining.signum() <= 0 ? LoanStatus.REPAID : LoanStatus.ACTIVE;
        return new LoanPosition(loanId, subject, borrowAsset, collateralAsset, collateralAmount.subtract(collateralReleased),
                remaining.max(BigDecimal.ZERO), next == LoanStatus.REPAID ? BigDecimal.ZERO : interestLeft, interestRate,
                liquidationThreshold, openedAt, now, next);
    }

    LoanPosition withCollateral(BigDecimal amount) {
        return new LoanPosition(loanId, subject, borrowAsset, collateralAsset, amount, outstandingPrincipal,
                accruedInterest, interestRate, liquidationThreshold, openedAt, interestCheckpoint, status);
    }

    LoanPosition liquidated(Instant now) {
        return new LoanPosition(loanId, subject, borrowAsset, collateralAsset, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, interestRate, liquidationThreshold, openedAt, now, LoanStatus.LIQUIDATED);
    }
}
