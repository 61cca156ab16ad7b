package com.eon.credit.liquidation;

import java.math.BigDecimal;
import java.time.Instant;

public record Auction(
        long id,
        long loanId,
        String subject,
        BigDecimal debtAmount,
        BigDecimal collateralAmount,
        Instant startedAt,
        Instant graceEndsAt,
        AuctionStatus status,
        String executor,
        Instant executedAt,
        BigDecimal recoveredAmount,
        String cancelReason
) {
    public LiquidationPhase phaseAt(Instant now) {
        switch (status) {
            case EXECUTED:
                return LiquidationPhase.EXECUTED;
            case CANCELLED:
                return LiquidationPhase.CANCELLED;
            default:
                return now.isBefore(graceEndsAt) ? LiquidationPhase.GRACE_PENDING : LiquidationPhase.AUCTION_OPEN;
        }
    }
}
