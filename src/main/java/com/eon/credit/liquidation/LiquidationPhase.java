package com.eon.credit.liquidation;

public enum LiquidationPhase {
    GRACE_PENDING,
    AUCTION_OPEN,
    EXECUTED,
    CANCELLED
}
