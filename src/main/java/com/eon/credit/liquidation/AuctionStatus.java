package com.eon.credit.liquidation;

/** Stored status. Whether an OPEN auction is still in grace is derived from the clock, see {@link LiquidationPhase}. */
public enum AuctionStatus {
    OPEN,
    EXECUTED,
    CANCELLED
}
