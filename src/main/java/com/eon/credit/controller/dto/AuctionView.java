package com.eon.credit.controller.dto;

import com.eon.credit.liquidation.Auction;
import com.eon.credit.liquidation.LiquidationPhase;

import java.math.BigDecimal;
import java.time.Instant;

/** Auction row plus its time-derived state at the moment of the read. */
public class AuctionView {
    public long auctionId;
    public long loanId;
    public String subject;
    public BigDecimal debtAmount;
    public BigDecimal collateralAmount;
    public Instant startedAt;
    public Instant graceEndsAt;
    public LiquidationPhase phase;
    public BigDecimal currentDiscount;
    public long graceRemainingSeconds;
    public String executor;             // null until executed
    public Instant executedAt;
    public BigDecimal recoveredAmount;
    public String cancelReason;

    public static AuctionView of(Auction a, LiquidationPhase phase, BigDecimal discount, long graceRemainingSeconds) {
        AuctionView v = new AuctionView();
        v.auctionId = a.id(); v.loanId = a.loanId(); v.subject = a.subject();
        v.debtAmount = a.debtAmount(); v.collateralAmount = a.collateralAmount();
        v.startedAt = a.startedAt(); v.graceEndsAt = a.graceEndsAt();
        v.phase = phase; v.currentDiscount = discount; v.graceRemainingSeconds = graceRemainingSeconds;
        v.executor = a.executor(); v.executedAt = a.executedAt();
        v.recoveredAmount = a.recoveredAmount(); v.cancelReason = a.cancelReason();
        return v;
    }
}
