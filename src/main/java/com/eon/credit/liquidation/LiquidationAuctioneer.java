package com.eon.credit.liquidation;

import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.NotFoundException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.health.HealthMonitor;
import com.eon.credit.health.HealthStatus;
import com.eon.credit.ledger.CreditRegistry;
import com.eon.credit.ledger.LedgerRepository;
import com.eon.credit.ledger.LedgerTransactions;
import com.eon.credit.ledger.LoanRecord;
import com.eon.credit.lending.LendingService;
import com.eon.credit.lending.LoanPosition;
import com.eon.credit.scoring.ScoreEngine;
import com.eon.credit.scoring.TierTerms;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Liquidation in two stages: a grace window sized by the borrower's tier, then a Dutch auction
 * whose discount grows linearly to a cap. Phases are derived from stored timestamps on every
 * call; nothing is scheduled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidationAuctioneer {

    static final String AUCTION_SEQUENCE = "auction";

    private final AuctionRepository auctions;
    private final LedgerRepository ledger;
    private final CreditRegistry registry;
    private final LendingService lending;
    private final HealthMonitor healthMonitor;
    private final ScoreEngine scoreEngine;
    private final AuthorizationGate gate;
    private final LedgerTransactions transactions;
    private final CreditProperties properties;
    private final Clock clock;

    /** Opens a grace window for an unhealthy active loan, or returns the window already open for it. */
    public Auction startLiquidation(long loanId) {
        return transactions.write(() -> {
            LoanRecord loan = registry.getLoan(loanId);
            if (!loan.isActive()) {
                throw new StateConflictException(CreditErrorCode.LOAN_NOT_ACTIVE, "Loan " + loanId + " is " + loan.status());
            }
            var existing = auctions.findOpenByLoan(loanId);
            if (existing.isPresent()) {
                return existing.get();
            }
            HealthStatus health = healthMonitor.assess(loanId);
            if (!health.liquidatable()) {
                throw new StateConflictException(CreditErrorCode.POSITION_HEALTHY,
                        "Loan " + loanId + " has health factor " + health.healthFactor().stripTrailingZeros());
            }
            Instant now = clock.instant();
            TierTerms terms = scoreEngine.getScoreTier(loan.subject());
            LoanPosition position = lending.position(loanId);

            Auction auction = new Auction(ledger.nextId(AUCTION_SEQUENCE), loanId, loan.subject(), health.debtUsd(),
                    position.collateralAmount(), now, now.plus(terms.gracePeriod()), AuctionStatus.OPEN,
                    null, null, null, null);
            auctions.insert(auction);
            log.info("Liquidation {} started for loan {} ({}, health {}), grace until {}", auction.id(), loanId,
                    terms.tier(), health.healthFactor().stripTrailingZeros(), auction.graceEndsAt());
            return auction;
        });
    }

    public Auction executeLiquidation(String executor, long auctionId) {
        return transactions.write(() -> {
            Auction auction = auction(auctionId);
            if (auction.status() == AuctionStatus.EXECUTED) {
                throw new StateConflictException(CreditErrorCode.AUCTION_ALREADY_EXECUTED,
                        "Auction " + auctionId + " was executed by " + auction.executor());
            }
            if (auction.status() == AuctionStatus.CANCELLED) {
                throw new StateConflictException(CreditErrorCode.AUCTION_CANCELLED,
                        "Auction " + auctionId + " was cancelled: " + auction.cancelReason());
            }
            Instant now = clock.instant();
            if (now.isBefore(auction.graceEndsAt())) {
                throw new StateConflictException(CreditErrorCode.GRACE_PERIOD_ACTIVE,
                        "Grace period of auction " + auctionId + " ends at " + auction.graceEndsAt());
            }
            LoanRecord loan = registry.getLoan(auction.loanId());
            if (!loan.isActive()) {
                throw new StateConflictException(CreditErrorCode.LOAN_NOT_ACTIVE,
                        "Loan " + auction.loanId() + " is " + loan.status());
            }
            // the borrower may have cured the position during grace; the auction stays open until cancelled
            HealthStatus health = healthMonitor.assess(auction.loanId());
            if (!health.liquidatable()) {
                throw new StateConflictException(CreditErrorCode.POSITION_HEALTHY,
                        "Loan " + auction.loanId() + " has health factor " + health.healthFactor().stripTrailingZeros());
            }
            BigDecimal discount = discountAt(auction, now);
            LendingService.LiquidationSettlement settlement = lending.settleLiquidation(executor, auction.loanId(), discount);
            registry.registerLiquidation(properties.getPrincipals().getAuctioneer(), auction.loanId(), settlement.payment());
            auctions.markExecuted(auctionId, executor, now, settlement.payment());
            log.info("Auction {} executed by {} at discount {}", auctionId, executor, discount.stripTrailingZeros());
            return auction(auctionId);
        });
    }

    public Auction cancelAuction(String admin, long auctionId, String reason) {
        return transactions.write(() -> {
            gate.require(admin, Capability.ADMIN);
            Auction auction = auction(auctionId);
            if (auction.status() == AuctionStatus.EXECUTED) {
                throw new StateConflictException(CreditErrorCode.AUCTION_ALREADY_EXECUTED,
                        "Auction " + auctionId + " was already executed");
            }
            if (auction.status() == AuctionStatus.CANCELLED) {
                throw new StateConflictException(CreditErrorCode.AUCTION_CANCELLED,
                        "Auction " + auctionId + " was already cancelled");
            }
            auctions.markCancelled(auctionId, reason);
            log.warn("Auction {} for loan {} cancelled by {}: {}", auctionId, auction.loanId(), admin, reason);
            return auction(auctionId);
        });
    }

    /**
     * 0 during grace, then {@code maxDiscount * elapsed / duration}, capped at {@code maxDiscount}.
     * The cap holds for ever after; an unexecuted auction stays open until settled or cancelled.
     */
    public BigDecimal discountAt(Auction auction, Instant now) {
        CreditProperties.Auction cfg = properties.getAuction();
        if (!now.isAfter(auction.graceEndsAt())) {
            return BigDecimal.ZERO;
        }
        long elapsed = Duration.between(auction.graceEndsAt(), now).getSeconds();
        BigDecimal linear = cfg.getMaxDiscount().multiply(BigDecimal.valueOf(elapsed))
                .divide(BigDecimal.valueOf(cfg.getDuration().getSeconds()), 18, RoundingMode.DOWN);
        return linear.min(cfg.getMaxDiscount());
    }

    public BigDecimal currentDiscount(long auctionId) {
        return discountAt(auction(auctionId), clock.instant());
    }

    /** Open past grace and still backed by an active loan. Health is re-checked on execution. */
    public boolean isExecutable(long auctionId) {
        Auction auction = auction(auctionId);
        return auction.phaseAt(clock.instant()) == LiquidationPhase.AUCTION_OPEN
                && registry.getLoan(auction.loanId()).isActive();
    }

    public Duration gracePeriodRemaining(long auctionId) {
        Auction auction = auction(auctionId);
        if (auction.status() != AuctionStatus.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), auction.graceEndsAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public LiquidationPhase phase(long auctionId) {
        return auction(auctionId).phaseAt(clock.instant());
    }

    public Auction auction(long auctionId) {
        return auctions.find(auctionId)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.AUCTION_NOT_FOUND, "Auction " + auctionId + " not found"));
    }

    public List<Auction> auctionsForLoan(long loanId) {
        return auctions.findByLoan(loanId);
    }

    /** Open auctions whose loan is still active; an auction on a repaid loan stays open but is not listed. */
    public List<Auction> openAuctions() {
        return auctions.findOpen().stream()
                .filter(a -> registry.getLoan(a.loanId()).isActive())
                .collect(Collectors.toList());
    }
}
