package com.eon.credit.lending;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.AuthorizationException;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.NotFoundException;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.fund.LossAbsorptionFund;
import com.eon.credit.health.HealthMonitor;
import com.eon.credit.health.HealthStatus;
import com.eon.credit.ledger.CreditRegistry;
import com.eon.credit.ledger.LedgerTransactions;
import com.eon.credit.ledger.LoanStatus;
import com.eon.credit.scoring.ScoreBreakdown;
import com.eon.credit.scoring.ScoreEngine;
import com.eon.credit.scoring.TierTable;
import com.eon.credit.scoring.TierTerms;
import com.eon.credit.transfer.SystemAccounts;
import com.eon.credit.transfer.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Score-gated borrowing against collateral. Each operation takes one price snapshot, moves value
 * through the {@link TransferGateway} and reports the event to the ledger under the lending
 * engine's own principal, all within one transition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LendingService {

    private static final int SCALE = 18;

    private final LoanPositionRepository positions;
    private final LiquidityPool pool;
    private final InterestRateModel rateModel;
    private final PriceOracle prices;
    private final ScoreEngine scoreEngine;
    private final TierTable tiers;
    private final CreditRegistry registry;
    private final LossAbsorptionFund fund;
    private final HealthMonitor healthMonitor;
    private final TransferGateway transfers;
    private final LedgerTransactions transactions;
    private final CreditProperties properties;
    private final Clock clock;

    public LoanPosition borrow(String subject, String collateralAsset, BigDecimal collateralAmount, BigDecimal principal) {
        return transactions.write(() -> {
            requirePositive(collateralAmount, "Collateral amount");
            requirePositive(principal, "Principal");
            Instant now = clock.instant();

            // 1) one price snapshot and one score for the whole decision
            PriceQuote quote = prices.freshPrice(collateralAsset);
            BigDecimal collateralValue = collateralAmount.multiply(quote.price()).setScale(SCALE, RoundingMode.DOWN);
            ScoreBreakdown score = scoreEngine.computeScore(subject);
            TierTerms terms = tiers.forScore(score.creditScore());

            // 2) leverage and liquidity gates
            BigDecimal maxPrincipal = collateralValue.multiply(terms.maxLtv());
            if (principal.compareTo(maxPrincipal) > 0) {
                throw new ResourceException(CreditErrorCode.EXCEEDS_ALLOWED_LTV,
                        "Principal " + principal + " exceeds " + terms.tier() + " limit " + maxPrincipal.stripTrailingZeros());
            }
            BigDecimal available = pool.availableLiquidity();
            if (available.compareTo(principal) < 0) {
                throw new ResourceException(CreditErrorCode.INSUFFICIENT_LIQUIDITY,
                        "Pool holds " + available + ", requested " + principal);
            }

            // 3) rate at post-borrow utilization, scaled by tier
            BigDecimal rate = rateModel.borrowRate(pool.utilizationAfter(principal))
                    .multiply(terms.rateMultiplier()).setScale(SCALE, RoundingMode.HALF_UP);

            // 4) move value, then record
            transfers.pull(SystemAccounts.PROTOCOL, subject, SystemAccounts.COLLATERAL_ESCROW, collateralAsset, collateralAmount);
            transfers.push(SystemAccounts.POOL, subject, borrowAsset(), principal);
            pool.recordBorrow(principal);

            String engine = enginePrincipal();
            long loanId = registry.registerLoan(engine, subject, principal, SystemAccounts.POOL);
            registry.recordCollateral(engine, loanId, collateralAsset, collateralValue, score.creditScore());

            LoanPosition position = new LoanPosition(loanId, subject, borrowAsset(), collateralAsset, collateralAmount,
                    principal, BigDecimal.ZERO, rate, terms.maxLtv(), now, now, LoanStatus.ACTIVE);
            positions.insert(position);
            log.info("Loan {} opened: {} borrowed {} {} against {} {} at {} ({}, score {})", loanId, subject, principal,
                    borrowAsset(), collateralAmount, collateralAsset, rate, terms.tier(), score.creditScore());
            return position;
        });
    }

    /**
     * Applies a payment to accrued interest first, then principal. Collateral is released in
     * proportion to the principal repaid; full settlement returns all of it.
     */
    public Repayment repay(String subject, long loanId, BigDecimal amount) {
        return transactions.write(() -> {
            requirePositive(amount, "Repayment");
            LoanPosition position = ownedActivePosition(subject, loanId);
            Instant now = clock.instant();

            BigDecimal interestDue = position.interestDue(now);
            BigDecimal interestPaid = amount.min(interestDue);
            BigDecimal principalPaid = amount.subtract(interestPaid).min(position.outstandingPrincipal());
            boolean settled = principalPaid.compareTo(position.outstandingPrincipal()) >= 0;
            BigDecimal released = settled
                    ? position.collateralAmount()
                    : position.collateralAmount().multiply(principalPaid)
                            .divide(position.outstandingPrincipal(), SCALE, RoundingMode.DOWN);

            transfers.pull(SystemAccounts.PROTOCOL, subject, SystemAccounts.POOL, position.borrowAsset(),
                    interestPaid.add(principalPaid));
            transfers.push(SystemAccounts.COLLATERAL_ESCROW, subject, position.collateralAsset(), released);
            BigDecimal lpInterest = distributeInterest(interestPaid);
            pool.recordReturn(principalPaid, lpInterest);
            if (principalPaid.signum() > 0) {
                registry.registerRepayment(enginePrincipal(), loanId, principalPaid);
            }

            LoanPosition updated = position.afterPayment(principalPaid, interestDue.subtract(interestPaid), released, now);
            positions.update(updated);
            log.info("Loan {} repaid {} interest + {} principal, released {} {}{}", loanId, interestPaid, principalPaid,
                    released, position.collateralAsset(), settled ? " (settled)" : "");
            return new Repayment(loanId, interestPaid, principalPaid, released, updated.outstandingPrincipal(), settled);
        });
    }

    public LoanPosition addCollateral(String subject, long loanId, BigDecimal amount) {
        return transactions.write(() -> {
            requirePositive(amount, "Collateral amount");
            LoanPosition position = ownedActivePosition(subject, loanId);
            transfers.pull(SystemAccounts.PROTOCOL, subject, SystemAccounts.COLLATERAL_ESCROW, position.collateralAsset(), amount);
            LoanPosition updated = position.withCollateral(position.collateralAmount().add(amount));
            positions.update(updated);
            log.info("Loan {} collateral topped up by {} {}", loanId, amount, position.collateralAsset());
            return updated;
        });
    }

    /**
     * Closes a position through a liquidation sale at {@code discount} below the live price.
     * The executor pays up to the debt and receives the collateral that payment buys; leftover
     * collateral goes back to the borrower and any principal shortfall is claimed from the fund.
     */
    public LiquidationSettlement settleLiquidation(String executor, long loanId, BigDecimal discount) {
        return transactions.write(() -> {
            LoanPosition position = activePosition(loanId);
            Instant now = clock.instant();
            PriceQuote quote = prices.freshPrice(position.collateralAsset());

            BigDecimal debt = position.debt(now);
            BigDecimal interestDue = debt.subtract(position.outstandingPrincipal());
            BigDecimal discountedPrice = quote.price().multiply(BigDecimal.ONE.subtract(discount));
            BigDecimal saleValue = position.collateralAmount().multiply(discountedPrice).setScale(SCALE, RoundingMode.DOWN);

            BigDecimal payment = debt.min(saleValue);
            BigDecimal toExecutor = payment.compareTo(saleValue) >= 0
                    ? position.collateralAmount()
                    : payment.divide(discountedPrice, SCALE, RoundingMode.DOWN).min(position.collateralAmount());
            BigDecimal toBorrower = position.collateralAmount().subtract(toExecutor);

            transfers.pull(SystemAccounts.PROTOCOL, executor, SystemAccounts.POOL, position.borrowAsset(), payment);
            transfers.push(SystemAccounts.COLLATERAL_ESCROW, executor, position.collateralAsset(), toExecutor);
            transfers.push(SystemAccounts.COLLATERAL_ESCROW, position.subject(), position.collateralAsset(), toBorrower);

            BigDecimal interestRecovered = payment.min(interestDue);
            BigDecimal principalRecovered = payment.subtract(interestRecovered);
            BigDecimal shortfall = position.outstandingPrincipal().subtract(principalRecovered).max(BigDecimal.ZERO);
            BigDecimal covered = BigDecimal.ZERO;
            if (shortfall.signum() > 0) {
                BigDecimal originalPrincipal = registry.getLoan(loanId).principal();
                covered = fund.coverLoss(enginePrincipal(), position.subject(), loanId, originalPrincipal, shortfall,
                        SystemAccounts.POOL);
            }
            BigDecimal lpInterest = distributeInterest(interestRecovered);
            pool.recordReturn(position.outstandingPrincipal(), lpInterest);
            positions.update(position.liquidated(now));

            log.info("Loan {} liquidated by {} at discount {}: paid {}, collateral {} to executor, {} returned, shortfall {} (covered {})",
                    loanId, executor, discount, payment, toExecutor, toBorrower, shortfall, covered);
            return new LiquidationSettlement(loanId, debt, payment, toExecutor, toBorrower, shortfall, covered);
        });
    }

    public BigDecimal calculateDebt(long loanId) {
        return position(loanId).debt(clock.instant());
    }

    public HealthStatus calculateHealthFactor(long loanId) {
        return healthMonitor.assess(loanId);
    }

    public LoanPosition position(long loanId) {
        return positions.find(loanId)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.LOAN_NOT_FOUND, "Loan " + loanId + " not found"));
    }

    public List<LoanPosition> positionsOf(String subject) {
        return positions.findBySubject(subject);
    }

    /** Annual rate a subject would pay at current utilization. */
    public BigDecimal aprFor(String subject) {
        TierTerms terms = tiers.forScore(scoreEngine.computeScore(subject).creditScore());
        return pool.currentBorrowRate().multiply(terms.rateMultiplier()).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** Splits paid interest into protocol revenue (treasury, with the fund's share) and the LP share. */
    private BigDecimal distributeInterest(BigDecimal interest) {
        if (interest.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal revenue = interest.multiply(properties.getRates().getProtocolFee()).setScale(SCALE, RoundingMode.DOWN);
        if (revenue.signum() > 0) {
            transfers.push(SystemAccounts.POOL, SystemAccounts.TREASURY, borrowAsset(), revenue);
            fund.allocateRevenue(enginePrincipal(), revenue);
        }
        return interest.subtract(revenue);
    }

    private LoanPosition ownedActivePosition(String subject, long loanId) {
        LoanPosition position = activePosition(loanId);
        if (!position.subject().equals(subject)) {
            throw new AuthorizationException(CreditErrorCode.UNAUTHORIZED, "Loan " + loanId + " does not belong to " + subject);
        }
        return position;
    }

    private LoanPosition activePosition(long loanId) {
        LoanPosition position = position(loanId);
        if (!position.isActive()) {
            throw new StateConflictException(CreditErrorCode.LOAN_NOT_ACTIVE, "Loan " + loanId + " is " + position.status());
        }
        return position;
    }

    private String enginePrincipal() {
        return properties.getPrincipals().getLendingEngine();
    }

    private String borrowAsset() {
        return properties.getPool().getBorrowAsset();
    }

    private static void requirePositive(BigDecimal amount, String what) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, what + " must be positive");
        }
    }

    public record Repayment(long loanId, BigDecimal interestPaid, BigDecimal principalPaid, BigDecimal collateralReleased,
                            BigDecimal remainingPrincipal, boolean settled) {}

    public record LiquidationSettlement(long loanId, BigDecimal debt, BigDecimal payment, BigDecimal collateralToExecutor,
                                        BigDecimal collateralReturned, BigDecimal shortfall, BigDecimal coveredByFund) {}
}
