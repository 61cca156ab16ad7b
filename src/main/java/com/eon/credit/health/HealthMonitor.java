package com.eon.credit.health;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.NotFoundException;
import com.eon.credit.lending.LoanPosition;
import com.eon.credit.lending.LoanPositionRepository;
import com.eon.credit.lending.PriceOracle;
import com.eon.credit.lending.PriceQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Health factor = collateral value * liquidation threshold / debt. A position without debt is
 * reported with {@link #MAX_HEALTH_FACTOR}; a position with debt and no collateral scores 0.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthMonitor {

    public static final BigDecimal MAX_HEALTH_FACTOR = BigDecimal.valueOf(Long.MAX_VALUE);

    private static final int SCALE = 18;

    private final LoanPositionRepository positions;
    private final PriceOracle prices;
    private final CreditProperties properties;
    private final Clock clock;

    public BigDecimal healthFactor(BigDecimal collateralValueUsd, BigDecimal liquidationThreshold, BigDecimal debtUsd) {
        if (debtUsd.signum() <= 0) {
            return MAX_HEALTH_FACTOR;
        }
        if (collateralValueUsd.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return collateralValueUsd.multiply(liquidationThreshold).divide(debtUsd, SCALE, RoundingMode.DOWN);
    }

    public RiskLevel riskLevel(BigDecimal healthFactor) {
        CreditProperties.Health h = properties.getHealth();
        if (healthFactor.compareTo(h.getSafeThreshold()) >= 0) {
            return RiskLevel.SAFE;
        }
        if (healthFactor.compareTo(h.getWarningThreshold()) >= 0) {
            return RiskLevel.WARNING;
        }
        if (healthFactor.compareTo(h.getLiquidationTrigger()) > 0) {
            return RiskLevel.DANGER;
        }
        return RiskLevel.CRITICAL;
    }

    public boolean isLiquidatable(BigDecimal healthFactor) {
        return healthFactor.compareTo(properties.getHealth().getLiquidationTrigger()) <= 0;
    }

    /** Extra collateral value needed to lift the position to {@code targetHealthFactor}; 0 when already there. */
    public BigDecimal requiredAdditionalCollateralValue(BigDecimal collateralValueUsd, BigDecimal liquidationThreshold,
                                                       BigDecimal debtUsd, BigDecimal targetHealthFactor) {
        if (debtUsd.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal required = targetHealthFactor.multiply(debtUsd).divide(liquidationThreshold, SCALE, RoundingMode.UP);
        return required.subtract(collateralValueUsd).max(BigDecimal.ZERO);
    }

    public HealthStatus assess(long loanId) {
        return assess(position(loanId), clock.instant());
    }

    /** Additional collateral, in units of the position's collateral asset, to reach {@code targetHealthFactor}. */
    public BigDecimal requiredAdditionalCollateral(long loanId, BigDecimal targetHealthFactor) {
        LoanPosition position = position(loanId);
        PriceQuote quote = prices.freshPrice(position.collateralAsset());
        BigDecimal collateralValue = position.collateralAmount().multiply(quote.price());
        BigDecimal value = requiredAdditionalCollateralValue(collateralValue, position.liquidationThreshold(),
                position.debt(clock.instant()), targetHealthFactor);
        return value.divide(quote.price(), SCALE, RoundingMode.UP);
    }

    /** Active positions at or below the liquidation trigger, for keepers deciding what to liquidate. */
    public List<HealthStatus> liquidatablePositions() {
        Instant now = clock.instant();
        List<HealthStatus> out = new ArrayList<>();
        for (LoanPosition p : positions.findActive()) {
            HealthStatus status = assess(p, now);
            if (status.liquidatable()) {
                out.add(status);
            }
        }
        return out;
    }

    public HealthStatus assess(LoanPosition position, Instant now) {
        BigDecimal debt = position.debt(now);
        BigDecimal collateralValue = BigDecimal.ZERO;
        if (position.collateralAmount().signum() > 0) {
            collateralValue = position.collateralAmount().multiply(prices.freshPrice(position.collateralAsset()).price());
        }
        BigDecimal hf = healthFactor(collateralValue, position.liquidationThreshold(), debt);
        HealthStatus status = new HealthStatus(position.loanId(), position.subject(), collateralValue, debt,
                position.liquidationThreshold(), hf, riskLevel(hf), isLiquidatable(hf), now);
        log.debug("Health of loan {}: {} ({})", position.loanId(), hf, status.riskLevel());
        return status;
    }

    private LoanPosition position(long loanId) {
        return positions.find(loanId)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.LOAN_NOT_FOUND, "Loan " + loanId + " not found"));
    }
}
