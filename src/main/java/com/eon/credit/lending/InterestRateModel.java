package com.eon.credit.lending;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Kinked utilization curve:
 * {@code base + min(u, opt)/opt * slope1 + max(u - opt, 0)/(1 - opt) * slope2}.
 */
@Component
public class InterestRateModel {

    static final int SCALE = 18;

    private final CreditProperties.Rates rates;

    public InterestRateModel(CreditProperties properties) {
        this.rates = properties.getRates();
        BigDecimal opt = rates.getOptimalUtilization();
        if (opt.signum() <= 0 || opt.compareTo(BigDecimal.ONE) >= 0) {
            throw new ValidationException(CreditErrorCode.INVALID_CONFIGURATION, "Optimal utilization must be in (0, 1)");
        }
    }

    public BigDecimal utilization(BigDecimal borrowed, BigDecimal totalAssets) {
        if (totalAssets.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return borrowed.divide(totalAssets, SCALE, RoundingMode.HALF_UP).min(BigDecimal.ONE);
    }

    public BigDecimal borrowRate(BigDecimal utilization) {
        BigDecimal u = utilization.max(BigDecimal.ZERO).min(BigDecimal.ONE);
        BigDecimal opt = rates.getOptimalUtilization();

        BigDecimal rate = rates.getBaseRate()
                .add(u.min(opt).divide(opt, SCALE, RoundingMode.HALF_UP).multiply(rates.getSlope1()));
        if (u.compareTo(opt) > 0) {
            BigDecimal excess = u.subtract(opt).divide(BigDecimal.ONE.subtract(opt), SCALE, RoundingMode.HALF_UP);
            rate = rate.add(excess.multiply(rates.getSlope2()));
        }
        return rate.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
