package com.eon.credit.health;

import java.math.BigDecimal;
import java.time.Instant;

public record HealthStatus(
        long loanId,
        String subject,
        BigDecimal collateralValueUsd,
        BigDecimal debtUsd,
        BigDecimal liquidationThreshold,
        BigDecimal healthFactor,
        RiskLevel riskLevel,
        boolean liquidatable,
        Instant evaluatedAt
) {}
