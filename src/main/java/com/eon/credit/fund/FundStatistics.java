package com.eon.credit.fund;

import java.math.BigDecimal;

public record FundStatistics(
        String asset,
        BigDecimal balance,
        BigDecimal totalDeposited,
        BigDecimal totalRevenue,
        BigDecimal totalCovered,
        long defaultCount
) {}
