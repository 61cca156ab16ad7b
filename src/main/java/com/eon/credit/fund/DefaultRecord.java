package com.eon.credit.fund;

import java.math.BigDecimal;
import java.time.Instant;

public record DefaultRecord(
        long loanId,
        String subject,
        String lender,
        BigDecimal principal,
        BigDecimal lossAmount,
        BigDecimal coveredAmount,
        Instant recordedAt
) {}
