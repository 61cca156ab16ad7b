package com.eon.credit.ledger;

import java.math.BigDecimal;
import java.time.Instant;

public record LoanRecord(
        long id,
        String subject,
        BigDecimal principal,
        BigDecimal repaidPrincipal,
        Instant openedAt,
        LoanStatus status,
        String counterparty
) {
    public BigDecimal remainingPrincipal() {
        return principal.subtract(repaidPrincipal).max(BigDecimal.ZERO);
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }
}
