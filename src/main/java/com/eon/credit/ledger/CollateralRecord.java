package com.eon.credit.ledger;

import java.math.BigDecimal;

public record CollateralRecord(
        long loanId,
        String collateralAsset,
        BigDecimal collateralValueUsd,
        int scoreAtOrigination
) {}
