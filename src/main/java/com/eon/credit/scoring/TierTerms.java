package com.eon.credit.scoring;

import java.math.BigDecimal;
import java.time.Duration;

/** Borrowing terms unlocked by a tier. */
public record TierTerms(
        CreditTier tier,
        int minScore,
        BigDecimal maxLtv,
        BigDecimal rateMultiplier,
        Duration gracePeriod
) {}
