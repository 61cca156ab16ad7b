package com.eon.credit.scoring;

import java.time.Instant;

/**
 * Point-in-time score. {@code overall} and the factors are on 0..100, {@code creditScore} is the
 * overall score rescaled to 300..850; {@code sybilRaw} is the signed pre-normalization value.
 */
public record ScoreBreakdown(
        String subject,
        int overall,
        int creditScore,
        CreditTier tier,
        int repayment,
        int collateral,
        int sybil,
        int sybilRaw,
        int reputation,
        int participation,
        String version,
        Instant computedAt
) {}
