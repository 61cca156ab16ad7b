package com.eon.credit.error;

/**
 * Enumerable failure reasons surfaced by the ledger, scoring and lending operations.
 * The name is what clients see in the {@code error} field of a failed response.
 */
public enum CreditErrorCode {

    UNAUTHORIZED,

    INVALID_SCORE,
    INVALID_TIER,
    INVALID_LTV,
    INVALID_PROOF,
    PROOF_EXPIRED,
    INVALID_AMOUNT,
    INVALID_SUBJECT,
    UNSUPPORTED_ASSET,
    INVALID_CONFIGURATION,

    LOAN_NOT_ACTIVE,
    ATTESTATION_PENDING,
    NO_PENDING_ATTESTATION,
    AUCTION_ALREADY_EXECUTED,
    AUCTION_CANCELLED,
    GRACE_PERIOD_ACTIVE,
    LOCK_ACTIVE,
    POSITION_HEALTHY,
    CHALLENGE_PERIOD_ACTIVE,
    CHALLENGE_PERIOD_EXPIRED,
    ALREADY_CHALLENGED,
    COLLATERAL_ALREADY_RECORDED,
    LOSS_ALREADY_COVERED,

    INSUFFICIENT_LIQUIDITY,
    EXCEEDS_ALLOWED_LTV,
    INSUFFICIENT_BOND,
    INSUFFICIENT_STAKE,
    INSUFFICIENT_SHARES,
    TRANSFER_FAILED,

    LOAN_NOT_FOUND,
    AUCTION_NOT_FOUND,
    SUBJECT_NOT_FOUND,

    PRICE_UNAVAILABLE,
    STALE_PRICE,
    REPUTATION_UNAVAILABLE
}
