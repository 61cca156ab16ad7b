package com.eon.credit.transfer;

import java.math.BigDecimal;

/**
 * Value-transfer primitive with approve-then-pull semantics. Any failure raises
 * {@link com.eon.credit.error.ResourceException} with {@code TRANSFER_FAILED}.
 */
public interface TransferGateway {

    void approve(String owner, String spender, String asset, BigDecimal amount);

    /** Moves {@code amount} out of {@code from} against the allowance it granted to {@code spender}. */
    void pull(String spender, String from, String to, String asset, BigDecimal amount);

    /** Moves {@code amount} out of an account the caller controls. */
    void push(String from, String to, String asset, BigDecimal amount);

    BigDecimal balanceOf(String account, String asset);

    BigDecimal allowance(String owner, String spender, String asset);
}
