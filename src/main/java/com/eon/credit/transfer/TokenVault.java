package com.eon.credit.transfer;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Balance and allowance book kept in the ledger database, so a transfer commits or rolls back
 * with the transition that issued it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenVault implements TransferGateway {

    private final JdbcTemplate jdbc;

    @Override
    public void approve(String owner, String spender, String asset, BigDecimal amount) {
        requireNonNegative(amount);
        int updated = jdbc.update("UPDATE token_allowances SET amount = ? WHERE owner = ? AND spender = ? AND asset = ?",
                amount, owner, spender, asset);
        if (updated == 0) {
            jdbc.update("INSERT INTO token_allowances (owner, spender, asset, amount) VALUES (?, ?, ?, ?)",
                    owner, spender, asset, amount);
        }
    }

    @Override
    public void pull(String spender, String from, String to, String asset, BigDecimal amount) {
        requireNonNegative(amount);
        if (amount.signum() == 0) {
            return;
        }
        BigDecimal allowed = allowance(from, spender, asset);
        if (allowed.compareTo(amount) < 0) {
            throw new ResourceException(CreditErrorCode.TRANSFER_FAILED,
                    "Allowance of " + from + " for " + spender + " is " + allowed + " " + asset + ", needs " + amount);
        }
        move(from, to, asset, amount);
        jdbc.update("UPDATE token_allowances SET amount = amount - ? WHERE owner = ? AND spender = ? AND asset = ?",
                amount, from, spender, asset);
    }

    @Override
    public void push(String from, String to, String asset, BigDecimal amount) {
        requireNonNegative(amount);
        if (amount.signum() == 0) {
            return;
        }
        move(from, to, asset, amount);
    }

    /** Creates balance out of thin air; used to fund accounts outside a real token deployment. */
    public void mint(String account, String asset, BigDecimal amount) {
        requireNonNegative(amount);
        credit(account, asset, amount);
        log.info("Minted {} {} to {}", amount, asset, account);
    }

    @Override
    public BigDecimal balanceOf(String account, String asset) {
        return jdbc.queryForList("SELECT amount FROM token_balances WHERE account = ? AND asset = ?",
                BigDecimal.class, account, asset).stream().findFirst().orElse(BigDecimal.ZERO);
    }

    @Override
    public BigDecimal allowance(String owner, String spender, String asset) {
        return jdbc.queryForList("SELECT amount FROM token_allowances WHERE owner = ? AND spender = ? AND asset = ?",
                BigDecimal.class, owner, spender, asset).stream().findFirst().orElse(BigDecimal.ZERO);
    }

    private void move(String from, String to, String asset, BigDecimal amount) {
        BigDecimal available = balanceOf(from, asset);
        if (available.compareTo(amount) < 0) {
            throw new ResourceException(CreditErrorCode.TRANSFER_FAILED,
                    "Balance of " + from + " is " + available + " " + asset + ", needs " + amount);
        }
        jdbc.update("UPDATE token_balances SET amount = amount - ? WHERE account = ? AND asset = ?", amount, from, asset);
        credit(to, asset, amount);
    }

    private void credit(String account, String asset, BigDecimal amount) {
        int updated = jdbc.update("UPDATE token_balances SET amount = amount + ? WHERE account = ? AND asset = ?",
                amount, account, asset);
        if (updated == 0) {
            jdbc.update("INSERT INTO token_balances (account, asset, amount) VALUES (?, ?, ?)", account, asset, amount);
        }
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Transfer amount must not be negative");
        }
    }
}
