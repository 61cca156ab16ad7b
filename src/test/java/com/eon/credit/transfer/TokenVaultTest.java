package com.eon.credit.transfer;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.support.LedgerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.eon.credit.support.LedgerFixture.USDC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenVault")
class TokenVaultTest {

    private LedgerFixture fx;
    private TokenVault vault;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        vault = fx.vault;
        vault.mint("alice", USDC, new BigDecimal("100"));
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("pulls within the allowance and consumes it")
    void pull() {
        vault.approve("alice", SystemAccounts.PROTOCOL, USDC, new BigDecimal("60"));

        vault.pull(SystemAccounts.PROTOCOL, "alice", SystemAccounts.POOL, USDC, new BigDecimal("40"));

        assertThat(vault.balanceOf("alice", USDC)).isEqualByComparingTo("60");
        assertThat(vault.balanceOf(SystemAccounts.POOL, USDC)).isEqualByComparingTo("40");
        assertThat(vault.allowance("alice", SystemAccounts.PROTOCOL, USDC)).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("approve replaces the previous allowance")
    void approveReplaces() {
        vault.approve("alice", SystemAccounts.PROTOCOL, USDC, new BigDecimal("60"));
        vault.approve("alice", SystemAccounts.PROTOCOL, USDC, new BigDecimal("5"));

        assertThat(vault.allowance("alice", SystemAccounts.PROTOCOL, USDC)).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("fails a pull above the allowance")
    void insufficientAllowance() {
        vault.approve("alice", SystemAccounts.PROTOCOL, USDC, new BigDecimal("10"));

        assertThatThrownBy(() -> vault.pull(SystemAccounts.PROTOCOL, "alice", SystemAccounts.POOL, USDC, new BigDecimal("11")))
                .isInstanceOf(ResourceException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.TRANSFER_FAILED);
        assertThat(vault.balanceOf("alice", USDC)).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("fails a transfer above the balance")
    void insufficientBalance() {
        assertThatThrownBy(() -> vault.push("alice", "bob", USDC, new BigDecimal("100.01")))
                .isInstanceOf(ResourceException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.TRANSFER_FAILED);
        assertThat(vault.balanceOf("bob", USDC)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("treats zero transfers as no-ops and rejects negative ones")
    void amounts() {
        vault.push("nobody", "bob", USDC, BigDecimal.ZERO);

        assertThat(vault.balanceOf("bob", USDC)).isEqualByComparingTo("0");
        assertThatThrownBy(() -> vault.push("alice", "bob", USDC, new BigDecimal("-1")))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.INVALID_AMOUNT);
    }
}
