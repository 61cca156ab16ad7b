package com.eon.credit.fund;

import com.eon.credit.error.AuthorizationException;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.support.LedgerFixture;
import com.eon.credit.transfer.SystemAccounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.eon.credit.support.LedgerFixture.ADMIN;
import static com.eon.credit.support.LedgerFixture.LP;
import static com.eon.credit.support.LedgerFixture.USDC;
import static com.eon.credit.support.LedgerFixture.WRITER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LossAbsorptionFund")
class LossAbsorptionFundTest {

    private static final String ALICE = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String DONOR = "protocol-donor";

    private LedgerFixture fx;
    private LossAbsorptionFund fund;
    private String engine;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        fund = fx.fund;
        engine = fx.properties.getPrincipals().getLendingEngine();
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    private void depositFromDonor(String amount) {
        fx.fund(DONOR, USDC, amount);
        fund.deposit(DONOR, new BigDecimal(amount));
    }

    @Nested
    @DisplayName("coverage")
    class Coverage {

        @Test
        @DisplayName("is capped at 0.25% of principal")
        void capped() {
            depositFromDonor("1000");

            BigDecimal covered = fund.coverLoss(engine, ALICE, 7, new BigDecimal("100000"), new BigDecimal("400"), LP);

            assertThat(covered).isEqualByComparingTo("250");
            assertThat(fx.vault.balanceOf(LP, USDC)).isEqualByComparingTo("250");
            assertThat(fund.balance()).isEqualByComparingTo("750");
            assertThat(fund.defaultHistory(7)).hasValueSatisfying(d -> {
                assertThat(d.subject()).isEqualTo(ALICE);
                assertThat(d.lossAmount()).isEqualByComparingTo("400");
                assertThat(d.coveredAmount()).isEqualByComparingTo("250");
            });
        }

        @Test
        @DisplayName("never exceeds the loss itself")
        void smallLoss() {
            depositFromDonor("1000");

            assertThat(fund.coverLoss(engine, ALICE, 7, new BigDecimal("100000"), new BigDecimal("40"), LP))
                    .isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("pays zero from an empty fund and still records the default")
        void emptyFund() {
            BigDecimal covered = fund.coverLoss(engine, ALICE, 7, new BigDecimal("100000"), new BigDecimal("400"), LP);

            assertThat(covered).isEqualByComparingTo("0");
            assertThat(fund.statistics().defaultCount()).isEqualTo(1);
            assertThat(fund.availableCoverage(new BigDecimal("100000"))).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("is granted once per loan")
        void once() {
            depositFromDonor("1000");
            fund.coverLoss(engine, ALICE, 7, new BigDecimal("100000"), new BigDecimal("400"), LP);

            assertThatThrownBy(() -> fund.coverLoss(engine, ALICE, 7, new BigDecimal("100000"), new BigDecimal("400"), LP))
                    .isInstanceOf(StateConflictException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.LOSS_ALREADY_COVERED);
            assertThat(fund.balance()).isEqualByComparingTo("750");
        }

        @Test
        @DisplayName("is only paid to fund requestors")
        void unauthorized() {
            depositFromDonor("1000");

            assertThatThrownBy(() -> fund.coverLoss(WRITER, ALICE, 7, new BigDecimal("100000"), new BigDecimal("400"), WRITER))
                    .isInstanceOf(AuthorizationException.class);
            assertThat(fund.balance()).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("rejects negative amounts")
        void negative() {
            assertThatThrownBy(() -> fund.coverLoss(engine, ALICE, 7, new BigDecimal("100000"), new BigDecimal("-1"), LP))
                    .isInstanceOf(ValidationException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.INVALID_AMOUNT);
        }
    }

    @Test
    @DisplayName("skims 5% of protocol revenue from the treasury")
    void revenueAllocation() {
        fx.vault.mint(SystemAccounts.TREASURY, USDC, new BigDecimal("100"));

        BigDecimal allocated = fund.allocateRevenue(engine, new BigDecimal("100"));

        assertThat(allocated).isEqualByComparingTo("5");
        assertThat(fx.vault.balanceOf(SystemAccounts.TREASURY, USDC)).isEqualByComparingTo("95");
        assertThat(fund.statistics().totalRevenue()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("tracks deposits in its statistics")
    void statistics() {
        depositFromDonor("300");
        depositFromDonor("200");

        FundStatistics stats = fund.statistics();

        assertThat(stats.asset()).isEqualTo(USDC);
        assertThat(stats.balance()).isEqualByComparingTo("500");
        assertThat(stats.totalDeposited()).isEqualByComparingTo("500");
        assertThat(stats.defaultCount()).isZero();
    }

    @Nested
    @DisplayName("emergency withdrawal")
    class EmergencyWithdrawal {

        @Test
        @DisplayName("moves funds for an admin")
        void admin() {
            depositFromDonor("1000");

            BigDecimal remaining = fund.emergencyWithdraw(ADMIN, "cold-wallet", new BigDecimal("600"));

            assertThat(remaining).isEqualByComparingTo("400");
            assertThat(fx.vault.balanceOf("cold-wallet", USDC)).isEqualByComparingTo("600");
        }

        @Test
        @DisplayName("cannot exceed the balance")
        void exceeds() {
            depositFromDonor("100");

            assertThatThrownBy(() -> fund.emergencyWithdraw(ADMIN, "cold-wallet", new BigDecimal("101")))
                    .isInstanceOf(ResourceException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.INSUFFICIENT_LIQUIDITY);
        }

        @Test
        @DisplayName("is refused to anyone else")
        void nonAdmin() {
            depositFromDonor("100");

            assertThatThrownBy(() -> fund.emergencyWithdraw(DONOR, DONOR, new BigDecimal("100")))
                    .isInstanceOf(AuthorizationException.class);
        }
    }
}
