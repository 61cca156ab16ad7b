package com.eon.credit.lending;

import com.eon.credit.auth.Capability;
import com.eon.credit.error.AuthorizationException;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.UpstreamException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.ledger.AggregateCounters;
import com.eon.credit.ledger.LoanStatus;
import com.eon.credit.scoring.CreditTier;
import com.eon.credit.support.LedgerFixture;
import com.eon.credit.transfer.SystemAccounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;

import static com.eon.credit.support.LedgerFixture.USDC;
import static com.eon.credit.support.LedgerFixture.WETH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LendingService")
class LendingServiceTest {

    private static final String ALICE = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private LedgerFixture fx;
    private LendingService lending;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        lending = fx.lending;
        fx.seedPool("100000");
        fx.fund(ALICE, WETH, "10");
        fx.approveAll(ALICE, USDC);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    /** Puts ALICE in the requested tier using identity, history and reputation inputs. */
    private void placeInTier(CreditTier tier) {
        switch (tier) {
            case SILVER:
                fx.makeSybilResistant(ALICE);
                break;
            case GOLD:
                fx.makeSybilResistant(ALICE);
                fx.giveCleanHistory(ALICE);
                break;
            case PLATINUM:
                fx.makeSybilResistant(ALICE);
                fx.giveCleanHistory(ALICE);
                fx.reputation.put(ALICE, 100);
                break;
            default:
                break;
        }
        assertThat(fx.scoreEngine.computeScore(ALICE).tier()).isEqualTo(tier);
    }

    @Nested
    @DisplayName("borrow")
    class Borrow {

        @ParameterizedTest(name = "{0} may borrow {1} against 1 WETH but not more")
        @CsvSource({
                "BRONZE, 1000",
                "SILVER, 1300",
                "GOLD, 1500",
                "PLATINUM, 1800"
        })
        void ltvLimitPerTier(CreditTier tier, String limit) {
            placeInTier(tier);
            BigDecimal max = new BigDecimal(limit);

            assertThatThrownBy(() -> lending.borrow(ALICE, WETH, BigDecimal.ONE, max.add(new BigDecimal("0.01"))))
                    .isInstanceOf(ResourceException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.EXCEEDS_ALLOWED_LTV);

            LoanPosition position = lending.borrow(ALICE, WETH, BigDecimal.ONE, max);
            assertThat(position.outstandingPrincipal()).isEqualByComparingTo(max);
        }

        @Test
        @DisplayName("opens the position, moves value and reports to the ledger")
        void opensPosition() {
            LoanPosition position = lending.borrow(ALICE, WETH, new BigDecimal("2"), new BigDecimal("1000"));

            assertThat(position.status()).isEqualTo(LoanStatus.ACTIVE);
            assertThat(position.liquidationThreshold()).isEqualByComparingTo("0.50");
            // (0.02 + 0.01 / 0.8 * 0.04) * 1.5 at 1% post-borrow utilization
            assertThat(position.interestRate()).isEqualByComparingTo("0.03075");

            assertThat(fx.vault.balanceOf(ALICE, USDC)).isEqualByComparingTo("1000");
            assertThat(fx.vault.balanceOf(ALICE, WETH)).isEqualByComparingTo("8");
            assertThat(fx.vault.balanceOf(SystemAccounts.COLLATERAL_ESCROW, WETH)).isEqualByComparingTo("2");
            assertThat(fx.pool.totalBorrowed()).isEqualByComparingTo("1000");

            assertThat(fx.registry.getLoan(position.loanId()).principal()).isEqualByComparingTo("1000");
            assertThat(fx.ledger.findCollateral(position.loanId()).orElseThrow().collateralValueUsd())
                    .isEqualByComparingTo("4000");
        }

        @Test
        @DisplayName("rejects loans the pool cannot fund and leaves no trace")
        void insufficientLiquidity() {
            fx.fund(ALICE, WETH, "1000");

            assertThatThrownBy(() -> lending.borrow(ALICE, WETH, new BigDecimal("500"), new BigDecimal("200000")))
                    .isInstanceOf(ResourceException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.INSUFFICIENT_LIQUIDITY);

            assertThat(fx.registry.loansOf(ALICE)).isEmpty();
            assertThat(fx.vault.balanceOf(ALICE, WETH)).isEqualByComparingTo("1010");
        }

        @Test
        @DisplayName("rolls back transfers and pool accounting when the ledger rejects the engine")
        void rollbackAfterTransfers() {
            fx.gate.revoke(LedgerFixture.ADMIN, fx.properties.getPrincipals().getLendingEngine(), Capability.LEDGER_WRITER);

            assertThatThrownBy(() -> lending.borrow(ALICE, WETH, BigDecimal.ONE, new BigDecimal("500")))
                    .isInstanceOf(AuthorizationException.class);

            assertThat(fx.vault.balanceOf(ALICE, USDC)).isEqualByComparingTo("0");
            assertThat(fx.vault.balanceOf(ALICE, WETH)).isEqualByComparingTo("10");
            assertThat(fx.vault.balanceOf(SystemAccounts.COLLATERAL_ESCROW, WETH)).isEqualByComparingTo("0");
            assertThat(fx.pool.availableLiquidity()).isEqualByComparingTo("100000");
            assertThat(fx.pool.totalBorrowed()).isEqualByComparingTo("0");
            assertThat(lending.positionsOf(ALICE)).isEmpty();
        }

        @Test
        @DisplayName("fails cleanly when the collateral transfer is not approved")
        void rollback() {
            fx.vault.approve(ALICE, SystemAccounts.PROTOCOL, WETH, BigDecimal.ZERO);

            assertThatThrownBy(() -> lending.borrow(ALICE, WETH, BigDecimal.ONE, new BigDecimal("500")))
                    .isInstanceOf(ResourceException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.TRANSFER_FAILED);

            AggregateCounters counters = fx.registry.counters(ALICE);
            assertThat(counters.totalLoans()).isZero();
            assertThat(fx.pool.totalBorrowed()).isEqualByComparingTo("0");
            assertThat(fx.vault.balanceOf(ALICE, USDC)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("refuses stale prices and unsupported collateral")
        void priceGates() {
            fx.priceFeed.setUpdatedAt(WETH, LedgerFixture.START.minus(Duration.ofHours(2)));
            assertThatThrownBy(() -> lending.borrow(ALICE, WETH, BigDecimal.ONE, new BigDecimal("100")))
                    .isInstanceOf(UpstreamException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.STALE_PRICE);

            assertThatThrownBy(() -> lending.borrow(ALICE, "DOGE", BigDecimal.ONE, new BigDecimal("100")))
                    .isInstanceOf(ValidationException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.UNSUPPORTED_ASSET);
        }
    }

    @Nested
    @DisplayName("repay")
    class Repay {

        @Test
        @DisplayName("releases collateral in proportion to principal repaid")
        void proportionalRelease() {
            long loanId = lending.borrow(ALICE, WETH, new BigDecimal("2"), new BigDecimal("1000")).loanId();

            LendingService.Repayment half = lending.repay(ALICE, loanId, new BigDecimal("500"));
            assertThat(half.principalPaid()).isEqualByComparingTo("500");
            assertThat(half.collateralReleased()).isEqualByComparingTo("1");
            assertThat(half.settled()).isFalse();

            LendingService.Repayment rest = lending.repay(ALICE, loanId, new BigDecimal("500"));
            assertThat(rest.settled()).isTrue();
            assertThat(rest.collateralReleased()).isEqualByComparingTo("1");

            assertThat(fx.vault.balanceOf(ALICE, WETH)).isEqualByComparingTo("10");
            assertThat(fx.registry.getLoan(loanId).status()).isEqualTo(LoanStatus.REPAID);
            assertThat(lending.position(loanId).status()).isEqualTo(LoanStatus.REPAID);
            assertThat(fx.pool.totalBorrowed()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("pays interest first and shares protocol revenue with the fund")
        void interestFirst() {
            long loanId = lending.borrow(ALICE, WETH, new BigDecimal("2"), new BigDecimal("1000")).loanId();
            fx.clock.advance(Duration.ofDays(365));
            fx.fund(ALICE, USDC, "100");

            assertThat(lending.calculateDebt(loanId)).isEqualByComparingTo("1030.75");

            LendingService.Repayment r = lending.repay(ALICE, loanId, new BigDecimal("1030.75"));

            assertThat(r.interestPaid()).isEqualByComparingTo("30.75");
            assertThat(r.principalPaid()).isEqualByComparingTo("1000");
            assertThat(r.settled()).isTrue();
            // 10% protocol fee, 5% of which goes to the loss fund
            assertThat(fx.vault.balanceOf(SystemAccounts.TREASURY, USDC)).isEqualByComparingTo("2.92125");
            assertThat(fx.fund.balance()).isEqualByComparingTo("0.15375");
            assertThat(fx.pool.stats().totalInterestEarned()).isEqualByComparingTo("27.675");
        }

        @Test
        @DisplayName("interest-only payments leave principal and collateral untouched")
        void interestOnly() {
            long loanId = lending.borrow(ALICE, WETH, new BigDecimal("2"), new BigDecimal("1000")).loanId();
            fx.clock.advance(Duration.ofDays(365));

            LendingService.Repayment r = lending.repay(ALICE, loanId, new BigDecimal("10"));

            assertThat(r.interestPaid()).isEqualByComparingTo("10");
            assertThat(r.principalPaid()).isEqualByComparingTo("0");
            assertThat(r.collateralReleased()).isEqualByComparingTo("0");
            assertThat(lending.calculateDebt(loanId)).isEqualByComparingTo("1020.75");
            assertThat(fx.registry.getLoan(loanId).repaidPrincipal()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("only the borrower may repay an active loan")
        void ownership() {
            long loanId = lending.borrow(ALICE, WETH, BigDecimal.ONE, new BigDecimal("100")).loanId();

            assertThatThrownBy(() -> lending.repay("0xbob", loanId, BigDecimal.TEN))
                    .isInstanceOf(AuthorizationException.class);

            lending.repay(ALICE, loanId, new BigDecimal("100"));
            assertThatThrownBy(() -> lending.repay(ALICE, loanId, BigDecimal.TEN))
                    .isInstanceOf(StateConflictException.class)
                    .hasFieldOrPropertyWithValue("code", CreditErrorCode.LOAN_NOT_ACTIVE);
        }
    }

    @Test
    @DisplayName("added collateral lifts the health factor")
    void addCollateral() {
        long loanId = lending.borrow(ALICE, WETH, BigDecimal.ONE, new BigDecimal("1000")).loanId();
        BigDecimal before = lending.calculateHealthFactor(loanId).healthFactor();

        lending.addCollateral(ALICE, loanId, BigDecimal.ONE);

        assertThat(lending.position(loanId).collateralAmount()).isEqualByComparingTo("2");
        assertThat(lending.calculateHealthFactor(loanId).healthFactor()).isGreaterThan(before);
    }

    @Test
    @DisplayName("quotes the tier-adjusted rate at current utilization")
    void apr() {
        // empty book: base rate times the BRONZE multiplier
        assertThat(lending.aprFor(ALICE)).isEqualByComparingTo("0.03");
    }
}
