package com.eon.credit.lending;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.ledger.LedgerTransactions;
import com.eon.credit.transfer.SystemAccounts;
import com.eon.credit.transfer.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Share-based lending pool in the borrow asset. Pool value is cash held in the {@code pool}
 * account plus principal currently lent out; LP interest raises the value of every share.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidityPool {

    private static final int SCALE = 18;

    private final PoolRepository repository;
    private final TransferGateway transfers;
    private final InterestRateModel rateModel;
    private final LedgerTransactions transactions;
    private final CreditProperties properties;

    public LpPosition deposit(String provider, BigDecimal amount) {
        return transactions.write(() -> {
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Deposit must be positive");
            }
            PoolRepository.PoolState state = state();
            BigDecimal assetsBefore = totalAssets(state);
            BigDecimal minted = state.totalShares().signum() == 0 || assetsBefore.signum() == 0
                    ? amount
                    : amount.multiply(state.totalShares()).divide(assetsBefore, SCALE, RoundingMode.DOWN);

            transfers.pull(SystemAccounts.PROTOCOL, provider, SystemAccounts.POOL, asset(), amount);
            repository.save(new PoolRepository.PoolState(state.asset(), state.totalShares().add(minted),
                    state.totalBorrowed(), state.totalInterestEarned()));
            repository.saveShares(provider, asset(), repository.findShares(provider, asset()).add(minted));
            log.info("{} deposited {} {} for {} shares", provider, amount, asset(), minted);
            return positionOf(provider);
        });
    }

    public LpPosition withdraw(String provider, BigDecimal shares) {
        return transactions.write(() -> {
            if (shares == null || shares.signum() <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Shares to withdraw must be positive");
            }
            BigDecimal held = repository.findShares(provider, asset());
            if (held.compareTo(shares) < 0) {
                throw new ResourceException(CreditErrorCode.INSUFFICIENT_SHARES, provider + " holds " + held + " shares");
            }
            PoolRepository.PoolState state = state();
            BigDecimal amount = shares.multiply(totalAssets(state)).divide(state.totalShares(), SCALE, RoundingMode.DOWN);
            if (availableLiquidity().compareTo(amount) < 0) {
                throw new ResourceException(CreditErrorCode.INSUFFICIENT_LIQUIDITY,
                        "Pool cash " + availableLiquidity() + " cannot cover withdrawal of " + amount);
            }
            transfers.push(SystemAccounts.POOL, provider, asset(), amount);
            repository.save(new PoolRepository.PoolState(state.asset(), state.totalShares().subtract(shares),
                    state.totalBorrowed(), state.totalInterestEarned()));
            repository.saveShares(provider, asset(), held.subtract(shares));
            log.info("{} withdrew {} {} burning {} shares", provider, amount, asset(), shares);
            return positionOf(provider);
        });
    }

    public LpPosition positionOf(String provider) {
        PoolRepository.PoolState state = state();
        BigDecimal shares = repository.findShares(provider, asset());
        BigDecimal value = state.totalShares().signum() == 0 ? BigDecimal.ZERO
                : shares.multiply(totalAssets(state)).divide(state.totalShares(), SCALE, RoundingMode.DOWN);
        return new LpPosition(provider, asset(), shares, value);
    }

    public BigDecimal availableLiquidity() {
        return transfers.balanceOf(SystemAccounts.POOL, asset());
    }

    public BigDecimal totalBorrowed() {
        return state().totalBorrowed();
    }

    public BigDecimal totalValueLocked() {
        return totalAssets(state());
    }

    public BigDecimal utilization() {
        PoolRepository.PoolState state = state();
        return rateModel.utilization(state.totalBorrowed(), totalAssets(state));
    }

    /** Utilization if {@code additionalBorrow} more were lent out now. */
    public BigDecimal utilizationAfter(BigDecimal additionalBorrow) {
        PoolRepository.PoolState state = state();
        return rateModel.utilization(state.totalBorrowed().add(additionalBorrow), totalAssets(state));
    }

    public BigDecimal currentBorrowRate() {
        return rateModel.borrowRate(utilization());
    }

    public PoolStats stats() {
        PoolRepository.PoolState state = state();
        BigDecimal utilization = rateModel.utilization(state.totalBorrowed(), totalAssets(state));
        return new PoolStats(asset(), totalAssets(state), availableLiquidity(), state.totalBorrowed(),
                utilization, rateModel.borrowRate(utilization), state.totalInterestEarned(), state.totalShares());
    }

    void recordBorrow(BigDecimal principal) {
        PoolRepository.PoolState s = state();
        repository.save(new PoolRepository.PoolState(s.asset(), s.totalShares(), s.totalBorrowed().add(principal),
                s.totalInterestEarned()));
    }

    /** Principal leaves the borrowed book; LP interest has already landed in pool cash. */
    void recordReturn(BigDecimal principal, BigDecimal lpInterest) {
        PoolRepository.PoolState s = state();
        repository.save(new PoolRepository.PoolState(s.asset(), s.totalShares(),
                s.totalBorrowed().subtract(principal).max(BigDecimal.ZERO), s.totalInterestEarned().add(lpInterest)));
    }

    private PoolRepository.PoolState state() {
        return repository.find(asset());
    }

    private BigDecimal totalAssets(PoolRepository.PoolState state) {
        return availableLiquidity().add(state.totalBorrowed());
    }

    private String asset() {
        return properties.getPool().getBorrowAsset();
    }

    public record LpPosition(String provider, String asset, BigDecimal shares, BigDecimal value) {}

    public record PoolStats(String asset, BigDecimal totalValueLocked, BigDecimal availableLiquidity,
                            BigDecimal totalBorrowed, BigDecimal utilization, BigDecimal borrowRate,
                            BigDecimal totalInterestEarned, BigDecimal totalShares) {}
}
