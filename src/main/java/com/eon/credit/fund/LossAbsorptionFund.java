package com.eon.credit.fund;

import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.ledger.LedgerTransactions;
import com.eon.credit.transfer.SystemAccounts;
import com.eon.credit.transfer.TransferGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;

/**
 * Backstop for lender shortfalls. Coverage per default is capped at a fixed fraction of the
 * loan principal and at the fund balance; an empty fund pays zero instead of failing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LossAbsorptionFund {

    private final FundRepository repository;
    private final TransferGateway transfers;
    private final AuthorizationGate gate;
    private final LedgerTransactions transactions;
    private final CreditProperties properties;
    private final Clock clock;

    public FundStatistics deposit(String depositor, BigDecimal amount) {
        return transactions.write(() -> {
            requirePositive(amount);
            transfers.pull(SystemAccounts.PROTOCOL, depositor, SystemAccounts.INSURANCE_FUND, asset(), amount);
            repository.addDeposit(asset(), amount);
            log.info("{} deposited {} {} into the loss fund", depositor, amount, asset());
            return statistics();
        });
    }

    /** Skims the configured share of protocol revenue from the treasury. Returns the amount allocated. */
    public BigDecimal allocateRevenue(String caller, BigDecimal revenue) {
        return transactions.write(() -> {
            gate.require(caller, Capability.FUND_REQUESTOR);
            requirePositive(revenue);
            BigDecimal allocation = revenue.multiply(properties.getFund().getRevenueAllocationPercent())
                    .setScale(18, RoundingMode.DOWN);
            transfers.push(SystemAccounts.TREASURY, SystemAccounts.INSURANCE_FUND, asset(), allocation);
            repository.addRevenue(asset(), allocation);
            log.debug("Allocated {} of revenue {} to the loss fund", allocation, revenue);
            return allocation;
        });
    }

    /**
     * Pays {@code min(loss, principal * maxCoveragePercent, balance)} to {@code lender} and records
     * the default. Returns the amount paid.
     */
    public BigDecimal coverLoss(String caller, String subject, long loanId, BigDecimal principal,
                                BigDecimal lossAmount, String lender) {
        return transactions.write(() -> {
            gate.require(caller, Capability.FUND_REQUESTOR);
            if (principal == null || principal.signum() < 0 || lossAmount == null || lossAmount.signum() < 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Principal and loss must not be negative");
            }
            if (repository.findDefault(loanId).isPresent()) {
                throw new StateConflictException(CreditErrorCode.LOSS_ALREADY_COVERED,
                        "Loss of loan " + loanId + " was already recorded");
            }
            BigDecimal covered = lossAmount.min(maxCoverage(principal)).min(balance());
            transfers.push(SystemAccounts.INSURANCE_FUND, lender, asset(), covered);
            repository.insertDefault(new DefaultRecord(loanId, subject, lender, principal, lossAmount, covered, clock.instant()));
            repository.addCoverage(asset(), covered);
            log.info("Loss fund covered {} of {} loss on loan {} ({})", covered, lossAmount, loanId, subject);
            return covered;
        });
    }

    public BigDecimal emergencyWithdraw(String admin, String recipient, BigDecimal amount) {
        return transactions.write(() -> {
            gate.require(admin, Capability.ADMIN);
            requirePositive(amount);
            if (amount.compareTo(balance()) > 0) {
                throw new ResourceException(CreditErrorCode.INSUFFICIENT_LIQUIDITY,
                        "Fund balance " + balance() + " below requested " + amount);
            }
            transfers.push(SystemAccounts.INSURANCE_FUND, recipient, asset(), amount);
            log.warn("Emergency withdrawal of {} {} to {} by {}", amount, asset(), recipient, admin);
            return balance();
        });
    }

    public BigDecimal maxCoverage(BigDecimal principal) {
        return principal.multiply(properties.getFund().getMaxCoveragePercent()).setScale(18, RoundingMode.DOWN);
    }

    public BigDecimal availableCoverage(BigDecimal principal) {
        return maxCoverage(principal).min(balance());
    }

    public BigDecimal balance() {
        return transfers.balanceOf(SystemAccounts.INSURANCE_FUND, asset());
    }

    public FundStatistics statistics() {
        FundRepository.Totals totals = repository.findTotals(asset());
        return new FundStatistics(asset(), balance(), totals.totalDeposited(), totals.totalRevenue(),
                totals.totalCovered(), totals.defaultCount());
    }

    public Optional<DefaultRecord> defaultHistory(long loanId) {
        return repository.findDefault(loanId);
    }

    private String asset() {
        return properties.getPool().getBorrowAsset();
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Amount must be greater than zero");
        }
    }
}
