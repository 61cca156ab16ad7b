package com.eon.credit.ledger;

import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.NotFoundException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.identity.IdentityRepository;
import com.eon.credit.scoring.TierTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Write side of the ledger. Every event lands together with its aggregate counter update in one
 * transition, and only principals holding {@link Capability#LEDGER_WRITER} may write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditRegistry {

    static final String LOAN_SEQUENCE = "loan";

    private final LedgerRepository ledger;
    private final IdentityRepository identity;
    private final AuthorizationGate gate;
    private final LedgerTransactions transactions;
    private final TierTable tiers;
    private final CreditProperties properties;
    private final Clock clock;

    public long registerLoan(String caller, String subject, BigDecimal principal, String counterparty) {
        return transactions.write(() -> {
            gate.require(caller, Capability.LEDGER_WRITER);
            requireSubject(subject);
            if (principal == null || principal.signum() <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Loan principal must be positive");
            }
            Instant now = clock.instant();
            long loanId = ledger.nextId(LOAN_SEQUENCE);
            ledger.insertLoan(new LoanRecord(loanId, subject, principal, BigDecimal.ZERO, now, LoanStatus.ACTIVE,
                    counterparty == null || counterparty.isBlank() ? caller : counterparty));
            ledger.ensureCounters(subject);
            ledger.countLoanOpened(subject, principal);
            identity.touchFirstSeen(subject, now);
            log.info("Loan {} registered for {} principal={} by {}", loanId, subject, principal, caller);
            return loanId;
        });
    }

    /**
     * Applies a principal repayment. Amounts beyond the remaining principal are accepted and
     * settle the loan; only the remaining principal is counted.
     */
    public LoanRecord registerRepayment(String caller, long loanId, BigDecimal amount) {
        return transactions.write(() -> {
            gate.require(caller, Capability.LEDGER_WRITER);
            requireNonNegative(amount);
            LoanRecord loan = activeLoan(loanId);

            BigDecimal applied = amount.min(loan.remainingPrincipal());
            BigDecimal repaid = loan.repaidPrincipal().add(applied);
            boolean settled = repaid.compareTo(loan.principal()) >= 0;
            LoanStatus status = settled ? LoanStatus.REPAID : LoanStatus.ACTIVE;

            ledger.updateRepayment(loanId, repaid, status);
            if (settled) {
                ledger.countLoanRepaid(loan.subject());
                log.info("Loan {} of {} fully repaid", loanId, loan.subject());
            } else {
                log.info("Loan {} repayment {} applied, remaining {}", loanId, applied, loan.principal().subtract(repaid));
            }
            return getLoan(loanId);
        });
    }

    public LoanRecord registerLiquidation(String caller, long loanId, BigDecimal recoveredAmount) {
        return transactions.write(() -> {
            gate.require(caller, Capability.LEDGER_WRITER);
            requireNonNegative(recoveredAmount);
            LoanRecord loan = activeLoan(loanId);

            ledger.updateStatus(loanId, LoanStatus.LIQUIDATED);
            ledger.countLoanLiquidated(loan.subject());
            log.info("Loan {} of {} liquidated, recovered {}", loanId, loan.subject(), recoveredAmount);
            return getLoan(loanId);
        });
    }

    /**
     * Records collateral once per loan. Counts the loan as a maximum-leverage borrow when its
     * principal reached the origination tier's max LTV (within the configured tolerance), and
     * counts the asset when the subject has never pledged it before.
     */
    public CollateralRecord recordCollateral(String caller, long loanId, String collateralAsset,
                                             BigDecimal collateralValueUsd, int scoreAtOrigination) {
        return transactions.write(() -> {
            gate.require(caller, Capability.LEDGER_WRITER);
            if (collateralAsset == null || collateralAsset.isBlank()) {
                throw new ValidationException(CreditErrorCode.UNSUPPORTED_ASSET, "Collateral asset is required");
            }
            if (collateralValueUsd == null || collateralValueUsd.signum() <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Collateral value must be positive");
            }
            CreditProperties.Scoring scoring = properties.getScoring();
            if (scoreAtOrigination < scoring.getMinScore() || scoreAtOrigination > scoring.getMaxScore()) {
                throw new ValidationException(CreditErrorCode.INVALID_SCORE,
                        "Score " + scoreAtOrigination + " outside " + scoring.getMinScore() + ".." + scoring.getMaxScore());
            }
            LoanRecord loan = getLoan(loanId);
            if (ledger.findCollateral(loanId).isPresent()) {
                throw new StateConflictException(CreditErrorCode.COLLATERAL_ALREADY_RECORDED,
                        "Collateral already recorded for loan " + loanId);
            }

            BigDecimal leverage = loan.principal().divide(collateralValueUsd, 18, RoundingMode.HALF_UP);
            BigDecimal maxLtv = tiers.forScore(scoreAtOrigination).maxLtv();
            boolean atMaxLeverage = leverage.compareTo(maxLtv.subtract(properties.getHealth().getMaxLeverageTolerance())) >= 0;

            CollateralRecord record = new CollateralRecord(loanId, collateralAsset, collateralValueUsd, scoreAtOrigination);
            ledger.insertCollateral(record);
            boolean newAsset = ledger.markAssetUsed(loan.subject(), collateralAsset);
            ledger.countCollateral(loan.subject(), collateralValueUsd, atMaxLeverage, newAsset);
            log.debug("Collateral for loan {}: {} worth {} (max leverage: {}, new asset: {})",
                    loanId, collateralAsset, collateralValueUsd, atMaxLeverage, newAsset);
            return record;
        });
    }

    public LoanRecord getLoan(long loanId) {
        return ledger.findLoan(loanId)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.LOAN_NOT_FOUND, "Loan " + loanId + " not found"));
    }

    public List<LoanRecord> loansOf(String subject) {
        return ledger.findLoansBySubject(subject);
    }

    public List<Long> loanIdsOf(String subject) {
        return ledger.findLoanIdsBySubject(subject);
    }

    public AggregateCounters counters(String subject) {
        return ledger.findCounters(subject);
    }

    private LoanRecord activeLoan(long loanId) {
        LoanRecord loan = getLoan(loanId);
        if (!loan.isActive()) {
            throw new StateConflictException(CreditErrorCode.LOAN_NOT_ACTIVE,
                    "Loan " + loanId + " is " + loan.status());
        }
        return loan;
    }

    private static void requireSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new ValidationException(CreditErrorCode.INVALID_SUBJECT, "Subject is required");
        }
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Amount must not be negative");
        }
    }
}
