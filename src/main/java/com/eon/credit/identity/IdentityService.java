package com.eon.credit.identity;

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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {

    private final IdentityRepository repository;
    private final IdentityProofVerifier verifier;
    private final TransferGateway transfers;
    private final AuthorizationGate gate;
    private final LedgerTransactions transactions;
    private final CreditProperties properties;
    private final Clock clock;

    /**
     * Accepts a proof signed by the trusted issuer over (subject, commitmentHash, expiresAt).
     * A newer proof replaces the stored one.
     */
    public IdentityProof submitIdentityProof(String subject, String commitmentHash, long expiresAt, String signature) {
        return transactions.write(() -> {
            Instant now = clock.instant();
            if (expiresAt <= now.getEpochSecond()) {
                throw new ValidationException(CreditErrorCode.PROOF_EXPIRED,
                        "Proof expired at " + Instant.ofEpochSecond(expiresAt));
            }
            if (!verifier.isIssuedByTrustedIssuer(subject, commitmentHash, expiresAt, signature)) {
                throw new ValidationException(CreditErrorCode.INVALID_PROOF,
                        "Identity proof for " + subject + " is not signed by the trusted issuer");
            }
            IdentityProof proof = new IdentityProof(subject, commitmentHash.toLowerCase(), now, Instant.ofEpochSecond(expiresAt));
            repository.saveProof(proof);
            repository.touchFirstSeen(subject, now);
            log.info("Identity proof accepted for {} valid until {}", subject, proof.expiresAt());
            return proof;
        });
    }

    /** Adds to the subject's stake. The lock is extended to now + lockDuration, never shortened. */
    public StakeCommitment stake(String subject, BigDecimal amount, Duration lockDuration) {
        return transactions.write(() -> {
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Stake amount must be positive");
            }
            if (lockDuration == null || lockDuration.isNegative()) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Lock duration must not be negative");
            }
            Instant now = clock.instant();
            StakeCommitment current = repository.findStake(subject);
            Instant requested = now.plus(lockDuration);
            Instant lockUntil = requested.isAfter(current.lockUntil()) ? requested : current.lockUntil();

            transfers.pull(SystemAccounts.PROTOCOL, subject, SystemAccounts.STAKE_ESCROW, stakingAsset(), amount);
            StakeCommitment updated = new StakeCommitment(subject, current.amount().add(amount), lockUntil);
            repository.saveStake(updated);
            repository.touchFirstSeen(subject, now);
            log.info("{} staked {} (total {}) locked until {}", subject, amount, updated.amount(), lockUntil);
            return updated;
        });
    }

    public StakeCommitment unstake(String subject, BigDecimal amount) {
        return transactions.write(() -> {
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "Unstake amount must be positive");
            }
            Instant now = clock.instant();
            StakeCommitment current = repository.findStake(subject);
            if (current.isLocked(now)) {
                throw new StateConflictException(CreditErrorCode.LOCK_ACTIVE,
                        "Stake of " + subject + " is locked until " + current.lockUntil());
            }
            if (current.amount().compareTo(amount) < 0) {
                throw new ResourceException(CreditErrorCode.INSUFFICIENT_STAKE,
                        "Staked " + current.amount() + ", requested " + amount);
            }
            transfers.push(SystemAccounts.STAKE_ESCROW, subject, stakingAsset(), amount);
            StakeCommitment updated = new StakeCommitment(subject, current.amount().subtract(amount), current.lockUntil());
            repository.saveStake(updated);
            log.info("{} unstaked {} (remaining {})", subject, amount, updated.amount());
            return updated;
        });
    }

    public ActivityCounters recordVote(String caller, String subject) {
        return transactions.write(() -> {
            gate.require(caller, Capability.ACTIVITY_REPORTER);
            repository.incrementVotes(subject);
            repository.touchFirstSeen(subject, clock.instant());
            return repository.findActivity(subject);
        });
    }

    public ActivityCounters recordProposal(String caller, String subject) {
        return transactions.write(() -> {
            gate.require(caller, Capability.ACTIVITY_REPORTER);
            repository.incrementProposals(subject);
            repository.touchFirstSeen(subject, clock.instant());
            return repository.findActivity(subject);
        });
    }

    /** Backfills first-seen from off-ledger discovery. Has no effect once first-seen is set. */
    public ActivityCounters recordFirstSeen(String caller, String subject, Instant at) {
        return transactions.write(() -> {
            gate.require(caller, Capability.ACTIVITY_REPORTER);
            Instant now = clock.instant();
            if (at == null || at.isAfter(now)) {
                throw new ValidationException(CreditErrorCode.INVALID_AMOUNT, "First-seen time must not be in the future");
            }
            if (repository.touchFirstSeen(subject, at)) {
                log.info("First-seen of {} set to {}", subject, at);
            }
            return repository.findActivity(subject);
        });
    }

    public Optional<IdentityProof> proofOf(String subject) {
        return repository.findProof(subject);
    }

    public StakeCommitment stakeOf(String subject) {
        return repository.findStake(subject);
    }

    public ActivityCounters activityOf(String subject) {
        return repository.findActivity(subject);
    }

    private String stakingAsset() {
        return properties.getIdentity().getStakingAsset();
    }
}
