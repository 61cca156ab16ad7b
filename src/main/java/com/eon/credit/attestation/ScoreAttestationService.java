package com.eon.credit.attestation;

import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ResourceException;
import com.eon.credit.error.StateConflictException;
import com.eon.credit.error.ValidationException;
import com.eon.credit.ledger.LedgerTransactions;
import com.eon.credit.scoring.CreditTier;
import com.eon.credit.transfer.SystemAccounts;
import com.eon.credit.transfer.TransferGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Optimistic score attestations. An attester posts a score, anyone may dispute it with a bond
 * during the challenge period, and an unchallenged attestation finalizes once the period ends.
 * Disputes are resolved by an admin.
 */
@Slf4j
@Service
public class ScoreAttestationService {

    static final Duration MIN_CHALLENGE_PERIOD = Duration.ofMinutes(10);
    static final Duration MAX_CHALLENGE_PERIOD = Duration.ofHours(24);
    static final BigDecimal MIN_BOND = new BigDecimal("100");
    static final BigDecimal MAX_BOND = new BigDecimal("10000");
    static final int MAX_LTV_PERCENT = 90;
    static final int MAX_DATA_QUALITY = 2;

    private final AttestationRepository repository;
    private final TransferGateway transfers;
    private final AuthorizationGate gate;
    private final LedgerTransactions transactions;
    private final CreditProperties properties;
    private final Clock clock;

    public ScoreAttestationService(AttestationRepository repository, TransferGateway transfers, AuthorizationGate gate,
                                   LedgerTransactions transactions, CreditProperties properties, Clock clock) {
        this.repository = repository;
        this.transfers = transfers;
        this.gate = gate;
        this.transactions = transactions;
        this.properties = properties;
        this.clock = clock;

        CreditProperties.Attestation cfg = properties.getAttestation();
        if (cfg.getChallengePeriod().compareTo(MIN_CHALLENGE_PERIOD) < 0
                || cfg.getChallengePeriod().compareTo(MAX_CHALLENGE_PERIOD) > 0) {
            throw new ValidationException(CreditErrorCode.INVALID_CONFIGURATION,
                    "Challenge period must be between 10 minutes and 24 hours");
        }
        if (cfg.getChallengeBond().compareTo(MIN_BOND) < 0 || cfg.getChallengeBond().compareTo(MAX_BOND) > 0) {
            throw new ValidationException(CreditErrorCode.INVALID_CONFIGURATION,
                    "Challenge bond must be between " + MIN_BOND + " and " + MAX_BOND);
        }
    }

    public PendingAttestation attestScore(String attester, String subject, int score, int tier, int ltvPercent,
                                          int rateMultiplierPercent, int dataQuality, String evidenceRoot) {
        return transactions.write(() -> {
            gate.require(attester, Capability.ATTESTER);
            CreditProperties.Scoring scoring = properties.getScoring();
            if (score < scoring.getMinScore() || score > scoring.getMaxScore()) {
                throw new ValidationException(CreditErrorCode.INVALID_SCORE, "Score " + score + " out of range");
            }
            if (tier < 0 || tier >= CreditTier.values().length) {
                throw new ValidationException(CreditErrorCode.INVALID_TIER, "Tier " + tier + " out of range");
            }
            if (ltvPercent < 0 || ltvPercent > MAX_LTV_PERCENT) {
                throw new ValidationException(CreditErrorCode.INVALID_LTV, "LTV " + ltvPercent + "% out of range");
            }
            if (dataQuality < 0 || dataQuality > MAX_DATA_QUALITY || rateMultiplierPercent <= 0) {
                throw new ValidationException(CreditErrorCode.INVALID_SCORE, "Invalid data quality or rate multiplier");
            }
            if (evidenceRoot == null || evidenceRoot.isBlank()) {
                throw new ValidationException(CreditErrorCode.INVALID_PROOF, "Evidence root is required");
            }
            if (repository.findPending(subject).isPresent()) {
                throw new StateConflictException(CreditErrorCode.ATTESTATION_PENDING,
                        "An attestation for " + subject + " is already pending");
            }
            Instant now = clock.instant();
            PendingAttestation pending = new PendingAttestation(subject, score, tier, ltvPercent, rateMultiplierPercent,
                    dataQuality, evidenceRoot, attester, now, now.plus(properties.getAttestation().getChallengePeriod()),
                    null, null, null);
            repository.insertPending(pending);
            log.info("{} attested score {} for {}, challengeable until {}", attester, score, subject,
                    pending.challengeDeadline());
            return pending;
        });
    }

    public PendingAttestation challengeScore(String challenger, String subject, String reason, BigDecimal bond) {
        return transactions.write(() -> {
            PendingAttestation pending = pendingOrThrow(subject);
            if (!clock.instant().isBefore(pending.challengeDeadline())) {
                throw new StateConflictException(CreditErrorCode.CHALLENGE_PERIOD_EXPIRED,
                        "Challenge period for " + subject + " ended at " + pending.challengeDeadline());
            }
            if (pending.isChallenged()) {
                throw new StateConflictException(CreditErrorCode.ALREADY_CHALLENGED,
                        "Attestation for " + subject + " is already challenged");
            }
            BigDecimal required = properties.getAttestation().getChallengeBond();
            if (bond == null || bond.compareTo(required) < 0) {
                throw new ResourceException(CreditErrorCode.INSUFFICIENT_BOND, "Challenge bond must be at least " + required);
            }
            transfers.pull(SystemAccounts.PROTOCOL, challenger, SystemAccounts.BOND_ESCROW, bondAsset(), bond);
            PendingAttestation challenged = pending.withChallenge(challenger, reason, bond);
            repository.updateChallenge(challenged);
            log.info("{} challenged attestation for {}: {}", challenger, subject, reason);
            return challenged;
        });
    }

    public AttestedScore finalizeScore(String subject) {
        return transactions.write(() -> {
            PendingAttestation pending = pendingOrThrow(subject);
            if (pending.isChallenged()) {
                throw new StateConflictException(CreditErrorCode.ALREADY_CHALLENGED,
                        "Attestation for " + subject + " awaits challenge resolution");
            }
            Instant now = clock.instant();
            if (now.isBefore(pending.challengeDeadline())) {
                throw new StateConflictException(CreditErrorCode.CHALLENGE_PERIOD_ACTIVE,
                        "Challenge period for " + subject + " runs until " + pending.challengeDeadline());
            }
            return promote(pending, now);
        });
    }

    /** Upheld: the attestation is discarded and the bond returned. Rejected: the bond is forfeited and the score finalizes. */
    public Optional<AttestedScore> resolveChallenge(String admin, String subject, boolean upheld) {
        return transactions.write(() -> {
            gate.require(admin, Capability.ADMIN);
            PendingAttestation pending = pendingOrThrow(subject);
            if (!pending.isChallenged()) {
                throw new StateConflictException(CreditErrorCode.NO_PENDING_ATTESTATION,
                        "Attestation for " + subject + " has no open challenge");
            }
            if (upheld) {
                transfers.push(SystemAccounts.BOND_ESCROW, pending.challenger(), bondAsset(), pending.bond());
                repository.deletePending(subject);
                log.info("Challenge against {} upheld by {}, attestation discarded", subject, admin);
                return Optional.empty();
            }
            transfers.push(SystemAccounts.BOND_ESCROW, SystemAccounts.TREASURY, bondAsset(), pending.bond());
            log.info("Challenge against {} rejected by {}, bond forfeited", subject, admin);
            return Optional.of(promote(pending, clock.instant()));
        });
    }

    public Optional<PendingAttestation> pending(String subject) {
        return repository.findPending(subject);
    }

    public Optional<AttestedScore> finalizedScore(String subject) {
        return repository.findFinalized(subject);
    }

    public boolean hasValidScore(String subject, Duration maxAge) {
        Instant now = clock.instant();
        return repository.findFinalized(subject)
                .map(s -> !s.finalizedAt().plus(maxAge).isBefore(now))
                .orElse(false);
    }

    private AttestedScore promote(PendingAttestation pending, Instant now) {
        AttestedScore finalized = AttestedScore.from(pending, now);
        repository.saveFinalized(finalized);
        repository.deletePending(pending.subject());
        log.info("Attested score {} finalized for {}", finalized.score(), finalized.subject());
        return finalized;
    }

    private PendingAttestation pendingOrThrow(String subject) {
        return repository.findPending(subject)
                .orElseThrow(() -> new StateConflictException(CreditErrorCode.NO_PENDING_ATTESTATION,
                        "No pending attestation for " + subject));
    }

    private String bondAsset() {
        return properties.getAttestation().getBondAsset();
    }
}
