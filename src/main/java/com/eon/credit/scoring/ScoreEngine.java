package com.eon.credit.scoring;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ValidationException;
import com.eon.credit.identity.ActivityCounters;
import com.eon.credit.identity.IdentityProof;
import com.eon.credit.identity.IdentityRepository;
import com.eon.credit.identity.StakeCommitment;
import com.eon.credit.ledger.AggregateCounters;
import com.eon.credit.ledger.LedgerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Five-factor composite score. Reads one aggregate row, one proof, one stake, one activity row
 * and one external reputation value per call, so cost does not depend on loan history length.
 */
@Slf4j
@Service
public class ScoreEngine {

    private final LedgerRepository ledger;
    private final IdentityRepository identity;
    private final ExternalReputationSource reputationSource;
    private final TierTable tiers;
    private final CreditProperties.Scoring params;
    private final Clock clock;

    public ScoreEngine(LedgerRepository ledger, IdentityRepository identity, ExternalReputationSource reputationSource,
                       TierTable tiers, CreditProperties properties, Clock clock) {
        this.ledger = ledger;
        this.identity = identity;
        this.reputationSource = reputationSource;
        this.tiers = tiers;
        this.params = properties.getScoring();
        this.clock = clock;
        if (params.getWeights().sum() != 100) {
            throw new ValidationException(CreditErrorCode.INVALID_CONFIGURATION,
                    "Score weights must sum to 100, got " + params.getWeights().sum());
        }
        if (params.getSybil().getRawCeiling() <= params.getSybil().getRawFloor()) {
            throw new ValidationException(CreditErrorCode.INVALID_CONFIGURATION, "Sybil raw ceiling must exceed floor");
        }
    }

    public ScoreBreakdown computeScore(String subject) {
        Instant now = clock.instant();
        AggregateCounters counters = ledger.findCounters(subject);
        Optional<IdentityProof> proof = identity.findProof(subject);
        StakeCommitment stake = identity.findStake(subject);
        ActivityCounters activity = identity.findActivity(subject);

        int s1 = repaymentScore(counters);
        int s2 = collateralScore(counters);
        int s3Raw = sybilRaw(proof.orElse(null), stake, activity, now);
        int s3 = sybilScore(s3Raw);
        int s4 = clamp(reputationSource.reputationOf(subject));
        int s5 = participationScore(activity);

        CreditProperties.Weights w = params.getWeights();
        int overall = clamp((s1 * w.getRepayment() + s2 * w.getCollateral() + s3 * w.getSybil()
                + s4 * w.getReputation() + s5 * w.getParticipation()) / 100);
        int creditScore = toCreditScore(overall);

        ScoreBreakdown breakdown = new ScoreBreakdown(subject, overall, creditScore, tiers.forScore(creditScore).tier(),
                s1, s2, s3, s3Raw, s4, s5, params.getVersion(), now);
        log.debug("Score {}", breakdown);
        return breakdown;
    }

    public TierTerms getScoreTier(String subject) {
        return tiers.forScore(computeScore(subject).creditScore());
    }

    /** Rescales 0..100 onto the configured credit score range. */
    public int toCreditScore(int overall) {
        int span = params.getMaxScore() - params.getMinScore();
        return params.getMinScore() + clamp(overall) * span / 100;
    }

    int repaymentScore(AggregateCounters c) {
        if (c.totalLoans() == 0) {
            return params.getRepaymentNeutral();
        }
        long raw = c.repaidLoans() * 100 / c.totalLoans() - c.liquidatedLoans() * params.getLiquidationPenalty();
        return clamp(raw);
    }

    int collateralScore(AggregateCounters c) {
        if (c.totalBorrowedUsd().signum() <= 0 || c.totalCollateralUsd().signum() <= 0) {
            return params.getCollateralNeutral();
        }
        BigDecimal ratio = c.totalCollateralUsd().divide(c.totalBorrowedUsd(), 6, RoundingMode.DOWN);
        int base = firstBand(params.getCollateralRatioBands(), ratio, params.getCollateralRatioFloor());
        long penalty = c.totalLoans() == 0 ? 0 : c.maxLtvBorrowCount() * params.getMaxLtvPenalty() / c.totalLoans();
        int diversity = Math.min(Math.max(c.uniqueCollateralAssets() - 1, 0) * params.getDiversityBonusPerAsset(),
                params.getMaxDiversityBonus());
        return clamp(base - penalty + diversity);
    }

    int sybilRaw(IdentityProof proof, StakeCommitment stake, ActivityCounters activity, Instant now) {
        CreditProperties.Sybil s = params.getSybil();
        long ageDays = activity.walletAgeDays(now);

        int identityTerm;
        if (proof != null && proof.isLive(now)) {
            identityTerm = s.getProofBonus();
        } else if (ageDays >= s.getReductionMinAgeDays() && stake.amount().compareTo(s.getReductionMinStake()) >= 0) {
            identityTerm = s.getReducedMissingProofPenalty();
        } else {
            identityTerm = s.getMissingProofPenalty();
        }

        int agePenalty = firstBand(s.getWalletAgeBands(), BigDecimal.valueOf(ageDays), s.getYoungWalletPenalty());
        int stakeBonus = firstBand(s.getStakeBands(), stake.amount(), 0);
        int activityBonus = activity.voteCount() + activity.proposalCount() >= s.getActivityThreshold()
                ? s.getActivityBonus() : 0;
        return identityTerm + agePenalty + stakeBonus + activityBonus;
    }

    int sybilScore(int raw) {
        CreditProperties.Sybil s = params.getSybil();
        long scaled = (long) (raw - s.getRawFloor()) * 100 / (s.getRawCeiling() - s.getRawFloor());
        return clamp(scaled);
    }

    int participationScore(ActivityCounters activity) {
        return clamp(activity.voteCount() * params.getVotePoints() + activity.proposalCount() * params.getProposalPoints());
    }

    private static int firstBand(List<CreditProperties.Band> bands, BigDecimal value, int fallback) {
        for (CreditProperties.Band band : bands) {
            if (value.compareTo(band.getThreshold()) >= 0) {
                return band.getPoints();
            }
        }
        return fallback;
    }

    static int clamp(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }
}
