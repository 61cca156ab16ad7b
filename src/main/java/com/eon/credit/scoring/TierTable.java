package com.eon.credit.scoring;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a 300..850 credit score to its tier terms. Built once from configuration and validated:
 * minimum scores and grace periods must be strictly increasing with the tier, and no tier may
 * lend above 90% of collateral value.
 */
@Slf4j
@Component
public class TierTable {

    static final BigDecimal LTV_CEILING = new BigDecimal("0.90");

    private final List<TierTerms> ascending;
    private final Map<CreditTier, TierTerms> byTier = new EnumMap<>(CreditTier.class);

    public TierTable(CreditProperties properties) {
        List<TierTerms> terms = new ArrayList<>();
        for (CreditProperties.Tier t : properties.getTiers()) {
            terms.add(new TierTerms(t.getName(), t.getMinScore(), t.getMaxLtv(), t.getRateMultiplier(), t.getGracePeriod()));
        }
        terms.sort(Comparator.comparingInt(TierTerms::minScore));
        validate(terms);
        this.ascending = List.copyOf(terms);
        for (TierTerms t : ascending) {
            byTier.put(t.tier(), t);
        }
        log.info("Tier table loaded (scoring {}): {}", properties.getScoring().getVersion(), ascending);
    }

    public TierTerms forScore(int creditScore) {
        TierTerms match = ascending.get(0);
        for (TierTerms t : ascending) {
            if (creditScore >= t.minScore()) {
                match = t;
            }
        }
        return match;
    }

    public TierTerms forTier(CreditTier tier) {
        return byTier.get(tier);
    }

    public List<TierTerms> all() {
        return ascending;
    }

    static void validate(List<TierTerms> terms) {
        if (terms.size() != CreditTier.values().length) {
            throw invalid("Expected one entry per tier, got " + terms.size());
        }
        TierTerms previous = null;
        for (TierTerms t : terms) {
            if (t.tier() == null || t.maxLtv() == null || t.rateMultiplier() == null || t.gracePeriod() == null) {
                throw invalid("Incomplete tier entry " + t);
            }
            if (t.maxLtv().signum() <= 0 || t.maxLtv().compareTo(LTV_CEILING) > 0) {
                throw invalid("Max LTV of " + t.tier() + " must be in (0, 0.90]");
            }
            if (t.rateMultiplier().signum() <= 0) {
                throw invalid("Rate multiplier of " + t.tier() + " must be positive");
            }
            if (t.gracePeriod().isNegative()) {
                throw invalid("Grace period of " + t.tier() + " must not be negative");
            }
            if (previous != null) {
                if (t.tier().ordinal() <= previous.tier().ordinal()) {
                    throw invalid("Tier order does not follow score order at " + t.tier());
                }
                if (t.minScore() <= previous.minScore()) {
                    throw invalid("Minimum scores must be strictly increasing at " + t.tier());
                }
                if (t.gracePeriod().compareTo(previous.gracePeriod()) <= 0) {
                    throw invalid("Grace periods must be strictly increasing at " + t.tier());
                }
            }
            previous = t;
        }
    }

    private static ValidationException invalid(String message) {
        return new ValidationException(CreditErrorCode.INVALID_CONFIGURATION, message);
    }
}
