package com.eon.credit.attestation;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.scoring.ExternalReputationSource;
import lombok.RequiredArgsConstructor;

/** Finalized attested score rescaled from the credit score range to 0..100; 0 when none exists. */
@RequiredArgsConstructor
public class AttestedReputationSource implements ExternalReputationSource {

    private final AttestationRepository repository;
    private final CreditProperties properties;

    @Override
    public int reputationOf(String subject) {
        CreditProperties.Scoring scoring = properties.getScoring();
        return repository.findFinalized(subject)
                .map(s -> (s.score() - scoring.getMinScore()) * 100 / (scoring.getMaxScore() - scoring.getMinScore()))
                .orElse(0);
    }
}
