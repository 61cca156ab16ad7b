package com.eon.credit.attestation;

import java.time.Instant;

public record AttestedScore(
        String subject,
        int score,
        int tier,
        int ltvPercent,
        int rateMultiplierPercent,
        int dataQuality,
        String evidenceRoot,
        String attester,
        Instant finalizedAt
) {
    static AttestedScore from(PendingAttestation p, Instant finalizedAt) {
        return new AttestedScore(p.subject(), p.score(), p.tier(), p.ltvPercent(), p.rateMultiplierPercent(),
                p.dataQuality(), p.evidenceRoot(), p.attester(), finalizedAt);
    }
}
