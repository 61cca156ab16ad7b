package com.eon.credit.attestation;

import java.math.BigDecimal;
import java.time.Instant;

public record PendingAttestation(
        String subject,
        int score,
        int tier,
        int ltvPercent,
        int rateMultiplierPercent,
        int dataQuality,
        String evidenceRoot,
        String attester,
        Instant attestedAt,
        Instant challengeDeadline,
        String challenger,
        String challengeReason,
        BigDecimal bond
) {
    public boolean isChallenged() {
        return challenger != null;
    }

    public PendingAttestation withChallenge(String challenger, String reason, BigDecimal bond) {
        return new PendingAttestation(subject, score, tier, ltvPercent, rateMultiplierPercent, dataQuality,
                evidenceRoot, attester, attestedAt, challengeDeadline, challenger, reason, bond);
    }
}
