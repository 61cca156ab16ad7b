package com.eon.credit.identity;

import java.time.Instant;

public record IdentityProof(
        String subject,
        String commitmentHash,
        Instant verifiedAt,
        Instant expiresAt
) {
    public boolean isLive(Instant now) {
        return expiresAt.isAfter(now);
    }
}
