package com.eon.credit.identity;

import java.math.BigDecimal;
import java.time.Instant;

public record StakeCommitment(String subject, BigDecimal amount, Instant lockUntil) {

    public static StakeCommitment none(String subject) {
        return new StakeCommitment(subject, BigDecimal.ZERO, Instant.EPOCH);
    }

    public boolean isLocked(Instant now) {
        return now.isBefore(lockUntil);
    }
}
