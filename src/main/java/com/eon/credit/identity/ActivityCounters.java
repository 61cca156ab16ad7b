package com.eon.credit.identity;

import java.time.Duration;
import java.time.Instant;

/** Governance participation and first-seen time. {@code firstSeen} is null until the first interaction. */
public record ActivityCounters(String subject, long voteCount, long proposalCount, Instant firstSeen) {

    public static ActivityCounters none(String subject) {
        return new ActivityCounters(subject, 0, 0, null);
    }

    public long walletAgeDays(Instant now) {
        if (firstSeen == null || firstSeen.isAfter(now)) {
            return 0;
        }
        return Duration.between(firstSeen, now).toDays();
    }
}
