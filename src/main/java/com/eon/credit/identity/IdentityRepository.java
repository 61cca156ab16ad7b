package com.eon.credit.identity;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class IdentityRepository {

    private final JdbcTemplate jdbc;

    // ---- proofs

    public Optional<IdentityProof> findProof(String subject) {
        return jdbc.query("""
            SELECT subject, commitment_hash, verified_at, expires_at
            FROM identity_proofs WHERE subject = ?
        """, (rs, i) -> new IdentityProof(
                rs.getString("subject"),
                rs.getString("commitment_hash"),
                Instant.ofEpochSecond(rs.getLong("verified_at")),
                Instant.ofEpochSecond(rs.getLong("expires_at"))
        ), subject).stream().findFirst();
    }

    public void saveProof(IdentityProof proof) {
        int updated = jdbc.update("""
            UPDATE identity_proofs SET commitment_hash = ?, verified_at = ?, expires_at = ? WHERE subject = ?
        """, proof.commitmentHash(), proof.verifiedAt().getEpochSecond(), proof.expiresAt().getEpochSecond(), proof.subject());
        if (updated == 0) {
            jdbc.update("""
                INSERT INTO identity_proofs (subject, commitment_hash, verified_at, expires_at) VALUES (?, ?, ?, ?)
            """, proof.subject(), proof.commitmentHash(), proof.verifiedAt().getEpochSecond(), proof.expiresAt().getEpochSecond());
        }
    }

    // ---- stakes

    public StakeCommitment findStake(String subject) {
        return jdbc.query("SELECT subject, amount, lock_until FROM stake_commitments WHERE subject = ?",
                (rs, i) -> new StakeCommitment(
                        rs.getString("subject"),
                        rs.getBigDecimal("amount"),
                        Instant.ofEpochSecond(rs.getLong("lock_until"))
                ), subject).stream().findFirst().orElseGet(() -> StakeCommitment.none(subject));
    }

    public void saveStake(StakeCommitment stake) {
        int updated = jdbc.update("UPDATE stake_commitments SET amount = ?, lock_until = ? WHERE subject = ?",
                stake.amount(), stake.lockUntil().getEpochSecond(), stake.subject());
        if (updated == 0) {
            jdbc.update("INSERT INTO stake_commitments (subject, amount, lock_until) VALUES (?, ?, ?)",
                    stake.subject(), stake.amount(), stake.lockUntil().getEpochSecond());
        }
    }

    // ---- activity

    public ActivityCounters findActivity(String subject) {
        return jdbc.query("SELECT subject, vote_count, proposal_count, first_seen FROM activity_counters WHERE subject = ?",
                (rs, i) -> {
                    long firstSeen = rs.getLong("first_seen");
                    boolean unset = rs.wasNull();
                    return new ActivityCounters(
                            rs.getString("subject"),
                            rs.getLong("vote_count"),
                            rs.getLong("proposal_count"),
                            unset ? null : Instant.ofEpochSecond(firstSeen)
                    );
                }, subject).stream().findFirst().orElseGet(() -> ActivityCounters.none(subject));
    }

    /** Sets first-seen if the subject has none yet. Returns true when it was set by this call. */
    public boolean touchFirstSeen(String subject, Instant at) {
        ensureActivity(subject);
        return jdbc.update("UPDATE activity_counters SET first_seen = ? WHERE subject = ? AND first_seen IS NULL",
                at.getEpochSecond(), subject) > 0;
    }

    public void incrementVotes(String subject) {
        ensureActivity(subject);
        jdbc.update("UPDATE activity_counters SET vote_count = vote_count + 1 WHERE subject = ?", subject);
    }

    public void incrementProposals(String subject) {
        ensureActivity(subject);
        jdbc.update("UPDATE activity_counters SET proposal_count = proposal_count + 1 WHERE subject = ?", subject);
    }

    private void ensureActivity(String subject) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM activity_counters WHERE subject = ?", Integer.class, subject);
        if (n == null || n == 0) {
            jdbc.update("INSERT INTO activity_counters (subject, vote_count, proposal_count, first_seen) VALUES (?, 0, 0, NULL)",
                    subject);
        }
    }
}
