package com.eon.credit.attestation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AttestationRepository {

    private final JdbcTemplate jdbc;

    public Optional<PendingAttestation> findPending(String subject) {
        return jdbc.query("""
            SELECT subject, score, tier, ltv_percent, rate_multiplier_percent, data_quality, evidence_root,
                   attester, attested_at, challenge_deadline, challenger, challenge_reason, bond
            FROM pending_attestations WHERE subject = ?
        """, pendingMapper(), subject).stream().findFirst();
    }

    public void insertPending(PendingAttestation p) {
        jdbc.update("""
            INSERT INTO pending_attestations (subject, score, tier, ltv_percent, rate_multiplier_percent, data_quality,
                evidence_root, attester, attested_at, challenge_deadline, challenger, challenge_reason, bond)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, p.subject(), p.score(), p.tier(), p.ltvPercent(), p.rateMultiplierPercent(), p.dataQuality(),
                p.evidenceRoot(), p.attester(), p.attestedAt().getEpochSecond(), p.challengeDeadline().getEpochSecond(),
                p.challenger(), p.challengeReason(), p.bond());
    }

    public void updateChallenge(PendingAttestation p) {
        jdbc.update("UPDATE pending_attestations SET challenger = ?, challenge_reason = ?, bond = ? WHERE subject = ?",
                p.challenger(), p.challengeReason(), p.bond(), p.subject());
    }

    public void deletePending(String subject) {
        jdbc.update("DELETE FROM pending_attestations WHERE subject = ?", subject);
    }

    public Optional<AttestedScore> findFinalized(String subject) {
        return jdbc.query("""
            SELECT subject, score, tier, ltv_percent, rate_multiplier_percent, data_quality, evidence_root,
                   attester, finalized_at
            FROM finalized_scores WHERE subject = ?
        """, (rs, i) -> new AttestedScore(
                rs.getString("subject"),
                rs.getInt("score"),
                rs.getInt("tier"),
                rs.getInt("ltv_percent"),
                rs.getInt("rate_multiplier_percent"),
                rs.getInt("data_quality"),
                rs.getString("evidence_root"),
                rs.getString("attester"),
                Instant.ofEpochSecond(rs.getLong("finalized_at"))
        ), subject).stream().findFirst();
    }

    public void saveFinalized(AttestedScore s) {
        jdbc.update("DELETE FROM finalized_scores WHERE subject = ?", s.subject());
        jdbc.update("""
            INSERT INTO finalized_scores (subject, score, tier, ltv_percent, rate_multiplier_percent, data_quality,
                evidence_root, attester, finalized_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, s.subject(), s.score(), s.tier(), s.ltvPercent(), s.rateMultiplierPercent(), s.dataQuality(),
                s.evidenceRoot(), s.attester(), s.finalizedAt().getEpochSecond());
    }

    private RowMapper<PendingAttestation> pendingMapper() {
        return (rs, i) -> new PendingAttestation(
                rs.getString("subject"),
                rs.getInt("score"),
                rs.getInt("tier"),
                rs.getInt("ltv_percent"),
                rs.getInt("rate_multiplier_percent"),
                rs.getInt("data_quality"),
                rs.getString("evidence_root"),
                rs.getString("attester"),
                Instant.ofEpochSecond(rs.getLong("attested_at")),
                Instant.ofEpochSecond(rs.getLong("challenge_deadline")),
                rs.getString("challenger"),
                rs.getString("challenge_reason"),
                rs.getBigDecimal("bond")
        );
    }
}
