package com.eon.credit.auth;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class AllowListRepository {

    private final JdbcTemplate jdbc;

    public boolean exists(String principal, Capability capability) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM authorized_principals WHERE principal = ? AND capability = ?",
                Integer.class, principal, capability.name());
        return n != null && n > 0;
    }

    public boolean insert(String principal, Capability capability, Instant grantedAt) {
        if (exists(principal, capability)) {
            return false;
        }
        jdbc.update("INSERT INTO authorized_principals (principal, capability, granted_at) VALUES (?, ?, ?)",
                principal, capability.name(), grantedAt.getEpochSecond());
        return true;
    }

    public boolean delete(String principal, Capability capability) {
        return jdbc.update("DELETE FROM authorized_principals WHERE principal = ? AND capability = ?",
                principal, capability.name()) > 0;
    }

    public List<Grant> findAll() {
        return jdbc.query("""
            SELECT principal, capability, granted_at
            FROM authorized_principals
            ORDER BY principal, capability
        """, rm());
    }

    private RowMapper<Grant> rm() {
        return (rs, i) -> new Grant(
                rs.getString("principal"),
                Capability.valueOf(rs.getString("capability")),
                Instant.ofEpochSecond(rs.getLong("granted_at"))
        );
    }

    public record Grant(String principal, Capability capability, Instant grantedAt) {}
}
