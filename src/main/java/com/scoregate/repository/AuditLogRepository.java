package com.scoregate.repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;

import com.scoregate.model.AuditLogEntry;

/**
 * Append-only request log ({@code request_logs}).
 */
@Repository
public class AuditLogRepository {

    private static final int ADDRESS_COLUMN_LENGTH = 45;

    private final JdbcTemplate jdbcTemplate;

    @Autowired
    public AuditLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(AuditLogEntry entry) {
        jdbcTemplate.update(
                "INSERT INTO request_logs (logged_at, ip_address, account_id, difficulty, score, rate_limited, success, request_result)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                Timestamp.from(entry.timestamp()),
                fitAddress(entry.sourceAddress()),
                entry.accountId(),
                entry.difficulty(),
                new SqlParameterValue(Types.BIGINT, entry.score()),
                entry.rateLimited(),
                entry.success(),
                entry.outcome());
    }

    /**
     * Outcome codes logged for an account, oldest first. Used by operators and tests;
     * the pipeline never reads the log.
     */
    public List<String> findOutcomesByAccountId(String accountId) {
        return jdbcTemplate.queryForList(
                "SELECT request_result FROM request_logs WHERE account_id = ? ORDER BY id", String.class, accountId);
    }

    // Column holds at most an IPv6 literal
    private static String fitAddress(String address) {
        if (address == null || address.length() <= ADDRESS_COLUMN_LENGTH) {
            return address;
        }
        return address.substring(0, ADDRESS_COLUMN_LENGTH);
    }
}
