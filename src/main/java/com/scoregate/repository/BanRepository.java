package com.scoregate.repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import com.scoregate.model.BanRecord;

/**
 * Persistent set of banned accounts ({@code banned_accounts}).
 * Storage errors surface as Spring {@code DataAccessException}s; the ban policy decides
 * whether to fail open.
 */
@Repository
public class BanRepository {

    private static final RowMapper<BanRecord> ROW_MAPPER = (rs, rowNum) -> new BanRecord(
            rs.getString("account_id"),
            rs.getString("source_address"),
            rs.getString("reason"),
            rs.getTimestamp("banned_at").toInstant());

    private static final int ADDRESS_COLUMN_LENGTH = 45;

    private final JdbcTemplate jdbcTemplate;

    @Autowired
    public BanRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean exists(String accountId) {
        List<Integer> rows = jdbcTemplate.queryForList(
                "SELECT 1 FROM banned_accounts WHERE account_id = ? LIMIT 1", Integer.class, accountId);
        return !rows.isEmpty();
    }

    /**
     * Inserts a ban. The unique key on {@code account_id} makes concurrent inserts
     * of one account safe.
     *
     * @return true if a new record was written, false if the account was already banned
     */
    public boolean insertIfAbsent(BanRecord record) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO banned_accounts (account_id, source_address, reason, banned_at) VALUES (?, ?, ?, ?)",
                    record.accountId(),
                    fitAddress(record.sourceAddress()),
                    record.reason(),
                    Timestamp.from(record.bannedAt()));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public Optional<BanRecord> findByAccountId(String accountId) {
        List<BanRecord> records = jdbcTemplate.query(
                "SELECT account_id, source_address, reason, banned_at FROM banned_accounts WHERE account_id = ?",
                ROW_MAPPER, accountId);
        return records.stream().findFirst();
    }

    public boolean delete(String accountId) {
        return jdbcTemplate.update("DELETE FROM banned_accounts WHERE account_id = ?", accountId) > 0;
    }

    public int count(String accountId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM banned_accounts WHERE account_id = ?", Integer.class, accountId);
        return count == null ? 0 : count;
    }

    // Column holds at most an IPv6 literal
    private static String fitAddress(String address) {
        if (address == null || address.length() <= ADDRESS_COLUMN_LENGTH) {
            return address;
        }
        return address.substring(0, ADDRESS_COLUMN_LENGTH);
    }
}
