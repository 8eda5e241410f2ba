package com.scoregate.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.scoregate.model.AuditLogEntry;
import com.scoregate.model.BanRecord;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import({ BanRepository.class, AuditLogRepository.class })
class BanRepositoryTest {

    @Autowired
    private BanRepository banRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Test
    void insertIsIdempotentPerAccount() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

        assertThat(banRepository.insertIfAbsent(new BanRecord("acct-1", "10.0.0.1", "first", now))).isTrue();
        assertThat(banRepository.insertIfAbsent(new BanRecord("acct-1", "10.0.0.2", "second", now))).isFalse();

        assertThat(banRepository.count("acct-1")).isEqualTo(1);
        assertThat(banRepository.findByAccountId("acct-1"))
                .hasValueSatisfying(record -> {
                    assertThat(record.reason()).isEqualTo("first");
                    assertThat(record.bannedAt()).isEqualTo(now);
                });
    }

    @Test
    void overlongAddressDoesNotBlockBan() {
        String address = "1234567890".repeat(6);

        assertThat(banRepository.insertIfAbsent(new BanRecord("acct-4", address, "reason", Instant.now()))).isTrue();
        assertThat(banRepository.findByAccountId("acct-4"))
                .hasValueSatisfying(record -> assertThat(record.sourceAddress()).hasSize(45));
        auditLogRepository.insert(new AuditLogEntry(Instant.now(), address, "acct-4", "hard", null, true, true,
                "TOKEN_REPLAYED"));
        assertThat(auditLogRepository.findOutcomesByAccountId("acct-4")).containsExactly("TOKEN_REPLAYED");
    }

    @Test
    void existsAndDelete() {
        banRepository.insertIfAbsent(new BanRecord("acct-2", "10.0.0.1", "reason", Instant.now()));

        assertThat(banRepository.exists("acct-2")).isTrue();
        assertThat(banRepository.delete("acct-2")).isTrue();
        assertThat(banRepository.exists("acct-2")).isFalse();
        assertThat(banRepository.delete("acct-2")).isFalse();
    }

    @Test
    void auditEntriesAreReadBackInOrder() {
        auditLogRepository.insert(new AuditLogEntry(Instant.now(), "10.0.0.1", "acct-3", "hard", 256_000L, false,
                true, "SUCCESS"));
        auditLogRepository.insert(new AuditLogEntry(Instant.now(), "10.0.0.1", "acct-3", null, null, true, false,
                "RATE_LIMITED"));

        assertThat(auditLogRepository.findOutcomesByAccountId("acct-3")).containsExactly("SUCCESS", "RATE_LIMITED");
    }
}
