package com.scoregate.model;

import java.time.Instant;

public record BanRecord(
        String accountId,
        String sourceAddress,
        String reason,
        Instant bannedAt) {
}
