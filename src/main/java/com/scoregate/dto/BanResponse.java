package com.scoregate.dto;

import java.time.Instant;

import com.scoregate.model.BanRecord;

public record BanResponse(
        String accountId,
        String sourceAddress,
        String reason,
        Instant bannedAt) {

    public static BanResponse from(BanRecord record) {
        return new BanResponse(record.accountId(), record.sourceAddress(), record.reason(), record.bannedAt());
    }
}
