package com.scoregate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Token issuance result. On rejection only the detail fields may be set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        String token,
        Long expiresIn,
        Long expiresAt,
        String reason,
        Long retryAfterSeconds) {

    public static TokenResponse issued(String token, long expiresIn, long expiresAt) {
        return new TokenResponse(token, expiresIn, expiresAt, null, null);
    }

    public static TokenResponse rejected(String reason, Long retryAfterSeconds) {
        return new TokenResponse(null, null, null, reason, retryAfterSeconds);
    }
}
