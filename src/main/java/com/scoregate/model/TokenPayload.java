package com.scoregate.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Claims carried by a capability token. Timestamps are epoch seconds.
 * The property order fixes the serialized form that gets signed.
 */
@JsonPropertyOrder({ "accountId", "iat", "exp", "nonce" })
public record TokenPayload(
        String accountId,
        long iat,
        long exp,
        String nonce) {

    public boolean isExpiredAt(long epochSeconds) {
        return exp < epochSeconds;
    }
}
