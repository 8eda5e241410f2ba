package com.scoregate.model;

public record TokenVerification(
        boolean valid,
        TokenPayload payload,
        TokenFailure failure) {

    public static TokenVerification valid(TokenPayload payload) {
        return new TokenVerification(true, payload, null);
    }

    public static TokenVerification invalid(TokenFailure failure) {
        return new TokenVerification(false, null, failure);
    }
}
