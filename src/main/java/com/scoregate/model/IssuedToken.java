package com.scoregate.model;

/**
 * A freshly issued capability token in transport form together with its claims.
 */
public record IssuedToken(String token, TokenPayload payload) {
}
