package com.scoregate.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoregate.model.IssuedToken;
import com.scoregate.model.TokenFailure;
import com.scoregate.model.TokenPayload;
import com.scoregate.model.TokenVerification;

/**
 * Issues and verifies short-lived capability tokens.
 * Transport form: {@code base64url(payloadJson) + "." + base64url(hmacSha256(payloadSegment))},
 * unpadded. Verification does not consume a token; single use is enforced by
 * {@link ReplayGuardService}.
 */
@Service
public class CapabilityTokenService {
    private static final Logger logger = LoggerFactory.getLogger(CapabilityTokenService.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int NONCE_BYTES = 16;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec signingKey;
    private final long ttlSeconds;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    // Private mapper so global Jackson settings cannot change the signed bytes.
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public CapabilityTokenService(
            @Value("${scoregate.token.secret}") String secret,
            @Value("${scoregate.token.ttl-seconds:30}") long ttlSeconds,
            Clock clock) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalArgumentException("Token secret must be at least 32 characters");
        }
        this.signingKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.ttlSeconds = ttlSeconds;
        this.clock = clock;
    }

    public IssuedToken issue(String accountId) {
        long now = clock.instant().getEpochSecond();
        TokenPayload payload = new TokenPayload(accountId, now, now + ttlSeconds, generateNonce());
        String payloadSegment;
        try {
            payloadSegment = ENCODER.encodeToString(objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token payload", e);
        }
        String token = payloadSegment + "." + ENCODER.encodeToString(sign(payloadSegment));
        return new IssuedToken(token, payload);
    }

    public TokenVerification verify(String token) {
        if (token == null) {
            return TokenVerification.invalid(TokenFailure.MALFORMED);
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return TokenVerification.invalid(TokenFailure.MALFORMED);
        }

        byte[] presentedSignature;
        try {
            presentedSignature = DECODER.decode(parts[1]);
        } catch (IllegalArgumentException e) {
            // An undecodable signature is still a signature that does not match.
            return TokenVerification.invalid(TokenFailure.BAD_SIGNATURE);
        }
        if (!MessageDigest.isEqual(sign(parts[0]), presentedSignature)) {
            return TokenVerification.invalid(TokenFailure.BAD_SIGNATURE);
        }

        TokenPayload payload;
        try {
            payload = objectMapper.readValue(DECODER.decode(parts[0]), TokenPayload.class);
        } catch (IllegalArgumentException | IOException e) {
            logger.warn("Signed token carries an unreadable payload: {}", e.getMessage());
            return TokenVerification.invalid(TokenFailure.MALFORMED);
        }
        if (payload.accountId() == null || payload.nonce() == null) {
            return TokenVerification.invalid(TokenFailure.MALFORMED);
        }
        if (payload.isExpiredAt(clock.instant().getEpochSecond())) {
            return TokenVerification.invalid(TokenFailure.EXPIRED);
        }
        return TokenVerification.valid(payload);
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    private byte[] sign(String payloadSegment) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(payloadSegment.getBytes(StandardCharsets.US_ASCII));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    private String generateNonce() {
        byte[] nonce = new byte[NONCE_BYTES];
        secureRandom.nextBytes(nonce);
        return HexFormat.of().formatHex(nonce);
    }
}
