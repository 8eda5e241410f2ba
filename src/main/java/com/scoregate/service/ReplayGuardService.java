package com.scoregate.service;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.scoregate.model.TokenPayload;
import com.scoregate.store.ReplayGuardStore;

/**
 * Enforces single use of capability tokens by claiming their nonce.
 * The claim lives for the token's remaining lifetime plus a buffer, so it
 * outlasts every moment at which the token could still verify.
 */
@Service
public class ReplayGuardService {
    private static final Logger logger = LoggerFactory.getLogger(ReplayGuardService.class);

    private final ReplayGuardStore replayGuardStore;
    private final Clock clock;
    private final long bufferSeconds;

    @Autowired
    public ReplayGuardService(ReplayGuardStore replayGuardStore, Clock clock,
            @Value("${scoregate.token.replay-buffer-seconds:60}") long bufferSeconds) {
        this.replayGuardStore = replayGuardStore;
        this.clock = clock;
        this.bufferSeconds = bufferSeconds;
    }

    /**
     * Consumes the token's nonce.
     *
     * @return true on first use, false if the nonce was already consumed
     * @throws com.scoregate.exception.StoreUnavailableException if the store fails
     */
    public boolean consume(TokenPayload payload) {
        long remaining = Math.max(0L, payload.exp() - clock.instant().getEpochSecond());
        boolean claimed = replayGuardStore.claim("replay:" + payload.nonce(),
                Duration.ofSeconds(remaining + bufferSeconds));
        if (!claimed) {
            logger.warn("Replayed token nonce {} for account {}", payload.nonce(), payload.accountId());
        }
        return claimed;
    }
}
