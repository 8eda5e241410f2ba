package com.scoregate.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Process-local replay guard. The claim is a single {@code compute} on a
 * ConcurrentHashMap, so two racing claims of one key cannot both win.
 */
@Component
@ConditionalOnProperty(name = "scoregate.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryReplayGuardStore implements ReplayGuardStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryReplayGuardStore.class);

    // Key: claimed key, Value: expiry of the claim
    private final ConcurrentHashMap<String, Instant> claims = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryReplayGuardStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean claim(String key, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        boolean[] claimed = new boolean[1];
        claims.compute(key, (k, existing) -> {
            if (existing != null && existing.isAfter(now)) {
                return existing;
            }
            claimed[0] = true;
            return expiresAt;
        });
        return claimed[0];
    }

    @Scheduled(fixedDelayString = "${scoregate.store.memory.purge-interval:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = claims.size();
        claims.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        int purged = before - claims.size();
        if (purged > 0) {
            logger.debug("Purged {} expired replay claims", purged);
        }
    }
}
