package com.scoregate.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Process-local counter store. Suitable for a single instance; counters do not
 * survive a restart.
 */
@Component
@ConditionalOnProperty(name = "scoregate.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCounterStore implements CounterStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCounterStore.class);

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        Instant now = clock.instant();
        Counter counter = counters.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpiredAt(now)) {
                return new Counter(1, now.plus(ttlOnCreate));
            }
            return new Counter(existing.count() + 1, existing.expiresAt());
        });
        return counter.count();
    }

    @Override
    public Optional<Duration> timeToLive(String key) {
        Instant now = clock.instant();
        Counter counter = counters.get(key);
        if (counter == null || counter.isExpiredAt(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, counter.expiresAt()));
    }

    @Scheduled(fixedDelayString = "${scoregate.store.memory.purge-interval:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = counters.size();
        counters.values().removeIf(counter -> counter.isExpiredAt(now));
        int purged = before - counters.size();
        if (purged > 0) {
            logger.debug("Purged {} expired rate limit counters", purged);
        }
    }

    int size() {
        return counters.size();
    }

    private record Counter(long count, Instant expiresAt) {
        boolean isExpiredAt(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
