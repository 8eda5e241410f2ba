package com.scoregate.service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.scoregate.model.RateLimitDecision;
import com.scoregate.store.CounterStore;

/**
 * Fixed-window request counter. The bucket is keyed by the caller's key and the
 * index of the current window ({@code epochSeconds / windowSeconds}), so a burst
 * straddling a window boundary can see up to twice the limit.
 */
@Service
public class RateLimiterService {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiterService.class);

    private final CounterStore counterStore;
    private final Clock clock;

    @Autowired
    public RateLimiterService(CounterStore counterStore, Clock clock) {
        this.counterStore = counterStore;
        this.clock = clock;
    }

    /**
     * Counts one request against {@code key}.
     *
     * @throws com.scoregate.exception.StoreUnavailableException if the counter store fails
     */
    public RateLimitDecision check(String key, long windowSeconds, long maxCount) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window must be positive");
        }
        long windowIndex = clock.instant().getEpochSecond() / windowSeconds;
        String bucket = "rl:" + key + ":" + windowIndex;

        long count = counterStore.increment(bucket, Duration.ofSeconds(windowSeconds));
        if (count <= maxCount) {
            return RateLimitDecision.allowed();
        }

        long retryAfter = counterStore.timeToLive(bucket)
                .map(Duration::toSeconds)
                .filter(seconds -> seconds > 0)
                .orElse(windowSeconds);
        logger.debug("Bucket {} over limit ({} > {}), retry after {}s", bucket, count, maxCount, retryAfter);
        return RateLimitDecision.limited(retryAfter);
    }

    /**
     * Checks each key in turn; the request is limited if any key is over its limit.
     * Stops at the first limited key.
     */
    public RateLimitDecision checkAll(List<String> keys, long windowSeconds, long maxCount) {
        for (String key : keys) {
            RateLimitDecision decision = check(key, windowSeconds, maxCount);
            if (decision.limited()) {
                return decision;
            }
        }
        return RateLimitDecision.allowed();
    }
}
