package com.scoregate.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared expiring counter store backing the rate limiter.
 * Implementations must make {@link #increment} atomic across concurrent callers.
 */
public interface CounterStore {

    /**
     * Increments the counter at {@code key}, creating it with the given time-to-live
     * when it does not exist yet.
     *
     * @return the post-increment value
     * @throws com.scoregate.exception.StoreUnavailableException if the store cannot be reached
     */
    long increment(String key, Duration ttlOnCreate);

    /**
     * @return the remaining lifetime of the counter, or empty when it is missing,
     *         has no expiry, or the lookup failed
     */
    Optional<Duration> timeToLive(String key);
}
