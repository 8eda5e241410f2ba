package com.scoregate.store;

import java.time.Duration;

/**
 * Records consumed token nonces.
 */
public interface ReplayGuardStore {

    /**
     * Atomically claims {@code key} for {@code ttl}. Exactly one of any number of
     * concurrent callers presenting the same key receives {@code true}.
     *
     * @return true if the key was absent and is now claimed, false if it was already claimed
     * @throws com.scoregate.exception.StoreUnavailableException if the store cannot be reached
     */
    boolean claim(String key, Duration ttl);
}
