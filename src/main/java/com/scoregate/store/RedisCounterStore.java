package com.scoregate.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.scoregate.exception.StoreUnavailableException;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Redis-backed counters shared by every instance of the service.
 */
@Component
@ConditionalOnProperty(name = "scoregate.store.type", havingValue = "redis")
public class RedisCounterStore implements CounterStore {
    private static final Logger logger = LoggerFactory.getLogger(RedisCounterStore.class);

    // Increment and first-write expiry run as one script so a key can never outlive its window.
    static final String INCREMENT_SCRIPT = "local count = redis.call('INCR', KEYS[1]) "
            + "if count == 1 then redis.call('EXPIRE', KEYS[1], ARGV[1]) end "
            + "return count";

    private final JedisPool jedisPool;

    @Autowired
    public RedisCounterStore(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        try (Jedis jedis = jedisPool.getResource()) {
            Object count = jedis.eval(INCREMENT_SCRIPT, List.of(key),
                    List.of(String.valueOf(Math.max(1L, ttlOnCreate.toSeconds()))));
            return (Long) count;
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to increment counter " + key, e);
        }
    }

    @Override
    public Optional<Duration> timeToLive(String key) {
        try (Jedis jedis = jedisPool.getResource()) {
            long ttl = jedis.ttl(key);
            return ttl > 0 ? Optional.of(Duration.ofSeconds(ttl)) : Optional.empty();
        } catch (JedisException e) {
            logger.warn("Failed to read TTL of {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
