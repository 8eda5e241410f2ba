package com.scoregate.store;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.scoregate.exception.StoreUnavailableException;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

/**
 * Redis-backed replay guard using {@code SET key value NX EX ttl}, which claims
 * and sets the expiry in one atomic command.
 */
@Component
@ConditionalOnProperty(name = "scoregate.store.type", havingValue = "redis")
public class RedisReplayGuardStore implements ReplayGuardStore {

    private final JedisPool jedisPool;

    @Autowired
    public RedisReplayGuardStore(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
    }

    @Override
    public boolean claim(String key, Duration ttl) {
        SetParams params = SetParams.setParams().nx().ex(Math.max(1L, ttl.toSeconds()));
        try (Jedis jedis = jedisPool.getResource()) {
            String result = jedis.set(key, "1", params);
            return "OK".equalsIgnoreCase(result);
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to claim replay key " + key, e);
        }
    }
}
