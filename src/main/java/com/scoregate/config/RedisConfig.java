package com.scoregate.config;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * One bounded Jedis pool per process, shared by the rate limiter and the replay guard.
 * Connections are opened lazily on first use.
 */
@Configuration
@ConditionalOnProperty(name = "scoregate.store.type", havingValue = "redis")
public class RedisConfig {
    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Bean(destroyMethod = "close")
    public JedisPool jedisPool(
            @Value("${scoregate.store.redis.host:localhost}") String host,
            @Value("${scoregate.store.redis.port:6379}") int port,
            @Value("${scoregate.store.redis.timeout-ms:2000}") int timeoutMs,
            @Value("${scoregate.store.redis.max-connections:16}") int maxConnections) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(maxConnections);
        poolConfig.setMaxIdle(maxConnections);
        poolConfig.setMinIdle(0);
        poolConfig.setMaxWait(Duration.ofMillis(timeoutMs));
        logger.info("Creating Redis pool for {}:{} (max {} connections)", host, port, maxConnections);
        return new JedisPool(poolConfig, host, port, timeoutMs);
    }
}
