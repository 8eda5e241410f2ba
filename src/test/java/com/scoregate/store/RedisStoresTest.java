package com.scoregate.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.scoregate.exception.StoreUnavailableException;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.SetParams;

@ExtendWith(MockitoExtension.class)
class RedisStoresTest {

    @Mock
    private JedisPool jedisPool;

    @Mock
    private Jedis jedis;

    @BeforeEach
    void setUp() {
        when(jedisPool.getResource()).thenReturn(jedis);
    }

    @Test
    void incrementRunsAsSingleScriptWithWindowTtl() {
        when(jedis.eval(anyString(), anyList(), anyList())).thenReturn(1L);

        assertThat(new RedisCounterStore(jedisPool).increment("rl:k:1", Duration.ofSeconds(600))).isEqualTo(1);

        verify(jedis).eval(RedisCounterStore.INCREMENT_SCRIPT, List.of("rl:k:1"), List.of("600"));
        verify(jedis, never()).incr(anyString());
        verify(jedis, never()).expire(anyString(), anyLong());
    }

    @Test
    void subSecondWindowStillExpires() {
        when(jedis.eval(anyString(), anyList(), anyList())).thenReturn(3L);

        assertThat(new RedisCounterStore(jedisPool).increment("rl:k:2", Duration.ofMillis(200))).isEqualTo(3);

        verify(jedis).eval(RedisCounterStore.INCREMENT_SCRIPT, List.of("rl:k:2"), List.of("1"));
    }

    @Test
    void connectionFailureIsStoreUnavailable() {
        when(jedis.eval(anyString(), anyList(), anyList())).thenThrow(new JedisConnectionException("refused"));

        assertThatThrownBy(() -> new RedisCounterStore(jedisPool).increment("k", Duration.ofSeconds(1)))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void missingTtlIsEmpty() {
        when(jedis.ttl("k")).thenReturn(-2L);

        assertThat(new RedisCounterStore(jedisPool).timeToLive("k")).isEmpty();
    }

    @Test
    void claimSucceedsOnlyWhenSetReturnsOk() {
        when(jedis.set(eq("replay:n"), eq("1"), any(SetParams.class))).thenReturn("OK", (String) null);
        RedisReplayGuardStore store = new RedisReplayGuardStore(jedisPool);

        assertThat(store.claim("replay:n", Duration.ofSeconds(90))).isTrue();
        assertThat(store.claim("replay:n", Duration.ofSeconds(90))).isFalse();
    }
}
