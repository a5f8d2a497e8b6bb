package com.shiptrack.webhooks.ratelimit;

import com.shiptrack.common.cache.InMemoryKeyValueCache;
import com.shiptrack.common.cache.KeyValueCache;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisRateLimiter.
 */
class RedisRateLimiterTest {

    @Test
    void testAllow_CountsInSharedStore() {
        InMemoryKeyValueCache cache = new InMemoryKeyValueCache();
        RedisRateLimiter limiter = new RedisRateLimiter(cache, 3, Duration.ofSeconds(60));

        assertTrue(limiter.allow("10.0.0.1"));
        assertTrue(limiter.allow("10.0.0.1"));
        assertTrue(limiter.allow("10.0.0.1"));
        assertFalse(limiter.allow("10.0.0.1"));

        assertTrue(limiter.allow("10.0.0.2"));
    }

    @Test
    void testAllow_WindowStartsWithFirstRequest() {
        InMemoryKeyValueCache cache = new InMemoryKeyValueCache();
        RedisRateLimiter limiter = new RedisRateLimiter(cache, 3, Duration.ofSeconds(60));

        limiter.allow("10.0.0.1");

        assertEquals(Duration.ofSeconds(60), cache.ttl(RedisRateLimiter.KEY_PREFIX + "10.0.0.1"));
    }

    @Test
    void testAllow_CounterAlwaysCarriesExpiryEvenWhenExpireIsLost() {
        InMemoryKeyValueCache cache = new InMemoryKeyValueCache() {
            @Override
            public void expire(String key, Duration ttl) {
                // dropped, as when Redis rejects EXPIRE or the process dies after INCR
            }
        };
        RedisRateLimiter limiter = new RedisRateLimiter(cache, 100, Duration.ofSeconds(60));
        String key = RedisRateLimiter.KEY_PREFIX + "10.0.0.1";

        for (int i = 0; i < 500; i++) {
            limiter.allow("10.0.0.1");
        }

        assertEquals(Duration.ofSeconds(60), cache.ttl(key));
        assertFalse(limiter.allow("10.0.0.1"));

        // window lapses
        cache.delete(key);
        assertTrue(limiter.allow("10.0.0.1"));
        assertEquals(Duration.ofSeconds(60), cache.ttl(key));
    }

    @Test
    void testAllow_FailsOpenWhenStoreUnavailable() {
        KeyValueCache cache = mock(KeyValueCache.class);
        when(cache.increment(anyString())).thenReturn(OptionalLong.empty());
        RedisRateLimiter limiter = new RedisRateLimiter(cache, 1, Duration.ofSeconds(60));

        assertTrue(limiter.allow("10.0.0.1"));
        assertTrue(limiter.allow("10.0.0.1"));
        verify(cache, never()).expire(anyString(), any());
    }
}
