package com.shiptrack.webhooks.ratelimit;

import com.shiptrack.common.cache.KeyValueCache;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Fixed-window limiter with counters in the shared key-value store, for
 * deployments running more than one instance.
 *
 * The window starts with the first request from a source: the counter is
 * created at zero together with its TTL in one command, then incremented, so
 * a counter never exists without an expiry. When the store is unreachable
 * every request is allowed.
 */
@Slf4j
public class RedisRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "webhook:ratelimit:";

    private final KeyValueCache cache;
    private final int maxRequests;
    private final Duration window;

    public RedisRateLimiter(KeyValueCache cache, int maxRequests, Duration window) {
        this.cache = cache;
        this.maxRequests = maxRequests;
        this.window = window;
    }

    @Override
    public boolean allow(String sourceKey) {
        String key = KEY_PREFIX + (sourceKey != null ? sourceKey : "unknown");

        cache.setIfAbsent(key, "0", window);

        OptionalLong count = cache.increment(key);
        if (count.isEmpty()) {
            log.warn("Rate limit store unavailable, allowing request: source={}", sourceKey);
            return true;
        }

        // the window may have lapsed between SET NX and INCR, recreating the key bare
        if (count.getAsLong() == 1) {
            cache.expire(key, window);
        }

        if (count.getAsLong() > maxRequests) {
            log.warn("Webhook rate limit exceeded: source={}, count={}", sourceKey, count.getAsLong());
            return false;
        }
        return true;
    }
}
