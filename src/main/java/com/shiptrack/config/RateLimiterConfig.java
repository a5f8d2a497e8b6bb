package com.shiptrack.config;

import com.shiptrack.common.cache.KeyValueCache;
import com.shiptrack.webhooks.ratelimit.FixedWindowRateLimiter;
import com.shiptrack.webhooks.ratelimit.RateLimiter;
import com.shiptrack.webhooks.ratelimit.RedisRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Builds the webhook ingestion rate limiter.
 *
 * {@code in-memory} keeps counters per process; {@code redis} shares them
 * across instances.
 */
@Configuration
@Slf4j
public class RateLimiterConfig {

    static final String IN_MEMORY = "in-memory";
    static final String REDIS = "redis";

    @Bean
    public RateLimiter webhookRateLimiter(
            @Value("${shiptrack.webhooks.rate-limit.store:in-memory}") String store,
            @Value("${shiptrack.webhooks.rate-limit.max-requests:100}") int maxRequests,
            @Value("${shiptrack.webhooks.rate-limit.window:60}") long windowSeconds,
            KeyValueCache cache,
            Clock clock) {

        if (maxRequests <= 0 || windowSeconds <= 0) {
            throw new IllegalArgumentException("Rate limit max-requests and window must be positive");
        }

        Duration window = Duration.ofSeconds(windowSeconds);
        String normalized = store.trim().toLowerCase(Locale.ROOT);

        log.info("Webhook rate limiter: store={}, maxRequests={}, window={}s", normalized, maxRequests, windowSeconds);

        switch (normalized) {
            case IN_MEMORY:
                return new FixedWindowRateLimiter(maxRequests, window, clock);
            case REDIS:
                return new RedisRateLimiter(cache, maxRequests, window);
            default:
                throw new IllegalArgumentException("Unknown rate limit store: " + store
                    + " (expected " + IN_MEMORY + " or " + REDIS + ")");
        }
    }
}
