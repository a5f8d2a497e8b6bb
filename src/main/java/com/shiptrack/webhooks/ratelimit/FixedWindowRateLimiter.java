package com.shiptrack.webhooks.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local fixed-window limiter.
 *
 * The window reset and the increment are not one atomic step, so concurrent
 * callers may overshoot the limit slightly at a window boundary.
 */
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    static final int EVICTION_THRESHOLD = 10_000;
    private static final String UNKNOWN_SOURCE = "unknown";

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public boolean allow(String sourceKey) {
        String key = sourceKey != null ? sourceKey : UNKNOWN_SOURCE;
        Instant now = clock.instant();

        Window current = windows.get(key);
        if (current == null || isExpired(current, now)) {
            windows.put(key, new Window(now));
            evictIfNeeded(now);
            return true;
        }

        int count = current.count.incrementAndGet();
        if (count > maxRequests) {
            log.warn("Webhook rate limit exceeded: source={}, count={}", key, count);
            return false;
        }
        return true;
    }

    int trackedSources() {
        return windows.size();
    }

    private boolean isExpired(Window w, Instant now) {
        return Duration.between(w.start, now).compareTo(window) >= 0;
    }

    private void evictIfNeeded(Instant now) {
        if (windows.size() > EVICTION_THRESHOLD) {
            windows.values().removeIf(w -> isExpired(w, now));
        }
    }

    private static final class Window {
        private final Instant start;
        private final AtomicInteger count = new AtomicInteger(1);

        private Window(Instant start) {
            this.start = start;
        }
    }
}
