package com.shiptrack.webhooks.ratelimit;

/**
 * Per-source request throttle for webhook ingestion.
 */
public interface RateLimiter {

    /**
     * Count one request from {@code sourceKey}.
     *
     * @return false when the source has exceeded its allowance for the current window
     */
    boolean allow(String sourceKey);
}
