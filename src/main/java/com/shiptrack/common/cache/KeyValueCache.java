package com.shiptrack.common.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Key-value store used for the webhook subscription cache, the webhook event
 * log and shared rate-limit counters.
 *
 * Implementations never throw on store outages: reads degrade to a miss and
 * writes are dropped, so callers fall back to the source of truth.
 */
public interface KeyValueCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Set {@code key} with a TTL only if it does not exist yet.
     *
     * @return true if the key was created
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Push a value to the head of the list stored at {@code key}.
     */
    void listPush(String key, String value);

    /**
     * Read a list range, inclusive on both ends. {@code -1} means the last element.
     */
    List<String> listRange(String key, long start, long end);

    void expire(String key, Duration ttl);

    /**
     * Atomically increment the counter at {@code key}, creating it at 1.
     *
     * @return the new value, or empty if the store is unavailable
     */
    OptionalLong increment(String key);
}
