package com.shiptrack.common.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Redis-backed {@link KeyValueCache}.
 *
 * Every call is wrapped: a Redis outage is logged and degraded, never propagated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisKeyValueCache implements KeyValueCache {

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            log.warn("Redis GET failed, treating as cache miss: key={}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            log.warn("Redis SET failed: key={}", key, e);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
        } catch (DataAccessException e) {
            log.warn("Redis SET NX failed: key={}", key, e);
            return false;
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.warn("Redis DEL failed: key={}", key, e);
        }
    }

    @Override
    public void listPush(String key, String value) {
        try {
            redisTemplate.opsForList().leftPush(key, value);
        } catch (DataAccessException e) {
            log.warn("Redis LPUSH failed: key={}", key, e);
        }
    }

    @Override
    public List<String> listRange(String key, long start, long end) {
        try {
            List<String> values = redisTemplate.opsForList().range(key, start, end);
            return values != null ? values : Collections.emptyList();
        } catch (DataAccessException e) {
            log.warn("Redis LRANGE failed: key={}", key, e);
            return Collections.emptyList();
        }
    }

    @Override
    public void expire(String key, Duration ttl) {
        try {
            redisTemplate.expire(key, ttl);
        } catch (DataAccessException e) {
            log.warn("Redis EXPIRE failed: key={}", key, e);
        }
    }

    @Override
    public OptionalLong increment(String key) {
        try {
            Long value = redisTemplate.opsForValue().increment(key);
            return value != null ? OptionalLong.of(value) : OptionalLong.empty();
        } catch (DataAccessException e) {
            log.warn("Redis INCR failed: key={}", key, e);
            return OptionalLong.empty();
        }
    }
}
