package com.polysearch.caching.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Shared response cache backed by Redis. Values are opaque JSON documents written by search-service
 * instances; Redis expiry enforces the TTL.
 */
@Service
public class CacheService {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final StringRedisTemplate redisTemplate;
    private final MeterRegistry meterRegistry;
    private final long defaultTtlSeconds;

    public CacheService(
            StringRedisTemplate redisTemplate,
            MeterRegistry meterRegistry,
            @Value("${caching.default-ttl-seconds:60}") long defaultTtlSeconds
    ) {
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("caching.default-ttl-seconds must be > 0, got " + defaultTtlSeconds);
        }
        this.redisTemplate = redisTemplate;
        this.meterRegistry = meterRegistry;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    /**
     * Stores {@code value} under {@code key}. A null TTL falls back to the configured default.
     */
    public void put(String key, String value, Long ttl) {
        requireKey(key);
        long ttlSeconds = ttl == null ? defaultTtlSeconds : ttl;
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttl must be > 0, got " + ttlSeconds);
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("cache value must not be empty");
        }
        redisTemplate.opsForValue().set(key, value, ttlSeconds, TimeUnit.SECONDS);
        meterRegistry.counter("cache_put_total").increment();
        log.debug("event=cache_put key={} ttl_s={}", key, ttlSeconds);
    }

    public String get(String key) {
        requireKey(key);
        String value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            meterRegistry.counter("cache_miss_count_total").increment();
        } else {
            meterRegistry.counter("cache_hit_count_total").increment();
        }
        return value;
    }

    public boolean evict(String key) {
        requireKey(key);
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key must not be blank");
        }
    }
}
