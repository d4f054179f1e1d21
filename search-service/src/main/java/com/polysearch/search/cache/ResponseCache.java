package com.polysearch.search.cache;

import com.polysearch.search.model.AggregateResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * TTL-bounded response cache over a pluggable {@link CacheStorage}.
 *
 * <p>Entries older than the configured TTL are removed when read and reported as a miss. Values are
 * copied on the way in and on the way out, so callers may mutate what they get. A failing backend
 * degrades to miss / no-op and is logged.
 */
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final CacheConfig config;
    private final CacheStorage storage;
    private final Clock clock;
    private final long ttlMillis;

    public ResponseCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public ResponseCache(CacheConfig config, Clock clock) {
        this.config = config == null ? CacheConfig.defaults() : config;
        this.clock = clock;
        this.ttlMillis = this.config.ttlSeconds() * 1000L;
        if (!this.config.isEnabled()) {
            this.storage = null;
        } else if (this.config.storage() != null) {
            this.storage = this.config.storage();
        } else {
            this.storage = new LruCacheStorage(this.config.maxItems());
        }
    }

    public static ResponseCache disabled() {
        return new ResponseCache(CacheConfig.disabled());
    }

    public boolean isEnabled() {
        return storage != null;
    }

    public CacheConfig config() {
        return config;
    }

    /** Default results per page configured for this cache, or null. */
    public Integer perPage() {
        return config.perPage();
    }

    /**
     * @return a private copy of the cached response, or null on miss
     */
    public AggregateResponse get(String key) {
        if (storage == null || key == null) {
            return null;
        }
        try {
            CacheEntry entry = storage.get(key);
            if (entry == null || entry.value() == null) {
                return null;
            }
            long age = clock.millis() - entry.storedAt();
            if (age > ttlMillis) {
                storage.remove(key);
                return null;
            }
            return entry.value().copy();
        } catch (RuntimeException ex) {
            log.warn("event=cache_read_failed key={} cause={}", key, ex.toString());
            return null;
        }
    }

    public void set(String key, AggregateResponse value) {
        if (storage == null || key == null || value == null) {
            return;
        }
        try {
            storage.put(key, new CacheEntry(value.copy(), clock.millis()), config.ttlSeconds());
        } catch (RuntimeException ex) {
            log.warn("event=cache_write_failed key={} cause={}", key, ex.toString());
        }
    }
}
