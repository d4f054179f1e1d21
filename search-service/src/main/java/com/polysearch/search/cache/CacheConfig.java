package com.polysearch.search.cache;

import java.util.Objects;

/**
 * Immutable response cache settings. {@link #disabled()} yields a cache whose reads always miss and
 * whose writes do nothing. A null storage means "build the default LRU store".
 */
public final class CacheConfig {

    public static final long DEFAULT_TTL_SECONDS = 60L;
    public static final int DEFAULT_MAX_ITEMS = 100;

    private static final CacheConfig DISABLED = new CacheConfig(false, DEFAULT_TTL_SECONDS, DEFAULT_MAX_ITEMS, null, null);
    private static final CacheConfig DEFAULTS = new CacheConfig(true, DEFAULT_TTL_SECONDS, DEFAULT_MAX_ITEMS, null, null);

    private final boolean enabled;
    private final long ttlSeconds;
    private final int maxItems;
    private final Integer perPage;
    private final CacheStorage storage;

    private CacheConfig(boolean enabled, long ttlSeconds, int maxItems, Integer perPage, CacheStorage storage) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive, got " + ttlSeconds);
        }
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive, got " + maxItems);
        }
        if (perPage != null && perPage <= 0) {
            throw new IllegalArgumentException("perPage must be positive, got " + perPage);
        }
        this.enabled = enabled;
        this.ttlSeconds = ttlSeconds;
        this.maxItems = maxItems;
        this.perPage = perPage;
        this.storage = storage;
    }

    public static CacheConfig defaults() {
        return DEFAULTS;
    }

    public static CacheConfig disabled() {
        return DISABLED;
    }

    public CacheConfig withTtlSeconds(long ttlSeconds) {
        return new CacheConfig(enabled, ttlSeconds, maxItems, perPage, storage);
    }

    public CacheConfig withMaxItems(int maxItems) {
        return new CacheConfig(enabled, ttlSeconds, maxItems, perPage, storage);
    }

    public CacheConfig withPerPage(Integer perPage) {
        return new CacheConfig(enabled, ttlSeconds, maxItems, perPage, storage);
    }

    public CacheConfig withStorage(CacheStorage storage) {
        return new CacheConfig(enabled, ttlSeconds, maxItems, perPage, storage);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public int maxItems() {
        return maxItems;
    }

    public Integer perPage() {
        return perPage;
    }

    public CacheStorage storage() {
        return storage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheConfig that)) {
            return false;
        }
        if (!enabled && !that.enabled) {
            return true;
        }
        return enabled == that.enabled
                && ttlSeconds == that.ttlSeconds
                && maxItems == that.maxItems
                && Objects.equals(perPage, that.perPage)
                && storage == that.storage;
    }

    @Override
    public int hashCode() {
        if (!enabled) {
            return 0;
        }
        return Objects.hash(ttlSeconds, maxItems, perPage, System.identityHashCode(storage));
    }

    @Override
    public String toString() {
        if (!enabled) {
            return "CacheConfig[disabled]";
        }
        return "CacheConfig[ttlSeconds=" + ttlSeconds + ", maxItems=" + maxItems + ", perPage=" + perPage
                + ", storage=" + (storage == null ? "lru" : storage.getClass().getSimpleName()) + "]";
    }
}
