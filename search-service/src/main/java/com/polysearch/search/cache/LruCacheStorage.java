package com.polysearch.search.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Count-bounded in-memory store with least-recently-used eviction. Expiry is left to
 * {@link ResponseCache}, which checks entry age on read.
 */
public class LruCacheStorage implements CacheStorage {

    private final int maxItems;
    private final LinkedHashMap<String, CacheEntry> entries;

    public LruCacheStorage(int maxItems) {
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive, got " + maxItems);
        }
        this.maxItems = maxItems;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > LruCacheStorage.this.maxItems;
            }
        };
    }

    @Override
    public synchronized CacheEntry get(String key) {
        return entries.get(key);
    }

    @Override
    public synchronized void put(String key, CacheEntry entry, long ttlSeconds) {
        entries.put(key, entry);
    }

    @Override
    public synchronized void remove(String key) {
        entries.remove(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxItems() {
        return maxItems;
    }
}
