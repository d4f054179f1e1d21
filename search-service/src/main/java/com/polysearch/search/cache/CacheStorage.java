package com.polysearch.search.cache;

/**
 * Backing store for {@link ResponseCache}. Implementations must be safe for concurrent use and may
 * throw on transport problems; the cache treats any failure as a miss.
 */
public interface CacheStorage {

    CacheEntry get(String key);

    void put(String key, CacheEntry entry, long ttlSeconds);

    void remove(String key);
}
