package com.polysearch.search.cache;

import com.polysearch.search.model.AggregateResponse;

/**
 * A stored response and the wall-clock millis at which it was written.
 */
public record CacheEntry(AggregateResponse value, long storedAt) {
}
