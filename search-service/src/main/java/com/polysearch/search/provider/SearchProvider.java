package com.polysearch.search.provider;

import com.polysearch.search.model.ProviderPage;
import com.polysearch.search.model.ProviderQuery;

/**
 * Adapter for one external search source. Implementations are stateless per call and may throw;
 * the engine isolates failures per provider.
 */
public interface SearchProvider {

    /** Stable identifier, reported in each merged result's sources. */
    String name();

    ProviderPage search(ProviderQuery query);

    /**
     * Identifies everything that scopes this provider's results (registry URL, remote endpoint, ...).
     * Part of the response cache key.
     */
    default String cacheScope() {
        return name();
    }
}
