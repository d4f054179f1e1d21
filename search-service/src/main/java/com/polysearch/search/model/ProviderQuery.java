package com.polysearch.search.model;

import java.util.Map;

/**
 * Parameters handed to a provider for one page. {@code extra} is passed through untouched;
 * only the provider it is meant for interprets it.
 */
public record ProviderQuery(String query, int page, int perPage, Map<String, String> extra) {

    public ProviderQuery {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public ProviderQuery(String query, int page, int perPage) {
        this(query, page, perPage, Map.of());
    }
}
