package com.polysearch.search.model;

import java.util.List;

/**
 * One provider-native page of results. {@code totalResults} is null when the provider does not report it.
 */
public record ProviderPage(List<RawResult> results, Integer totalResults) {

    public ProviderPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ProviderPage empty() {
        return new ProviderPage(List.of(), null);
    }
}
