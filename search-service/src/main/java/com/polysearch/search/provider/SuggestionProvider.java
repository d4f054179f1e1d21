package com.polysearch.search.provider;

import java.util.List;
import java.util.Map;

/**
 * Optional autocomplete capability of a {@link SearchProvider}.
 */
public interface SuggestionProvider {

    List<String> suggest(String query);

    /**
     * Suggest with the caller's extra request parameters. Providers that take no options ignore them.
     */
    default List<String> suggest(String query, Map<String, String> extra) {
        return suggest(query);
    }
}
