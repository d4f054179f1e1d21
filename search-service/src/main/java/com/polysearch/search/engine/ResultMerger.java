package com.polysearch.search.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class ResultMerger {

    /** Ascending score, then descending weight. */
    public static final Comparator<WeightedResult> RANKING_ORDER = Comparator
            .comparingDouble(WeightedResult::score)
            .thenComparing(Comparator.comparingDouble(WeightedResult::weight).reversed());

    private ResultMerger() {
    }

    /**
     * Collapses results sharing a normalized URL into one entry and returns them in ranking order.
     */
    public static List<WeightedResult> deduplicate(List<WeightedResult> results) {
        Map<String, WeightedResult> byUrl = new LinkedHashMap<>();
        for (WeightedResult result : results) {
            byUrl.merge(UrlNormalizer.normalize(result.url()), result, WeightedResult::mergedWith);
        }
        List<WeightedResult> merged = new ArrayList<>(byUrl.values());
        merged.sort(RANKING_ORDER);
        return merged;
    }

    /**
     * Case-insensitive dedup on trimmed text. Keeps the first spelling seen and the incoming order;
     * blank entries are dropped.
     */
    public static List<String> deduplicateSuggestions(List<String> suggestions) {
        Set<String> seen = new HashSet<>();
        List<String> unique = new ArrayList<>();
        for (String suggestion : suggestions) {
            if (suggestion == null) {
                continue;
            }
            String normalized = suggestion.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty() && seen.add(normalized)) {
                unique.add(suggestion);
            }
        }
        return unique;
    }
}
