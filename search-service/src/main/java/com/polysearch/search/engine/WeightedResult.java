package com.polysearch.search.engine;

import com.polysearch.search.model.RawResult;
import com.polysearch.search.model.SearchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A provider result tagged with its binding weight, its 1-based rank within that provider's
 * results and the providers that returned it. Immutable; merging produces a new instance.
 */
public final class WeightedResult {
    private final String title;
    private final String url;
    private final String snippet;
    private final double weight;
    private final Set<String> sources;
    private final long rank;

    WeightedResult(String title, String url, String snippet, double weight, Set<String> sources, long rank) {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got " + rank);
        }
        this.title = title;
        this.url = url;
        this.snippet = snippet;
        this.weight = weight;
        this.sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
        this.rank = rank;
    }

    public static WeightedResult of(RawResult raw, double weight, String source, long rank) {
        Set<String> sources = new LinkedHashSet<>();
        sources.add(source);
        return new WeightedResult(raw.title(), raw.url(), raw.snippet(), weight, sources, rank);
    }

    /**
     * Merges a duplicate into this result. Content, rank and weight come from whichever member has
     * the higher weight, then the lower rank; on a full tie this result wins. Sources are unioned.
     */
    public WeightedResult mergedWith(WeightedResult other) {
        boolean otherWins = other.weight > weight || (other.weight == weight && other.rank < rank);
        WeightedResult winner = otherWins ? other : this;
        Set<String> union = new LinkedHashSet<>(sources);
        union.addAll(other.sources);
        return new WeightedResult(winner.title, winner.url, winner.snippet, winner.weight, union, winner.rank);
    }

    /** Sort key; lower is better. */
    public double score() {
        return rank / weight;
    }

    public String title() {
        return title;
    }

    public String url() {
        return url;
    }

    public String snippet() {
        return snippet;
    }

    public double weight() {
        return weight;
    }

    public Set<String> sources() {
        return sources;
    }

    public long rank() {
        return rank;
    }

    public SearchResult toSearchResult() {
        return new SearchResult(title, url, snippet, new ArrayList<>(sources));
    }
}
