package com.polysearch.search.provider;

import java.util.Objects;

/**
 * A provider together with its ranking weight and optional per-call timeout.
 */
public final class ProviderBinding {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final SearchProvider provider;
    private final double weight;
    private final Long timeoutMs;

    public ProviderBinding(SearchProvider provider) {
        this(provider, DEFAULT_WEIGHT, null);
    }

    public ProviderBinding(SearchProvider provider, double weight) {
        this(provider, weight, null);
    }

    public ProviderBinding(SearchProvider provider, double weight, Long timeoutMs) {
        this.provider = Objects.requireNonNull(provider, "provider");
        if (provider.name() == null || provider.name().isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Provider " + provider.name() + " weight must be positive, got " + weight);
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("Provider " + provider.name() + " timeout must be positive, got " + timeoutMs);
        }
        this.weight = weight;
        this.timeoutMs = timeoutMs;
    }

    public SearchProvider provider() {
        return provider;
    }

    public String name() {
        return provider.name();
    }

    public double weight() {
        return weight;
    }

    public Long timeoutMs() {
        return timeoutMs;
    }

    public boolean hasTimeout() {
        return timeoutMs != null;
    }
}
