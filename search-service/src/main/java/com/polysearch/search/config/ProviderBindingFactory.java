package com.polysearch.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polysearch.search.provider.DuckDuckGoProvider;
import com.polysearch.search.provider.GitHubRepositoryProvider;
import com.polysearch.search.provider.GoogleCseProvider;
import com.polysearch.search.provider.NpmRegistryProvider;
import com.polysearch.search.provider.ProviderBinding;
import com.polysearch.search.provider.RemotePolySearchProvider;
import com.polysearch.search.provider.SearchProvider;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the provider bindings enabled under {@code polysearch.providers.<name>}, in a fixed order:
 * npm, duckduckgo, google-cse, github-repo, http. A timeout of zero or less means the provider is
 * awaited without a timeout.
 */
@Component
public class ProviderBindingFactory {
    private static final String PREFIX = "polysearch.providers.";
    private static final long DEFAULT_TIMEOUT_MS = 5000L;

    private final ObjectMapper objectMapper;
    private final Environment environment;

    public ProviderBindingFactory(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
    }

    public List<ProviderBinding> create() {
        long requestTimeoutMs = environment.getProperty(PREFIX + "request-timeout-ms", Long.class, DEFAULT_TIMEOUT_MS);
        List<ProviderBinding> bindings = new ArrayList<>();
        if (enabled("npm", true)) {
            String registry = environment.getProperty(PREFIX + "npm.registry", NpmRegistryProvider.DEFAULT_REGISTRY);
            bindings.add(binding("npm", new NpmRegistryProvider(registry, objectMapper, requestTimeoutMs), 1.0));
        }
        if (enabled("duckduckgo", true)) {
            bindings.add(binding("duckduckgo", new DuckDuckGoProvider(objectMapper, requestTimeoutMs), 0.5));
        }
        if (enabled("google-cse", false)) {
            String cx = environment.getProperty(PREFIX + "google-cse.cx", "");
            bindings.add(binding("google-cse", new GoogleCseProvider(cx, objectMapper, requestTimeoutMs), 1.0));
        }
        if (enabled("github-repo", false)) {
            String token = environment.getProperty(PREFIX + "github-repo.token", "");
            bindings.add(binding("github-repo", new GitHubRepositoryProvider(token, objectMapper, requestTimeoutMs), 1.0));
        }
        if (enabled("http", false)) {
            String baseUrl = environment.getProperty(PREFIX + "http.base-url", "");
            bindings.add(binding("http", new RemotePolySearchProvider(baseUrl, objectMapper, requestTimeoutMs), 1.0));
        }
        return bindings;
    }

    private boolean enabled(String provider, boolean defaultValue) {
        return environment.getProperty(PREFIX + provider + ".enabled", Boolean.class, defaultValue);
    }

    private ProviderBinding binding(String provider, SearchProvider instance, double defaultWeight) {
        double weight = environment.getProperty(PREFIX + provider + ".weight", Double.class, defaultWeight);
        long timeoutMs = environment.getProperty(PREFIX + provider + ".timeout-ms", Long.class, DEFAULT_TIMEOUT_MS);
        return new ProviderBinding(instance, weight, timeoutMs > 0 ? timeoutMs : null);
    }
}
