package com.polysearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polysearch.search.model.ProviderPage;
import com.polysearch.search.model.ProviderQuery;
import com.polysearch.search.model.RawResult;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Package search against an npm registry's {@code /-/v1/search} endpoint.
 */
public class NpmRegistryProvider implements SearchProvider, SuggestionProvider {

    public static final String DEFAULT_REGISTRY = "https://registry.npmjs.org";
    private static final String SEARCH_PATH = "/-/v1/search";
    private static final int MAX_PAGE_SIZE = 250;
    private static final int SUGGEST_SIZE = 5;

    private final String registry;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;

    public NpmRegistryProvider(String registry, ObjectMapper objectMapper, long requestTimeoutMs) {
        this(registry, WebClient.builder().baseUrl(stripTrailingSlash(registry)).build(), objectMapper, requestTimeoutMs);
    }

    public NpmRegistryProvider(String registry, WebClient webClient, ObjectMapper objectMapper, long requestTimeoutMs) {
        this.registry = stripTrailingSlash(registry == null || registry.isBlank() ? DEFAULT_REGISTRY : registry);
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public String name() {
        return "npm";
    }

    @Override
    public String cacheScope() {
        return "npm:" + registry;
    }

    @Override
    public ProviderPage search(ProviderQuery query) {
        int size = Math.min(query.perPage(), MAX_PAGE_SIZE);
        int from = (query.page() - 1) * size;
        String body = fetch(query.query(), size, from);
        JsonNode root = readTree(body);
        JsonNode objects = root.path("objects");
        List<RawResult> results = new ArrayList<>();
        if (objects.isArray()) {
            for (JsonNode item : objects) {
                JsonNode pkg = item.path("package");
                String name = pkg.path("name").asText("");
                if (name.isBlank()) {
                    continue;
                }
                String url = pkg.path("links").path("npm").asText("");
                if (url.isBlank()) {
                    url = "https://www.npmjs.com/package/" + name;
                }
                results.add(new RawResult(name, url, snippet(pkg)));
            }
        }
        JsonNode total = root.get("total");
        return new ProviderPage(results, total != null && total.isNumber() ? total.asInt() : null);
    }

    @Override
    public List<String> suggest(String query) {
        JsonNode objects = readTree(fetch(query, SUGGEST_SIZE, 0)).path("objects");
        List<String> names = new ArrayList<>();
        if (objects.isArray()) {
            for (JsonNode item : objects) {
                String name = item.path("package").path("name").asText("");
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private String fetch(String text, int size, int from) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(SEARCH_PATH)
                        .queryParam("text", "{text}")
                        .queryParam("size", size)
                        .queryParam("from", from)
                        .build(Map.of("text", text)))
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderException("npm registry returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderException("npm registry returned malformed JSON", ex);
        }
    }

    private static String snippet(JsonNode pkg) {
        String description = pkg.path("description").asText("");
        String version = pkg.path("version").asText("");
        if (version.isBlank()) {
            return description;
        }
        return description.isBlank() ? "Version: " + version : description + "\n\nVersion: " + version;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return DEFAULT_REGISTRY;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
