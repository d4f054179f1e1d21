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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uses another search-service instance as a provider through its {@code /search} and
 * {@code /suggest} endpoints. Extra parameters are forwarded as query parameters.
 */
public class RemotePolySearchProvider implements SearchProvider, SuggestionProvider {

    private final String baseUrl;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;

    public RemotePolySearchProvider(String baseUrl, ObjectMapper objectMapper, long requestTimeoutMs) {
        this(baseUrl, WebClient.builder().baseUrl(baseUrl).build(), objectMapper, requestTimeoutMs);
    }

    public RemotePolySearchProvider(String baseUrl, WebClient webClient, ObjectMapper objectMapper, long requestTimeoutMs) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Remote provider requires a base URL");
        }
        this.baseUrl = baseUrl;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public String cacheScope() {
        return "http:" + baseUrl;
    }

    @Override
    public ProviderPage search(ProviderQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query.query());
        params.put("page", String.valueOf(query.page()));
        params.put("perPage", String.valueOf(query.perPage()));
        putExtra(params, query.extra());
        String body = get("/search", params);
        JsonNode root = readTree(body);
        List<RawResult> results = new ArrayList<>();
        JsonNode items = root.path("results");
        if (items.isArray()) {
            for (JsonNode item : items) {
                String url = item.path("url").asText("");
                if (url.isBlank()) {
                    continue;
                }
                JsonNode snippet = item.get("snippet");
                results.add(new RawResult(
                        item.path("title").asText(""),
                        url,
                        snippet == null || snippet.isNull() ? null : snippet.asText()
                ));
            }
        }
        JsonNode total = root.get("totalResults");
        return new ProviderPage(results, total != null && total.isNumber() ? total.asInt() : null);
    }

    @Override
    public List<String> suggest(String query) {
        return suggest(query, Map.of());
    }

    @Override
    public List<String> suggest(String query, Map<String, String> extra) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        putExtra(params, extra);
        String body = get("/suggest", params);
        JsonNode root = readTree(body);
        JsonNode items = root.isArray() ? root : root.path("suggestions");
        List<String> suggestions = new ArrayList<>();
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (item.isTextual()) {
                    suggestions.add(item.asText());
                }
            }
        }
        return suggestions;
    }

    private String get(String path, Map<String, String> params) {
        return webClient.get()
                .uri(uriBuilder -> QueryParams.build(uriBuilder, path, params))
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
    }

    private static void putExtra(Map<String, String> params, Map<String, String> extra) {
        if (extra == null) {
            return;
        }
        for (Map.Entry<String, String> e : extra.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                params.putIfAbsent(e.getKey(), e.getValue());
            }
        }
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderException("remote search service returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderException("remote search service returned malformed JSON", ex);
        }
    }
}
