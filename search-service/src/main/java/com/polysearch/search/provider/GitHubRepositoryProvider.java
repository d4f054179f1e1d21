package com.polysearch.search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polysearch.search.model.ProviderPage;
import com.polysearch.search.model.ProviderQuery;
import com.polysearch.search.model.RawResult;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Searches GitHub repositories. Extra parameters other than {@code sort} and {@code order} become
 * search qualifiers ({@code language=java} is sent as {@code language:java}) unless the query
 * already carries that qualifier.
 */
public class GitHubRepositoryProvider implements SearchProvider {

    public static final String DEFAULT_API_URL = "https://api.github.com";
    private static final String API_VERSION = "2022-11-28";
    private static final int MAX_PAGE_SIZE = 100;
    private static final Set<String> NON_QUALIFIER_PARAMS = Set.of("sort", "order");

    private final String token;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;

    public GitHubRepositoryProvider(String token, ObjectMapper objectMapper, long requestTimeoutMs) {
        this(token, WebClient.builder().baseUrl(DEFAULT_API_URL).build(), objectMapper, requestTimeoutMs);
    }

    public GitHubRepositoryProvider(String token, WebClient webClient, ObjectMapper objectMapper, long requestTimeoutMs) {
        this.token = token;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public String name() {
        return "github-repo";
    }

    @Override
    public ProviderPage search(ProviderQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", buildQuery(query.query(), query.extra()));
        params.put("per_page", String.valueOf(Math.min(query.perPage(), MAX_PAGE_SIZE)));
        params.put("page", String.valueOf(query.page()));
        String sort = query.extra().get("sort");
        if (sort != null && !sort.isBlank()) {
            params.put("sort", sort);
            String order = query.extra().get("order");
            if (order != null && !order.isBlank()) {
                params.put("order", order);
            }
        }

        String body = webClient.get()
                .uri(uriBuilder -> QueryParams.build(uriBuilder, "/search/repositories", params))
                .headers(headers -> {
                    headers.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
                    headers.set("X-GitHub-Api-Version", API_VERSION);
                    if (token != null && !token.isBlank()) {
                        headers.setBearerAuth(token);
                    }
                })
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
        JsonNode root = readTree(body);

        List<RawResult> results = new ArrayList<>();
        JsonNode items = root.path("items");
        if (items.isArray()) {
            for (JsonNode repo : items) {
                JsonNode description = repo.get("description");
                results.add(new RawResult(
                        repo.path("full_name").asText(""),
                        repo.path("html_url").asText(""),
                        description == null || description.isNull() ? null : description.asText()
                ));
            }
        }
        JsonNode total = root.get("total_count");
        return new ProviderPage(results, total != null && total.isNumber() ? total.asInt() : null);
    }

    static String buildQuery(String query, Map<String, String> extra) {
        List<String> terms = new ArrayList<>();
        List<String> qualifiers = new ArrayList<>();
        for (String part : query.trim().split("\\s+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (part.contains(":")) {
                qualifiers.add(part);
            } else {
                terms.add(part);
            }
        }
        List<String> fromQuery = List.copyOf(qualifiers);
        for (Map.Entry<String, String> e : extra.entrySet()) {
            String key = e.getKey();
            if (NON_QUALIFIER_PARAMS.contains(key) || e.getValue() == null) {
                continue;
            }
            boolean present = fromQuery.stream().anyMatch(q -> q.startsWith(key + ":"));
            if (!present) {
                qualifiers.add(key + ":" + e.getValue());
            }
        }
        String text = String.join(" ", terms);
        if (qualifiers.isEmpty()) {
            return text;
        }
        return (text + " " + String.join(" ", qualifiers)).trim();
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderException("GitHub returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderException("GitHub returned malformed JSON", ex);
        }
    }
}
