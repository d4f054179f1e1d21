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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DuckDuckGo instant-answer API. The API has no paging, so every page after the first is empty.
 */
public class DuckDuckGoProvider implements SearchProvider, SuggestionProvider {

    public static final String DEFAULT_API_URL = "https://api.duckduckgo.com";
    public static final String DEFAULT_AUTOCOMPLETE_URL = "https://duckduckgo.com";
    private static final Pattern ANCHOR = Pattern.compile("<a[^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private final WebClient apiClient;
    private final WebClient autocompleteClient;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;

    public DuckDuckGoProvider(ObjectMapper objectMapper, long requestTimeoutMs) {
        this(
                WebClient.builder().baseUrl(DEFAULT_API_URL).build(),
                WebClient.builder().baseUrl(DEFAULT_AUTOCOMPLETE_URL).build(),
                objectMapper,
                requestTimeoutMs
        );
    }

    public DuckDuckGoProvider(WebClient apiClient, WebClient autocompleteClient, ObjectMapper objectMapper, long requestTimeoutMs) {
        this.apiClient = apiClient;
        this.autocompleteClient = autocompleteClient;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public ProviderPage search(ProviderQuery query) {
        if (query.page() > 1) {
            return ProviderPage.empty();
        }
        String body = apiClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/")
                        .queryParam("q", "{q}")
                        .queryParam("format", "json")
                        .queryParam("no_html", 0)
                        .build(Map.of("q", query.query())))
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
        JsonNode root = readTree(body);

        List<JsonNode> topics = new ArrayList<>();
        JsonNode direct = root.path("Results");
        if (direct.isArray()) {
            direct.forEach(topics::add);
        }
        JsonNode related = root.path("RelatedTopics");
        if (related.isArray()) {
            for (JsonNode topic : related) {
                if (!topic.path("FirstURL").asText("").isBlank() && !topic.path("Result").asText("").isBlank()) {
                    topics.add(topic);
                }
            }
        }

        List<RawResult> all = new ArrayList<>();
        for (JsonNode topic : topics) {
            String url = topic.path("FirstURL").asText("");
            String resultHtml = topic.path("Result").asText("");
            String text = topic.path("Text").asText("");
            all.add(new RawResult(firstNonBlank(extractTitle(resultHtml), text, url), url, firstNonBlank(stripTags(resultHtml), text)));
        }
        String abstractUrl = root.path("AbstractURL").asText("");
        String abstractText = root.path("AbstractText").asText("");
        if (!abstractUrl.isBlank() && !abstractText.isBlank()) {
            all.add(new RawResult(firstNonBlank(root.path("Heading").asText(""), "Abstract"), abstractUrl, abstractText));
        }

        List<RawResult> page = all.size() > query.perPage() ? all.subList(0, query.perPage()) : all;
        return new ProviderPage(page, all.size());
    }

    @Override
    public List<String> suggest(String query) {
        String body = autocompleteClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/ac/")
                        .queryParam("q", "{q}")
                        .queryParam("kl", "wt-wt")
                        .build(Map.of("q", query)))
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
        JsonNode root = readTree(body);
        List<String> suggestions = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode item : root) {
                String phrase = item.path("phrase").asText("");
                if (!phrase.isBlank()) {
                    suggestions.add(phrase);
                }
            }
        }
        return suggestions;
    }

    static String extractTitle(String resultHtml) {
        if (resultHtml == null || resultHtml.isBlank()) {
            return "";
        }
        Matcher matcher = ANCHOR.matcher(resultHtml);
        if (matcher.find()) {
            return TAG.matcher(matcher.group(1)).replaceAll("").trim();
        }
        String clean = stripTags(resultHtml);
        int separator = clean.indexOf(" - ");
        return separator > 0 ? clean.substring(0, separator) : clean;
    }

    static String stripTags(String html) {
        if (html == null) {
            return "";
        }
        return TAG.matcher(html).replaceAll(" ").replaceAll("\\s+", " ").trim();
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderException("duckduckgo returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderException("duckduckgo returned malformed JSON", ex);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
