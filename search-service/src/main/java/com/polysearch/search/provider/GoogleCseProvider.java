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
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Queries a Google Programmable Search Engine through its hosted element endpoint.
 *
 * <p>Every search first loads {@code cse.js} for the engine to obtain the session token, library
 * version and experiment flags, then requests the JSONP result page. Recognized extra parameters:
 * {@code hl}, {@code safe}, {@code cr}, {@code gl}, {@code lr} and {@code userAgent}.
 */
public class GoogleCseProvider implements SearchProvider, SuggestionProvider {

    public static final String DEFAULT_CSE_URL = "https://cse.google.com";
    public static final String DEFAULT_SUGGEST_URL = "https://clients1.google.com";
    static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/143.0.0.0 Safari/537.36";

    private static final Pattern TOKEN = Pattern.compile("\"cse_token\":\\s*\"([^\"]+)\"");
    private static final Pattern VERSION = Pattern.compile("\"cselibVersion\":\\s*\"([^\"]+)\"");
    private static final Pattern EXPERIMENTS = Pattern.compile("\"exp\":\\s*(\\[[^\\]]*\\])");
    private static final Pattern SUGGEST_JSONP = Pattern.compile("window\\.google\\.ac\\.h\\((.*)\\)", Pattern.DOTALL);
    private static final String JSONP_PREAMBLE = "/*O_o*/\n";

    private final String cx;
    private final WebClient cseClient;
    private final WebClient suggestClient;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;

    public GoogleCseProvider(String cx, ObjectMapper objectMapper, long requestTimeoutMs) {
        this(
                cx,
                WebClient.builder().baseUrl(DEFAULT_CSE_URL).build(),
                WebClient.builder().baseUrl(DEFAULT_SUGGEST_URL).build(),
                objectMapper,
                requestTimeoutMs
        );
    }

    public GoogleCseProvider(
            String cx,
            WebClient cseClient,
            WebClient suggestClient,
            ObjectMapper objectMapper,
            long requestTimeoutMs
    ) {
        if (cx == null || cx.isBlank()) {
            throw new IllegalArgumentException("Google CSE provider requires a search engine id (cx)");
        }
        this.cx = cx;
        this.cseClient = cseClient;
        this.suggestClient = suggestClient;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public String name() {
        return "google-cse";
    }

    @Override
    public String cacheScope() {
        return "google-cse:" + cx;
    }

    @Override
    public ProviderPage search(ProviderQuery query) {
        Map<String, String> extra = query.extra();
        SessionData session = loadSession();
        String callback = callbackName();
        long start = (long) (query.page() - 1) * query.perPage() + 1;

        Map<String, String> params = new LinkedHashMap<>();
        params.put("rsz", "filtered_cse");
        params.put("num", String.valueOf(query.perPage()));
        params.put("hl", extra.getOrDefault("hl", "en"));
        params.put("source", "gcsc");
        params.put("cx", cx);
        params.put("q", query.query());
        params.put("safe", extra.getOrDefault("safe", "active"));
        params.put("start", String.valueOf(start));
        for (String optional : List.of("cr", "gl", "lr")) {
            String value = extra.get(optional);
            if (value != null && !value.isBlank()) {
                params.put(optional, value);
            }
        }
        params.put("cse_tok", session.token());
        params.put("cselibv", session.version());
        params.put("exp", String.join(",", session.experiments()));
        params.put("cseclient", "hosted-page-client");
        params.put("rurl", referer());
        params.put("callback", callback);

        String body = cseClient.get()
                .uri(uriBuilder -> QueryParams.build(uriBuilder, "/cse/element/v1", params))
                .header(HttpHeaders.ACCEPT, "*/*")
                .header(HttpHeaders.USER_AGENT, extra.getOrDefault("userAgent", DEFAULT_USER_AGENT))
                .header(HttpHeaders.REFERER, referer())
                .header("sec-fetch-dest", "script")
                .header("sec-fetch-mode", "no-cors")
                .header("sec-fetch-site", "same-origin")
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));

        JsonNode data = unwrapJsonp(body, callback);
        if (data == null) {
            return ProviderPage.empty();
        }
        List<RawResult> results = new ArrayList<>();
        JsonNode items = data.path("results");
        if (items.isArray()) {
            for (JsonNode item : items) {
                String snippet = firstNonBlank(item.path("contentNoFormatting").asText(""), item.path("content").asText(""));
                results.add(new RawResult(
                        firstNonBlank(item.path("titleNoFormatting").asText(""), item.path("title").asText("")),
                        firstNonBlank(item.path("unescapedUrl").asText(""), item.path("url").asText("")),
                        snippet.isEmpty() ? null : snippet
                ));
            }
        }
        return new ProviderPage(results, estimatedTotal(data.path("cursor").path("estimatedResultCount").asText("")));
    }

    @Override
    public List<String> suggest(String query) {
        return suggest(query, Map.of());
    }

    @Override
    public List<String> suggest(String query, Map<String, String> extra) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client", "partner-web");
        params.put("partnerid", cx);
        params.put("q", query);
        params.put("hl", extra == null ? "en" : extra.getOrDefault("hl", "en"));

        String body = suggestClient.get()
                .uri(uriBuilder -> QueryParams.build(uriBuilder, "/complete/search", params))
                .header(HttpHeaders.ACCEPT, "*/*")
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
        if (body == null) {
            return List.of();
        }
        Matcher matcher = SUGGEST_JSONP.matcher(body);
        if (!matcher.find()) {
            return List.of();
        }
        JsonNode entries = readTree(matcher.group(1)).path(1);
        List<String> suggestions = new ArrayList<>();
        if (entries.isArray()) {
            for (JsonNode entry : entries) {
                String text = entry.path(0).asText("");
                if (!text.isBlank()) {
                    suggestions.add(text);
                }
            }
        }
        return suggestions;
    }

    private SessionData loadSession() {
        String script = cseClient.get()
                .uri(uriBuilder -> QueryParams.build(uriBuilder, "/cse.js", Map.of("newwindow", "1", "hpg", "1", "cx", cx)))
                .header(HttpHeaders.ACCEPT, "*/*")
                .header(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
                .header(HttpHeaders.REFERER, referer())
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
        if (script == null) {
            throw new ProviderException("Google CSE returned an empty cse.js");
        }
        Matcher token = TOKEN.matcher(script);
        Matcher version = VERSION.matcher(script);
        Matcher experiments = EXPERIMENTS.matcher(script);
        if (!token.find() || !version.find() || !experiments.find()) {
            throw new ProviderException("Google CSE session data not found for cx " + cx);
        }
        List<String> flags = new ArrayList<>();
        for (JsonNode flag : readTree(experiments.group(1))) {
            flags.add(flag.asText());
        }
        return new SessionData(token.group(1), version.group(1), flags);
    }

    private JsonNode unwrapJsonp(String body, String callback) {
        if (body == null) {
            return null;
        }
        String clean = body.replace(JSONP_PREAMBLE, "");
        Matcher matcher = Pattern.compile(Pattern.quote(callback) + "\\((.*)\\);?$", Pattern.DOTALL).matcher(clean.trim());
        if (!matcher.find()) {
            return null;
        }
        return readTree(matcher.group(1));
    }

    static Integer estimatedTotal(String estimatedResultCount) {
        String digits = estimatedResultCount.replace(",", "").trim();
        if (digits.isEmpty()) {
            return null;
        }
        try {
            long total = Long.parseLong(digits);
            return (int) Math.min(Integer.MAX_VALUE, total);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String callbackName() {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "google_search_cse_api_" + System.currentTimeMillis() + "_" + suffix.substring(0, Math.min(7, suffix.length()));
    }

    private String referer() {
        return DEFAULT_CSE_URL + "/cse?cx=" + cx;
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderException("Google CSE returned malformed JSON", ex);
        }
    }

    private static String firstNonBlank(String first, String second) {
        return first.isBlank() ? second : first;
    }

    private record SessionData(String token, String version, List<String> experiments) {
    }
}
