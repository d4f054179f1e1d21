package com.polysearch.search.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polysearch.search.cache.CacheConfig;
import com.polysearch.search.engine.AggregationEngine;
import com.polysearch.search.model.AggregateResponse;
import com.polysearch.search.model.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@RestController
@CrossOrigin(origins = "*")
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private static final Set<String> RESERVED_PARAMS = Set.of("q", "query", "page", "perPage", "cache");

    private final AggregationEngine aggregationEngine;
    private final ObjectMapper objectMapper;
    private final long maxCacheTtlSeconds;
    private final int maxCacheItems;

    public SearchController(
            AggregationEngine aggregationEngine,
            ObjectMapper objectMapper,
            @Value("${polysearch.cache.ttl-seconds:" + CacheConfig.DEFAULT_TTL_SECONDS + "}") long maxCacheTtlSeconds,
            @Value("${polysearch.cache.max-items:" + CacheConfig.DEFAULT_MAX_ITEMS + "}") int maxCacheItems
    ) {
        this.aggregationEngine = aggregationEngine;
        this.objectMapper = objectMapper;
        this.maxCacheTtlSeconds = maxCacheTtlSeconds;
        this.maxCacheItems = maxCacheItems;
    }

    @GetMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    public AggregateResponse search(
            @RequestParam Map<String, String> params,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        SearchRequest request = new SearchRequest(requireQuery(params), parseInt(params.get("page")), parseInt(params.get("perPage")));
        request.setCacheOverride(parseCacheConfig(params.get("cache")));
        request.setExtra(extraParams(params));
        return aggregationEngine.search(request, effectiveTraceId(traceId));
    }

    @GetMapping(value = "/suggest", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, List<String>> suggest(
            @RequestParam Map<String, String> params,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        List<String> suggestions = aggregationEngine.suggest(requireQuery(params), extraParams(params), effectiveTraceId(traceId));
        return Map.of("suggestions", suggestions);
    }

    private static Map<String, String> extraParams(Map<String, String> params) {
        Map<String, String> extra = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (!RESERVED_PARAMS.contains(e.getKey()) && e.getValue() != null) {
                extra.put(e.getKey(), e.getValue());
            }
        }
        return extra;
    }

    private static String requireQuery(Map<String, String> params) {
        String q = params.get("q");
        if (q == null || q.isBlank()) {
            q = params.get("query");
        }
        if (q == null || q.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Query parameter 'q' or 'query' is required");
        }
        return q;
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Accepts {@code false} or a JSON object with any of {@code ttl}, {@code maxItems}, {@code perPage}.
     * {@code ttl} and {@code maxItems} are capped at the configured cache limits. Anything unreadable is
     * ignored and the default cache applies.
     */
    private CacheConfig parseCacheConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        if ("false".equalsIgnoreCase(raw.trim())) {
            return CacheConfig.disabled();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node.isBoolean()) {
                return node.asBoolean() ? null : CacheConfig.disabled();
            }
            if (!node.isObject()) {
                return null;
            }
            CacheConfig config = CacheConfig.defaults()
                    .withTtlSeconds(maxCacheTtlSeconds)
                    .withMaxItems(maxCacheItems);
            if (node.hasNonNull("ttl")) {
                config = config.withTtlSeconds(Math.min(node.get("ttl").asLong(), maxCacheTtlSeconds));
            }
            if (node.hasNonNull("maxItems")) {
                config = config.withMaxItems(Math.min(node.get("maxItems").asInt(), maxCacheItems));
            }
            if (node.hasNonNull("perPage")) {
                config = config.withPerPage(node.get("perPage").asInt());
            }
            return config;
        } catch (Exception ex) {
            log.debug("ignoring unreadable cache parameter: {}", ex.getMessage());
            return null;
        }
    }

    private static String effectiveTraceId(String traceId) {
        return (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
    }
}
