package com.polysearch.search.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Stores entries in the caching-service key/value API. Entries travel as JSON.
 */
public class RemoteCacheStorage implements CacheStorage {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ObjectReader entryReader;
    private final Duration requestTimeout;

    public RemoteCacheStorage(String cachingUrl, ObjectMapper objectMapper, long requestTimeoutMs) {
        this(WebClient.builder().baseUrl(cachingUrl).build(), objectMapper, requestTimeoutMs);
    }

    public RemoteCacheStorage(WebClient webClient, ObjectMapper objectMapper, long requestTimeoutMs) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.entryReader = objectMapper.readerFor(CacheEntry.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.requestTimeout = Duration.ofMillis(Math.max(50L, requestTimeoutMs));
    }

    @Override
    public CacheEntry get(String key) {
        try {
            String response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cache/get")
                            .queryParam("key", "{key}")
                            .build(Map.of("key", key)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(requestTimeout);
            if (response == null || response.isBlank() || "null".equals(response)) {
                return null;
            }
            JsonNode root = objectMapper.readTree(response);
            if (!root.has("value") || !root.has("storedAt")) {
                return null;
            }
            return entryReader.readValue(root);
        } catch (Exception ex) {
            throw new CacheStorageException("Remote cache read failed for key " + key, ex);
        }
    }

    @Override
    public void put(String key, CacheEntry entry, long ttlSeconds) {
        try {
            webClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cache/put")
                            .queryParam("key", "{key}")
                            .queryParam("ttl", Math.max(1L, ttlSeconds))
                            .build(Map.of("key", key)))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(entry))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(requestTimeout);
        } catch (Exception ex) {
            throw new CacheStorageException("Remote cache write failed for key " + key, ex);
        }
    }

    @Override
    public void remove(String key) {
        try {
            webClient.delete()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cache/evict")
                            .queryParam("key", "{key}")
                            .build(Map.of("key", key)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(requestTimeout);
        } catch (Exception ex) {
            throw new CacheStorageException("Remote cache evict failed for key " + key, ex);
        }
    }
}
