package com.polysearch.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polysearch.search.cache.CacheConfig;
import com.polysearch.search.cache.RemoteCacheStorage;
import com.polysearch.search.cache.ResponseCache;
import com.polysearch.search.engine.AggregationEngine;
import com.polysearch.search.engine.ProviderInvoker;
import com.polysearch.search.provider.ProviderBinding;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.concurrent.ExecutorService;

@Configuration
public class SearchEngineConfig {
    private static final Logger log = LoggerFactory.getLogger(SearchEngineConfig.class);

    private static final String BACKEND_MEMORY = "memory";
    private static final String BACKEND_REMOTE = "remote";

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor(@Value("${polysearch.engine.threads:16}") int threads) {
        return ProviderInvoker.defaultExecutor(threads);
    }

    @Bean
    public ResponseCache responseCache(
            ObjectMapper objectMapper,
            @Value("${polysearch.cache.enabled:true}") boolean enabled,
            @Value("${polysearch.cache.ttl-seconds:60}") long ttlSeconds,
            @Value("${polysearch.cache.max-items:100}") int maxItems,
            @Value("${polysearch.cache.per-page:#{null}}") Integer perPage,
            @Value("${polysearch.cache.backend:memory}") String backend,
            @Value("${polysearch.cache.remote-url:http://caching-service:8096}") String remoteUrl,
            @Value("${polysearch.cache.remote-timeout-ms:150}") long remoteTimeoutMs
    ) {
        if (!enabled) {
            log.info("response cache disabled");
            return ResponseCache.disabled();
        }
        CacheConfig config = CacheConfig.defaults()
                .withTtlSeconds(ttlSeconds)
                .withMaxItems(maxItems)
                .withPerPage(perPage);
        String resolvedBackend = backend == null ? BACKEND_MEMORY : backend.trim().toLowerCase(Locale.ROOT);
        if (BACKEND_REMOTE.equals(resolvedBackend)) {
            config = config.withStorage(new RemoteCacheStorage(remoteUrl, objectMapper, remoteTimeoutMs));
        } else if (!BACKEND_MEMORY.equals(resolvedBackend)) {
            throw new IllegalArgumentException("Unknown polysearch.cache.backend: " + backend);
        }
        log.info("response cache enabled backend={} ttl_seconds={} max_items={}", resolvedBackend, ttlSeconds, maxItems);
        return new ResponseCache(config);
    }

    @Bean
    public AggregationEngine aggregationEngine(
            ProviderBindingFactory providerBindingFactory,
            ResponseCache responseCache,
            ExecutorService providerExecutor,
            ObjectProvider<MeterRegistry> meterRegistry,
            @Value("${polysearch.engine.max-rounds:" + AggregationEngine.DEFAULT_MAX_ROUNDS + "}") int maxRounds
    ) {
        AggregationEngine engine = new AggregationEngine(
                providerBindingFactory.create(),
                responseCache,
                providerExecutor,
                meterRegistry.getIfAvailable(),
                maxRounds
        );
        for (ProviderBinding binding : engine.bindings()) {
            log.info(
                    "provider registered name={} weight={} timeout_ms={}",
                    binding.name(),
                    binding.weight(),
                    binding.hasTimeout() ? binding.timeoutMs() : "none"
            );
        }
        return engine;
    }
}
