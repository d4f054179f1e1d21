package com.polysearch.search.engine;

import com.polysearch.search.cache.CacheConfig;
import com.polysearch.search.cache.CacheKeys;
import com.polysearch.search.cache.ResponseCache;
import com.polysearch.search.model.AggregateResponse;
import com.polysearch.search.model.Pagination;
import com.polysearch.search.model.ProviderPage;
import com.polysearch.search.model.ProviderQuery;
import com.polysearch.search.model.RawResult;
import com.polysearch.search.model.SearchRequest;
import com.polysearch.search.model.SearchResult;
import com.polysearch.search.provider.ProviderBinding;
import com.polysearch.search.provider.SuggestionProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fans a search out to every configured provider, merges and deduplicates the results by weighted
 * rank and serves the requested page.
 *
 * <p>Provider pages are fetched in rounds: round {@code n} asks every provider for its page {@code n}
 * in parallel, and rounds continue until enough distinct results exist to fill the requested page or
 * {@code maxRounds} is reached. Provider failures and timeouts only shrink the result set; neither
 * {@link #search} nor {@link #suggest} throws.
 */
public class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    public static final int DEFAULT_MAX_ROUNDS = 5;
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 10;
    public static final int DEFAULT_THREADS = 16;
    private static final int MAX_OVERRIDE_CACHES = 16;

    private final List<ProviderBinding> bindings;
    private final ResponseCache cache;
    private final ProviderInvoker invoker;
    private final MeterRegistry meterRegistry;
    private final int maxRounds;
    private final ConcurrentHashMap<CacheConfig, ResponseCache> overrideCaches = new ConcurrentHashMap<>();

    public AggregationEngine(List<ProviderBinding> bindings) {
        this(bindings, CacheConfig.defaults());
    }

    public AggregationEngine(List<ProviderBinding> bindings, CacheConfig cacheConfig) {
        this(
                bindings,
                new ResponseCache(cacheConfig),
                ProviderInvoker.defaultExecutor(DEFAULT_THREADS),
                null,
                DEFAULT_MAX_ROUNDS
        );
    }

    public AggregationEngine(
            List<ProviderBinding> bindings,
            ResponseCache cache,
            ExecutorService executor,
            MeterRegistry meterRegistry,
            int maxRounds
    ) {
        if (bindings == null || bindings.isEmpty()) {
            throw new IllegalArgumentException("AggregationEngine requires at least one provider binding");
        }
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be >= 1, got " + maxRounds);
        }
        this.bindings = List.copyOf(bindings);
        this.cache = cache == null ? ResponseCache.disabled() : cache;
        this.invoker = new ProviderInvoker(executor, meterRegistry);
        this.meterRegistry = meterRegistry;
        this.maxRounds = maxRounds;
    }

    public List<ProviderBinding> bindings() {
        return bindings;
    }

    public AggregateResponse search(SearchRequest request) {
        return search(request, UUID.randomUUID().toString());
    }

    public AggregateResponse search(SearchRequest request, String traceId) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        long totalStart = System.nanoTime();
        incrementCounter("search_request_total");

        ResponseCache requestCache = resolveCache(request == null ? null : request.getCacheOverride());
        int page = resolvePage(request);
        int perPage = resolvePerPage(request, requestCache);
        String query = request == null || request.getQuery() == null ? "" : request.getQuery().trim();
        if (query.isEmpty()) {
            log.info("trace_id={} event=search_rejected reason=empty_query", effectiveTraceId);
            return AggregateResponse.empty(page, perPage);
        }
        Map<String, String> extra = request.getExtra() == null ? Map.of() : request.getExtra();
        log.info(
                "trace_id={} event=search_start query=\"{}\" page={} per_page={} providers={}",
                effectiveTraceId,
                sanitizeForLog(query),
                page,
                perPage,
                bindings.size()
        );

        String cacheKey = CacheKeys.searchKey(bindings, query, page, perPage, extra);
        AggregateResponse cached = requestCache.get(cacheKey);
        if (cached != null) {
            incrementCounter("search_cache_hit_total");
            log.info("trace_id={} event=cache_hit total_ms={}", effectiveTraceId, elapsedMillis(totalStart));
            return cached;
        }
        if (requestCache.isEnabled()) {
            incrementCounter("search_cache_miss_total");
        }

        try {
            Aggregation aggregation = aggregate(query, page, perPage, extra, effectiveTraceId);
            AggregateResponse response = aggregation.toResponse(page, perPage);
            if (aggregation.anyProviderSucceeded && !aggregation.interrupted) {
                requestCache.set(cacheKey, response);
            }
            recordTimer("search_total_latency_ms", totalStart);
            log.info(
                    "trace_id={} event=search_complete total_ms={} rounds={} merged={} returned={} total_results={}",
                    effectiveTraceId,
                    elapsedMillis(totalStart),
                    aggregation.rounds,
                    aggregation.merged.size(),
                    response.getResults().size(),
                    response.getTotalResults()
            );
            return response;
        } catch (RuntimeException ex) {
            log.error("trace_id={} event=search_failed cause={}", effectiveTraceId, ex.toString(), ex);
            return AggregateResponse.empty(page, perPage);
        }
    }

    public List<String> suggest(String query) {
        return suggest(query, UUID.randomUUID().toString());
    }

    public List<String> suggest(String query, String traceId) {
        return suggest(query, Map.of(), traceId);
    }

    /**
     * Fans {@code query} out to every binding whose provider can suggest. {@code extra} is handed to
     * each provider untouched.
     */
    public List<String> suggest(String query, Map<String, String> extra, String traceId) {
        Map<String, String> options = extra == null ? Map.of() : Map.copyOf(extra);
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        incrementCounter("suggest_request_total");
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        List<ProviderBinding> capable = new ArrayList<>();
        for (ProviderBinding binding : bindings) {
            if (binding.provider() instanceof SuggestionProvider) {
                capable.add(binding);
            }
        }
        if (capable.isEmpty()) {
            return List.of();
        }
        try {
            List<ProviderCallOutcome<List<String>>> outcomes = invoker.invokeAll(
                    capable,
                    "suggest",
                    binding -> ((SuggestionProvider) binding.provider()).suggest(trimmed, options),
                    effectiveTraceId
            );
            List<String> all = new ArrayList<>();
            for (ProviderCallOutcome<List<String>> outcome : outcomes) {
                if (outcome.isSuccess() && outcome.value() != null) {
                    all.addAll(outcome.value());
                }
            }
            List<String> suggestions = ResultMerger.deduplicateSuggestions(all);
            log.info(
                    "trace_id={} event=suggest_complete query=\"{}\" providers={} suggestions={}",
                    effectiveTraceId,
                    sanitizeForLog(trimmed),
                    capable.size(),
                    suggestions.size()
            );
            return suggestions;
        } catch (RuntimeException ex) {
            log.error("trace_id={} event=suggest_failed cause={}", effectiveTraceId, ex.toString(), ex);
            return List.of();
        }
    }

    private Aggregation aggregate(String query, int page, int perPage, Map<String, String> extra, String traceId) {
        long targetCount = (long) page * perPage;
        Aggregation aggregation = new Aggregation();
        int driverPage = 1;

        while (aggregation.merged.size() < targetCount && driverPage <= maxRounds) {
            if (Thread.currentThread().isInterrupted()) {
                aggregation.interrupted = true;
                log.warn("trace_id={} event=search_interrupted rounds={} merged={}", traceId, aggregation.rounds, aggregation.merged.size());
                break;
            }
            long roundStart = System.nanoTime();
            int round = driverPage;
            ProviderQuery providerQuery = new ProviderQuery(query, round, perPage, extra);
            List<ProviderCallOutcome<ProviderPage>> outcomes = invoker.invokeAll(
                    bindings,
                    "search",
                    binding -> binding.provider().search(providerQuery),
                    traceId
            );

            List<WeightedResult> accumulated = new ArrayList<>(aggregation.merged);
            int fetched = 0;
            for (ProviderCallOutcome<ProviderPage> outcome : outcomes) {
                if (!outcome.isSuccess()) {
                    continue;
                }
                aggregation.anyProviderSucceeded = true;
                ProviderPage providerPage = outcome.value() == null ? ProviderPage.empty() : outcome.value();
                ProviderBinding binding = outcome.binding();
                Integer total = providerPage.totalResults();
                if (!aggregation.providerTotals.containsKey(binding.name()) && total != null && total > 0) {
                    aggregation.providerTotals.put(binding.name(), total);
                }
                List<RawResult> results = providerPage.results();
                for (int i = 0; i < results.size(); i++) {
                    RawResult raw = results.get(i);
                    if (raw == null || raw.url().isBlank()) {
                        continue;
                    }
                    long rank = (long) (round - 1) * perPage + i + 1;
                    accumulated.add(WeightedResult.of(raw, binding.weight(), binding.name(), rank));
                    fetched++;
                }
            }
            aggregation.merged = ResultMerger.deduplicate(accumulated);
            aggregation.rounds = round;
            recordTimer("search_round_latency_ms", roundStart);
            log.info(
                    "trace_id={} event=round_complete round={} duration_ms={} fetched={} merged={} target={}",
                    traceId,
                    round,
                    elapsedMillis(roundStart),
                    fetched,
                    aggregation.merged.size(),
                    targetCount
            );
            driverPage++;
        }
        if (Thread.currentThread().isInterrupted()) {
            aggregation.interrupted = true;
        }
        return aggregation;
    }

    private ResponseCache resolveCache(CacheConfig override) {
        if (override == null) {
            return cache;
        }
        if (!overrideCaches.containsKey(override) && overrideCaches.size() >= MAX_OVERRIDE_CACHES) {
            overrideCaches.clear();
        }
        return overrideCaches.computeIfAbsent(override, ResponseCache::new);
    }

    private static int resolvePage(SearchRequest request) {
        if (request == null || request.getPage() == null || request.getPage() <= 0) {
            return DEFAULT_PAGE;
        }
        return request.getPage();
    }

    private static int resolvePerPage(SearchRequest request, ResponseCache requestCache) {
        if (request != null && request.getPerPage() != null && request.getPerPage() > 0) {
            return request.getPerPage();
        }
        Integer cachePerPage = requestCache.perPage();
        return cachePerPage != null ? cachePerPage : DEFAULT_PER_PAGE;
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static final class Aggregation {
        private List<WeightedResult> merged = new ArrayList<>();
        private final Map<String, Integer> providerTotals = new LinkedHashMap<>();
        private boolean anyProviderSucceeded;
        private boolean interrupted;
        private int rounds;

        private AggregateResponse toResponse(int page, int perPage) {
            long offset = (long) (page - 1) * perPage;
            int from = (int) Math.min(offset, merged.size());
            int to = (int) Math.min(offset + perPage, merged.size());
            List<SearchResult> pageResults = new ArrayList<>(to - from);
            for (WeightedResult result : merged.subList(from, to)) {
                pageResults.add(result.toSearchResult());
            }
            long reported = 0L;
            for (int total : providerTotals.values()) {
                reported += total;
            }
            int totalResults = reported > 0 ? (int) Math.min(Integer.MAX_VALUE, reported) : merged.size();
            return new AggregateResponse(pageResults, totalResults, new Pagination(page, perPage));
        }
    }
}
