package com.polysearch.search.engine;

import com.polysearch.search.cache.CacheConfig;
import com.polysearch.search.cache.ResponseCache;
import com.polysearch.search.model.AggregateResponse;
import com.polysearch.search.model.ProviderPage;
import com.polysearch.search.model.ProviderQuery;
import com.polysearch.search.model.RawResult;
import com.polysearch.search.model.SearchRequest;
import com.polysearch.search.model.SearchResult;
import com.polysearch.search.provider.ProviderBinding;
import com.polysearch.search.provider.SearchProvider;
import com.polysearch.search.provider.SuggestionProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregationEngineTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = ProviderInvoker.defaultExecutor(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void duplicateUrlsCollapseToHighestWeightAndUnionSources() {
        StubProvider alpha = new StubProvider("alpha", firstPageOnly(List.of(
                new RawResult("Alpha A", "https://example.com/a", "from alpha"),
                new RawResult("Alpha B", "https://b.example.org", "only alpha")
        ), null));
        StubProvider beta = new StubProvider("beta", firstPageOnly(List.of(
                new RawResult("Beta A", "https://www.Example.com/a/?utm_source=x", "from beta")
        ), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(alpha, 1.0), new ProviderBinding(beta, 2.0)));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 10));

        assertThat(response.getResults()).hasSize(2);
        SearchResult first = response.getResults().get(0);
        assertThat(first.getTitle()).isEqualTo("Beta A");
        assertThat(first.getUrl()).isEqualTo("https://www.Example.com/a/?utm_source=x");
        assertThat(first.getSources()).containsExactly("alpha", "beta");
        assertThat(response.getResults().get(1).getSources()).containsExactly("alpha");
        assertThat(response.getTotalResults()).isEqualTo(2);
    }

    @Test
    void resultsAreOrderedByScoreThenWeight() {
        StubProvider heavy = new StubProvider("heavy", firstPageOnly(results("h", 3), null));
        StubProvider light = new StubProvider("light", firstPageOnly(results("l", 2), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(heavy, 1.0), new ProviderBinding(light, 0.5)));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 10));

        assertThat(response.getResults())
                .extracting(SearchResult::getUrl)
                .containsExactly(
                        "https://h.example.com/1",
                        "https://h.example.com/2",
                        "https://l.example.com/1",
                        "https://h.example.com/3",
                        "https://l.example.com/2"
                );
    }

    @Test
    void slowProviderTimesOutWithoutBlockingOthers() {
        StubProvider slow = new StubProvider("slow", query -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new ProviderPage(results("s", 1), null);
        });
        StubProvider fast = new StubProvider("fast", firstPageOnly(results("f", 2), null));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AggregationEngine engine = new AggregationEngine(
                List.of(new ProviderBinding(slow, 1.0, 100L), new ProviderBinding(fast, 1.0, 1_000L)),
                ResponseCache.disabled(),
                executor,
                registry,
                1
        );

        long start = System.nanoTime();
        AggregateResponse response = engine.search(new SearchRequest("query", 1, 10));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(response.getResults()).extracting(SearchResult::getUrl)
                .containsExactly("https://f.example.com/1", "https://f.example.com/2");
        assertThat(registry.counter("provider_timeout_total", "provider", "slow").count()).isEqualTo(1.0);
    }

    @Test
    void failingProviderOnlyShrinksResults() {
        StubProvider broken = new StubProvider("broken", query -> {
            throw new IllegalStateException("upstream 500");
        });
        StubProvider healthy = new StubProvider("healthy", firstPageOnly(results("ok", 1), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(broken), new ProviderBinding(healthy)));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 10));

        assertThat(response.getResults()).extracting(SearchResult::getUrl).containsExactly("https://ok.example.com/1");
    }

    @Test
    void allProvidersFailingYieldsEmptyResponse() {
        StubProvider broken = new StubProvider("broken", query -> {
            throw new IllegalStateException("down");
        });
        AggregationEngine engine = engine(List.of(new ProviderBinding(broken)));

        AggregateResponse response = engine.search(new SearchRequest("query", 2, 5));

        assertThat(response.getResults()).isEmpty();
        assertThat(response.getTotalResults()).isZero();
        assertThat(response.getPagination().getPage()).isEqualTo(2);
        assertThat(response.getPagination().getPerPage()).isEqualTo(5);
    }

    @Test
    void laterPagesFetchAdditionalRoundsAndSliceByOffset() {
        StubProvider paged = new StubProvider("paged", query -> {
            List<RawResult> page = new ArrayList<>();
            for (int i = 1; i <= query.perPage(); i++) {
                int n = (query.page() - 1) * query.perPage() + i;
                page.add(new RawResult("Item " + n, "https://paged.example.com/" + n, ""));
            }
            return new ProviderPage(page, 140);
        });
        AggregationEngine engine = engine(List.of(new ProviderBinding(paged)));

        AggregateResponse response = engine.search(new SearchRequest("query", 2, 3));

        assertThat(paged.pagesRequested()).containsExactly(1, 2);
        assertThat(response.getResults()).extracting(SearchResult::getUrl)
                .containsExactly("https://paged.example.com/4", "https://paged.example.com/5", "https://paged.example.com/6");
        assertThat(response.getTotalResults()).isEqualTo(140);
    }

    @Test
    void roundsStopAtMaxRoundsWhenProvidersRunDry() {
        StubProvider sparse = new StubProvider("sparse", firstPageOnly(results("sp", 2), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(sparse)));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 10));

        assertThat(sparse.pagesRequested()).containsExactly(1, 2, 3, 4, 5);
        assertThat(response.getResults()).hasSize(2);
    }

    @Test
    void totalResultsSumFirstReportedTotalPerProvider() {
        StubProvider alpha = new StubProvider("alpha", query -> new ProviderPage(results("a" + query.page(), 1), query.page() == 1 ? 100 : 999));
        StubProvider beta = new StubProvider("beta", firstPageOnly(results("b", 1), 40));
        AggregationEngine engine = engine(List.of(new ProviderBinding(alpha), new ProviderBinding(beta)));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 10));

        assertThat(response.getTotalResults()).isEqualTo(140);
    }

    @Test
    void emptyQueryCallsNoProvider() {
        StubProvider provider = new StubProvider("p", firstPageOnly(results("p", 1), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(provider)));

        AggregateResponse response = engine.search(new SearchRequest("   ", 3, 7));

        assertThat(provider.calls()).isZero();
        assertThat(response.getResults()).isEmpty();
        assertThat(response.getTotalResults()).isZero();
        assertThat(response.getPagination().getPage()).isEqualTo(3);
        assertThat(response.getPagination().getPerPage()).isEqualTo(7);
    }

    @Test
    void missingPagingFallsBackToDefaults() {
        StubProvider provider = new StubProvider("p", firstPageOnly(results("p", 1), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(provider)));

        AggregateResponse response = engine.search(new SearchRequest("query", null, 0));

        assertThat(response.getPagination().getPage()).isEqualTo(AggregationEngine.DEFAULT_PAGE);
        assertThat(response.getPagination().getPerPage()).isEqualTo(AggregationEngine.DEFAULT_PER_PAGE);
    }

    @Test
    void repeatedSearchIsServedFromCache() {
        StubProvider provider = new StubProvider("p", firstPageOnly(results("p", 2), 2));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AggregationEngine engine = new AggregationEngine(
                List.of(new ProviderBinding(provider)),
                new ResponseCache(CacheConfig.defaults()),
                executor,
                registry,
                1
        );

        AggregateResponse first = engine.search(new SearchRequest("query", 1, 10));
        first.getResults().clear();
        AggregateResponse second = engine.search(new SearchRequest("query", 1, 10));

        assertThat(provider.calls()).isEqualTo(1);
        assertThat(second.getResults()).hasSize(2);
        assertThat(registry.counter("search_cache_hit_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("search_cache_miss_total").count()).isEqualTo(1.0);
    }

    @Test
    void disabledCacheOverrideBypassesCache() {
        StubProvider provider = new StubProvider("p", firstPageOnly(results("p", 1), null));
        AggregationEngine engine = new AggregationEngine(
                List.of(new ProviderBinding(provider)),
                new ResponseCache(CacheConfig.defaults()),
                executor,
                null,
                1
        );
        SearchRequest request = new SearchRequest("query", 1, 10);
        request.setCacheOverride(CacheConfig.disabled());

        engine.search(request);
        engine.search(request);

        assertThat(provider.calls()).isEqualTo(2);
    }

    @Test
    void cacheOverridePerPageAppliesWhenRequestOmitsIt() {
        StubProvider provider = new StubProvider("p", firstPageOnly(results("p", 5), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(provider)));
        SearchRequest request = new SearchRequest("query", 1, null);
        request.setCacheOverride(CacheConfig.defaults().withPerPage(3));

        AggregateResponse response = engine.search(request);

        assertThat(response.getPagination().getPerPage()).isEqualTo(3);
        assertThat(response.getResults()).hasSize(3);
    }

    @Test
    void responsesAreNotCachedWhenEveryProviderFailed() {
        AtomicInteger attempts = new AtomicInteger();
        StubProvider flaky = new StubProvider("flaky", query -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first call fails");
            }
            return new ProviderPage(results("fl", 1), null);
        });
        AggregationEngine engine = new AggregationEngine(
                List.of(new ProviderBinding(flaky)),
                new ResponseCache(CacheConfig.defaults()),
                executor,
                null,
                1
        );

        assertThat(engine.search(new SearchRequest("query", 1, 10)).getResults()).isEmpty();
        assertThat(engine.search(new SearchRequest("query", 1, 10)).getResults()).hasSize(1);
    }

    @Test
    void constructorRejectsEmptyBindings() {
        assertThatThrownBy(() -> new AggregationEngine(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void suggestMergesCapableProvidersCaseInsensitively() {
        SuggestingProvider first = new SuggestingProvider("first", List.of("ab", "AB", "cd"));
        SuggestingProvider second = new SuggestingProvider("second", List.of("cd", "ef"));
        StubProvider searchOnly = new StubProvider("search-only", firstPageOnly(results("x", 1), null));
        AggregationEngine engine = engine(List.of(
                new ProviderBinding(first),
                new ProviderBinding(searchOnly),
                new ProviderBinding(second)
        ));

        assertThat(engine.suggest("a")).containsExactly("ab", "cd", "ef");
        assertThat(searchOnly.calls()).isZero();
    }

    @Test
    void suggestIgnoresFailingProviders() {
        SuggestingProvider healthy = new SuggestingProvider("healthy", List.of("java"));
        SuggestingProvider broken = new SuggestingProvider("broken", null);
        AggregationEngine engine = engine(List.of(new ProviderBinding(broken), new ProviderBinding(healthy)));

        assertThat(engine.suggest("ja")).containsExactly("java");
        assertThat(engine.suggest("  ")).isEmpty();
    }

    @Test
    void hugePerPageDoesNotOverflowRanks() {
        StubProvider single = new StubProvider("single", query ->
                new ProviderPage(List.of(new RawResult("Page " + query.page(), "https://single.example.com/" + query.page(), "")), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(single)));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 1_500_000_000));

        assertThat(single.pagesRequested()).containsExactly(1, 2, 3, 4, 5);
        assertThat(response.getResults()).extracting(SearchResult::getUrl).containsExactly(
                "https://single.example.com/1",
                "https://single.example.com/2",
                "https://single.example.com/3",
                "https://single.example.com/4",
                "https://single.example.com/5"
        );
        assertThat(response.getTotalResults()).isEqualTo(5);
        assertThat(response.getPagination().getPerPage()).isEqualTo(1_500_000_000);
    }

    @Test
    void hugePageRunsAllRoundsAndReturnsEmptySlice() {
        StubProvider provider = new StubProvider("p", query -> new ProviderPage(results("p" + query.page(), 10), null));
        AggregationEngine engine = engine(List.of(new ProviderBinding(provider)));

        AggregateResponse response = engine.search(new SearchRequest("query", Integer.MAX_VALUE, 10));

        assertThat(provider.pagesRequested()).containsExactly(1, 2, 3, 4, 5);
        assertThat(response.getResults()).isEmpty();
        assertThat(response.getTotalResults()).isEqualTo(50);
        assertThat(response.getPagination().getPage()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void interruptedSearchStopsFetchingRoundsAndIsNotCached() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StubProvider blocking = new StubProvider("blocking", query -> {
            if (query.page() != 1) {
                return ProviderPage.empty();
            }
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new ProviderPage(results("bl", 1), null);
        });
        AggregationEngine engine = new AggregationEngine(
                List.of(new ProviderBinding(blocking)),
                new ResponseCache(CacheConfig.defaults()),
                executor,
                null,
                AggregationEngine.DEFAULT_MAX_ROUNDS
        );
        AtomicReference<AggregateResponse> interruptedResponse = new AtomicReference<>();
        Thread caller = new Thread(() -> interruptedResponse.set(engine.search(new SearchRequest("query", 1, 10))));

        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(2_000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(interruptedResponse.get()).isNotNull();
        assertThat(interruptedResponse.get().getResults()).isEmpty();
        assertThat(blocking.pagesRequested()).containsExactly(1);

        release.countDown();
        AggregateResponse retried = engine.search(new SearchRequest("query", 1, 10));

        assertThat(retried.getResults()).extracting(SearchResult::getUrl).containsExactly("https://bl.example.com/1");
        assertThat(blocking.pagesRequested()).containsExactly(1, 1, 2, 3, 4, 5);
    }

    @Test
    void laterRoundDuplicateFromHeavierProviderReplacesEarlierWinner() {
        StubProvider light = new StubProvider("light", query -> query.page() == 1
                ? new ProviderPage(List.of(new RawResult("Light X", "https://x.example.com", "light")), null)
                : ProviderPage.empty());
        StubProvider heavy = new StubProvider("heavy", query -> query.page() == 2
                ? new ProviderPage(List.of(new RawResult("Heavy X", "https://www.x.example.com/", "heavy")), null)
                : ProviderPage.empty());
        StubProvider heavier = new StubProvider("heavier", query -> query.page() == 2
                ? new ProviderPage(List.of(new RawResult("W", "https://w.example.com", "w")), null)
                : ProviderPage.empty());
        AggregationEngine engine = engine(List.of(
                new ProviderBinding(light, 1.0),
                new ProviderBinding(heavy, 2.0),
                new ProviderBinding(heavier, 2.4)
        ));

        AggregateResponse response = engine.search(new SearchRequest("query", 1, 2));

        // X now ranks 3 at weight 2.0 (score 1.5), behind W at rank 3 and weight 2.4 (score 1.25)
        assertThat(response.getResults()).extracting(SearchResult::getTitle).containsExactly("W", "Heavy X");
        SearchResult x = response.getResults().get(1);
        assertThat(x.getUrl()).isEqualTo("https://www.x.example.com/");
        assertThat(x.getSnippet()).isEqualTo("heavy");
        assertThat(x.getSources()).containsExactlyInAnyOrder("light", "heavy");
        assertThat(light.pagesRequested()).containsExactly(1, 2);
    }

    @Test
    void secondPageSliceOfOverlappingProviders() {
        StubProvider alpha = new StubProvider("alpha", query -> overlappingPage("a", query.page(), 50));
        StubProvider beta = new StubProvider("beta", query -> overlappingPage("b", query.page(), 30));
        AggregationEngine engine = engine(List.of(new ProviderBinding(alpha, 2.0), new ProviderBinding(beta, 1.0)));

        AggregateResponse response = engine.search(new SearchRequest("query", 2, 5));

        assertThat(alpha.pagesRequested()).containsExactly(1, 2);
        assertThat(beta.pagesRequested()).containsExactly(1, 2);
        assertThat(response.getResults()).extracting(SearchResult::getUrl).containsExactly(
                "https://a.example.com/4",
                "https://b.example.com/1",
                "https://a.example.com/5",
                "https://a.example.com/6",
                "https://b.example.com/2"
        );
        assertThat(response.getResults()).allSatisfy(result -> assertThat(result.getSources()).hasSize(1));
        assertThat(response.getTotalResults()).isEqualTo(80);
        assertThat(response.getPagination().getPage()).isEqualTo(2);
        assertThat(response.getPagination().getPerPage()).isEqualTo(5);
    }

    @Test
    void slowSuggesterIsDroppedWhileOthersAnswer() {
        SuggestingProvider slow = new SuggestingProvider("slow", List.of("late")) {
            @Override
            public List<String> suggest(String query) {
                try {
                    Thread.sleep(3_000);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return super.suggest(query);
            }
        };
        SuggestingProvider fast = new SuggestingProvider("fast", List.of("java", "javascript"));
        AggregationEngine engine = engine(List.of(new ProviderBinding(slow, 1.0, 100L), new ProviderBinding(fast)));

        long start = System.nanoTime();
        List<String> suggestions = engine.suggest("ja");
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(suggestions).containsExactly("java", "javascript");
    }

    @Test
    void suggestHandsExtraParametersToProviders() {
        SuggestingProvider provider = new SuggestingProvider("p", List.of("java"));
        AggregationEngine engine = engine(List.of(new ProviderBinding(provider)));

        assertThat(engine.suggest("ja", Map.of("hl", "de"), "trace-1")).containsExactly("java");
        assertThat(provider.lastExtra).containsExactly(Map.entry("hl", "de"));

        engine.suggest("ja", "trace-2");
        assertThat(provider.lastExtra).isEmpty();
    }

    private AggregationEngine engine(List<ProviderBinding> bindings) {
        return new AggregationEngine(bindings, ResponseCache.disabled(), executor, null, AggregationEngine.DEFAULT_MAX_ROUNDS);
    }

    private static Function<ProviderQuery, ProviderPage> firstPageOnly(List<RawResult> results, Integer total) {
        return query -> query.page() == 1 ? new ProviderPage(results, total) : ProviderPage.empty();
    }

    /**
     * Page 1 leads with two URLs every caller shares, followed by the caller's own numbered results.
     */
    private static ProviderPage overlappingPage(String prefix, int page, int total) {
        List<RawResult> results = new ArrayList<>();
        if (page == 1) {
            results.add(new RawResult("Shared 1", "https://shared.example.com/1", ""));
            results.add(new RawResult("Shared 2", "https://shared.example.com/2", ""));
            for (int i = 1; i <= 3; i++) {
                results.add(new RawResult(prefix + " " + i, "https://" + prefix + ".example.com/" + i, ""));
            }
        } else {
            for (int i = 1; i <= 5; i++) {
                int n = (page - 2) * 5 + 3 + i;
                results.add(new RawResult(prefix + " " + n, "https://" + prefix + ".example.com/" + n, ""));
            }
        }
        return new ProviderPage(results, total);
    }

    private static List<RawResult> results(String prefix, int count) {
        List<RawResult> results = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            results.add(new RawResult(prefix + " " + i, "https://" + prefix + ".example.com/" + i, "snippet " + i));
        }
        return results;
    }

    private static class StubProvider implements SearchProvider {
        private final String name;
        private final Function<ProviderQuery, ProviderPage> handler;
        private final List<Integer> pages = new ArrayList<>();

        StubProvider(String name, Function<ProviderQuery, ProviderPage> handler) {
            this.name = name;
            this.handler = handler;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ProviderPage search(ProviderQuery query) {
            synchronized (pages) {
                pages.add(query.page());
            }
            return handler.apply(query);
        }

        int calls() {
            synchronized (pages) {
                return pages.size();
            }
        }

        List<Integer> pagesRequested() {
            synchronized (pages) {
                return new ArrayList<>(pages);
            }
        }
    }

    private static class SuggestingProvider extends StubProvider implements SuggestionProvider {
        private final List<String> suggestions;
        private volatile Map<String, String> lastExtra;

        SuggestingProvider(String name, List<String> suggestions) {
            super(name, query -> ProviderPage.empty());
            this.suggestions = suggestions;
        }

        @Override
        public List<String> suggest(String query, Map<String, String> extra) {
            lastExtra = extra;
            return suggest(query);
        }

        @Override
        public List<String> suggest(String query) {
            if (suggestions == null) {
                throw new IllegalStateException("suggest endpoint unavailable");
            }
            return suggestions;
        }
    }
}
