package com.affordabot.backend.gateway.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.affordabot.backend.gateway.cost.CostTracker;
import com.affordabot.backend.gateway.cost.CostTrackerProvider;
import com.affordabot.backend.gateway.invocation.AttemptStatus;
import com.affordabot.backend.gateway.invocation.AttemptRecord;
import com.affordabot.backend.gateway.invocation.FailoverExecutor;
import com.affordabot.backend.gateway.invocation.FailureKind;
import com.affordabot.backend.gateway.invocation.GatewayException;
import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import com.affordabot.backend.gateway.provider.ProviderRegistry;
import com.affordabot.backend.gateway.provider.model.CostModel;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.provider.model.ProviderFamily;
import com.affordabot.backend.gateway.provider.model.RateLimit;
import com.affordabot.backend.gateway.ratelimit.RateLimiter;
import com.affordabot.backend.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

class SearchClientTest {

  private static final CostModel PER_SEARCH = CostModel.perRequest(new BigDecimal("0.01"));
  private static final List<SearchHit> HITS =
      List.of(new SearchHit("Agenda", "https://sanjoseca.gov/agenda", "Housing bond", null, null));

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void secondIdenticalSearchIsServedFromCacheForFree() {
    StubSearchProvider zai = new StubSearchProvider("zai-search", HITS);
    CostTracker tracker = new CostTracker(BigDecimal.ONE);
    RateLimiter limiter =
        new RateLimiter(Map.of("zai-search", RateLimit.callsPer(10, Duration.ofMinutes(1))), clock);
    SearchClient client =
        searchClient(tracker, limiter, List.of(searchProvider("zai-search", 1)), memoryCache(), zai);

    SearchResult first = client.search("San Jose housing bond");
    SearchResult second = client.search(" san jose HOUSING bond ");

    assertThat(first.cacheHit()).isFalse();
    assertThat(first.cost()).isEqualByComparingTo("0.01");
    assertThat(first.providerId()).isEqualTo("zai-search");
    assertThat(second.cacheHit()).isTrue();
    assertThat(second.cost()).isEqualByComparingTo("0");
    assertThat(second.hits()).isEqualTo(first.hits());
    assertThat(zai.calls()).isEqualTo(1);
    assertThat(tracker.runningTotal()).isEqualByComparingTo("0.01");
    assertThat(tracker.entries()).extracting(entry -> entry.providerId()).containsExactly("zai-search");
    assertThat(limiter.admittedInWindow("zai-search")).isEqualTo(1);
  }

  @Test
  void everySearchProviderThrottledReportsRateLimitedWithShortestRetryAfter() {
    Map<String, RateLimit> limits = new HashMap<>();
    limits.put("zai-search", RateLimit.callsPer(1, Duration.ofMinutes(1)));
    limits.put("backup-search", RateLimit.callsPer(1, Duration.ofSeconds(30)));
    RateLimiter limiter = new RateLimiter(limits, clock);
    limiter.tryAcquire("zai-search");
    limiter.tryAcquire("backup-search");
    clock.advance(Duration.ofSeconds(10));

    StubSearchProvider primary = new StubSearchProvider("zai-search", HITS);
    StubSearchProvider backup = new StubSearchProvider("backup-search", HITS);
    CostTracker tracker = new CostTracker(BigDecimal.ONE);
    SearchClient client =
        searchClient(
            tracker,
            limiter,
            List.of(searchProvider("zai-search", 1), searchProvider("backup-search", 2)),
            memoryCache(),
            primary,
            backup);

    assertThatThrownBy(() -> client.search("zoning variance"))
        .isInstanceOfSatisfying(
            GatewayException.class,
            exception -> {
              assertThat(exception.kind()).isEqualTo(FailureKind.RATE_LIMITED);
              assertThat(exception.retryAfter()).contains(Duration.ofSeconds(20));
              assertThat(exception.attempts())
                  .extracting(AttemptRecord::status)
                  .containsOnly(AttemptStatus.RATE_LIMITED);
            });
    assertThat(primary.calls()).isZero();
    assertThat(backup.calls()).isZero();
    assertThat(tracker.entries()).isEmpty();
    assertThat(tracker.reservedTotal()).isEqualByComparingTo("0");
  }

  @Test
  void emptyResultsAreCachedToo() {
    StubSearchProvider zai = new StubSearchProvider("zai-search", List.of());
    SearchClient client =
        searchClient(
            new CostTracker(BigDecimal.ONE),
            new RateLimiter(Map.of(), clock),
            List.of(searchProvider("zai-search", 1)),
            memoryCache(),
            zai);

    assertThat(client.search("obscure ordinance").isEmpty()).isTrue();
    assertThat(client.search("obscure ordinance").cacheHit()).isTrue();
    assertThat(zai.calls()).isEqualTo(1);
  }

  @Test
  void failsOverToBackupSearchProvider() {
    StubSearchProvider primary =
        new StubSearchProvider("zai-search", null, new ResourceAccessException("Connection refused"));
    StubSearchProvider backup = new StubSearchProvider("backup-search", HITS);
    SearchClient client =
        searchClient(
            new CostTracker(BigDecimal.ONE),
            new RateLimiter(Map.of(), clock),
            List.of(searchProvider("zai-search", 1), searchProvider("backup-search", 2)),
            SearchResultCache.noOp(),
            primary,
            backup);

    SearchResult result = client.search(SearchQuery.of("rent control").withRecency("1y"));

    assertThat(result.providerId()).isEqualTo("backup-search");
    assertThat(primary.calls()).isEqualTo(1);
  }

  @Test
  void failedSearchesAreReportedAsSearchFailedAndNotCached() {
    StubSearchProvider zai =
        new StubSearchProvider("zai-search", null, new ResourceAccessException("Read timed out"));
    InMemorySearchResultCache cache = memoryCache();
    CostTracker tracker = new CostTracker(BigDecimal.ONE);
    SearchClient client =
        searchClient(tracker, new RateLimiter(Map.of(), clock), List.of(searchProvider("zai-search", 1)), cache, zai);

    assertThatThrownBy(() -> client.search("zoning variance"))
        .isInstanceOfSatisfying(
            GatewayException.class,
            failure -> {
              assertThat(failure.kind()).isEqualTo(FailureKind.SEARCH_FAILED);
              assertThat(failure.attempts())
                  .extracting(AttemptRecord::status)
                  .containsExactly(AttemptStatus.TRANSIENT_FAILURE);
            });
    assertThat(cache.size()).isZero();
    assertThat(tracker.runningTotal()).isEqualByComparingTo("0");
  }

  @Test
  void searchIsSkippedWhenBudgetCannotCoverIt() {
    StubSearchProvider zai = new StubSearchProvider("zai-search", HITS);
    SearchClient client =
        searchClient(
            new CostTracker(new BigDecimal("0.005")),
            new RateLimiter(Map.of(), clock),
            List.of(searchProvider("zai-search", 1)),
            memoryCache(),
            zai);

    assertThatThrownBy(() -> client.search("city budget"))
        .isInstanceOfSatisfying(
            GatewayException.class, failure -> assertThat(failure.kind()).isEqualTo(FailureKind.BUDGET_EXCEEDED));
    assertThat(zai.calls()).isZero();
  }

  @Test
  void noSearchProviderIsAConfigurationFailure() {
    SearchClient client =
        searchClient(
            new CostTracker(BigDecimal.ONE),
            new RateLimiter(Map.of(), clock),
            List.of(new ProviderConfig("zai", ProviderFamily.CHAT_COMPLETION, 1, "glm-4.6", null, null, null, null)),
            memoryCache());

    assertThatThrownBy(() -> client.search("anything"))
        .isInstanceOfSatisfying(
            GatewayException.class, failure -> assertThat(failure.kind()).isEqualTo(FailureKind.CONFIGURATION));
  }

  @Test
  void everySearchProviderNeedsAClient() {
    ProviderRegistry registry = new ProviderRegistry(List.of(searchProvider("zai-search", 1)));
    FailoverExecutor failoverExecutor =
        failoverExecutor(new CostTracker(BigDecimal.ONE), new RateLimiter(Map.of(), clock));

    assertThatThrownBy(() -> new SearchClient(registry, List.of(), failoverExecutor, null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("zai-search");
  }

  private InMemorySearchResultCache memoryCache() {
    return new InMemorySearchResultCache(Duration.ofHours(24), 1_000, new GatewayMetrics(meterRegistry));
  }

  private SearchClient searchClient(
      CostTracker tracker,
      RateLimiter limiter,
      List<ProviderConfig> providers,
      SearchResultCache cache,
      WebSearchProviderClient... clients) {
    return new SearchClient(
        new ProviderRegistry(providers), List.of(clients), failoverExecutor(tracker, limiter), cache);
  }

  private FailoverExecutor failoverExecutor(CostTracker tracker, RateLimiter limiter) {
    return new FailoverExecutor(
        CostTrackerProvider.fixed(tracker),
        limiter,
        new GatewayMetrics(meterRegistry),
        executor,
        Duration.ofSeconds(5),
        Duration.ZERO);
  }

  private static ProviderConfig searchProvider(String id, int priority) {
    return new ProviderConfig(id, ProviderFamily.WEB_SEARCH, priority, null, null, PER_SEARCH, null, null);
  }

  private static final class StubSearchProvider implements WebSearchProviderClient {

    private final String providerId;
    private final List<SearchHit> hits;
    private final RuntimeException failure;
    private final AtomicInteger calls = new AtomicInteger();

    private StubSearchProvider(String providerId, List<SearchHit> hits) {
      this(providerId, hits, null);
    }

    private StubSearchProvider(String providerId, List<SearchHit> hits, RuntimeException failure) {
      this.providerId = providerId;
      this.hits = hits;
      this.failure = failure;
    }

    @Override
    public String providerId() {
      return providerId;
    }

    @Override
    public List<SearchHit> search(ProviderConfig provider, SearchQuery query) {
      calls.incrementAndGet();
      if (failure != null) {
        throw failure;
      }
      return hits;
    }

    int calls() {
      return calls.get();
    }
  }
}
