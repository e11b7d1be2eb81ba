package com.affordabot.backend.gateway.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class InMemorySearchResultCacheTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final AtomicLong nanos = new AtomicLong();
  private final InMemorySearchResultCache cache = cache(Duration.ofHours(1), 10_000);

  @Test
  void returnsStoredResultUntilTtlElapses() {
    SearchResult result = result("council agenda");
    cache.put("key", result);

    advance(Duration.ofMinutes(59));
    assertThat(cache.get("key")).contains(result);

    advance(Duration.ofMinutes(1));
    assertThat(cache.get("key")).isEmpty();
    assertThat(cache.size()).isZero();
    assertThat(lookups("hit")).isEqualTo(1.0);
    assertThat(lookups("miss")).isEqualTo(1.0);
  }

  @Test
  void missesAreCounted() {
    assertThat(cache.get("unknown")).isEmpty();
    assertThat(cache.get(" ")).isEmpty();

    assertThat(lookups("miss")).isEqualTo(1.0);
  }

  @Test
  void expiredKeysThatAreNeverReadAgainDoNotAccumulate() {
    for (int i = 0; i < 10_000; i++) {
      cache.put("query-" + i, result("query " + i));
    }
    assertThat(cache.size()).isEqualTo(10_000);

    advance(Duration.ofDays(30));
    cache.put("fresh", result("fresh"));

    assertThat(cache.size()).isEqualTo(1);
    assertThat(cache.get("fresh")).isPresent();
  }

  @Test
  void entryCountStaysWithinTheConfiguredMaximum() {
    InMemorySearchResultCache bounded = cache(Duration.ofHours(1), 100);

    for (int i = 0; i < 1_000; i++) {
      bounded.put("query-" + i, result("query " + i));
    }

    assertThat(bounded.size()).isLessThanOrEqualTo(100);
  }

  @Test
  void rejectsNonPositiveLimits() {
    assertThatThrownBy(() -> cache(Duration.ZERO, 10)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> cache(Duration.ofMinutes(1), 0)).isInstanceOf(IllegalArgumentException.class);
  }

  private InMemorySearchResultCache cache(Duration ttl, long maximumSize) {
    return new InMemorySearchResultCache(
        ttl, maximumSize, nanos::get, Runnable::run, new GatewayMetrics(meterRegistry));
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  private double lookups(String result) {
    return meterRegistry
        .counter("gateway.search.cache.requests", "tier", InMemorySearchResultCache.TIER, "result", result)
        .count();
  }

  private static SearchResult result(String query) {
    return new SearchResult(
        SearchQuery.of(query),
        List.of(new SearchHit("Agenda", "https://example.gov/agenda", "Item 4", null, null)),
        "zai-search",
        false,
        new BigDecimal("0.01"));
  }
}
