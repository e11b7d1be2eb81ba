package com.affordabot.backend.gateway.search;

import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import org.springframework.util.StringUtils;

/** Process-local cache tier, bounded by entry count and expiring entries after write. */
public final class InMemorySearchResultCache implements SearchResultCache {

  static final String TIER = "memory";

  private final Cache<String, SearchResult> entries;
  private final GatewayMetrics metrics;

  public InMemorySearchResultCache(Duration ttl, long maximumSize, GatewayMetrics metrics) {
    this(ttl, maximumSize, Ticker.systemTicker(), ForkJoinPool.commonPool(), metrics);
  }

  InMemorySearchResultCache(
      Duration ttl, long maximumSize, Ticker ticker, Executor maintenance, GatewayMetrics metrics) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (maximumSize <= 0) {
      throw new IllegalArgumentException("maximumSize must be positive");
    }
    this.entries =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
            .ticker(ticker)
            .executor(maintenance)
            .build();
    this.metrics = metrics;
  }

  @Override
  public Optional<SearchResult> get(String key) {
    if (!StringUtils.hasText(key)) {
      return Optional.empty();
    }
    long start = System.nanoTime();
    SearchResult result = entries.getIfPresent(key);
    record(result != null ? "hit" : "miss", start);
    return Optional.ofNullable(result);
  }

  @Override
  public void put(String key, SearchResult result) {
    if (!StringUtils.hasText(key) || result == null) {
      return;
    }
    entries.put(key, result);
  }

  long size() {
    entries.cleanUp();
    return entries.estimatedSize();
  }

  private void record(String result, long startNanos) {
    if (metrics != null) {
      metrics.recordCacheLookup(TIER, result, System.nanoTime() - startNanos);
    }
  }
}
