package com.affordabot.backend.gateway.search;

import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.util.StringUtils;

/**
 * Shared cache tier. Redis outages degrade to cache misses; they never fail a search.
 */
public final class RedisSearchResultCache implements SearchResultCache {

  private static final Logger log = LoggerFactory.getLogger(RedisSearchResultCache.class);
  static final String TIER = "redis";

  private final ValueOperations<String, String> valueOperations;
  private final ObjectMapper objectMapper;
  private final Duration ttl;
  private final String keyPrefix;
  private final GatewayMetrics metrics;

  public RedisSearchResultCache(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      Duration ttl,
      String keyPrefix,
      GatewayMetrics metrics) {
    this.valueOperations = redisTemplate.opsForValue();
    this.objectMapper = objectMapper;
    this.ttl = ttl;
    this.keyPrefix = StringUtils.hasText(keyPrefix) ? keyPrefix : "gateway:search";
    this.metrics = metrics;
  }

  @Override
  public Optional<SearchResult> get(String key) {
    if (!StringUtils.hasText(key)) {
      return Optional.empty();
    }
    long start = System.nanoTime();
    try {
      String value = valueOperations.get(redisKey(key));
      if (!StringUtils.hasText(value)) {
        record("miss", start);
        return Optional.empty();
      }
      SearchResult result = objectMapper.readValue(value, SearchResult.class);
      record("hit", start);
      return Optional.of(result);
    } catch (JsonProcessingException exception) {
      log.warn("Discarding unreadable search cache entry {}", key, exception);
      record("error", start);
      return Optional.empty();
    } catch (RuntimeException exception) {
      log.warn("Failed to fetch search results from Redis cache", exception);
      record("error", start);
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, SearchResult result) {
    if (!StringUtils.hasText(key) || result == null) {
      return;
    }
    long start = System.nanoTime();
    try {
      String value = objectMapper.writeValueAsString(result);
      if (ttl != null) {
        valueOperations.set(redisKey(key), value, ttl);
      } else {
        valueOperations.set(redisKey(key), value);
      }
      record("write", start);
    } catch (JsonProcessingException exception) {
      log.warn("Failed to serialise search results for {}", key, exception);
      record("write_error", start);
    } catch (RuntimeException exception) {
      log.warn("Failed to store search results in Redis cache", exception);
      record("write_error", start);
    }
  }

  String redisKey(String key) {
    return keyPrefix + ":" + key;
  }

  private void record(String result, long startNanos) {
    if (metrics != null) {
      metrics.recordCacheLookup(TIER, result, System.nanoTime() - startNanos);
    }
  }
}
