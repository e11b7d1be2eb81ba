package com.affordabot.backend.gateway.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class GatewayMetrics {

  private final MeterRegistry meterRegistry;

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordAttempt(String capability, String providerId, String status, Duration elapsed) {
    meterRegistry
        .counter("gateway.attempts", "capability", capability, "provider", providerId, "status", status)
        .increment();
    if (elapsed != null) {
      meterRegistry
          .timer("gateway.attempt.latency", "capability", capability, "provider", providerId)
          .record(elapsed.toNanos(), TimeUnit.NANOSECONDS);
    }
  }

  public void recordCost(String providerId, BigDecimal amount) {
    if (amount == null) {
      return;
    }
    meterRegistry.summary("gateway.cost", "provider", providerId).record(amount.doubleValue());
  }

  public void recordRateLimitDenied(String providerId) {
    meterRegistry.counter("gateway.rate_limit.denied", "provider", providerId).increment();
  }

  public void recordFailure(String capability, String kind) {
    meterRegistry.counter("gateway.failures", "capability", capability, "kind", kind).increment();
  }

  public void recordCacheLookup(String tier, String result, long durationNanos) {
    meterRegistry.counter("gateway.search.cache.requests", "tier", tier, "result", result).increment();
    meterRegistry
        .timer("gateway.search.cache.latency", "tier", tier, "result", result)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }
}
