package com.affordabot.backend.gateway.provider.model;

import java.time.Duration;

/**
 * Ceiling of calls (and optionally tokens) a provider accepts within a sliding window.
 *
 * @param maxCalls calls admitted per window, must be positive
 * @param maxTokens token volume admitted per window, {@code null} when only calls are limited
 * @param window window length
 */
public record RateLimit(int maxCalls, Long maxTokens, Duration window) {

  public RateLimit {
    if (maxCalls < 1) {
      throw new IllegalArgumentException("maxCalls must be >= 1");
    }
    if (maxTokens != null && maxTokens < 1) {
      throw new IllegalArgumentException("maxTokens must be >= 1 when specified");
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be a positive duration");
    }
  }

  public static RateLimit callsPer(int maxCalls, Duration window) {
    return new RateLimit(maxCalls, null, window);
  }

  public boolean limitsTokens() {
    return maxTokens != null;
  }
}
