package com.affordabot.backend.gateway.ratelimit;

import java.time.Duration;

/**
 * Result of {@link RateLimiter#tryAcquire}. A denied decision always carries a positive
 * {@code retryAfter}.
 */
public record RateLimitDecision(boolean allowed, Duration retryAfter) {

  private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, Duration.ZERO);
  private static final Duration MIN_RETRY_AFTER = Duration.ofMillis(1);

  public RateLimitDecision {
    if (allowed) {
      retryAfter = Duration.ZERO;
    } else if (retryAfter == null || retryAfter.compareTo(MIN_RETRY_AFTER) < 0) {
      retryAfter = MIN_RETRY_AFTER;
    }
  }

  public static RateLimitDecision allow() {
    return ALLOWED;
  }

  public static RateLimitDecision deny(Duration retryAfter) {
    return new RateLimitDecision(false, retryAfter);
  }

  public boolean denied() {
    return !allowed;
  }
}
