package com.affordabot.backend.gateway.invocation;

import java.time.Duration;

/**
 * One step of the candidate walk, kept for diagnostics and for classifying exhaustion.
 *
 * @param elapsed time spent calling the provider, {@link Duration#ZERO} for skipped candidates
 * @param retryAfter suggested wait for rate-limited candidates, otherwise {@code null}
 */
public record AttemptRecord(
    String providerId, AttemptStatus status, Duration elapsed, String reason, Duration retryAfter) {

  public AttemptRecord {
    if (providerId == null || status == null) {
      throw new IllegalArgumentException("providerId and status must not be null");
    }
    elapsed = elapsed != null ? elapsed : Duration.ZERO;
  }

  public static AttemptRecord succeeded(String providerId, Duration elapsed) {
    return new AttemptRecord(providerId, AttemptStatus.SUCCEEDED, elapsed, null, null);
  }

  public static AttemptRecord budgetSkipped(String providerId, String reason) {
    return new AttemptRecord(providerId, AttemptStatus.BUDGET_SKIPPED, Duration.ZERO, reason, null);
  }

  public static AttemptRecord rateLimited(
      String providerId, Duration elapsed, String reason, Duration retryAfter) {
    return new AttemptRecord(providerId, AttemptStatus.RATE_LIMITED, elapsed, reason, retryAfter);
  }

  public static AttemptRecord transientFailure(String providerId, Duration elapsed, String reason) {
    return new AttemptRecord(providerId, AttemptStatus.TRANSIENT_FAILURE, elapsed, reason, null);
  }

  public static AttemptRecord rejected(String providerId, Duration elapsed, String reason) {
    return new AttemptRecord(providerId, AttemptStatus.REJECTED, elapsed, reason, null);
  }

  public String describe() {
    return reason != null ? providerId + " " + status.tag() + " (" + reason + ")" : providerId + " " + status.tag();
  }
}
