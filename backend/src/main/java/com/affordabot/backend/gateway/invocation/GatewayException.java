package com.affordabot.backend.gateway.invocation;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Terminal failure of a gateway call. Callers branch on {@link #kind()} rather than on exception
 * subtypes.
 */
public class GatewayException extends RuntimeException {

  private final FailureKind kind;
  private final String capability;
  private final List<AttemptRecord> attempts;
  private final Duration retryAfter;

  public GatewayException(
      FailureKind kind,
      String capability,
      String message,
      List<AttemptRecord> attempts,
      Duration retryAfter,
      Throwable cause) {
    super(message, cause);
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null");
    }
    this.kind = kind;
    this.capability = capability;
    this.attempts = attempts != null ? List.copyOf(attempts) : List.of();
    this.retryAfter = retryAfter;
  }

  public static GatewayException noCandidates(String capability) {
    return new GatewayException(
        FailureKind.CONFIGURATION,
        capability,
        "No providers configured for capability '" + capability + "'",
        List.of(),
        null,
        null);
  }

  public FailureKind kind() {
    return kind;
  }

  public String capability() {
    return capability;
  }

  public List<AttemptRecord> attempts() {
    return attempts;
  }

  /** Shortest suggested wait across rate-limited candidates, when known. */
  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
