package com.affordabot.backend.gateway.invocation;

import java.time.Duration;

/** Failure of a single provider attempt, already classified. */
public class ProviderCallException extends RuntimeException {

  public enum Kind {
    TRANSIENT,
    RATE_LIMITED,
    REJECTED
  }

  private final String providerId;
  private final Kind kind;
  private final Integer statusCode;
  private final Duration retryAfter;

  public ProviderCallException(
      String providerId,
      Kind kind,
      Integer statusCode,
      Duration retryAfter,
      String message,
      Throwable cause) {
    super(message, cause);
    this.providerId = providerId;
    this.kind = kind;
    this.statusCode = statusCode;
    this.retryAfter = retryAfter;
  }

  public static ProviderCallException transientFailure(
      String providerId, String message, Throwable cause) {
    return new ProviderCallException(providerId, Kind.TRANSIENT, null, null, message, cause);
  }

  public static ProviderCallException rateLimited(
      String providerId, Duration retryAfter, String message, Throwable cause) {
    return new ProviderCallException(providerId, Kind.RATE_LIMITED, 429, retryAfter, message, cause);
  }

  public static ProviderCallException rejected(
      String providerId, Integer statusCode, String message, Throwable cause) {
    return new ProviderCallException(providerId, Kind.REJECTED, statusCode, null, message, cause);
  }

  public String providerId() {
    return providerId;
  }

  public Kind kind() {
    return kind;
  }

  public Integer statusCode() {
    return statusCode;
  }

  public Duration retryAfter() {
    return retryAfter;
  }
}
