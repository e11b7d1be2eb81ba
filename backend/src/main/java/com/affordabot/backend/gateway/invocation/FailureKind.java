package com.affordabot.backend.gateway.invocation;

/** Discriminator callers branch on when a gateway call cannot be served. */
public enum FailureKind {
  /** No provider is configured for the requested capability. */
  CONFIGURATION(false),
  /** Every candidate was skipped because its estimated cost did not fit the budget. */
  BUDGET_EXCEEDED(true),
  /** Every candidate was under rate-limit backpressure; see the suggested retry-after. */
  RATE_LIMITED(true),
  /** Every completion candidate that was tried failed transiently. */
  ALL_PROVIDERS_FAILED(true),
  /** A provider rejected the request itself; retrying elsewhere cannot help. */
  REQUEST_REJECTED(false),
  /** Search counterpart of {@link #ALL_PROVIDERS_FAILED}. */
  SEARCH_FAILED(true);

  private final boolean retryableLater;

  FailureKind(boolean retryableLater) {
    this.retryableLater = retryableLater;
  }

  /** Whether repeating the whole request later may succeed. */
  public boolean isRetryableLater() {
    return retryableLater;
  }
}
