package com.affordabot.backend.gateway.invocation;

import java.util.Locale;

public enum AttemptStatus {
  SUCCEEDED,
  /** Not called: the estimated cost did not fit the remaining or per-request budget. */
  BUDGET_SKIPPED,
  /** Not called because of local backpressure, or the provider itself answered 429. */
  RATE_LIMITED,
  TRANSIENT_FAILURE,
  /** The provider rejected the request itself; no further candidates are tried. */
  REJECTED;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
