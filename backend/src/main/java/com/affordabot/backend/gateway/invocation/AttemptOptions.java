package com.affordabot.backend.gateway.invocation;

import java.math.BigDecimal;
import java.time.Duration;

/** Per-request knobs the failover walk honours. All fields are optional. */
public record AttemptOptions(String step, BigDecimal budgetCeiling, Duration timeout) {

  public static AttemptOptions defaults() {
    return new AttemptOptions(null, null, null);
  }

  public static AttemptOptions from(InvocationRequest request) {
    return new AttemptOptions(request.step(), request.budgetCeiling(), request.timeout());
  }
}
