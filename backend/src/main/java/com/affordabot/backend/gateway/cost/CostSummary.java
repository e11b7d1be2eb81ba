package com.affordabot.backend.gateway.cost;

import java.math.BigDecimal;
import java.util.Map;

/** Point-in-time view of a tracker, suitable for a caller to persist. */
public record CostSummary(
    BigDecimal ceiling,
    BigDecimal total,
    BigDecimal remaining,
    String currency,
    int entryCount,
    Map<String, BigDecimal> byProvider,
    Map<String, BigDecimal> byStep) {

  public CostSummary {
    byProvider = byProvider != null ? Map.copyOf(byProvider) : Map.of();
    byStep = byStep != null ? Map.copyOf(byStep) : Map.of();
  }
}
