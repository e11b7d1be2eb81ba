package com.affordabot.backend.gateway.cost;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public enum BudgetPeriod {
  DAILY,
  MONTHLY,
  /** A single budget for the lifetime of the process. */
  NONE;

  /** Identifier of the period containing {@code instant}; equal keys share one tracker. */
  public String periodKey(Instant instant, ZoneId zone) {
    LocalDate date = LocalDate.ofInstant(instant, zone);
    return switch (this) {
      case DAILY -> date.toString();
      case MONTHLY -> date.getYear() + "-" + String.format("%02d", date.getMonthValue());
      case NONE -> "lifetime";
    };
  }
}
