package com.affordabot.backend.gateway.cost;

import java.math.BigDecimal;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rolls over to a fresh {@link CostTracker} whenever the clock enters a new budget period. */
public class PeriodicCostTrackerProvider implements CostTrackerProvider {

  private static final Logger log = LoggerFactory.getLogger(PeriodicCostTrackerProvider.class);

  private final BudgetPeriod period;
  private final BigDecimal ceiling;
  private final String currency;
  private final double alertThreshold;
  private final Clock clock;

  private String currentKey;
  private CostTracker currentTracker;

  public PeriodicCostTrackerProvider(
      BudgetPeriod period, BigDecimal ceiling, String currency, double alertThreshold, Clock clock) {
    this.period = period != null ? period : BudgetPeriod.DAILY;
    this.ceiling = ceiling;
    this.currency = currency;
    this.alertThreshold = alertThreshold;
    this.clock = clock;
  }

  @Override
  public synchronized CostTracker current() {
    String key = period.periodKey(clock.instant(), clock.getZone());
    if (!key.equals(currentKey)) {
      if (currentTracker != null) {
        log.info(
            "Closing budget period {} at {} {}; starting period {}",
            currentKey,
            currentTracker.runningTotal().toPlainString(),
            currency,
            key);
      }
      currentKey = key;
      currentTracker = new CostTracker(ceiling, currency, alertThreshold, clock);
    }
    return currentTracker;
  }

  public synchronized String currentPeriodKey() {
    current();
    return currentKey;
  }
}
