package com.affordabot.backend.gateway.cost;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Running cost ledger for one budget period. The ceiling is fixed for the tracker's lifetime; use a
 * fresh tracker per period.
 *
 * <p>{@link #record} never rejects a priced call. Callers that issue a paid request first hold its
 * estimate with {@link #tryReserve}, then {@link #settle} the hold with the actual price or
 * {@link #release} it when no price is due. Held amounts count against the ceiling, so concurrent
 * callers cannot all pass the same remaining budget. All reads and writes of the running total go
 * through a single lock.
 */
public class CostTracker {

  private static final Logger log = LoggerFactory.getLogger(CostTracker.class);
  private static final String UNLABELLED_STEP = "unlabelled";

  private final BigDecimal ceiling;
  private final String currency;
  private final double alertThreshold;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<CostLedgerEntry> ledger = new ArrayList<>();

  private BigDecimal runningTotal = BigDecimal.ZERO;
  private BigDecimal reserved = BigDecimal.ZERO;
  private boolean alertRaised;

  public CostTracker(BigDecimal ceiling) {
    this(ceiling, "USD", 0.8, Clock.systemUTC());
  }

  public CostTracker(BigDecimal ceiling, String currency, double alertThreshold, Clock clock) {
    if (ceiling == null || ceiling.signum() < 0) {
      throw new IllegalArgumentException("ceiling must be a non-negative amount");
    }
    if (alertThreshold < 0.0 || alertThreshold > 1.0) {
      throw new IllegalArgumentException("alertThreshold must be within [0, 1]");
    }
    this.ceiling = ceiling;
    this.currency = StringUtils.hasText(currency) ? currency : "USD";
    this.alertThreshold = alertThreshold;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  public BigDecimal record(String providerId, BigDecimal amount) {
    return record(providerId, null, amount);
  }

  /** Appends a ledger entry and returns the running total after it. */
  public BigDecimal record(String providerId, String step, BigDecimal amount) {
    requireNonNegative(amount);
    lock.lock();
    try {
      runningTotal = runningTotal.add(amount);
      ledger.add(
          new CostLedgerEntry(
              clock.instant(),
              providerId,
              StringUtils.hasText(step) ? step : null,
              amount,
              runningTotal));
      raiseAlertIfNeeded();
      return runningTotal;
    } finally {
      lock.unlock();
    }
  }

  public boolean canAfford(BigDecimal amount) {
    requireNonNegative(amount);
    lock.lock();
    try {
      return committed().add(amount).compareTo(ceiling) <= 0;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Holds {@code amount} against the ceiling when spent plus held plus {@code amount} still fits.
   * Returns empty when it does not.
   */
  public Optional<Reservation> tryReserve(BigDecimal amount) {
    requireNonNegative(amount);
    lock.lock();
    try {
      if (committed().add(amount).compareTo(ceiling) > 0) {
        return Optional.empty();
      }
      reserved = reserved.add(amount);
      return Optional.of(new Reservation(amount));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops the hold and records the actual price in one step. The actual price may differ from the
   * held estimate; it is recorded either way.
   */
  public BigDecimal settle(
      Reservation reservation, String providerId, String step, BigDecimal actual) {
    requireNonNegative(actual);
    lock.lock();
    try {
      requireOwn(reservation);
      if (reservation.closed) {
        throw new IllegalStateException("reservation already closed");
      }
      closeHold(reservation);
      return record(providerId, step, actual);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the held amount to the budget. No-op once the reservation is settled or released. */
  public void release(Reservation reservation) {
    lock.lock();
    try {
      requireOwn(reservation);
      if (!reservation.closed) {
        closeHold(reservation);
      }
    } finally {
      lock.unlock();
    }
  }

  public BigDecimal reservedTotal() {
    lock.lock();
    try {
      return reserved;
    } finally {
      lock.unlock();
    }
  }

  public BigDecimal remainingBudget() {
    lock.lock();
    try {
      BigDecimal remaining = ceiling.subtract(committed());
      return remaining.signum() > 0 ? remaining : BigDecimal.ZERO;
    } finally {
      lock.unlock();
    }
  }

  public BigDecimal runningTotal() {
    lock.lock();
    try {
      return runningTotal;
    } finally {
      lock.unlock();
    }
  }

  public BigDecimal ceiling() {
    return ceiling;
  }

  public String currency() {
    return currency;
  }

  public List<CostLedgerEntry> entries() {
    lock.lock();
    try {
      return List.copyOf(ledger);
    } finally {
      lock.unlock();
    }
  }

  public CostSummary summary() {
    lock.lock();
    try {
      Map<String, BigDecimal> byProvider = new LinkedHashMap<>();
      Map<String, BigDecimal> byStep = new LinkedHashMap<>();
      for (CostLedgerEntry entry : ledger) {
        String providerKey = StringUtils.hasText(entry.providerId()) ? entry.providerId() : "unknown";
        byProvider.merge(providerKey, entry.amount(), BigDecimal::add);
        String stepKey = entry.step() != null ? entry.step() : UNLABELLED_STEP;
        byStep.merge(stepKey, entry.amount(), BigDecimal::add);
      }
      BigDecimal remaining = ceiling.subtract(runningTotal);
      return new CostSummary(
          ceiling,
          runningTotal,
          remaining.signum() > 0 ? remaining : BigDecimal.ZERO,
          currency,
          ledger.size(),
          byProvider,
          byStep);
    } finally {
      lock.unlock();
    }
  }

  private BigDecimal committed() {
    return runningTotal.add(reserved);
  }

  private void closeHold(Reservation reservation) {
    reservation.closed = true;
    reserved = reserved.subtract(reservation.amount);
  }

  private void requireOwn(Reservation reservation) {
    if (reservation == null || reservation.owner != this) {
      throw new IllegalArgumentException("reservation does not belong to this tracker");
    }
  }

  private void raiseAlertIfNeeded() {
    if (alertRaised || ceiling.signum() == 0) {
      return;
    }
    BigDecimal threshold = ceiling.multiply(BigDecimal.valueOf(alertThreshold));
    if (runningTotal.compareTo(threshold) >= 0) {
      alertRaised = true;
      log.warn(
          "Budget alert: spent {} {} of {} {} ({}% threshold reached)",
          runningTotal.toPlainString(),
          currency,
          ceiling.toPlainString(),
          currency,
          Math.round(alertThreshold * 100));
    }
  }

  private static void requireNonNegative(BigDecimal amount) {
    if (amount == null || amount.signum() < 0) {
      throw new IllegalArgumentException("amount must be a non-negative value");
    }
  }

  /** Budget held for one in-flight call. Guarded by the owning tracker's lock. */
  public final class Reservation {

    private final CostTracker owner = CostTracker.this;
    private final BigDecimal amount;
    private boolean closed;

    private Reservation(BigDecimal amount) {
      this.amount = amount;
    }

    public BigDecimal amount() {
      return amount;
    }
  }
}
