package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.cost.CostTracker;
import com.affordabot.backend.gateway.cost.CostTrackerProvider;
import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.ratelimit.RateLimitDecision;
import com.affordabot.backend.gateway.ratelimit.RateLimiter;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks an ordered candidate list: budget reservation, rate-limit admission, timed call, cost
 * settlement. Transient failures move on to the next candidate; a rejected request stops the walk.
 *
 * <p>The estimate is held on the tracker for the duration of the attempt and settled with the actual
 * price once the call returns. Any other exit releases the hold, so an attempt cancelled by timeout
 * or interruption leaves the ledger untouched while its rate-limit slot stays consumed.
 */
public class FailoverExecutor {

  private static final Logger log = LoggerFactory.getLogger(FailoverExecutor.class);

  private final CostTrackerProvider costTrackers;
  private final RateLimiter rateLimiter;
  private final GatewayMetrics metrics;
  private final ExecutorService executor;
  private final Duration defaultTimeout;
  private final Duration rateLimitWait;

  public FailoverExecutor(
      CostTrackerProvider costTrackers,
      RateLimiter rateLimiter,
      GatewayMetrics metrics,
      ExecutorService executor,
      Duration defaultTimeout,
      Duration rateLimitWait) {
    this.costTrackers = Objects.requireNonNull(costTrackers, "costTrackers");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.defaultTimeout = defaultTimeout != null ? defaultTimeout : Duration.ofSeconds(30);
    this.rateLimitWait = rateLimitWait != null ? rateLimitWait : Duration.ZERO;
  }

  /**
   * @param exhaustedKind failure kind reported when candidates that were actually called all failed
   */
  public <T> FailoverResult<T> execute(
      String capability,
      List<ProviderConfig> candidates,
      AttemptOptions options,
      ProviderCall<T> call,
      FailureKind exhaustedKind) {
    if (candidates == null || candidates.isEmpty()) {
      metrics.recordFailure(capability, FailureKind.CONFIGURATION.name());
      throw GatewayException.noCandidates(capability);
    }
    AttemptOptions effectiveOptions = options != null ? options : AttemptOptions.defaults();
    CostTracker tracker = costTrackers.current();
    List<AttemptRecord> attempts = new ArrayList<>();
    long startedAt = System.nanoTime();

    for (int index = 0; index < candidates.size(); index++) {
      ProviderConfig provider = candidates.get(index);
      BigDecimal estimate = call.estimateCost(provider);

      if (effectiveOptions.budgetCeiling() != null
          && estimate.compareTo(effectiveOptions.budgetCeiling()) > 0) {
        skipForBudget(capability, provider, attempts, "estimate " + estimate.toPlainString()
            + " above request ceiling " + effectiveOptions.budgetCeiling().toPlainString());
        continue;
      }
      Optional<CostTracker.Reservation> held = tracker.tryReserve(estimate);
      if (held.isEmpty()) {
        skipForBudget(capability, provider, attempts, "estimate " + estimate.toPlainString()
            + " above remaining budget " + tracker.remainingBudget().toPlainString());
        continue;
      }
      CostTracker.Reservation reservation = held.get();
      try {
        RateLimitDecision decision = acquire(provider, call.estimateTokens(provider), index == 0);
        if (decision.denied()) {
          metrics.recordRateLimitDenied(provider.id());
          metrics.recordAttempt(capability, provider.id(), AttemptStatus.RATE_LIMITED.tag(), null);
          attempts.add(
              AttemptRecord.rateLimited(provider.id(), Duration.ZERO, "local rate limit", decision.retryAfter()));
          continue;
        }

        long attemptStartedAt = System.nanoTime();
        try {
          T response = callWithTimeout(provider, call, effectiveTimeout(provider, effectiveOptions));
          Duration attemptElapsed = since(attemptStartedAt);
          BigDecimal cost = call.price(provider, response);
          BigDecimal runningTotal =
              tracker.settle(reservation, provider.id(), effectiveOptions.step(), cost);
          metrics.recordCost(provider.id(), cost);
          metrics.recordAttempt(capability, provider.id(), AttemptStatus.SUCCEEDED.tag(), attemptElapsed);
          attempts.add(AttemptRecord.succeeded(provider.id(), attemptElapsed));
          log.debug(
              "Provider {} served capability {} in {} ms for {} (running total {})",
              provider.id(),
              capability,
              attemptElapsed.toMillis(),
              cost.toPlainString(),
              runningTotal.toPlainString());
          return new FailoverResult<>(provider, response, cost, since(startedAt), attempts);
        } catch (ProviderCallException failure) {
          Duration attemptElapsed = since(attemptStartedAt);
          switch (failure.kind()) {
            case REJECTED -> {
              metrics.recordAttempt(capability, provider.id(), AttemptStatus.REJECTED.tag(), attemptElapsed);
              attempts.add(AttemptRecord.rejected(provider.id(), attemptElapsed, failure.getMessage()));
              metrics.recordFailure(capability, FailureKind.REQUEST_REJECTED.name());
              log.warn("Provider {} rejected {} request: {}", provider.id(), capability, failure.getMessage());
              throw new GatewayException(
                  FailureKind.REQUEST_REJECTED,
                  capability,
                  "Request rejected by provider " + provider.id() + ": " + failure.getMessage(),
                  attempts,
                  null,
                  failure);
            }
            case RATE_LIMITED -> {
              metrics.recordAttempt(capability, provider.id(), AttemptStatus.RATE_LIMITED.tag(), attemptElapsed);
              attempts.add(
                  AttemptRecord.rateLimited(
                      provider.id(), attemptElapsed, failure.getMessage(), failure.retryAfter()));
              log.info("Provider {} throttled {} request; trying next candidate", provider.id(), capability);
            }
            default -> {
              metrics.recordAttempt(
                  capability, provider.id(), AttemptStatus.TRANSIENT_FAILURE.tag(), attemptElapsed);
              attempts.add(
                  AttemptRecord.transientFailure(provider.id(), attemptElapsed, failure.getMessage()));
              log.info(
                  "Provider {} failed {} request ({}); trying next candidate",
                  provider.id(),
                  capability,
                  failure.getMessage());
            }
          }
        }
      } finally {
        tracker.release(reservation);
      }
    }
    throw exhausted(capability, attempts, exhaustedKind);
  }

  private void skipForBudget(
      String capability, ProviderConfig provider, List<AttemptRecord> attempts, String reason) {
    metrics.recordAttempt(capability, provider.id(), AttemptStatus.BUDGET_SKIPPED.tag(), null);
    attempts.add(AttemptRecord.budgetSkipped(provider.id(), reason));
    log.debug("Skipping provider {} for {}: {}", provider.id(), capability, reason);
  }

  private RateLimitDecision acquire(ProviderConfig provider, long tokens, boolean topCandidate) {
    RateLimitDecision decision = rateLimiter.tryAcquire(provider.id(), tokens);
    if (decision.allowed()
        || !topCandidate
        || rateLimitWait.isZero()
        || decision.retryAfter().compareTo(rateLimitWait) > 0) {
      return decision;
    }
    log.debug("Waiting {} ms for provider {} window", decision.retryAfter().toMillis(), provider.id());
    try {
      Thread.sleep(decision.retryAfter().toMillis() + 1);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for provider " + provider.id());
    }
    return rateLimiter.tryAcquire(provider.id(), tokens);
  }

  private <T> T callWithTimeout(ProviderConfig provider, ProviderCall<T> call, Duration timeout) {
    Future<T> future = executor.submit(() -> call.call(provider));
    try {
      return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException timedOut) {
      future.cancel(true);
      throw ProviderCallException.transientFailure(
          provider.id(), "timed out after " + timeout.toMillis() + " ms", timedOut);
    } catch (ExecutionException failed) {
      throw ProviderFailureClassifier.classify(provider.id(), failed.getCause());
    } catch (InterruptedException interrupted) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while calling provider " + provider.id());
    }
  }

  private Duration effectiveTimeout(ProviderConfig provider, AttemptOptions options) {
    if (options.timeout() != null) {
      return options.timeout();
    }
    return provider.timeout() != null ? provider.timeout() : defaultTimeout;
  }

  private GatewayException exhausted(
      String capability, List<AttemptRecord> attempts, FailureKind exhaustedKind) {
    boolean anyFailed =
        attempts.stream().anyMatch(attempt -> attempt.status() == AttemptStatus.TRANSIENT_FAILURE);
    List<AttemptRecord> rateLimited =
        attempts.stream().filter(attempt -> attempt.status() == AttemptStatus.RATE_LIMITED).toList();

    FailureKind kind;
    Duration retryAfter = null;
    if (anyFailed) {
      kind = exhaustedKind;
    } else if (!rateLimited.isEmpty()) {
      kind = FailureKind.RATE_LIMITED;
      retryAfter =
          rateLimited.stream()
              .map(AttemptRecord::retryAfter)
              .filter(Objects::nonNull)
              .min(Duration::compareTo)
              .orElse(null);
    } else {
      kind = FailureKind.BUDGET_EXCEEDED;
    }

    String summary = attempts.stream().map(AttemptRecord::describe).collect(Collectors.joining("; "));
    metrics.recordFailure(capability, kind.name());
    log.warn("No provider could serve {} request ({}): {}", capability, kind, summary);
    return new GatewayException(
        kind,
        capability,
        "No provider could serve capability '" + capability + "' (" + kind + "): " + summary,
        attempts,
        retryAfter,
        null);
  }

  private static Duration since(long startedAtNanos) {
    return Duration.ofNanos(System.nanoTime() - startedAtNanos);
  }
}
