package com.affordabot.backend.gateway.ratelimit;

import com.affordabot.backend.gateway.provider.ProviderRegistry;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.provider.model.RateLimit;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-provider sliding-window limiter. Denials are advisory backpressure: the invocation engine
 * uses them to move on to the next candidate. A slot is consumed when a call is admitted, whether
 * or not the call later succeeds.
 */
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final Map<String, RateLimit> limits;
  private final Clock clock;
  private final ConcurrentMap<String, RateWindowState> windows = new ConcurrentHashMap<>();

  public RateLimiter(Map<String, RateLimit> limits, Clock clock) {
    this.limits = Map.copyOf(limits);
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  public static RateLimiter fromRegistry(ProviderRegistry registry, Clock clock) {
    Map<String, RateLimit> limits = new HashMap<>();
    for (ProviderConfig provider : registry.all()) {
      if (provider.isRateLimited()) {
        limits.put(provider.id(), provider.rateLimit());
      }
    }
    return new RateLimiter(limits, clock);
  }

  public RateLimitDecision tryAcquire(String providerId) {
    return tryAcquire(providerId, 0L);
  }

  /** Admits one call weighing {@code tokens} against the provider's token volume, if limited. */
  public RateLimitDecision tryAcquire(String providerId, long tokens) {
    if (tokens < 0) {
      throw new IllegalArgumentException("tokens must not be negative");
    }
    RateLimit limit = limits.get(providerId);
    if (limit == null) {
      return RateLimitDecision.allow();
    }
    RateLimitDecision decision =
        windows
            .computeIfAbsent(providerId, key -> new RateWindowState())
            .tryAdmit(limit, tokens, clock.instant());
    if (decision.denied() && log.isDebugEnabled()) {
      log.debug(
          "Rate limit reached for provider {}; retry after {} ms",
          providerId,
          decision.retryAfter().toMillis());
    }
    return decision;
  }

  /** Calls admitted for the provider in the current window; zero for unlimited providers. */
  public int admittedInWindow(String providerId) {
    RateLimit limit = limits.get(providerId);
    RateWindowState state = windows.get(providerId);
    if (limit == null || state == null) {
      return 0;
    }
    return state.admittedInWindow(limit.window(), clock.instant());
  }
}
