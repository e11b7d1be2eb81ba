package com.affordabot.backend.gateway.ratelimit;

import com.affordabot.backend.gateway.provider.model.RateLimit;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/** Sliding-window log of admitted calls for a single provider. */
final class RateWindowState {

  private final Deque<Admission> admissions = new ArrayDeque<>();
  private long tokensInWindow;

  synchronized RateLimitDecision tryAdmit(RateLimit limit, long tokens, Instant now) {
    evictExpired(limit.window(), now);

    if (admissions.size() >= limit.maxCalls()) {
      return RateLimitDecision.deny(untilExpiry(admissions.peekFirst(), limit.window(), now));
    }
    if (limit.limitsTokens() && tokensInWindow + tokens > limit.maxTokens()) {
      return RateLimitDecision.deny(untilTokensFreed(limit, tokens, now));
    }

    admissions.addLast(new Admission(now, tokens));
    tokensInWindow += tokens;
    return RateLimitDecision.allow();
  }

  synchronized int admittedInWindow(Duration window, Instant now) {
    evictExpired(window, now);
    return admissions.size();
  }

  private void evictExpired(Duration window, Instant now) {
    Instant windowStart = now.minus(window);
    while (!admissions.isEmpty() && !admissions.peekFirst().at().isAfter(windowStart)) {
      tokensInWindow -= admissions.removeFirst().tokens();
    }
  }

  private Duration untilTokensFreed(RateLimit limit, long tokens, Instant now) {
    if (tokens > limit.maxTokens()) {
      // can never fit; the caller should pick another provider
      return limit.window();
    }
    long excess = tokensInWindow + tokens - limit.maxTokens();
    long freed = 0;
    Iterator<Admission> iterator = admissions.iterator();
    while (iterator.hasNext()) {
      Admission admission = iterator.next();
      freed += admission.tokens();
      if (freed >= excess) {
        return untilExpiry(admission, limit.window(), now);
      }
    }
    return limit.window();
  }

  private static Duration untilExpiry(Admission admission, Duration window, Instant now) {
    return Duration.between(now, admission.at().plus(window));
  }

  private record Admission(Instant at, long tokens) {}
}
