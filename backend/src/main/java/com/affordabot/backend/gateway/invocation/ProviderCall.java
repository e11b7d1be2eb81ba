package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import java.math.BigDecimal;

/** What the failover walk needs to know about one kind of provider call. */
public interface ProviderCall<T> {

  /** Worst-case cost of calling {@code provider}, checked against the budget before the call. */
  BigDecimal estimateCost(ProviderConfig provider);

  /** Token volume charged against the provider's rate limit. */
  default long estimateTokens(ProviderConfig provider) {
    return 0L;
  }

  T call(ProviderConfig provider);

  /** Actual cost of a completed call. */
  BigDecimal price(ProviderConfig provider, T response);
}
