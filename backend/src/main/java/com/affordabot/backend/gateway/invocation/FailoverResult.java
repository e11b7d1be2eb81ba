package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

public record FailoverResult<T>(
    ProviderConfig provider,
    T response,
    BigDecimal cost,
    Duration elapsed,
    List<AttemptRecord> attempts) {

  public FailoverResult {
    attempts = List.copyOf(attempts);
  }
}
