package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Successful invocation. {@code elapsed} covers the whole candidate walk; {@code attempts} lists
 * every candidate considered before and including the one that answered.
 */
public record InvocationOutcome(
    ProviderConfig provider,
    String content,
    int promptTokens,
    int completionTokens,
    Duration elapsed,
    BigDecimal cost,
    Object rawResponse,
    List<AttemptRecord> attempts) {

  public InvocationOutcome {
    attempts = attempts != null ? List.copyOf(attempts) : List.of();
  }

  public String providerId() {
    return provider.id();
  }

  public int totalTokens() {
    return promptTokens + completionTokens;
  }
}
