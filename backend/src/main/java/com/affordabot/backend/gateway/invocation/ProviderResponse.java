package com.affordabot.backend.gateway.invocation;

/**
 * Raw answer of a completion provider. Token counts are {@code null} when the provider did not
 * report usage.
 */
public record ProviderResponse(
    String content, Integer promptTokens, Integer completionTokens, Object raw) {

  public ProviderResponse {
    content = content != null ? content : "";
  }

  public boolean hasUsage() {
    return promptTokens != null
        && completionTokens != null
        && promptTokens + completionTokens > 0;
  }
}
