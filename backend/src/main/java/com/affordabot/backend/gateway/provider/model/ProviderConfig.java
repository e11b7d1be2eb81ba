package com.affordabot.backend.gateway.provider.model;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Immutable description of one provider candidate. Lower {@code priority} values are tried first.
 *
 * @param rateLimit {@code null} when the provider is not rate limited locally
 * @param timeout per-attempt timeout, {@code null} to fall back to the request or gateway default
 */
public record ProviderConfig(
    String id,
    ProviderFamily family,
    int priority,
    String model,
    Set<String> capabilities,
    CostModel costModel,
    RateLimit rateLimit,
    Duration timeout) {

  public ProviderConfig {
    if (!StringUtils.hasText(id)) {
      throw new IllegalArgumentException("Provider identifier must be defined");
    }
    if (family == null) {
      throw new IllegalArgumentException("Provider family must be defined for '" + id + "'");
    }
    Set<String> normalized = new LinkedHashSet<>();
    if (CollectionUtils.isEmpty(capabilities)) {
      normalized.add(Capabilities.defaultFor(family));
    } else {
      capabilities.forEach(capability -> normalized.add(Capabilities.normalize(capability)));
    }
    capabilities = Set.copyOf(normalized);
    costModel = costModel != null ? costModel : CostModel.free();
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new IllegalArgumentException("timeout must be positive for '" + id + "'");
    }
  }

  public boolean supports(String capability) {
    return capabilities.contains(Capabilities.normalize(capability));
  }

  public boolean isRateLimited() {
    return rateLimit != null;
  }
}
