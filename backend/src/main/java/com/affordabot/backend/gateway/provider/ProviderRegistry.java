package com.affordabot.backend.gateway.provider;

import com.affordabot.backend.gateway.config.GatewayProperties;
import com.affordabot.backend.gateway.config.ProviderType;
import com.affordabot.backend.gateway.provider.model.Capabilities;
import com.affordabot.backend.gateway.provider.model.CostModel;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.provider.model.ProviderFamily;
import com.affordabot.backend.gateway.provider.model.RateLimit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Ranked, read-only list of provider candidates. Populated once at startup; candidate lists are
 * ordered by priority with declaration order breaking ties.
 */
public class ProviderRegistry {

  private final List<ProviderConfig> providers;
  private final Map<String, ProviderConfig> providersById;

  public ProviderRegistry(List<ProviderConfig> providers) {
    Map<String, ProviderConfig> byId = new LinkedHashMap<>();
    for (ProviderConfig provider : providers) {
      if (byId.putIfAbsent(provider.id(), provider) != null) {
        throw new IllegalStateException("Duplicate provider identifier: " + provider.id());
      }
    }
    this.providers = List.copyOf(providers);
    this.providersById = Map.copyOf(byId);
  }

  public static ProviderRegistry fromProperties(GatewayProperties properties) {
    List<ProviderConfig> configs = new ArrayList<>();
    properties
        .getProviders()
        .forEach(
            (providerId, provider) -> {
              if (provider.isEnabled()) {
                configs.add(toConfig(providerId, provider));
              }
            });
    return new ProviderRegistry(configs);
  }

  public List<ProviderConfig> candidatesFor(String capability) {
    String normalized = Capabilities.normalize(capability);
    // Stream.sorted is stable for ordered streams, which keeps declaration order on ties.
    return providers.stream()
        .filter(provider -> provider.capabilities().contains(normalized))
        .sorted(Comparator.comparingInt(ProviderConfig::priority))
        .toList();
  }

  public Optional<ProviderConfig> find(String providerId) {
    if (!StringUtils.hasText(providerId)) {
      return Optional.empty();
    }
    return Optional.ofNullable(providersById.get(providerId));
  }

  public ProviderConfig requireProvider(String providerId) {
    return find(providerId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + providerId));
  }

  public List<ProviderConfig> all() {
    return providers;
  }

  public List<ProviderConfig> byFamily(ProviderFamily family) {
    return providers.stream().filter(provider -> provider.family() == family).toList();
  }

  private static ProviderConfig toConfig(String providerId, GatewayProperties.Provider provider) {
    ProviderFamily family = resolveFamily(providerId, provider);
    if (family == ProviderFamily.EMBEDDING) {
      throw new IllegalStateException(
          "Provider '" + providerId + "' declares family EMBEDDING, which no provider client serves");
    }
    if (family != ProviderFamily.WEB_SEARCH && !StringUtils.hasText(provider.getModel())) {
      throw new IllegalStateException("Model must be defined for provider '" + providerId + "'");
    }
    GatewayProperties.Pricing pricing =
        provider.getPricing() != null ? provider.getPricing() : new GatewayProperties.Pricing();
    CostModel costModel =
        new CostModel(
            pricing.getUnit(),
            pricing.getInputPer1KTokens(),
            pricing.getOutputPer1KTokens(),
            pricing.getPerRequest(),
            pricing.getCurrency());
    GatewayProperties.RateLimit rateLimit = provider.getRateLimit();
    RateLimit limit =
        rateLimit != null
            ? new RateLimit(rateLimit.getMaxCalls(), rateLimit.getMaxTokens(), rateLimit.getWindow())
            : null;
    return new ProviderConfig(
        providerId,
        family,
        provider.getPriority(),
        provider.getModel(),
        provider.getCapabilities() != null
            ? new LinkedHashSet<>(provider.getCapabilities())
            : null,
        costModel,
        limit,
        provider.getTimeout());
  }

  private static ProviderFamily resolveFamily(String providerId, GatewayProperties.Provider provider) {
    if (provider.getFamily() != null) {
      return provider.getFamily();
    }
    if (provider.getType() == ProviderType.OPENAI_COMPATIBLE) {
      return ProviderFamily.CHAT_COMPLETION;
    }
    if (provider.getType() == ProviderType.ZAI_SEARCH) {
      return ProviderFamily.WEB_SEARCH;
    }
    throw new IllegalStateException(
        "Provider type or family must be defined for provider '" + providerId + "'");
  }
}
