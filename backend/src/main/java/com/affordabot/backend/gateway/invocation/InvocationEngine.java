package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.provider.ProviderRegistry;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.provider.model.ProviderFamily;
import com.affordabot.backend.gateway.token.TokenUsageEstimator;
import com.affordabot.backend.gateway.token.TokenUsageEstimator.Estimate;
import com.affordabot.backend.gateway.token.TokenUsageEstimator.EstimateRequest;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for completion work. Candidates for the requested capability are tried in
 * priority order until one answers; budget, rate limits and timeouts are enforced per attempt.
 */
public class InvocationEngine {

  private static final Logger log = LoggerFactory.getLogger(InvocationEngine.class);

  /** Completion size assumed for budget estimates when the request does not cap it. */
  static final int DEFAULT_EXPECTED_COMPLETION_TOKENS = 1_000;

  private final ProviderRegistry registry;
  private final Map<String, CompletionProviderClient> clients;
  private final FailoverExecutor failoverExecutor;
  private final TokenUsageEstimator tokenUsageEstimator;

  public InvocationEngine(
      ProviderRegistry registry,
      List<CompletionProviderClient> clients,
      FailoverExecutor failoverExecutor,
      TokenUsageEstimator tokenUsageEstimator) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.failoverExecutor = Objects.requireNonNull(failoverExecutor, "failoverExecutor");
    this.tokenUsageEstimator = Objects.requireNonNull(tokenUsageEstimator, "tokenUsageEstimator");
    Map<String, CompletionProviderClient> byId = new LinkedHashMap<>();
    for (CompletionProviderClient client : clients) {
      if (byId.putIfAbsent(client.providerId(), client) != null) {
        throw new IllegalStateException("Duplicate completion client for provider '" + client.providerId() + "'");
      }
    }
    for (ProviderConfig provider : registry.all()) {
      if (provider.family() == ProviderFamily.CHAT_COMPLETION && !byId.containsKey(provider.id())) {
        throw new IllegalStateException("No completion client registered for provider '" + provider.id() + "'");
      }
    }
    this.clients = Map.copyOf(byId);
  }

  public InvocationOutcome invoke(InvocationRequest request) {
    Objects.requireNonNull(request, "request");
    List<ProviderConfig> candidates =
        registry.candidatesFor(request.capability()).stream()
            .filter(provider -> provider.family() == ProviderFamily.CHAT_COMPLETION)
            .toList();
    CompletionCall call = new CompletionCall(request);
    FailoverResult<ProviderResponse> result =
        failoverExecutor.execute(
            request.capability(),
            candidates,
            AttemptOptions.from(request),
            call,
            FailureKind.ALL_PROVIDERS_FAILED);

    ProviderResponse response = result.response();
    Estimate usage = call.usage(result.provider(), response);
    if (log.isDebugEnabled()) {
      log.debug(
          "Invocation {} served by {} after {} attempt(s): {} prompt / {} completion tokens",
          request.capability(),
          result.provider().id(),
          result.attempts().size(),
          usage.promptTokens(),
          usage.completionTokens());
    }
    return new InvocationOutcome(
        result.provider(),
        response.content(),
        usage.promptTokens(),
        usage.completionTokens(),
        result.elapsed(),
        result.cost(),
        response.raw(),
        result.attempts());
  }

  private final class CompletionCall implements ProviderCall<ProviderResponse> {

    private final InvocationRequest request;
    private final String promptText;
    private final Map<String, Integer> promptTokensByModel = new ConcurrentHashMap<>();

    private CompletionCall(InvocationRequest request) {
      this.request = request;
      this.promptText =
          request.systemPrompt() != null
              ? request.systemPrompt() + "\n" + request.prompt()
              : request.prompt();
    }

    @Override
    public BigDecimal estimateCost(ProviderConfig provider) {
      return provider.costModel().price(promptTokens(provider), expectedCompletionTokens());
    }

    @Override
    public long estimateTokens(ProviderConfig provider) {
      return (long) promptTokens(provider) + expectedCompletionTokens();
    }

    @Override
    public ProviderResponse call(ProviderConfig provider) {
      return clients.get(provider.id()).complete(provider, request);
    }

    @Override
    public BigDecimal price(ProviderConfig provider, ProviderResponse response) {
      Estimate usage = usage(provider, response);
      return provider.costModel().price(usage.promptTokens(), usage.completionTokens());
    }

    Estimate usage(ProviderConfig provider, ProviderResponse response) {
      if (response.hasUsage()) {
        return new Estimate(response.promptTokens(), response.completionTokens());
      }
      return tokenUsageEstimator.estimate(
          new EstimateRequest(provider.id(), provider.model(), promptText, response.content()));
    }

    private int promptTokens(ProviderConfig provider) {
      String modelKey = provider.model() != null ? provider.model() : "";
      return promptTokensByModel.computeIfAbsent(
          modelKey,
          key ->
              tokenUsageEstimator
                  .estimate(EstimateRequest.promptOnly(provider.id(), provider.model(), promptText))
                  .promptTokens());
    }

    private int expectedCompletionTokens() {
      return request.maxTokens() != null ? request.maxTokens() : DEFAULT_EXPECTED_COMPLETION_TOKENS;
    }
  }
}
