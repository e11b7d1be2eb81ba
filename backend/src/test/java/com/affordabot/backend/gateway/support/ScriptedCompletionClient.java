package com.affordabot.backend.gateway.support;

import com.affordabot.backend.gateway.invocation.CompletionProviderClient;
import com.affordabot.backend.gateway.invocation.InvocationRequest;
import com.affordabot.backend.gateway.invocation.ProviderResponse;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

public final class ScriptedCompletionClient implements CompletionProviderClient {

  private final String providerId;
  private final Function<InvocationRequest, ProviderResponse> behaviour;
  private final AtomicInteger calls = new AtomicInteger();

  private ScriptedCompletionClient(
      String providerId, Function<InvocationRequest, ProviderResponse> behaviour) {
    this.providerId = providerId;
    this.behaviour = behaviour;
  }

  public static ScriptedCompletionClient answering(
      String providerId, String content, Integer promptTokens, Integer completionTokens) {
    return new ScriptedCompletionClient(
        providerId, request -> new ProviderResponse(content, promptTokens, completionTokens, null));
  }

  public static ScriptedCompletionClient failing(String providerId, RuntimeException failure) {
    return new ScriptedCompletionClient(
        providerId,
        request -> {
          throw failure;
        });
  }

  public static ScriptedCompletionClient behaving(
      String providerId, Function<InvocationRequest, ProviderResponse> behaviour) {
    return new ScriptedCompletionClient(providerId, behaviour);
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public ProviderResponse complete(ProviderConfig provider, InvocationRequest request) {
    calls.incrementAndGet();
    return behaviour.apply(request);
  }

  public int calls() {
    return calls.get();
  }
}
