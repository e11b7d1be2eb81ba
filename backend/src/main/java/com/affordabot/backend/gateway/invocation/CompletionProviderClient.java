package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.provider.model.ProviderConfig;

/**
 * Transport to one completion provider. Implementations throw on failure; the invocation engine
 * classifies the exception and decides whether to fail over.
 */
public interface CompletionProviderClient {

  String providerId();

  ProviderResponse complete(ProviderConfig provider, InvocationRequest request);
}
