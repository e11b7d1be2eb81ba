package com.affordabot.backend.gateway.search;

import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import java.util.List;

/** Transport to one web search provider. Failures are thrown and classified by the caller. */
public interface WebSearchProviderClient {

  String providerId();

  List<SearchHit> search(ProviderConfig provider, SearchQuery query);
}
