package com.affordabot.backend.gateway.search;

import com.affordabot.backend.gateway.invocation.AttemptOptions;
import com.affordabot.backend.gateway.invocation.FailoverExecutor;
import com.affordabot.backend.gateway.invocation.FailoverResult;
import com.affordabot.backend.gateway.invocation.FailureKind;
import com.affordabot.backend.gateway.invocation.ProviderCall;
import com.affordabot.backend.gateway.provider.ProviderRegistry;
import com.affordabot.backend.gateway.provider.model.Capabilities;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.provider.model.ProviderFamily;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Web search with caching in front of the same budget, rate-limit and failover discipline as
 * completions. Cache hits are free and do not consume rate-limit slots.
 */
public class SearchClient {

  private static final Logger log = LoggerFactory.getLogger(SearchClient.class);

  private final ProviderRegistry registry;
  private final Map<String, WebSearchProviderClient> clients;
  private final FailoverExecutor failoverExecutor;
  private final SearchResultCache cache;

  public SearchClient(
      ProviderRegistry registry,
      List<WebSearchProviderClient> clients,
      FailoverExecutor failoverExecutor,
      SearchResultCache cache) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.failoverExecutor = Objects.requireNonNull(failoverExecutor, "failoverExecutor");
    this.cache = cache != null ? cache : SearchResultCache.noOp();
    Map<String, WebSearchProviderClient> byId = new LinkedHashMap<>();
    for (WebSearchProviderClient client : clients) {
      if (byId.putIfAbsent(client.providerId(), client) != null) {
        throw new IllegalStateException("Duplicate search client for provider '" + client.providerId() + "'");
      }
    }
    for (ProviderConfig provider : registry.byFamily(ProviderFamily.WEB_SEARCH)) {
      if (!byId.containsKey(provider.id())) {
        throw new IllegalStateException("No search client registered for provider '" + provider.id() + "'");
      }
    }
    this.clients = Map.copyOf(byId);
  }

  public SearchResult search(String query) {
    return search(SearchQuery.of(query));
  }

  public SearchResult search(SearchQuery query) {
    return search(query, AttemptOptions.defaults());
  }

  public SearchResult search(SearchQuery query, AttemptOptions options) {
    Objects.requireNonNull(query, "query");
    String cacheKey = query.cacheKey();
    Optional<SearchResult> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      log.debug("Search cache hit for '{}'", query.normalizedQuery());
      return cached.get().asCacheHit();
    }

    List<ProviderConfig> candidates =
        registry.candidatesFor(Capabilities.SEARCH).stream()
            .filter(provider -> provider.family() == ProviderFamily.WEB_SEARCH)
            .toList();
    FailoverResult<List<SearchHit>> result =
        failoverExecutor.execute(
            Capabilities.SEARCH, candidates, options, new WebSearchCall(query), FailureKind.SEARCH_FAILED);

    SearchResult searchResult =
        new SearchResult(query, result.response(), result.provider().id(), false, result.cost());
    cache.put(cacheKey, searchResult);
    log.debug(
        "Search '{}' served by {} with {} hit(s)",
        query.normalizedQuery(),
        searchResult.providerId(),
        searchResult.hits().size());
    return searchResult;
  }

  private final class WebSearchCall implements ProviderCall<List<SearchHit>> {

    private final SearchQuery query;

    private WebSearchCall(SearchQuery query) {
      this.query = query;
    }

    @Override
    public BigDecimal estimateCost(ProviderConfig provider) {
      return provider.costModel().price(0, 0);
    }

    @Override
    public List<SearchHit> call(ProviderConfig provider) {
      List<SearchHit> hits = clients.get(provider.id()).search(provider, query);
      return hits != null ? hits : List.of();
    }

    @Override
    public BigDecimal price(ProviderConfig provider, List<SearchHit> response) {
      return provider.costModel().price(0, 0);
    }
  }
}
