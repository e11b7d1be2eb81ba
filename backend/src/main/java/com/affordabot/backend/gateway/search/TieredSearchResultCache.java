package com.affordabot.backend.gateway.search;

import java.util.Optional;

/**
 * Two-level cache: a short-lived local tier in front of a longer-lived shared tier. Shared-tier
 * hits are copied into the local tier.
 */
public final class TieredSearchResultCache implements SearchResultCache {

  private final SearchResultCache local;
  private final SearchResultCache shared;

  public TieredSearchResultCache(SearchResultCache local, SearchResultCache shared) {
    this.local = local;
    this.shared = shared;
  }

  @Override
  public Optional<SearchResult> get(String key) {
    Optional<SearchResult> cached = local.get(key);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<SearchResult> fromShared = shared.get(key);
    fromShared.ifPresent(result -> local.put(key, result));
    return fromShared;
  }

  @Override
  public void put(String key, SearchResult result) {
    local.put(key, result);
    shared.put(key, result);
  }
}
