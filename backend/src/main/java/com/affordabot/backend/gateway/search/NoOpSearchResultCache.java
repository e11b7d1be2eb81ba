package com.affordabot.backend.gateway.search;

import java.util.Optional;

enum NoOpSearchResultCache implements SearchResultCache {
  INSTANCE;

  @Override
  public Optional<SearchResult> get(String key) {
    return Optional.empty();
  }

  @Override
  public void put(String key, SearchResult result) {
    // no-op
  }
}
