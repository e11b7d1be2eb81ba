package com.affordabot.backend.gateway.search;

import java.util.Optional;

public interface SearchResultCache {

  Optional<SearchResult> get(String key);

  void put(String key, SearchResult result);

  static SearchResultCache noOp() {
    return NoOpSearchResultCache.INSTANCE;
  }
}
