package com.affordabot.backend.gateway.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.util.List;

/**
 * Hits for one query. Cache hits carry the provider that originally answered and a zero cost.
 */
public record SearchResult(
    SearchQuery query, List<SearchHit> hits, String providerId, boolean cacheHit, BigDecimal cost) {

  public SearchResult {
    hits = hits != null ? List.copyOf(hits) : List.of();
    cost = cost != null ? cost : BigDecimal.ZERO;
  }

  public SearchResult asCacheHit() {
    return new SearchResult(query, hits, providerId, true, BigDecimal.ZERO);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return hits.isEmpty();
  }
}
