package com.affordabot.backend.gateway.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchHit(
    String title,
    String url,
    String snippet,
    @JsonProperty("published_date") String publishedDate,
    @JsonProperty("relevance_score") Double relevanceScore) {

  public SearchHit {
    title = title != null ? title : "";
    url = url != null ? url : "";
    snippet = snippet != null ? snippet : "";
  }
}
