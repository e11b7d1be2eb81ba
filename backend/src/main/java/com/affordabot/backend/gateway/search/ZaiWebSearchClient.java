package com.affordabot.backend.gateway.search;

import com.affordabot.backend.gateway.config.GatewayProperties;
import com.affordabot.backend.gateway.config.ProviderType;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

public class ZaiWebSearchClient implements WebSearchProviderClient {

  static final String DEFAULT_BASE_URL = "https://api.z.ai/api/paas/v4";
  static final String DEFAULT_SEARCH_PATH = "/web-search";

  private final String providerId;
  private final String searchPath;
  private final WebClient webClient;

  public ZaiWebSearchClient(
      String providerId, GatewayProperties.Provider providerConfig, WebClient.Builder webClientBuilder) {
    Assert.hasText(providerId, "providerId must not be empty");
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.state(
        providerConfig.getType() == ProviderType.ZAI_SEARCH,
        () -> "Invalid provider type for z.ai search client: " + providerConfig.getType());
    Assert.state(
        StringUtils.hasText(providerConfig.getApiKey()),
        () -> "API key must be configured for provider '" + providerId + "'");

    this.providerId = providerId;
    this.searchPath =
        StringUtils.hasText(providerConfig.getSearchPath())
            ? providerConfig.getSearchPath()
            : DEFAULT_SEARCH_PATH;
    WebClient.Builder builder = webClientBuilder != null ? webClientBuilder : WebClient.builder();
    this.webClient =
        builder
            .baseUrl(
                StringUtils.hasText(providerConfig.getBaseUrl())
                    ? providerConfig.getBaseUrl()
                    : DEFAULT_BASE_URL)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + providerConfig.getApiKey().trim())
            .build();
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public List<SearchHit> search(ProviderConfig provider, SearchQuery query) {
    ZaiSearchResponse response =
        webClient
            .post()
            .uri(searchPath)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload(query))
            .retrieve()
            .bodyToMono(ZaiSearchResponse.class)
            .block();
    if (response == null || response.results() == null) {
      return List.of();
    }
    return response.results();
  }

  static Map<String, Object> payload(SearchQuery query) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("query", query.normalizedQuery());
    payload.put("count", query.count());
    if (!query.domains().isEmpty()) {
      payload.put("domains", query.domains());
    }
    if (query.recency() != null) {
      payload.put("recency", query.recency());
    }
    return payload;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ZaiSearchResponse(List<SearchHit> results) {}
}
