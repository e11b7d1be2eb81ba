package com.affordabot.backend.gateway.config;

import com.affordabot.backend.gateway.invocation.FailoverExecutor;
import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import com.affordabot.backend.gateway.provider.ProviderRegistry;
import com.affordabot.backend.gateway.search.InMemorySearchResultCache;
import com.affordabot.backend.gateway.search.RedisSearchResultCache;
import com.affordabot.backend.gateway.search.SearchClient;
import com.affordabot.backend.gateway.search.SearchResultCache;
import com.affordabot.backend.gateway.search.TieredSearchResultCache;
import com.affordabot.backend.gateway.search.WebSearchProviderClient;
import com.affordabot.backend.gateway.search.ZaiWebSearchClient;
import com.affordabot.backend.gateway.tool.WebSearchTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class SearchConfiguration {

  @Bean
  public SearchResultCache searchResultCache(
      GatewayProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplateProvider,
      ObjectProvider<ObjectMapper> objectMapperProvider,
      GatewayMetrics gatewayMetrics) {
    GatewayProperties.Cache cacheProperties =
        Optional.ofNullable(properties.getSearch())
            .map(GatewayProperties.Search::getCache)
            .orElseGet(GatewayProperties.Cache::new);
    if (!cacheProperties.isEnabled()) {
      return SearchResultCache.noOp();
    }
    SearchResultCache memoryCache =
        new InMemorySearchResultCache(
            cacheProperties.getMemoryTtl(), cacheProperties.getMemoryMaximumSize(), gatewayMetrics);
    StringRedisTemplate redisTemplate =
        cacheProperties.isRedisEnabled() ? redisTemplateProvider.getIfAvailable() : null;
    if (redisTemplate == null) {
      return memoryCache;
    }
    RedisSearchResultCache redisCache =
        new RedisSearchResultCache(
            redisTemplate,
            objectMapperProvider.getIfAvailable(ObjectMapper::new),
            cacheProperties.getRedisTtl(),
            cacheProperties.getKeyPrefix(),
            gatewayMetrics);
    return new TieredSearchResultCache(memoryCache, redisCache);
  }

  @Bean
  public List<WebSearchProviderClient> webSearchProviderClients(
      GatewayProperties properties, ObjectProvider<WebClient.Builder> webClientBuilderProvider) {
    List<WebSearchProviderClient> clients = new ArrayList<>();
    properties
        .getProviders()
        .forEach(
            (providerId, providerConfig) -> {
              if (providerConfig.isEnabled() && providerConfig.getType() == ProviderType.ZAI_SEARCH) {
                clients.add(
                    new ZaiWebSearchClient(
                        providerId,
                        providerConfig,
                        webClientBuilderProvider.getIfAvailable(WebClient::builder)));
              }
            });
    return clients;
  }

  @Bean
  public SearchClient searchClient(
      ProviderRegistry providerRegistry,
      List<WebSearchProviderClient> webSearchProviderClients,
      FailoverExecutor failoverExecutor,
      SearchResultCache searchResultCache) {
    return new SearchClient(
        providerRegistry, webSearchProviderClients, failoverExecutor, searchResultCache);
  }

  @Bean
  public WebSearchTool webSearchTool(SearchClient searchClient) {
    return new WebSearchTool(searchClient);
  }
}
