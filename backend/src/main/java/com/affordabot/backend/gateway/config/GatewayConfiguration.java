package com.affordabot.backend.gateway.config;

import com.affordabot.backend.gateway.citation.CitationValidator;
import com.affordabot.backend.gateway.cost.CostTrackerProvider;
import com.affordabot.backend.gateway.cost.PeriodicCostTrackerProvider;
import com.affordabot.backend.gateway.invocation.CompletionProviderClient;
import com.affordabot.backend.gateway.invocation.FailoverExecutor;
import com.affordabot.backend.gateway.invocation.InvocationEngine;
import com.affordabot.backend.gateway.invocation.OpenAiCompletionClient;
import com.affordabot.backend.gateway.metrics.GatewayMetrics;
import com.affordabot.backend.gateway.provider.ProviderRegistry;
import com.affordabot.backend.gateway.ratelimit.RateLimiter;
import com.affordabot.backend.gateway.token.DefaultTokenUsageEstimator;
import com.affordabot.backend.gateway.token.TokenUsageEstimator;
import com.affordabot.backend.gateway.tool.AnalysisStep;
import com.affordabot.backend.gateway.tool.CompletionTool;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfiguration {

  @Bean
  public Clock gatewayClock() {
    return Clock.systemUTC();
  }

  @Bean
  public ProviderRegistry providerRegistry(GatewayProperties properties) {
    return ProviderRegistry.fromProperties(properties);
  }

  @Bean
  public EncodingRegistry encodingRegistry() {
    return Encodings.newDefaultEncodingRegistry();
  }

  @Bean
  public TokenUsageEstimator tokenUsageEstimator(EncodingRegistry encodingRegistry) {
    return new DefaultTokenUsageEstimator(encodingRegistry);
  }

  @Bean
  public GatewayMetrics gatewayMetrics(ObjectProvider<MeterRegistry> meterRegistryProvider) {
    return new GatewayMetrics(meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  public CostTrackerProvider costTrackerProvider(GatewayProperties properties, Clock gatewayClock) {
    GatewayProperties.Budget budget = properties.getBudget();
    return new PeriodicCostTrackerProvider(
        budget.getPeriod(),
        budget.getCeiling(),
        budget.getCurrency(),
        budget.getAlertThreshold(),
        gatewayClock);
  }

  @Bean
  public RateLimiter rateLimiter(ProviderRegistry providerRegistry, Clock gatewayClock) {
    return RateLimiter.fromRegistry(providerRegistry, gatewayClock);
  }

  @Bean(name = "gatewayCallExecutor", destroyMethod = "shutdown")
  public ExecutorService gatewayCallExecutor() {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("gateway-call-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };
    return Executors.newCachedThreadPool(threadFactory);
  }

  @Bean
  public FailoverExecutor failoverExecutor(
      GatewayProperties properties,
      CostTrackerProvider costTrackerProvider,
      RateLimiter rateLimiter,
      GatewayMetrics gatewayMetrics,
      ExecutorService gatewayCallExecutor) {
    return new FailoverExecutor(
        costTrackerProvider,
        rateLimiter,
        gatewayMetrics,
        gatewayCallExecutor,
        properties.getDefaultTimeout(),
        properties.getRateLimitWait());
  }

  @Bean
  public List<CompletionProviderClient> completionProviderClients(
      GatewayProperties properties,
      ObjectProvider<RestClient.Builder> restClientBuilderProvider,
      ObjectProvider<WebClient.Builder> webClientBuilderProvider) {
    List<CompletionProviderClient> clients = new ArrayList<>();
    properties
        .getProviders()
        .forEach(
            (providerId, providerConfig) -> {
              if (!providerConfig.isEnabled()) {
                return;
              }
              if (providerConfig.getType() == ProviderType.OPENAI_COMPATIBLE) {
                clients.add(
                    new OpenAiCompletionClient(
                        providerId,
                        providerConfig,
                        restClientBuilderProvider.getIfAvailable(RestClient::builder),
                        webClientBuilderProvider.getIfAvailable(WebClient::builder)));
              } else if (providerConfig.getType() != ProviderType.ZAI_SEARCH) {
                throw new IllegalStateException(
                    "Unsupported provider type for '" + providerId + "': " + providerConfig.getType());
              }
            });
    return clients;
  }

  @Bean
  public InvocationEngine invocationEngine(
      ProviderRegistry providerRegistry,
      List<CompletionProviderClient> completionProviderClients,
      FailoverExecutor failoverExecutor,
      TokenUsageEstimator tokenUsageEstimator) {
    return new InvocationEngine(
        providerRegistry, completionProviderClients, failoverExecutor, tokenUsageEstimator);
  }

  @Bean
  public CompletionTool completionTool(InvocationEngine invocationEngine) {
    return new CompletionTool(invocationEngine);
  }

  @Bean
  public CitationValidator citationValidator() {
    return new CitationValidator();
  }

  @Bean
  public AnalysisStep analysisStep(CompletionTool completionTool, CitationValidator citationValidator) {
    return new AnalysisStep(completionTool, citationValidator);
  }
}
