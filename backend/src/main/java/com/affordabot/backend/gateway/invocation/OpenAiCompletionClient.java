package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.config.GatewayProperties;
import com.affordabot.backend.gateway.config.ProviderType;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Completion client for any OpenAI-compatible chat endpoint (OpenAI, OpenRouter, z.ai). Retries are
 * disabled on the underlying model: failover across providers is the invocation engine's job.
 */
public class OpenAiCompletionClient implements CompletionProviderClient {

  private static final RetryTemplate SINGLE_ATTEMPT = RetryTemplate.builder().maxAttempts(1).build();

  private final String providerId;
  private final GatewayProperties.Provider providerConfig;
  private final ChatClient chatClient;

  public OpenAiCompletionClient(String providerId, GatewayProperties.Provider providerConfig) {
    this(providerId, providerConfig, RestClient.builder(), WebClient.builder());
  }

  public OpenAiCompletionClient(
      String providerId,
      GatewayProperties.Provider providerConfig,
      RestClient.Builder restClientBuilder,
      WebClient.Builder webClientBuilder) {
    Assert.hasText(providerId, "providerId must not be empty");
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.state(
        providerConfig.getType() == ProviderType.OPENAI_COMPATIBLE,
        () -> "Invalid provider type for OpenAI-compatible client: " + providerConfig.getType());
    Assert.state(
        StringUtils.hasText(providerConfig.getApiKey()),
        () -> "API key must be configured for provider '" + providerId + "'");

    this.providerId = providerId;
    this.providerConfig = providerConfig;
    OpenAiApi api = buildApi(providerConfig, restClientBuilder, webClientBuilder);
    OpenAiChatModel chatModel =
        OpenAiChatModel.builder()
            .openAiApi(api)
            .defaultOptions(OpenAiChatOptions.builder().model(providerConfig.getModel()).build())
            .retryTemplate(SINGLE_ATTEMPT)
            .build();
    this.chatClient = ChatClient.builder(chatModel).build();
  }

  private static OpenAiApi buildApi(
      GatewayProperties.Provider provider,
      RestClient.Builder restClientBuilder,
      WebClient.Builder webClientBuilder) {
    OpenAiApi.Builder builder =
        OpenAiApi.builder()
            .apiKey(provider.getApiKey())
            .restClientBuilder(restClientBuilder != null ? restClientBuilder : RestClient.builder())
            .webClientBuilder(webClientBuilder != null ? webClientBuilder : WebClient.builder())
            .responseErrorHandler(new DefaultResponseErrorHandler());
    if (StringUtils.hasText(provider.getBaseUrl())) {
      builder.baseUrl(provider.getBaseUrl());
    }
    if (StringUtils.hasText(provider.getCompletionsPath())) {
      builder.completionsPath(provider.getCompletionsPath());
    }
    return builder.build();
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public ProviderResponse complete(ProviderConfig provider, InvocationRequest request) {
    ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
    if (StringUtils.hasText(request.systemPrompt())) {
      spec = spec.system(request.systemPrompt());
    }
    ChatResponse response = spec.user(request.prompt()).options(buildOptions(provider, request)).call().chatResponse();
    return new ProviderResponse(
        extractContent(response), promptTokens(response), completionTokens(response), response);
  }

  OpenAiChatOptions buildOptions(ProviderConfig provider, InvocationRequest request) {
    OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder();
    builder.model(StringUtils.hasText(provider.model()) ? provider.model() : providerConfig.getModel());

    Double temperature =
        request.temperature() != null ? request.temperature() : providerConfig.getTemperature();
    if (temperature != null) {
      builder.temperature(temperature);
    }
    Integer maxTokens = request.maxTokens() != null ? request.maxTokens() : providerConfig.getMaxTokens();
    if (maxTokens != null) {
      builder.maxTokens(maxTokens);
    }
    if (request.jsonResponse()) {
      builder.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
    }
    return builder.build();
  }

  private static String extractContent(ChatResponse response) {
    if (response == null) {
      return "";
    }
    Generation generation = response.getResult();
    if (generation == null || generation.getOutput() == null) {
      return "";
    }
    String text = generation.getOutput().getText();
    return text != null ? text : "";
  }

  private static Integer promptTokens(ChatResponse response) {
    Usage usage = usage(response);
    return usage != null ? usage.getPromptTokens() : null;
  }

  private static Integer completionTokens(ChatResponse response) {
    Usage usage = usage(response);
    return usage != null ? usage.getCompletionTokens() : null;
  }

  private static Usage usage(ChatResponse response) {
    if (response == null || response.getMetadata() == null) {
      return null;
    }
    return response.getMetadata().getUsage();
  }
}
