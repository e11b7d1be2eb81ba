package com.affordabot.backend.gateway.invocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.affordabot.backend.gateway.config.GatewayProperties;
import com.affordabot.backend.gateway.config.ProviderType;
import com.affordabot.backend.gateway.provider.model.ProviderConfig;
import com.affordabot.backend.gateway.provider.model.ProviderFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

class OpenAiCompletionClientTest {

  private static final String COMPLETION_BODY =
      """
      {
        "id": "chatcmpl-1",
        "object": "chat.completion",
        "created": 1760000000,
        "model": "glm-4.6",
        "choices": [
          {
            "index": 0,
            "message": {"role": "assistant", "content": "Three agenda items concern housing."},
            "finish_reason": "stop"
          }
        ],
        "usage": {"prompt_tokens": 21, "completion_tokens": 7, "total_tokens": 28}
      }
      """;

  private final ProviderConfig provider =
      new ProviderConfig("zai", ProviderFamily.CHAT_COMPLETION, 1, "glm-4.6", null, null, null, null);

  private GatewayProperties.Provider providerProperties;
  private MockRestServiceServer server;
  private OpenAiCompletionClient client;

  @BeforeEach
  void setUp() {
    providerProperties = new GatewayProperties.Provider();
    providerProperties.setType(ProviderType.OPENAI_COMPATIBLE);
    providerProperties.setModel("glm-4.6");
    providerProperties.setBaseUrl("https://api.z.ai/api/paas/v4");
    providerProperties.setCompletionsPath("/chat/completions");
    providerProperties.setApiKey("test-key");
    providerProperties.setTemperature(0.2);

    RestClient.Builder restClientBuilder = RestClient.builder();
    server = MockRestServiceServer.bindTo(restClientBuilder).build();
    client = new OpenAiCompletionClient("zai", providerProperties, restClientBuilder, WebClient.builder());
  }

  @Test
  void sendsChatCompletionAndReadsNativeUsage() {
    server
        .expect(requestTo("https://api.z.ai/api/paas/v4/chat/completions"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
        .andExpect(jsonPath("$.model").value("glm-4.6"))
        .andExpect(jsonPath("$.max_tokens").value(256))
        .andExpect(jsonPath("$.messages[0].role").value("system"))
        .andExpect(jsonPath("$.messages[1].content").value("Summarise the agenda"))
        .andRespond(withSuccess(COMPLETION_BODY, MediaType.APPLICATION_JSON));

    ProviderResponse response =
        client.complete(
            provider,
            InvocationRequest.builder()
                .systemPrompt("You are a civic analyst.")
                .prompt("Summarise the agenda")
                .maxTokens(256)
                .build());

    assertThat(response.content()).isEqualTo("Three agenda items concern housing.");
    assertThat(response.promptTokens()).isEqualTo(21);
    assertThat(response.completionTokens()).isEqualTo(7);
    assertThat(response.hasUsage()).isTrue();
    server.verify();
  }

  @Test
  void serverErrorSurfacesAsTransientFailure() {
    server
        .expect(requestTo("https://api.z.ai/api/paas/v4/chat/completions"))
        .andRespond(withServerError());

    Throwable thrown = catchThrowable(() -> client.complete(provider, InvocationRequest.of("completion", "hi")));

    assertThat(thrown).isNotNull();
    assertThat(ProviderFailureClassifier.classify("zai", thrown).kind())
        .isEqualTo(ProviderCallException.Kind.TRANSIENT);
  }

  @Test
  void badRequestSurfacesAsRejection() {
    server
        .expect(requestTo("https://api.z.ai/api/paas/v4/chat/completions"))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST));

    Throwable thrown = catchThrowable(() -> client.complete(provider, InvocationRequest.of("completion", "hi")));

    assertThat(ProviderFailureClassifier.classify("zai", thrown).kind())
        .isEqualTo(ProviderCallException.Kind.REJECTED);
  }

  @Test
  void requestOverridesProviderDefaults() {
    providerProperties.setMaxTokens(1024);

    OpenAiChatOptions options =
        client.buildOptions(
            provider,
            InvocationRequest.builder().prompt("x").temperature(0.7).jsonResponse(true).build());

    assertThat(options.getModel()).isEqualTo("glm-4.6");
    assertThat(options.getTemperature()).isEqualTo(0.7);
    assertThat(options.getMaxTokens()).isEqualTo(1024);
    assertThat(options.getResponseFormat().getType()).isEqualTo(ResponseFormat.Type.JSON_OBJECT);
  }

  @Test
  void requiresApiKeyAndCompatibleType() {
    GatewayProperties.Provider missingKey = new GatewayProperties.Provider();
    missingKey.setType(ProviderType.OPENAI_COMPATIBLE);
    missingKey.setModel("gpt-4o-mini");

    assertThatThrownBy(() -> new OpenAiCompletionClient("openai", missingKey))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("openai");

    GatewayProperties.Provider search = new GatewayProperties.Provider();
    search.setType(ProviderType.ZAI_SEARCH);
    search.setApiKey("key");

    assertThatThrownBy(() -> new OpenAiCompletionClient("zai-search", search))
        .isInstanceOf(IllegalStateException.class);
  }
}
