package com.affordabot.backend.gateway.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolResultTest {

  @Test
  void successCarriesContentAndNoError() {
    ToolResult result = ToolResult.ok("summary", List.of(Map.of("url", "https://example.gov")));

    assertThat(result.success()).isTrue();
    assertThat(result.content()).isEqualTo("summary");
    assertThat(result.errorMessage()).isNull();
    assertThat(result.artifacts()).hasSize(1);
    assertThat(result.metadata()).isEmpty();
  }

  @Test
  void failureCarriesErrorAndEmptyContent() {
    ToolResult result = ToolResult.fail("all providers failed", Map.of("failureKind", "ALL_PROVIDERS_FAILED"));

    assertThat(result.success()).isFalse();
    assertThat(result.content()).isEmpty();
    assertThat(result.errorMessage()).isEqualTo("all providers failed");
    assertThat(result.artifacts()).isEmpty();
    assertThat(result.metadata()).containsEntry("failureKind", "ALL_PROVIDERS_FAILED");
  }

  @Test
  void failureNeedsAMessageAndSuccessNeedsContent() {
    assertThatThrownBy(() -> ToolResult.fail(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ToolResult.ok(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void inputsAreCopiedAndNullMetadataValuesKept() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("promptTokens", null);
    metadata.put("provider", "zai");

    ToolResult result = ToolResult.ok("x", List.of(), metadata);
    metadata.put("provider", "openai");

    assertThat(result.metadata()).containsEntry("provider", "zai").containsEntry("promptTokens", null);
    assertThatThrownBy(() -> result.metadata().put("cost", 1)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void withMetadataReturnsEnrichedCopy() {
    ToolResult original = ToolResult.ok("x", List.of(), Map.of("provider", "zai"));

    ToolResult enriched = original.withMetadata("citationWarnings", List.of("w"));

    assertThat(enriched.metadata()).containsKeys("provider", "citationWarnings");
    assertThat(original.metadata()).doesNotContainKey("citationWarnings");
  }
}
