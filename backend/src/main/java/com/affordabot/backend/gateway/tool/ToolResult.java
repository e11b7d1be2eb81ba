package com.affordabot.backend.gateway.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Uniform envelope returned by gateway tools. Only {@link #ok} and {@link #fail} create instances:
 * a success never carries an error message and a failure never carries content.
 *
 * <p>Check {@link #success()} before reading {@link #content()}; a failure reports empty content.
 */
public final class ToolResult {

  private final boolean success;
  private final String content;
  private final List<Map<String, Object>> artifacts;
  private final String errorMessage;
  private final Map<String, Object> metadata;

  private ToolResult(
      boolean success,
      String content,
      List<Map<String, Object>> artifacts,
      String errorMessage,
      Map<String, Object> metadata) {
    this.success = success;
    this.content = content;
    this.artifacts = artifacts;
    this.errorMessage = errorMessage;
    this.metadata = metadata;
  }

  public static ToolResult ok(String content) {
    return ok(content, List.of(), Map.of());
  }

  public static ToolResult ok(String content, List<Map<String, Object>> artifacts) {
    return ok(content, artifacts, Map.of());
  }

  public static ToolResult ok(
      String content, List<Map<String, Object>> artifacts, Map<String, Object> metadata) {
    Objects.requireNonNull(content, "content must not be null for a successful result");
    return new ToolResult(true, content, copyArtifacts(artifacts), null, copyMap(metadata));
  }

  public static ToolResult fail(String errorMessage) {
    return fail(errorMessage, Map.of());
  }

  public static ToolResult fail(String errorMessage, Map<String, Object> metadata) {
    if (!StringUtils.hasText(errorMessage)) {
      throw new IllegalArgumentException("errorMessage must not be blank for a failed result");
    }
    return new ToolResult(false, "", List.of(), errorMessage, copyMap(metadata));
  }

  public boolean success() {
    return success;
  }

  public String content() {
    return content;
  }

  public List<Map<String, Object>> artifacts() {
    return artifacts;
  }

  /** {@code null} for successful results. */
  public String errorMessage() {
    return errorMessage;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  /** Copy of this result with one more metadata entry. */
  public ToolResult withMetadata(String key, Object value) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.put(key, value);
    return new ToolResult(success, content, artifacts, errorMessage, Collections.unmodifiableMap(merged));
  }

  private static List<Map<String, Object>> copyArtifacts(List<Map<String, Object>> artifacts) {
    if (artifacts == null || artifacts.isEmpty()) {
      return List.of();
    }
    return artifacts.stream().map(ToolResult::copyMap).toList();
  }

  // metadata values may be null
  private static Map<String, Object> copyMap(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  @Override
  public String toString() {
    return success
        ? "ToolResult[success, artifacts=" + artifacts.size() + ", metadata=" + metadata.keySet() + "]"
        : "ToolResult[failure, error=" + errorMessage + "]";
  }
}
