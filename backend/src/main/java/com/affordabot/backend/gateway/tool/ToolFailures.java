package com.affordabot.backend.gateway.tool;

import com.affordabot.backend.gateway.invocation.AttemptRecord;
import com.affordabot.backend.gateway.invocation.GatewayException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ToolFailures {

  private ToolFailures() {}

  static ToolResult fromGatewayException(GatewayException exception) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("failureKind", exception.kind().name());
    metadata.put("retryableLater", exception.kind().isRetryableLater());
    exception.retryAfter().ifPresent(retryAfter -> metadata.put("retryAfterMs", retryAfter.toMillis()));
    metadata.put("attempts", describe(exception.attempts()));
    return ToolResult.fail(exception.getMessage(), metadata);
  }

  static List<String> describe(List<AttemptRecord> attempts) {
    return attempts.stream().map(AttemptRecord::describe).toList();
  }
}
