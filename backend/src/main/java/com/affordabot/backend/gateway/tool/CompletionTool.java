package com.affordabot.backend.gateway.tool;

import com.affordabot.backend.gateway.invocation.GatewayException;
import com.affordabot.backend.gateway.invocation.InvocationEngine;
import com.affordabot.backend.gateway.invocation.InvocationOutcome;
import com.affordabot.backend.gateway.invocation.InvocationRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Wraps the invocation engine in a {@link ToolResult} envelope. Gateway failures become failed results. */
public class CompletionTool {

  private final InvocationEngine invocationEngine;

  public CompletionTool(InvocationEngine invocationEngine) {
    this.invocationEngine = invocationEngine;
  }

  public ToolResult execute(InvocationRequest request) {
    InvocationOutcome outcome;
    try {
      outcome = invocationEngine.invoke(request);
    } catch (GatewayException exception) {
      return ToolFailures.fromGatewayException(exception);
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("provider", outcome.providerId());
    metadata.put("model", outcome.provider().model());
    metadata.put("cost", outcome.cost());
    metadata.put("durationMs", outcome.elapsed().toMillis());
    metadata.put("promptTokens", outcome.promptTokens());
    metadata.put("completionTokens", outcome.completionTokens());
    metadata.put("attempts", ToolFailures.describe(outcome.attempts()));
    return ToolResult.ok(outcome.content(), List.of(), metadata);
  }
}
