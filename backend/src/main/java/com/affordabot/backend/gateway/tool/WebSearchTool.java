package com.affordabot.backend.gateway.tool;

import com.affordabot.backend.gateway.invocation.GatewayException;
import com.affordabot.backend.gateway.search.SearchClient;
import com.affordabot.backend.gateway.search.SearchHit;
import com.affordabot.backend.gateway.search.SearchQuery;
import com.affordabot.backend.gateway.search.SearchResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

public class WebSearchTool {

  private final SearchClient searchClient;

  public WebSearchTool(SearchClient searchClient) {
    this.searchClient = searchClient;
  }

  public ToolResult execute(SearchQuery query) {
    SearchResult result;
    try {
      result = searchClient.search(query);
    } catch (GatewayException exception) {
      return ToolFailures.fromGatewayException(exception);
    }

    List<Map<String, Object>> artifacts = new ArrayList<>();
    StringBuilder digest = new StringBuilder();
    int position = 1;
    for (SearchHit hit : result.hits()) {
      Map<String, Object> artifact = new LinkedHashMap<>();
      artifact.put("title", hit.title());
      artifact.put("url", hit.url());
      artifact.put("snippet", hit.snippet());
      artifacts.add(artifact);

      digest.append(position++).append(". ").append(hit.title());
      if (StringUtils.hasText(hit.url())) {
        digest.append(" (").append(hit.url()).append(')');
      }
      if (StringUtils.hasText(hit.snippet())) {
        digest.append('\n').append("   ").append(hit.snippet());
      }
      digest.append('\n');
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("provider", result.providerId());
    metadata.put("cacheHit", result.cacheHit());
    metadata.put("cost", result.cost());
    metadata.put("count", result.hits().size());
    return ToolResult.ok(digest.toString().trim(), artifacts, metadata);
  }
}
