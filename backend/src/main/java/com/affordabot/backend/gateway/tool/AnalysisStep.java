package com.affordabot.backend.gateway.tool;

import com.affordabot.backend.gateway.citation.CitationValidator;
import com.affordabot.backend.gateway.invocation.InvocationRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completion followed by a citation check against the source it was asked to analyse. Warnings are
 * attached as {@code citationWarnings} metadata; they never turn a success into a failure.
 */
public class AnalysisStep {

  private static final Logger log = LoggerFactory.getLogger(AnalysisStep.class);

  private final CompletionTool completionTool;
  private final CitationValidator citationValidator;

  public AnalysisStep(CompletionTool completionTool, CitationValidator citationValidator) {
    this.completionTool = completionTool;
    this.citationValidator = citationValidator;
  }

  public ToolResult analyze(InvocationRequest request, String sourceText) {
    ToolResult result = completionTool.execute(request);
    if (!result.success()) {
      return result;
    }
    List<String> warnings = citationValidator.validate(result.content(), sourceText);
    if (warnings.isEmpty()) {
      return result;
    }
    log.warn("Analysis step {} produced {} unsupported quote(s)", request.step(), warnings.size());
    return result.withMetadata("citationWarnings", warnings);
  }
}
