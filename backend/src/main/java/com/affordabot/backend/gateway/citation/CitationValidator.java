package com.affordabot.backend.gateway.citation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags double-quoted spans in an analysis that do not appear verbatim in the source text. The
 * check is exact-match and advisory: it returns warnings and never throws.
 */
public class CitationValidator {

  static final int MIN_QUOTE_LENGTH = 20;
  static final int PREVIEW_LENGTH = 50;

  private static final Pattern QUOTED_SPAN = Pattern.compile("\"([^\"]+)\"");

  public List<String> validate(String analysisText, String sourceText) {
    String analysis = analysisText != null ? analysisText : "";
    String source = sourceText != null ? sourceText : "";
    List<String> warnings = new ArrayList<>();
    Matcher matcher = QUOTED_SPAN.matcher(analysis);
    while (matcher.find()) {
      String quote = matcher.group(1);
      if (quote.length() > MIN_QUOTE_LENGTH && !source.contains(quote)) {
        warnings.add("Quote not found in source: \"" + preview(quote) + "...\"");
      }
    }
    return warnings;
  }

  private static String preview(String quote) {
    return quote.length() > PREVIEW_LENGTH ? quote.substring(0, PREVIEW_LENGTH) : quote;
  }
}
