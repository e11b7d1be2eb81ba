package com.affordabot.backend.gateway.provider.model;

import java.util.Locale;
import org.springframework.util.StringUtils;

/** Well-known capability tags. Providers may declare any additional tag in configuration. */
public final class Capabilities {

  public static final String COMPLETION = "completion";
  public static final String STRUCTURED = "structured";
  public static final String EMBEDDING = "embedding";
  public static final String SEARCH = "search";

  private Capabilities() {}

  public static String normalize(String capability) {
    if (!StringUtils.hasText(capability)) {
      throw new IllegalArgumentException("capability must not be blank");
    }
    return capability.trim().toLowerCase(Locale.ROOT);
  }

  public static String defaultFor(ProviderFamily family) {
    return switch (family) {
      case CHAT_COMPLETION -> COMPLETION;
      case EMBEDDING -> EMBEDDING;
      case WEB_SEARCH -> SEARCH;
    };
  }
}
