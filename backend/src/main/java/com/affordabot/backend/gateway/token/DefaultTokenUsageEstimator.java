package com.affordabot.backend.gateway.token;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Counts tokens with jtokkit. Models unknown to jtokkit (OpenRouter slugs, GLM models) fall back to
 * the default encoding, which is close enough for budget estimates.
 */
public class DefaultTokenUsageEstimator implements TokenUsageEstimator {

  private static final Logger log = LoggerFactory.getLogger(DefaultTokenUsageEstimator.class);

  private final EncodingRegistry encodingRegistry;
  private final Encoding defaultEncoding;
  private final Map<String, Encoding> encodingsByModel = new ConcurrentHashMap<>();

  public DefaultTokenUsageEstimator(EncodingRegistry encodingRegistry) {
    this(encodingRegistry, EncodingType.CL100K_BASE);
  }

  public DefaultTokenUsageEstimator(EncodingRegistry encodingRegistry, EncodingType defaultEncoding) {
    this.encodingRegistry = encodingRegistry;
    this.defaultEncoding = encodingRegistry.getEncoding(defaultEncoding);
  }

  @Override
  public Estimate estimate(EstimateRequest request) {
    if (request == null) {
      return new Estimate(0, 0);
    }
    Encoding encoding = resolveEncoding(request.model());
    int promptTokens = count(encoding, request.prompt());
    int completionTokens = count(encoding, request.completion());
    if (log.isDebugEnabled()) {
      log.debug(
          "Estimated tokens for provider='{}', model='{}', encoding='{}': prompt={}, completion={}",
          request.providerId(),
          request.model(),
          encoding.getName(),
          promptTokens,
          completionTokens);
    }
    return new Estimate(promptTokens, completionTokens);
  }

  private int count(Encoding encoding, String text) {
    if (!StringUtils.hasText(text)) {
      return 0;
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to strict token counting due to {}", ordinaryFailure.getMessage());
      return encoding.countTokens(text);
    }
  }

  private Encoding resolveEncoding(String model) {
    if (!StringUtils.hasText(model)) {
      return defaultEncoding;
    }
    return encodingsByModel.computeIfAbsent(
        model.trim(),
        key -> {
          // "openai/gpt-4o-mini" style slugs carry the vendor prefix
          String bareModel = key.contains("/") ? key.substring(key.lastIndexOf('/') + 1) : key;
          return encodingRegistry.getEncodingForModel(bareModel).orElse(defaultEncoding);
        });
  }
}
