package com.affordabot.backend.gateway.token;

import org.springframework.util.StringUtils;

public interface TokenUsageEstimator {

  Estimate estimate(EstimateRequest request);

  record EstimateRequest(String providerId, String model, String prompt, String completion) {

    public EstimateRequest {
      prompt = StringUtils.hasText(prompt) ? prompt : null;
      completion = StringUtils.hasText(completion) ? completion : null;
    }

    public static EstimateRequest promptOnly(String providerId, String model, String prompt) {
      return new EstimateRequest(providerId, model, prompt, null);
    }
  }

  record Estimate(int promptTokens, int completionTokens) {

    public int totalTokens() {
      return promptTokens + completionTokens;
    }

    public boolean hasUsage() {
      return totalTokens() > 0;
    }
  }
}
