package com.affordabot.backend.gateway.invocation;

import com.affordabot.backend.gateway.provider.model.Capabilities;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.util.StringUtils;

/**
 * A provider-agnostic completion request.
 *
 * @param budgetCeiling upper bound on what this single request may spend, {@code null} for no
 *     per-request bound
 * @param timeout per-attempt timeout override, {@code null} to use the provider or gateway default
 * @param step optional label attributed to the cost ledger entry
 */
public record InvocationRequest(
    String capability,
    String systemPrompt,
    String prompt,
    Integer maxTokens,
    Double temperature,
    boolean jsonResponse,
    BigDecimal budgetCeiling,
    Duration timeout,
    String step) {

  public InvocationRequest {
    capability = StringUtils.hasText(capability) ? Capabilities.normalize(capability) : Capabilities.COMPLETION;
    if (!StringUtils.hasText(prompt)) {
      throw new IllegalArgumentException("prompt must not be blank");
    }
    if (maxTokens != null && maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
    if (budgetCeiling != null && budgetCeiling.signum() < 0) {
      throw new IllegalArgumentException("budgetCeiling must not be negative");
    }
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static InvocationRequest of(String capability, String prompt) {
    return builder().capability(capability).prompt(prompt).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String capability;
    private String systemPrompt;
    private String prompt;
    private Integer maxTokens;
    private Double temperature;
    private boolean jsonResponse;
    private BigDecimal budgetCeiling;
    private Duration timeout;
    private String step;

    private Builder() {}

    public Builder capability(String capability) {
      this.capability = capability;
      return this;
    }

    public Builder systemPrompt(String systemPrompt) {
      this.systemPrompt = systemPrompt;
      return this;
    }

    public Builder prompt(String prompt) {
      this.prompt = prompt;
      return this;
    }

    public Builder maxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
      return this;
    }

    public Builder temperature(Double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder jsonResponse(boolean jsonResponse) {
      this.jsonResponse = jsonResponse;
      return this;
    }

    public Builder budgetCeiling(BigDecimal budgetCeiling) {
      this.budgetCeiling = budgetCeiling;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder step(String step) {
      this.step = step;
      return this;
    }

    public InvocationRequest build() {
      return new InvocationRequest(
          capability, systemPrompt, prompt, maxTokens, temperature, jsonResponse, budgetCeiling, timeout, step);
    }
  }
}
