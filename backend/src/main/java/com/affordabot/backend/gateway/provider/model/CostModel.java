package com.affordabot.backend.gateway.provider.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.util.StringUtils;

/**
 * Per-unit cost function of a provider. Amounts are kept at a fixed scale so that ledger totals
 * are exact sums of the recorded entries.
 */
public record CostModel(
    CostUnit unit,
    BigDecimal inputPer1KTokens,
    BigDecimal outputPer1KTokens,
    BigDecimal perRequest,
    String currency) {

  public static final int COST_SCALE = 8;
  private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1_000);

  public CostModel {
    unit = unit != null ? unit : CostUnit.PER_1K_TOKENS;
    inputPer1KTokens = requireNonNegative(inputPer1KTokens, "inputPer1KTokens");
    outputPer1KTokens = requireNonNegative(outputPer1KTokens, "outputPer1KTokens");
    perRequest = requireNonNegative(perRequest, "perRequest");
    currency = StringUtils.hasText(currency) ? currency.trim() : "USD";
  }

  public static CostModel free() {
    return new CostModel(CostUnit.PER_REQUEST, null, null, null, null);
  }

  public static CostModel per1KTokens(BigDecimal inputRate, BigDecimal outputRate) {
    return new CostModel(CostUnit.PER_1K_TOKENS, inputRate, outputRate, null, null);
  }

  public static CostModel perRequest(BigDecimal amount) {
    return new CostModel(CostUnit.PER_REQUEST, null, null, amount, null);
  }

  /** Price of a call that consumed the given number of prompt and completion tokens. */
  public BigDecimal price(int promptTokens, int completionTokens) {
    if (unit == CostUnit.PER_REQUEST) {
      return scale(perRequest);
    }
    BigDecimal inputCost = tokenCost(promptTokens, inputPer1KTokens);
    BigDecimal outputCost = tokenCost(completionTokens, outputPer1KTokens);
    return scale(inputCost.add(outputCost));
  }

  private static BigDecimal tokenCost(int tokens, BigDecimal ratePer1KTokens) {
    if (tokens <= 0 || ratePer1KTokens.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return ratePer1KTokens
        .multiply(BigDecimal.valueOf(tokens))
        .divide(ONE_THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
  }

  private static BigDecimal scale(BigDecimal amount) {
    return amount.setScale(COST_SCALE, RoundingMode.HALF_UP);
  }

  private static BigDecimal requireNonNegative(BigDecimal value, String name) {
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (value.signum() < 0) {
      throw new IllegalArgumentException(name + " must not be negative");
    }
    return value;
  }
}
