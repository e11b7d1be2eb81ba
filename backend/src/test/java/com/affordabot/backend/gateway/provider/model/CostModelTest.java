package com.affordabot.backend.gateway.provider.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CostModelTest {

  @Test
  void pricesInputAndOutputTokensSeparately() {
    CostModel model = CostModel.per1KTokens(new BigDecimal("0.0020"), new BigDecimal("0.0040"));

    assertThat(model.price(12, 18)).isEqualByComparingTo("0.00009600");
    assertThat(model.price(0, 0)).isEqualByComparingTo("0");
    assertThat(model.price(12, 18).scale()).isEqualTo(CostModel.COST_SCALE);
  }

  @Test
  void perRequestPricingIgnoresTokens() {
    CostModel model = CostModel.perRequest(new BigDecimal("0.01"));

    assertThat(model.price(0, 0)).isEqualByComparingTo("0.01");
    assertThat(model.price(10_000, 10_000)).isEqualByComparingTo("0.01");
  }

  @Test
  void freeModelCostsNothing() {
    assertThat(CostModel.free().price(1_000_000, 1_000_000)).isEqualByComparingTo("0");
  }

  @Test
  void rejectsNegativeRates() {
    assertThatThrownBy(() -> CostModel.per1KTokens(new BigDecimal("-0.1"), BigDecimal.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void providerConfigDefaultsCapabilityAndCostModel() {
    ProviderConfig config =
        new ProviderConfig("zai", ProviderFamily.CHAT_COMPLETION, 1, "glm-4.6", null, null, null, null);

    assertThat(config.supports("COMPLETION")).isTrue();
    assertThat(config.supports("search")).isFalse();
    assertThat(config.costModel().price(100, 100)).isEqualByComparingTo("0");
    assertThatThrownBy(
            () ->
                new ProviderConfig(
                    "zai", ProviderFamily.CHAT_COMPLETION, 1, "glm-4.6", null, null, null, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RateLimit.callsPer(0, Duration.ofMinutes(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
