package com.affordabot.backend.gateway.provider.model;

public enum CostUnit {
  /** Input and output tokens are billed separately per thousand tokens. */
  PER_1K_TOKENS,
  /** Every call (a completion or a search query) is billed at a flat rate. */
  PER_REQUEST
}
