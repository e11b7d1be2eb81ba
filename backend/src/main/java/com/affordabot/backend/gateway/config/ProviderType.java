package com.affordabot.backend.gateway.config;

public enum ProviderType {
  /** Any endpoint speaking the OpenAI chat-completions protocol (OpenRouter, z.ai, OpenAI). */
  OPENAI_COMPATIBLE,
  /** z.ai web-search endpoint. */
  ZAI_SEARCH
}
