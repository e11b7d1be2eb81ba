package com.affordabot.backend.gateway.provider.model;

public enum ProviderFamily {
  CHAT_COMPLETION,
  EMBEDDING,
  WEB_SEARCH
}
