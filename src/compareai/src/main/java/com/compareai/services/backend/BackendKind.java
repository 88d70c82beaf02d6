package com.compareai.services.backend;

import com.compareai.exception.ConfigException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** The closed set of provider families a backend can be built from. */
public enum BackendKind {
  OPENAI("openai", "OpenAI GPT", "Direct OpenAI API access"),
  ANTHROPIC("anthropic", "Anthropic Claude", "Anthropic's Claude AI models"),
  GEMINI("gemini", "Google Gemini", "Google AI Gemini models"),
  AZURE_OPENAI("azure-openai", "Azure OpenAI", "Microsoft Azure OpenAI Service with GPT models");

  private final String id;
  private final String defaultDisplayName;
  private final String defaultDescription;

  BackendKind(String id, String defaultDisplayName, String defaultDescription) {
    this.id = id;
    this.defaultDisplayName = defaultDisplayName;
    this.defaultDescription = defaultDescription;
  }

  public String id() {
    return id;
  }

  public String defaultDisplayName() {
    return defaultDisplayName;
  }

  public String defaultDescription() {
    return defaultDescription;
  }

  /** @throws ConfigException for a missing or unknown kind */
  public static BackendKind fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigException("Backend kind is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (BackendKind kind : values()) {
      if (kind.id.equals(normalized)) return kind;
    }
    throw new ConfigException("Unsupported backend kind '%s', expected one of %s".formatted(
        value, Arrays.stream(values()).map(BackendKind::id).collect(Collectors.joining(", "))));
  }
}
