package com.compareai.services.backend;

import com.compareai.exception.ConfigException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.azure.AzureOpenAiChatModel;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.stereotype.Component;

/**
 * Builds the LangChain4j chat model behind one backend from its settings.
 */
@Component
public class ChatModelFactory {

  /**
   * @throws ConfigException when a setting the provider needs is missing
   */
  public ChatLanguageModel create(BackendKind kind, ProviderProperties.ProviderSettings settings) {
    if (settings == null) {
      throw new ConfigException("Provider configuration not found for kind: " + kind.id());
    }
    if (isBlank(settings.getApiKey())) {
      throw new ConfigException(kind.defaultDisplayName() + " API key is required");
    }
    if (isBlank(settings.getModelName())) {
      throw new ConfigException(kind.defaultDisplayName() + " model name is required");
    }
    return switch (kind) {
      case OPENAI -> {
        var builder = OpenAiChatModel.builder()
            .apiKey(settings.getApiKey())
            .modelName(settings.getModelName())
            .temperature(settings.getTemperature())
            .maxTokens(settings.getMaxTokens())
            .timeout(settings.getTimeout());

        if (!isBlank(settings.getBaseUrl())) {
          builder.baseUrl(settings.getBaseUrl());
        }
        yield builder.build();
      }
      case ANTHROPIC -> {
        var builder = AnthropicChatModel.builder()
            .apiKey(settings.getApiKey())
            .modelName(settings.getModelName())
            .temperature(settings.getTemperature())
            .maxTokens(settings.getMaxTokens())
            .timeout(settings.getTimeout());

        if (!isBlank(settings.getBaseUrl())) {
          builder.baseUrl(settings.getBaseUrl());
        }
        yield builder.build();
      }
      case GEMINI -> GoogleAiGeminiChatModel.builder()
          .apiKey(settings.getApiKey())
          .modelName(settings.getModelName())
          .temperature(settings.getTemperature())
          .maxOutputTokens(settings.getMaxTokens())
          .timeout(settings.getTimeout())
          .build();
      case AZURE_OPENAI -> {
        if (isBlank(settings.getEndpoint())) {
          throw new ConfigException("Azure OpenAI endpoint is required");
        }
        var builder = AzureOpenAiChatModel.builder()
            .endpoint(settings.getEndpoint())
            .apiKey(settings.getApiKey())
            .deploymentName(settings.getModelName())
            .temperature(settings.getTemperature())
            .maxTokens(settings.getMaxTokens())
            .timeout(settings.getTimeout());

        if (!isBlank(settings.getApiVersion())) {
          builder.serviceVersion(settings.getApiVersion());
        }
        yield builder.build();
      }
    };
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
