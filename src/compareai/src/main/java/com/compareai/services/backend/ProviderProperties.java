package com.compareai.services.backend;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly-typed configuration of the selectable backends.
 *
 * Expected configuration shape (application.yaml):
 *
 * providers:
 *   system-prompt: "You are a helpful AI assistant..."
 *   providers:
 *     openai:
 *       kind: openai
 *       api-key: ${OPENAI_API_KEY:}
 *       model-name: gpt-4o-mini
 *       display-name: OpenAI GPT
 *       input-price-per-k: 0.00015
 *       output-price-per-k: 0.0006
 *     azure:
 *       kind: azure-openai
 *       api-key: ${AZURE_OPENAI_KEY:}
 *       endpoint: ${AZURE_OPENAI_ENDPOINT:}
 *       api-version: ${AZURE_OPENAI_API_VERSION:}
 *       model-name: ${AZURE_OPENAI_DEPLOYMENT_NAME:}
 *
 * The map key is the backend key used in responses. API keys must not be logged.
 */
@Component
@ConfigurationProperties(prefix = "providers")
public class ProviderProperties {

    /**
     * System prompt sent ahead of the selected context to every backend.
     */
    private String systemPrompt;

    /**
     * Map of backend-key -> settings for that backend, in presentation order.
     */
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers;
    }

    /**
     * Settings for a specific backend.
     */
    public static class ProviderSettings {
        /** Provider family: openai, anthropic, gemini or azure-openai. */
        private String kind;
        /** Disabled backends are not offered at all. */
        private boolean enabled = true;
        /** Provider API key (keep secret). */
        private String apiKey;
        /** Optional base URL if pointing to a gateway or compatible server. */
        private String baseUrl;
        /** Resource endpoint; required for Azure OpenAI. */
        private String endpoint;
        /** Service API version; used by Azure OpenAI. */
        private String apiVersion;
        /** Model name, or deployment name for Azure OpenAI. */
        private String modelName;
        private Double temperature;
        private Integer maxTokens;
        private Duration timeout = Duration.ofSeconds(60);
        private String displayName;
        private String description;
        /** USD per thousand input tokens. */
        private double inputPricePerK;
        /** USD per thousand output tokens. */
        private double outputPricePerK;

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public double getInputPricePerK() {
            return inputPricePerK;
        }

        public void setInputPricePerK(double inputPricePerK) {
            this.inputPricePerK = inputPricePerK;
        }

        public double getOutputPricePerK() {
            return outputPricePerK;
        }

        public void setOutputPricePerK(double outputPricePerK) {
            this.outputPricePerK = outputPricePerK;
        }
    }
}
