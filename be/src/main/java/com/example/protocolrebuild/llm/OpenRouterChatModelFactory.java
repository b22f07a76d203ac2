package com.example.protocolrebuild.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a {@link ChatModel} for OpenRouter (OpenAI-compatible API).
 * API key is read from config/env only; startup fails if key is missing.
 * Client-side retries are turned off: the regeneration orchestrator owns retry and backoff.
 */
@Component
public class OpenRouterChatModelFactory {

    private static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    private static final String DEFAULT_MODEL = "openai/gpt-4o-mini";

    private final String apiKey;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final Double defaultTemperature;
    private final Integer defaultMaxTokens;
    private final Duration timeout;

    public OpenRouterChatModelFactory(
            @Value("${openrouter.api-key:}") String apiKey,
            @Value("${openrouter.base-url:https://openrouter.ai/api/v1}") String defaultBaseUrl,
            @Value("${openrouter.model:openai/gpt-4o-mini}") String defaultModel,
            @Value("${openrouter.temperature:0.2}") Double defaultTemperature,
            @Value("${openrouter.max-tokens:8000}") Integer defaultMaxTokens,
            @Value("${openrouter.timeout:120s}") Duration timeout) {
        String key = apiKey != null ? apiKey.trim() : "";
        if (key.isEmpty()) {
            throw new IllegalStateException(
                    "OpenRouter API key is required. Set OPENROUTER_API_KEY in the environment or openrouter.api-key in configuration.");
        }
        this.apiKey = key;
        this.defaultBaseUrl = defaultBaseUrl != null && !defaultBaseUrl.isBlank() ? defaultBaseUrl.trim() : DEFAULT_BASE_URL;
        this.defaultModel = defaultModel != null && !defaultModel.isBlank() ? defaultModel.trim() : DEFAULT_MODEL;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(120);
    }

    /**
     * Builds a ChatModel with the configured defaults.
     */
    public ChatModel build() {
        return build(null, null, null, null);
    }

    /**
     * Builds a ChatModel using the given base URL and model name.
     * If either is null or blank, the configured default is used.
     */
    public ChatModel build(String baseUrl, String modelName) {
        return build(baseUrl, modelName, null, null);
    }

    /**
     * Same as {@link #build(String, String)}; a null temperature or token budget falls back to configuration.
     */
    public ChatModel build(String baseUrl, String modelName, Double temperature, Integer maxTokens) {
        String url = (baseUrl != null && !baseUrl.isBlank()) ? baseUrl.trim() : defaultBaseUrl;
        String model = (modelName != null && !modelName.isBlank()) ? modelName.trim() : defaultModel;
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(url)
                .modelName(model)
                .temperature(temperature != null ? temperature : defaultTemperature)
                .maxTokens(maxTokens != null ? maxTokens : defaultMaxTokens)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }
}
