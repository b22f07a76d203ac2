package com.example.protocolrebuild.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("OpenRouterChatModelFactory")
class OpenRouterChatModelFactoryTest {

    @Test
    @DisplayName("throws when API key is blank")
    void throwsWhenApiKeyBlank() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new OpenRouterChatModelFactory("  ", "https://test", "model", 0.2, 8000, Duration.ofSeconds(5)));
        assertTrue(ex.getMessage().contains("API key"));
    }

    @Test
    @DisplayName("build returns ChatModel when key is set, with or without overrides")
    void buildReturnsChatModel() {
        var factory = new OpenRouterChatModelFactory("test-key", "https://openrouter.ai/api/v1", "openai/gpt-4o-mini",
                0.2, 8000, Duration.ofSeconds(5));
        assertNotNull(factory.build());
        assertNotNull(factory.build("https://other", "other-model"));
        assertNotNull(factory.build(null, " ", 0.0, 2000));
    }

    @Test
    @DisplayName("blank base URL, model and timeout fall back to defaults")
    void defaults() {
        var factory = new OpenRouterChatModelFactory("test-key", "", "", null, null, null);
        assertNotNull(factory.build());
    }
}
