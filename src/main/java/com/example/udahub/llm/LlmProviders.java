package com.example.udahub.llm;

import java.util.Map;

import org.springframework.ai.chat.model.ChatModel;

final class LlmProviders {

    static final Map<String, String> PROVIDER_SERVERS = Map.of(
        "openai", "api.openai.com",
        "anthropic", "api.anthropic.com"
    );

    private LlmProviders() {}

    static ChatModel resolveChatModel(String provider, Map<String, ChatModel> chatModels) {
        // Spring AI registers its models as "openAiChatModel", "anthropicChatModel"
        return switch (provider) {
            case "openai" -> findBean(chatModels, "openAiChatModel");
            case "anthropic" -> findBean(chatModels, "anthropicChatModel");
            default -> throw new IllegalArgumentException("Unknown LLM provider: " + provider);
        };
    }

    private static ChatModel findBean(Map<String, ChatModel> chatModels, String name) {
        var model = chatModels.get(name);
        if (model == null) {
            throw new IllegalStateException(
                "ChatModel bean '" + name + "' not found. Available: " + chatModels.keySet());
        }
        return model;
    }
}
