package com.example.udahub.llm;

public record LlmResponse(
    String content,
    String model,
    String provider,
    int inputTokens,
    int outputTokens,
    String finishReason
) {

    public static LlmResponse of(String content) {
        return new LlmResponse(content, "unknown", "unknown", 0, 0, "");
    }
}
