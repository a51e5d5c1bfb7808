package com.example.udahub.llm;

import java.util.List;

import org.springframework.ai.tool.ToolCallback;

public record ReasoningRequest(
    String stage,
    String systemPrompt,
    String userPrompt,
    ModelTier tier,
    List<ToolCallback> toolCallbacks
) {

    public enum ModelTier { FAST, CAPABLE }

    public ReasoningRequest {
        toolCallbacks = toolCallbacks == null ? List.of() : List.copyOf(toolCallbacks);
    }

    public static ReasoningRequest fast(String stage, String systemPrompt, String userPrompt) {
        return new ReasoningRequest(stage, systemPrompt, userPrompt, ModelTier.FAST, List.of());
    }

    public static ReasoningRequest capable(String stage, String systemPrompt, String userPrompt) {
        return new ReasoningRequest(stage, systemPrompt, userPrompt, ModelTier.CAPABLE, List.of());
    }

    public ReasoningRequest withTools(List<ToolCallback> callbacks) {
        return new ReasoningRequest(stage, systemPrompt, userPrompt, tier, callbacks);
    }
}
