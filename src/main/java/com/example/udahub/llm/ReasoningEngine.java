package com.example.udahub.llm;

/**
 * Generative reasoning used by the stages. Implementations either answer or throw
 * {@link ReasoningUnavailableException}; they never return a partial response.
 */
public interface ReasoningEngine {

    LlmResponse infer(ReasoningRequest request);
}
