package com.example.udahub.llm;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.annotation.Tool;

import com.example.udahub.config.LlmProperties;
import com.example.udahub.failure.CollaboratorKind;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmServiceTest {

    private static final LlmProperties PROPERTIES =
        new LlmProperties("openai", "capable-model", "fast-model", "anthropic", "fallback-model", 512, 0.2);

    private final ChatModel primary = mock(ChatModel.class);
    private final ChatModel fallback = mock(ChatModel.class);
    private final LlmService service = new LlmService(primary, fallback, PROPERTIES);

    public static class EchoTool {
        @Tool(description = "Echo the value back")
        public String echo(String value) {
            return value;
        }
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @ParameterizedTest
    @CsvSource({
        "'rate limit exceeded',               rate_limit",
        "'status 429: too many requests',     rate_limit",
        "'request timed out',                 timeout",
        "'401 unauthorized',                  auth_error",
        "'invalid api key',                   auth_error",
        "'422 unprocessable entity',          invalid_request",
        "'503 service unavailable',           server_error",
        "'connection refused',                network_error",
        "'something unexpected',              unknown_error",
    })
    void classifyErrorCategories(String message, String expected) {
        assertEquals(expected, LlmService.classifyError(new RuntimeException(message)));
    }

    @Test
    void classifyErrorNull() {
        assertEquals("unknown_error", LlmService.classifyError(null));
    }

    @Test
    void fastTierUsesFastModelOnPrimary() {
        when(primary.call(any(Prompt.class))).thenReturn(reply("{\"ok\": true}"));

        LlmResponse response = service.infer(ReasoningRequest.fast("classify", "system", "user"));

        assertEquals("{\"ok\": true}", response.content());
        assertEquals("openai", response.provider());
        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(primary).call(prompt.capture());
        assertEquals("fast-model", prompt.getValue().getOptions().getModel());
        verify(fallback, never()).call(any(Prompt.class));
    }

    @Test
    void fallsBackWhenPrimaryFails() {
        when(primary.call(any(Prompt.class))).thenThrow(new RuntimeException("503 service unavailable"));
        when(fallback.call(any(Prompt.class))).thenReturn(reply("from fallback"));

        LlmResponse response = service.infer(ReasoningRequest.capable("resolve", "system", "user"));

        assertEquals("from fallback", response.content());
        assertEquals("anthropic", response.provider());
        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(fallback).call(prompt.capture());
        assertEquals("fallback-model", prompt.getValue().getOptions().getModel());
    }

    @Test
    void bothProvidersFailingIsReasoningUnavailable() {
        when(primary.call(any(Prompt.class))).thenThrow(new RuntimeException("429 rate limit"));
        when(fallback.call(any(Prompt.class))).thenThrow(new RuntimeException("request timed out"));

        var ex = assertThrows(ReasoningUnavailableException.class,
            () -> service.infer(ReasoningRequest.fast("classify", "system", "user")));

        assertEquals(CollaboratorKind.REASONING_ENGINE, ex.kind());
        assertEquals("timeout", ex.errorType());
        assertEquals(1, ex.getCause().getSuppressed().length);
    }

    @Test
    void toolCallbacksSelectToolCallingOptions() {
        when(primary.call(any(Prompt.class))).thenReturn(reply("done"));
        ToolCallback[] tools = ToolCallbacks.from(new EchoTool());

        service.infer(ReasoningRequest.capable("resolve", "system", "user").withTools(List.of(tools)));

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(primary).call(prompt.capture());
        var options = assertInstanceOf(ToolCallingChatOptions.class, prompt.getValue().getOptions());
        assertEquals(1, options.getToolCallbacks().size());
        assertEquals("capable-model", options.getModel());
    }
}
