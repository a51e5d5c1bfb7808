package com.example.udahub.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.example.udahub.config.LlmProperties;

/**
 * Calls the primary provider once and, when that fails, the fallback provider once. Retrying
 * a failed stage is the orchestrator's job, so nothing here sleeps.
 */
@Service
public class LlmService implements ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatModel primaryModel;
    private final ChatModel fallbackModel;
    private final LlmProperties config;
    private final Tracer tracer;
    private final DoubleHistogram tokenUsage;
    private final DoubleHistogram operationDuration;
    private final LongCounter fallbackCounter;
    private final LongCounter errorCounter;

    @Autowired
    public LlmService(Map<String, ChatModel> chatModels, LlmProperties config) {
        this(LlmProviders.resolveChatModel(config.provider(), chatModels),
            LlmProviders.resolveChatModel(config.fallbackProvider(), chatModels),
            config);
    }

    LlmService(ChatModel primaryModel, ChatModel fallbackModel, LlmProperties config) {
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
        this.config = config;
        log.info("Primary LLM: {} (capable={}, fast={}), Fallback: {} (model={})",
            config.provider(), config.modelCapable(), config.modelFast(),
            config.fallbackProvider(), config.fallbackModel());

        this.tracer = GlobalOpenTelemetry.getTracer("udahub-ticket-routing");
        Meter meter = GlobalOpenTelemetry.getMeter("udahub-ticket-routing");

        this.tokenUsage = meter.histogramBuilder("gen_ai.client.token.usage")
            .setUnit("{token}").build();
        this.operationDuration = meter.histogramBuilder("gen_ai.client.operation.duration")
            .setUnit("s").build();
        this.fallbackCounter = meter.counterBuilder("gen_ai.client.fallback.count")
            .build();
        this.errorCounter = meter.counterBuilder("gen_ai.client.error.count")
            .build();
    }

    @Override
    public LlmResponse infer(ReasoningRequest request) {
        String model = request.tier() == ReasoningRequest.ModelTier.FAST
            ? config.modelFast() : config.modelCapable();
        try {
            return generateOnce(primaryModel, config.provider(), model, request);
        } catch (RuntimeException primaryError) {
            log.warn("Primary provider {} failed for stage {} ({}), falling back to {}",
                config.provider(), request.stage(), classifyError(primaryError), config.fallbackProvider());
            fallbackCounter.add(1);
            try {
                return generateOnce(fallbackModel, config.fallbackProvider(), config.fallbackModel(), request);
            } catch (RuntimeException fallbackError) {
                fallbackError.addSuppressed(primaryError);
                String errorType = classifyError(fallbackError);
                log.error("All LLM providers failed for stage {}: {}", request.stage(), errorType);
                throw new ReasoningUnavailableException(
                    "Reasoning engine unavailable for stage " + request.stage() + " (" + errorType + ")",
                    errorType, fallbackError);
            }
        }
    }

    private LlmResponse generateOnce(ChatModel chatModel, String providerName, String model,
                                     ReasoningRequest request) {
        long start = System.nanoTime();

        Span span = tracer.spanBuilder("gen_ai.chat " + model)
            .setAttribute("gen_ai.operation.name", "chat")
            .setAttribute("gen_ai.provider.name", providerName)
            .setAttribute("gen_ai.request.model", model)
            .setAttribute("server.address", LlmProviders.PROVIDER_SERVERS.getOrDefault(providerName, "unknown"))
            .setAttribute("gen_ai.request.temperature", config.temperature())
            .setAttribute("gen_ai.request.max_tokens", (long) config.maxTokens())
            .startSpan();

        if (request.stage() != null && !request.stage().isEmpty()) {
            span.setAttribute("udahub.stage", request.stage());
        }

        try (Scope ignored = span.makeCurrent()) {
            ChatResponse response = chatModel.call(buildPrompt(request, model));
            if (response == null || response.getResult() == null) {
                throw new IllegalStateException("empty response from " + providerName);
            }

            var generation = response.getResult();
            var usage = response.getMetadata().getUsage();

            String content = generation.getOutput().getText();
            int inputTokens = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            int outputTokens = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            String responseModel = response.getMetadata().getModel() != null
                && !response.getMetadata().getModel().isEmpty()
                ? response.getMetadata().getModel() : model;
            String finishReason = generation.getMetadata().getFinishReason() != null
                ? generation.getMetadata().getFinishReason() : "";
            double duration = (System.nanoTime() - start) / 1_000_000_000.0;

            span.setAttribute("gen_ai.response.model", responseModel);
            span.setAttribute("gen_ai.usage.input_tokens", (long) inputTokens);
            span.setAttribute("gen_ai.usage.output_tokens", (long) outputTokens);
            if (!finishReason.isEmpty()) {
                span.setAttribute("gen_ai.response.finish_reasons", finishReason);
            }

            var attrs = providerModelAttrs(providerName, responseModel);
            tokenUsage.record(inputTokens, withTokenType(attrs, "input"));
            tokenUsage.record(outputTokens, withTokenType(attrs, "output"));
            operationDuration.record(duration, attrs);

            return new LlmResponse(content, responseModel, providerName,
                inputTokens, outputTokens, finishReason);

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.setAttribute("error.type", classifyError(e));
            errorCounter.add(1, Attributes.of(
                AttributeKey.stringKey("gen_ai.provider.name"), providerName,
                AttributeKey.stringKey("gen_ai.request.model"), model,
                AttributeKey.stringKey("error.type"), classifyError(e)
            ));
            throw e;
        } finally {
            span.end();
        }
    }

    private Prompt buildPrompt(ReasoningRequest request, String model) {
        List<Message> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isEmpty()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        messages.add(new UserMessage(request.userPrompt()));

        if (!request.toolCallbacks().isEmpty()) {
            var options = ToolCallingChatOptions.builder()
                .model(model)
                .temperature(config.temperature())
                .maxTokens(config.maxTokens())
                .toolCallbacks(request.toolCallbacks())
                .build();
            return new Prompt(messages, options);
        }

        var options = ChatOptions.builder()
            .model(model)
            .temperature(config.temperature())
            .maxTokens(config.maxTokens())
            .build();
        return new Prompt(messages, options);
    }

    static String classifyError(Exception e) {
        if (e == null) return "unknown_error";
        String msg = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        if (msg.contains("rate limit") || msg.contains("429")) return "rate_limit";
        if (msg.contains("timeout") || msg.contains("timed out") || msg.contains("deadline")) return "timeout";
        if (msg.contains("401") || msg.contains("403") || msg.contains("auth") || msg.contains("api key")) return "auth_error";
        if (msg.contains("400") || msg.contains("422") || msg.contains("invalid")) return "invalid_request";
        if (msg.contains("500") || msg.contains("502") || msg.contains("503") || msg.contains("server")) return "server_error";
        if (msg.contains("connect") || msg.contains("dns") || msg.contains("network") || msg.contains("reset")) return "network_error";
        return "unknown_error";
    }

    private static Attributes providerModelAttrs(String provider, String model) {
        return Attributes.of(
            AttributeKey.stringKey("gen_ai.operation.name"), "chat",
            AttributeKey.stringKey("gen_ai.provider.name"), provider,
            AttributeKey.stringKey("gen_ai.request.model"), model
        );
    }

    private static Attributes withTokenType(Attributes base, String tokenType) {
        return base.toBuilder()
            .put(AttributeKey.stringKey("gen_ai.token.type"), tokenType)
            .build();
    }
}
