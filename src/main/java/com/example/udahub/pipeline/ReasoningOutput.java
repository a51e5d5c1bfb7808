package com.example.udahub.pipeline;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.udahub.llm.LlmResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Strict view over the JSON object a stage asked the reasoning engine for. Anything missing,
 * mistyped or out of range is a {@link MalformedReasoningOutputException}.
 */
final class ReasoningOutput {

    private static final Logger log = LoggerFactory.getLogger(ReasoningOutput.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final String stage;
    private final JsonNode root;

    private ReasoningOutput(String stage, JsonNode root) {
        this.stage = stage;
        this.root = root;
    }

    static ReasoningOutput parse(String stage, LlmResponse response) {
        if (response == null || response.content() == null || response.content().isBlank()) {
            throw new MalformedReasoningOutputException(stage, "empty response");
        }
        String content = response.content().strip();
        if (content.startsWith("```")) {
            content = content.replaceAll("```(?:json)?\\s*", "").replaceAll("```\\s*$", "").strip();
        }
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse {} response: {}", stage, e.getOriginalMessage());
            throw new MalformedReasoningOutputException(stage, "not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedReasoningOutputException(stage, "expected a JSON object");
        }
        log.debug("Parsed {} output: {}", stage, root);
        return new ReasoningOutput(stage, root);
    }

    String text(String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new MalformedReasoningOutputException(stage, "missing text field '" + field + "'");
        }
        return node.asText().strip();
    }

    String optionalText(String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText().strip() : "";
    }

    String choice(String field) {
        return text(field).toLowerCase(Locale.ROOT);
    }

    double unitInterval(String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isNumber()) {
            throw new MalformedReasoningOutputException(stage, "missing number field '" + field + "'");
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MalformedReasoningOutputException(stage, field + " out of range [0,1]: " + value);
        }
        return value;
    }

    int nonNegativeInt(String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new MalformedReasoningOutputException(stage, "missing integer field '" + field + "'");
        }
        int value = node.asInt();
        if (value < 0) {
            throw new MalformedReasoningOutputException(stage, field + " must not be negative: " + value);
        }
        return value;
    }

    JsonNode array(String field) {
        JsonNode node = root.get(field);
        return node != null && node.isArray() ? node : mapper.createArrayNode();
    }

    MalformedReasoningOutputException invalid(String field, String value) {
        return new MalformedReasoningOutputException(stage, "unexpected " + field + " '" + value + "'");
    }
}
