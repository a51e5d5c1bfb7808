package com.example.udahub.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

@Component
public class RoutingMetrics {

    private final DoubleHistogram stageDuration;
    private final LongCounter transitionCount;
    private final LongCounter outcomeCount;
    private final DoubleHistogram retrievalConfidence;
    private final LongCounter stageRetryCount;
    private final LongCounter runFailureCount;
    private final LongCounter toolCallCount;

    public RoutingMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter("udahub-ticket-routing");

        this.stageDuration = meter.histogramBuilder("udahub.stage.duration")
            .setUnit("s")
            .setDescription("Duration of a single stage execution")
            .build();

        this.transitionCount = meter.counterBuilder("udahub.routing.transitions")
            .setDescription("Router decisions, by source signal and destination")
            .build();

        this.outcomeCount = meter.counterBuilder("udahub.ticket.outcomes")
            .setDescription("Tickets that reached a terminal status")
            .build();

        this.retrievalConfidence = meter.histogramBuilder("udahub.retrieval.confidence")
            .setDescription("Knowledge retrieval confidence as scored by the reasoning engine")
            .build();

        this.stageRetryCount = meter.counterBuilder("udahub.stage.retries")
            .setDescription("Stage re-runs after a collaborator failure")
            .build();

        this.runFailureCount = meter.counterBuilder("udahub.routing.failures")
            .setDescription("Routing runs that ended in a fatal error")
            .build();

        this.toolCallCount = meter.counterBuilder("udahub.tool_calls")
            .setDescription("Account tool calls made by the reasoning engine")
            .build();
    }

    public void recordStage(String stage, double seconds, boolean success) {
        stageDuration.record(seconds, Attributes.of(
            AttributeKey.stringKey("udahub.stage"), stage,
            AttributeKey.booleanKey("udahub.success"), success
        ));
    }

    public void recordTransition(String signal, String destination) {
        transitionCount.add(1, Attributes.of(
            AttributeKey.stringKey("udahub.signal"), signal,
            AttributeKey.stringKey("udahub.destination"), destination
        ));
    }

    public void recordOutcome(String status, int stagesRun) {
        outcomeCount.add(1, Attributes.of(
            AttributeKey.stringKey("udahub.status"), status,
            AttributeKey.longKey("udahub.stages_run"), (long) stagesRun
        ));
    }

    public void recordRetrievalConfidence(double confidence, String urgency) {
        retrievalConfidence.record(confidence, Attributes.of(
            AttributeKey.stringKey("udahub.urgency"), urgency
        ));
    }

    public void recordStageRetry(String stage, String collaborator) {
        stageRetryCount.add(1, Attributes.of(
            AttributeKey.stringKey("udahub.stage"), stage,
            AttributeKey.stringKey("udahub.collaborator"), collaborator
        ));
    }

    public void recordRunFailure(String errorType) {
        runFailureCount.add(1, Attributes.of(
            AttributeKey.stringKey("error.type"), errorType
        ));
    }

    public void recordToolCall(String toolName, boolean success) {
        toolCallCount.add(1, Attributes.of(
            AttributeKey.stringKey("udahub.tool_name"), toolName,
            AttributeKey.booleanKey("udahub.tool_success"), success
        ));
    }
}
