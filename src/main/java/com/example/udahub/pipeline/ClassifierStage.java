package com.example.udahub.pipeline;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.udahub.llm.LlmResponse;
import com.example.udahub.llm.ReasoningEngine;
import com.example.udahub.llm.ReasoningRequest;
import com.example.udahub.model.IssueType;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.model.Urgency;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.routing.RoutingSignal;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;

import io.opentelemetry.api.trace.Span;

@Component
public class ClassifierStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(ClassifierStage.class);

    private static final String SYSTEM_PROMPT = """
        You are the ticket classifier for UDA-Hub, the support desk of the CultPass experiences platform.
        Classify the customer's ticket. Do not try to solve it.

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "issue_type": "login|billing|reservation|subscription|account|general",
          "urgency": "high|medium|low",
          "sentiment": "frustrated|negative|neutral|positive",
          "summary": "one sentence describing the problem"
        }

        Issue types:
        - login: problems signing in, password reset, 2FA
        - billing: payment failures, refund requests, invoices
        - reservation: booking, cancellation, waitlist for experiences
        - subscription: plan management, upgrades, downgrades, pausing
        - account: blocked accounts, profile issues, data requests
        - general: anything else

        Urgency:
        - high: blocked accounts, data loss, payment failures
        - medium: functional issues that degrade the experience
        - low: informational or minor questions
        """;

    record Classification(IssueType issueType, Urgency urgency, String sentiment, String summary) {}

    private final ReasoningEngine reasoningEngine;
    private final SessionStore sessionStore;

    public ClassifierStage(ReasoningEngine reasoningEngine, SessionStore sessionStore) {
        this.reasoningEngine = reasoningEngine;
        this.sessionStore = sessionStore;
    }

    @Override
    public StageName name() {
        return StageName.CLASSIFIER;
    }

    @Override
    public StageResult run(TicketSession session, String incomingMessage) {
        String userPrompt = "Ticket " + session.sessionId() + "\n\nConversation so far:\n"
            + session.transcript() + "\nLatest customer message:\n" + incomingMessage;

        LlmResponse response = reasoningEngine.infer(
            ReasoningRequest.fast("classify", SYSTEM_PROMPT, userPrompt));
        Classification result = parseResponse(response);

        Span span = Span.current();
        span.setAttribute("udahub.issue_type", result.issueType().wireName());
        span.setAttribute("udahub.urgency", result.urgency().wireName());
        span.setAttribute("udahub.sentiment", result.sentiment());

        String note = "CLASSIFIED: issue_type=" + result.issueType().wireName()
            + ", urgency=" + result.urgency().wireName()
            + ", sentiment=" + result.sentiment()
            + (result.summary().isEmpty() ? "" : "\n" + result.summary());

        TicketSession updated = sessionStore.commit(session.sessionId(), SessionUpdate.builder()
            .issueType(result.issueType())
            .urgency(result.urgency())
            .sentiment(result.sentiment())
            .message(TicketMessage.internal(StageName.CLASSIFIER, note))
            .lastSignal(SignalType.CLASSIFIED)
            .build());

        log.debug("Classified ticket {}: type={} urgency={} sentiment={}",
            session.sessionId(), result.issueType(), result.urgency(), result.sentiment());
        return new StageResult(updated, new RoutingSignal.Classified(result.issueType(), result.urgency()));
    }

    Classification parseResponse(LlmResponse response) {
        ReasoningOutput output = ReasoningOutput.parse("classify", response);

        String issueType = output.text("issue_type");
        String urgency = output.text("urgency");
        try {
            String sentiment = output.optionalText("sentiment");
            return new Classification(
                IssueType.fromWire(issueType),
                Urgency.fromWire(urgency),
                sentiment.isEmpty() ? "neutral" : sentiment.toLowerCase(Locale.ROOT),
                output.optionalText("summary"));
        } catch (IllegalArgumentException e) {
            throw new MalformedReasoningOutputException("classify",
                "unknown issue_type/urgency '" + issueType + "'/'" + urgency + "'", e);
        }
    }
}
