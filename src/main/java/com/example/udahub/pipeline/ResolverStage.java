package com.example.udahub.pipeline;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

import com.example.udahub.llm.LlmResponse;
import com.example.udahub.llm.ReasoningEngine;
import com.example.udahub.llm.ReasoningRequest;
import com.example.udahub.model.CustomerProfile;
import com.example.udahub.model.PreferenceRecord;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.Subscription;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.model.TicketStatus;
import com.example.udahub.repository.CustomerDirectory;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.routing.RoutingSignal.ResolutionOutcome;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;
import com.example.udahub.tools.AccountTools;

import io.opentelemetry.api.trace.Span;

/**
 * Drafts the customer reply from the retrieval note and account data, or hands the ticket to
 * escalation. Works only from what the retriever committed: it holds no knowledge-search handle.
 */
@Component
public class ResolverStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(ResolverStage.class);

    private static final String SYSTEM_PROMPT = """
        You are the resolver for UDA-Hub, the support desk of the CultPass experiences platform.
        Resolve the customer's ticket using the knowledge base material and account context provided.
        You may call the account tools for reservations, experience availability, subscription details,
        or to store preferences the customer mentions (language, contact channel).

        Write in the customer's preferred language when one is known. Never invent policy: only use
        what the knowledge base material says. If the account is blocked, tell the customer.
        If the customer contacted us before about the same issue, acknowledge it.

        Do NOT resolve, and answer with outcome "needs_escalation" instead, when ANY of these apply:
        - a billing dispute, charge reversal or refund request
        - a blocked account that needs manual unblocking
        - the material and account context are not enough to answer
        - the customer asks for a human agent
        - a previous resolution did not work

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "outcome": "resolved|needs_escalation",
          "response": "the reply to the customer (required when resolved)",
          "reason": "why escalation is needed (required when needs_escalation)"
        }
        """;

    record Resolution(boolean resolved, String response, String reason) {}

    private final ReasoningEngine reasoningEngine;
    private final SessionStore sessionStore;
    private final CustomerDirectory directory;
    private final List<ToolCallback> toolCallbacks;

    public ResolverStage(ReasoningEngine reasoningEngine, SessionStore sessionStore,
                         CustomerDirectory directory, AccountTools accountTools) {
        this.reasoningEngine = reasoningEngine;
        this.sessionStore = sessionStore;
        this.directory = directory;
        this.toolCallbacks = List.of(ToolCallbacks.from(accountTools));
    }

    @Override
    public StageName name() {
        return StageName.RESOLVER;
    }

    @Override
    public StageResult run(TicketSession session, String incomingMessage) {
        String userPrompt = buildUserPrompt(session, incomingMessage);
        LlmResponse response = reasoningEngine.infer(
            ReasoningRequest.capable("resolve", SYSTEM_PROMPT, userPrompt).withTools(toolCallbacks));
        Resolution resolution = parseResponse(response);

        Span.current().setAttribute("udahub.resolution", resolution.resolved() ? "resolved" : "needs_escalation");

        if (resolution.resolved()) {
            TicketSession updated = sessionStore.commit(session.sessionId(), SessionUpdate.builder()
                .message(TicketMessage.agent(StageName.RESOLVER, resolution.response()))
                .status(TicketStatus.RESOLVED)
                .lastSignal(SignalType.RESOLVED)
                .build());
            log.info("Ticket {} resolved", session.sessionId());
            return new StageResult(updated, ResolutionOutcome.resolvedOutcome());
        }

        String reason = resolution.reason().isEmpty() ? "no reason given" : resolution.reason();
        TicketSession updated = sessionStore.commit(session.sessionId(), SessionUpdate.builder()
            .message(TicketMessage.internal(StageName.RESOLVER, "NEEDS_ESCALATION: " + reason))
            .lastSignal(SignalType.NEEDS_ESCALATION)
            .build());
        log.info("Ticket {} needs escalation: {}", session.sessionId(), reason);
        return new StageResult(updated, ResolutionOutcome.needsEscalation());
    }

    Resolution parseResponse(LlmResponse response) {
        ReasoningOutput output = ReasoningOutput.parse("resolve", response);
        String outcome = output.choice("outcome");
        switch (outcome) {
            case "resolved":
                return new Resolution(true, output.text("response"), output.optionalText("reason"));
            case "needs_escalation":
                return new Resolution(false, output.optionalText("response"), output.optionalText("reason"));
            default:
                throw output.invalid("outcome", outcome);
        }
    }

    private String buildUserPrompt(TicketSession session, String incomingMessage) {
        var sb = new StringBuilder();
        sb.append("Ticket ").append(session.sessionId())
            .append(" (issue_type=").append(session.issueType() != null ? session.issueType().wireName() : "unknown")
            .append(", urgency=").append(session.urgency() != null ? session.urgency().wireName() : "unknown")
            .append(", sentiment=").append(session.sentiment() != null ? session.sentiment() : "unknown")
            .append(")\n\n");

        sb.append("Knowledge base material:\n")
            .append(session.latestNote(StageName.RETRIEVER)
                .map(TicketMessage::content)
                .orElse("No knowledge base material was retrieved."))
            .append("\n\n");

        String userId = session.externalUserId();
        if (userId != null && !userId.isBlank()) {
            sb.append("Customer account (user_id=").append(userId).append("):\n");
            Optional<CustomerProfile> profile = directory.findUser(userId);
            if (profile.isPresent()) {
                sb.append("- name: ").append(profile.get().fullName())
                    .append("\n- account blocked: ").append(profile.get().blocked()).append("\n");
            } else {
                sb.append("- no CultPass profile found\n");
            }
            Optional<Subscription> subscription = directory.findSubscription(userId);
            subscription.ifPresent(s -> sb.append("- subscription: ").append(s.tier())
                .append(" (").append(s.status()).append(")\n"));

            PreferenceRecord preferences = sessionStore.getPreferences(userId);
            if (!preferences.isEmpty()) {
                sb.append("- preferences: language=").append(orUnset(preferences.language()))
                    .append(", channel=").append(orUnset(preferences.channel()))
                    .append(", notes=").append(orUnset(preferences.notes())).append("\n");
            }

            List<TicketSession> prior = sessionStore.findByExternalUser(userId).stream()
                .filter(t -> !t.sessionId().equals(session.sessionId()))
                .toList();
            if (!prior.isEmpty()) {
                sb.append("- previous tickets:\n");
                for (TicketSession t : prior) {
                    sb.append("  - ").append(t.sessionId())
                        .append(" issue_type=").append(t.issueType() != null ? t.issueType().wireName() : "unknown")
                        .append(" status=").append(t.status().name().toLowerCase())
                        .append("\n");
                }
            }
            sb.append("\n");
        }

        sb.append("Conversation:\n").append(session.transcript())
            .append("\nLatest customer message:\n").append(incomingMessage);
        return sb.toString();
    }

    private static String orUnset(String value) {
        return value != null ? value : "unset";
    }
}
