package com.example.udahub.pipeline;

import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.udahub.llm.LlmResponse;
import com.example.udahub.llm.ReasoningEngine;
import com.example.udahub.llm.ReasoningRequest;
import com.example.udahub.model.CustomerProfile;
import com.example.udahub.model.MessageRole;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.model.TicketStatus;
import com.example.udahub.model.Urgency;
import com.example.udahub.repository.CustomerDirectory;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.routing.RoutingSignal;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;

import io.opentelemetry.api.trace.Span;

@Component
public class EscalationStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(EscalationStage.class);

    private static final String SYSTEM_PROMPT = """
        You are the escalation agent for UDA-Hub. This ticket could not be resolved automatically
        and goes to a human support lead.

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "summary": "issue summary in 1-2 sentences",
          "root_cause": "root cause hypothesis",
          "attempted": "what was already attempted",
          "recommended_action": "e.g. manual refund review, account unblock, billing correction",
          "customer_message": "empathetic message to the customer"
        }

        The customer message must acknowledge the issue, confirm that a human agent will follow up
        within the stated window, and quote the ticket reference.
        """;

    record EscalationNote(String summary, String rootCause, String attempted,
                          String recommendedAction, String customerMessage) {}

    private final ReasoningEngine reasoningEngine;
    private final SessionStore sessionStore;
    private final CustomerDirectory directory;

    public EscalationStage(ReasoningEngine reasoningEngine, SessionStore sessionStore,
                           CustomerDirectory directory) {
        this.reasoningEngine = reasoningEngine;
        this.sessionStore = sessionStore;
        this.directory = directory;
    }

    @Override
    public StageName name() {
        return StageName.ESCALATION;
    }

    @Override
    public StageResult run(TicketSession session, String incomingMessage) {
        Optional<CustomerProfile> profile = lookupProfile(session);
        String window = followUpWindow(session.urgency());

        LlmResponse response = reasoningEngine.infer(ReasoningRequest.capable("escalate", SYSTEM_PROMPT,
            buildUserPrompt(session, incomingMessage, profile, window)));
        EscalationNote note = parseResponse(response);

        Span.current().setAttribute("udahub.escalation.follow_up", window);

        TicketSession updated = sessionStore.commit(session.sessionId(), SessionUpdate.builder()
            .message(TicketMessage.internal(StageName.ESCALATION, formatNote(session, note, profile)))
            .message(TicketMessage.agent(StageName.ESCALATION,
                customerMessage(note.customerMessage(), session.sessionId(), window)))
            .status(TicketStatus.ESCALATED)
            .lastSignal(SignalType.ESCALATION_COMPLETE)
            .build());

        log.info("Ticket {} escalated (urgency={}, follow-up within {})",
            session.sessionId(), session.urgency(), window);
        return new StageResult(updated, new RoutingSignal.EscalationComplete());
    }

    EscalationNote parseResponse(LlmResponse response) {
        ReasoningOutput output = ReasoningOutput.parse("escalate", response);
        return new EscalationNote(
            output.text("summary"),
            output.optionalText("root_cause"),
            output.optionalText("attempted"),
            output.optionalText("recommended_action"),
            output.text("customer_message"));
    }

    static String followUpWindow(Urgency urgency) {
        return urgency == Urgency.HIGH ? "4 hours" : "24 hours";
    }

    /**
     * The reply always quotes the ticket reference and the follow-up window, whatever the engine wrote.
     */
    static String customerMessage(String drafted, String sessionId, String window) {
        if (drafted.contains(sessionId) && Pattern.compile("\\b" + Pattern.quote(window)).matcher(drafted).find()) {
            return drafted;
        }
        return drafted + "\n\nYour ticket reference is " + sessionId
            + ". A member of our support team will follow up within " + window + ".";
    }

    private Optional<CustomerProfile> lookupProfile(TicketSession session) {
        String userId = session.externalUserId();
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        // An unknown user escalates without a profile; an unreachable directory fails the stage.
        return directory.findUser(userId);
    }

    private static String formatNote(TicketSession session, EscalationNote note, Optional<CustomerProfile> profile) {
        var sb = new StringBuilder("ESCALATION NOTE\n");
        sb.append("Ticket: ").append(session.sessionId()).append("\n");
        sb.append("Issue type: ").append(session.issueType() != null ? session.issueType().wireName() : "unknown").append("\n");
        sb.append("Urgency: ").append(session.urgency() != null ? session.urgency().wireName() : "unknown").append("\n");
        profile.ifPresent(p -> sb.append("Customer: ").append(p.fullName()).append(" <").append(p.email()).append(">")
            .append(p.blocked() ? " (account blocked)" : "").append("\n"));
        sb.append("Summary: ").append(note.summary()).append("\n");
        sb.append("Root cause: ").append(orNone(note.rootCause())).append("\n");
        sb.append("Attempted: ").append(orNone(note.attempted())).append("\n");
        sb.append("Recommended action: ").append(orNone(note.recommendedAction()));
        return sb.toString();
    }

    private static String buildUserPrompt(TicketSession session, String incomingMessage,
                                          Optional<CustomerProfile> profile, String window) {
        var sb = new StringBuilder();
        sb.append("Ticket reference: ").append(session.sessionId()).append("\n")
            .append("Urgency: ").append(session.urgency() != null ? session.urgency().wireName() : "unknown")
            .append(" (human follow-up within ").append(window).append(")\n");
        profile.ifPresent(p -> sb.append("Customer: ").append(p.fullName())
            .append(", account blocked: ").append(p.blocked()).append("\n"));

        sb.append("\nInternal notes:\n");
        for (TicketMessage msg : session.conversation()) {
            if (msg.role() == MessageRole.SYSTEM) {
                sb.append("- [").append(msg.stage() != null ? msg.stage().spanName() : "system").append("] ")
                    .append(firstLine(msg.content())).append("\n");
            }
        }
        sb.append("\nConversation:\n").append(session.transcript())
            .append("\nLatest customer message:\n").append(incomingMessage);
        return sb.toString();
    }

    private static String firstLine(String content) {
        int nl = content.indexOf('\n');
        return nl < 0 ? content : content.substring(0, nl);
    }

    private static String orNone(String value) {
        return value.isEmpty() ? "none recorded" : value;
    }
}
