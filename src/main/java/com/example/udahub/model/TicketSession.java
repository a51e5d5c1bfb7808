package com.example.udahub.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;

public record TicketSession(
    String sessionId,
    String externalUserId,
    IssueType issueType,
    Urgency urgency,
    String sentiment,
    TicketStatus status,
    Double retrievalConfidence,
    int articlesFound,
    SignalType lastSignal,
    List<TicketMessage> conversation,
    Instant createdAt,
    Instant updatedAt
) {

    public TicketSession {
        conversation = conversation == null ? List.of() : List.copyOf(conversation);
    }

    public static TicketSession open(String sessionId, String externalUserId, TicketMessage firstMessage) {
        Instant now = Instant.now();
        return new TicketSession(sessionId, externalUserId, null, null, null, TicketStatus.OPEN,
            null, 0, null, List.of(firstMessage), now, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public TicketSession apply(SessionUpdate update, Instant now) {
        TicketStatus nextStatus = status;
        if (update.status() != null) {
            if (!status.canTransitionTo(update.status())) {
                throw new IllegalStatusTransitionException(sessionId, status, update.status());
            }
            nextStatus = update.status();
        }
        Double confidence = retrievalConfidence;
        if (update.retrievalConfidence() != null) {
            double value = update.retrievalConfidence();
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("retrieval confidence out of range: " + value);
            }
            confidence = value;
        }
        if (update.articlesFound() != null && update.articlesFound() < 0) {
            throw new IllegalArgumentException("articles found must not be negative");
        }
        return new TicketSession(
            sessionId,
            externalUserId,
            update.issueType() != null ? update.issueType() : issueType,
            update.urgency() != null ? update.urgency() : urgency,
            update.sentiment() != null ? update.sentiment() : sentiment,
            nextStatus,
            confidence,
            update.articlesFound() != null ? update.articlesFound() : articlesFound,
            update.lastSignal() != null ? update.lastSignal() : lastSignal,
            appended(update.messages()),
            createdAt,
            now);
    }

    public TicketSession withMessage(TicketMessage message, Instant now) {
        return new TicketSession(sessionId, externalUserId, issueType, urgency, sentiment, status,
            retrievalConfidence, articlesFound, lastSignal, appended(List.of(message)), createdAt, now);
    }

    public Optional<String> lastCustomerMessage() {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            if (conversation.get(i).customerVisible()) {
                return Optional.of(conversation.get(i).content());
            }
        }
        return Optional.empty();
    }

    public Optional<String> latestUserMessage() {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            if (conversation.get(i).role() == MessageRole.USER) {
                return Optional.of(conversation.get(i).content());
            }
        }
        return Optional.empty();
    }

    public Optional<TicketMessage> latestNote(StageName stage) {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            TicketMessage msg = conversation.get(i);
            if (msg.role() == MessageRole.SYSTEM && msg.stage() == stage) {
                return Optional.of(msg);
            }
        }
        return Optional.empty();
    }

    public String transcript() {
        var sb = new StringBuilder();
        for (var msg : conversation) {
            if (msg.role() == MessageRole.SYSTEM) continue;
            sb.append(msg.role() == MessageRole.USER ? "customer" : "agent")
                .append(": ").append(msg.content()).append("\n");
        }
        return sb.toString();
    }

    private List<TicketMessage> appended(List<TicketMessage> messages) {
        if (messages.isEmpty()) {
            return conversation;
        }
        var all = new ArrayList<TicketMessage>(conversation.size() + messages.size());
        all.addAll(conversation);
        all.addAll(messages);
        return all;
    }
}
