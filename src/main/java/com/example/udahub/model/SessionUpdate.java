package com.example.udahub.model;

import java.util.ArrayList;
import java.util.List;

import com.example.udahub.routing.SignalType;

/**
 * Field-level mutation of a {@link TicketSession}. Unset fields are left as stored; messages are
 * appended in the same atomic commit.
 */
public record SessionUpdate(
    IssueType issueType,
    Urgency urgency,
    String sentiment,
    TicketStatus status,
    Double retrievalConfidence,
    Integer articlesFound,
    SignalType lastSignal,
    List<TicketMessage> messages
) {

    public SessionUpdate {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IssueType issueType;
        private Urgency urgency;
        private String sentiment;
        private TicketStatus status;
        private Double retrievalConfidence;
        private Integer articlesFound;
        private SignalType lastSignal;
        private final List<TicketMessage> messages = new ArrayList<>();

        private Builder() {}

        public Builder issueType(IssueType issueType) {
            this.issueType = issueType;
            return this;
        }

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder sentiment(String sentiment) {
            this.sentiment = sentiment;
            return this;
        }

        public Builder status(TicketStatus status) {
            this.status = status;
            return this;
        }

        public Builder retrieval(double confidence, int articlesFound) {
            this.retrievalConfidence = confidence;
            this.articlesFound = articlesFound;
            return this;
        }

        public Builder lastSignal(SignalType lastSignal) {
            this.lastSignal = lastSignal;
            return this;
        }

        public Builder message(TicketMessage message) {
            this.messages.add(message);
            return this;
        }

        public SessionUpdate build() {
            return new SessionUpdate(issueType, urgency, sentiment, status,
                retrievalConfidence, articlesFound, lastSignal, messages);
        }
    }
}
