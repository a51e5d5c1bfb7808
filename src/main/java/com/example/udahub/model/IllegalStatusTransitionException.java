package com.example.udahub.model;

public class IllegalStatusTransitionException extends IllegalStateException {

    private final String sessionId;
    private final TicketStatus from;
    private final TicketStatus to;

    public IllegalStatusTransitionException(String sessionId, TicketStatus from, TicketStatus to) {
        super("Ticket " + sessionId + " cannot move from " + from + " to " + to);
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public String sessionId() {
        return sessionId;
    }

    public TicketStatus from() {
        return from;
    }

    public TicketStatus to() {
        return to;
    }
}
