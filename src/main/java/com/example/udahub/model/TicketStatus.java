package com.example.udahub.model;

/**
 * Lifecycle of a ticket. OPEN moves to exactly one of the terminal states and stays there.
 */
public enum TicketStatus {
    OPEN, RESOLVED, ESCALATED;

    public boolean isTerminal() {
        return this != OPEN;
    }

    public boolean canTransitionTo(TicketStatus next) {
        return this == next || (this == OPEN && next.isTerminal());
    }
}
