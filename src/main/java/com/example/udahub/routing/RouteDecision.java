package com.example.udahub.routing;

import com.example.udahub.model.TicketStatus;

public record RouteDecision(StageName stage, TicketStatus terminal) {

    public static RouteDecision toStage(StageName stage) {
        return new RouteDecision(stage, null);
    }

    public static RouteDecision terminal(TicketStatus status) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return new RouteDecision(null, status);
    }

    public boolean isTerminal() {
        return terminal != null;
    }

    @Override
    public String toString() {
        return isTerminal() ? "terminal(" + terminal + ")" : stage.name();
    }
}
