package com.example.udahub.model;

import java.util.List;

import com.example.udahub.routing.StageName;

public record TicketOutcome(
    String sessionId,
    TicketStatus status,
    String lastCustomerMessage,
    List<StageName> path
) {

    public static TicketOutcome of(TicketSession session, List<StageName> path) {
        return new TicketOutcome(
            session.sessionId(),
            session.status(),
            session.lastCustomerMessage().orElse(null),
            List.copyOf(path));
    }
}
