package com.example.udahub.pipeline;

public class RoutingExhaustedException extends RuntimeException {

    private final String sessionId;
    private final int maxTransitions;

    public RoutingExhaustedException(String sessionId, int maxTransitions) {
        super("Ticket " + sessionId + " exceeded " + maxTransitions + " stage transitions");
        this.sessionId = sessionId;
        this.maxTransitions = maxTransitions;
    }

    public String sessionId() {
        return sessionId;
    }

    public int maxTransitions() {
        return maxTransitions;
    }
}
