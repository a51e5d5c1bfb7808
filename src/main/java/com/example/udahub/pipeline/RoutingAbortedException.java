package com.example.udahub.pipeline;

public class RoutingAbortedException extends RuntimeException {

    private final String sessionId;

    public RoutingAbortedException(String sessionId) {
        super("Routing aborted for ticket " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
