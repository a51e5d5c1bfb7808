package com.example.udahub.routing;

public class InvalidTransitionException extends RuntimeException {

    private final String sessionId;

    public InvalidTransitionException(String sessionId, String message) {
        super("Invalid transition for ticket " + sessionId + ": " + message);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
