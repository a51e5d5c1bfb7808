package com.example.udahub.pipeline;

public class SessionBusyException extends RuntimeException {

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("Ticket " + sessionId + " is already being routed");
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
