package com.example.udahub.pipeline;

import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;
import com.example.udahub.routing.StageName;

public class StageFailedException extends RuntimeException {

    private final String sessionId;
    private final StageName stage;
    private final int attempts;

    public StageFailedException(String sessionId, StageName stage, int attempts,
                                CollaboratorFailureException cause) {
        super("Stage " + stage + " failed for ticket " + sessionId + " after " + attempts
            + " attempt(s): " + cause.getMessage(), cause);
        this.sessionId = sessionId;
        this.stage = stage;
        this.attempts = attempts;
    }

    public String sessionId() {
        return sessionId;
    }

    public StageName stage() {
        return stage;
    }

    public int attempts() {
        return attempts;
    }

    public CollaboratorKind kind() {
        return ((CollaboratorFailureException) getCause()).kind();
    }
}
