package com.example.udahub.failure;

/**
 * A collaborator was unreachable, failed, or answered with something unusable. Recoverable: the
 * orchestrator re-runs the stage before giving up on the run.
 */
public class CollaboratorFailureException extends RuntimeException {

    private final CollaboratorKind kind;

    public CollaboratorFailureException(CollaboratorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollaboratorFailureException(CollaboratorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CollaboratorKind kind() {
        return kind;
    }
}
