package com.example.udahub.routing;

/**
 * Persisted tag of the last routing signal a stage committed.
 */
public enum SignalType {
    CLASSIFIED,
    RETRIEVAL_RESULT,
    RESOLVED,
    NEEDS_ESCALATION,
    ESCALATION_COMPLETE
}
