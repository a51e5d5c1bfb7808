package com.example.udahub.routing;

import com.example.udahub.model.IssueType;
import com.example.udahub.model.Urgency;

/**
 * Output of a stage, consumed by {@link TicketRouter}. Not persisted as such; only its
 * {@link SignalType} tag is stored alongside the fields the stage committed.
 */
public sealed interface RoutingSignal {

    SignalType type();

    record Classified(IssueType issueType, Urgency urgency) implements RoutingSignal {
        @Override
        public SignalType type() {
            return SignalType.CLASSIFIED;
        }
    }

    record RetrievalResult(double confidence, int articlesFound) implements RoutingSignal {
        @Override
        public SignalType type() {
            return SignalType.RETRIEVAL_RESULT;
        }
    }

    record ResolutionOutcome(boolean resolved) implements RoutingSignal {

        public static ResolutionOutcome resolvedOutcome() {
            return new ResolutionOutcome(true);
        }

        public static ResolutionOutcome needsEscalation() {
            return new ResolutionOutcome(false);
        }

        @Override
        public SignalType type() {
            return resolved ? SignalType.RESOLVED : SignalType.NEEDS_ESCALATION;
        }
    }

    record EscalationComplete() implements RoutingSignal {
        @Override
        public SignalType type() {
            return SignalType.ESCALATION_COMPLETE;
        }
    }
}
