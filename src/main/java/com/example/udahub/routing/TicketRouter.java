package com.example.udahub.routing;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.udahub.model.TicketSession;
import com.example.udahub.model.TicketStatus;
import com.example.udahub.model.Urgency;
import com.example.udahub.routing.RoutingSignal.Classified;
import com.example.udahub.routing.RoutingSignal.EscalationComplete;
import com.example.udahub.routing.RoutingSignal.ResolutionOutcome;
import com.example.udahub.routing.RoutingSignal.RetrievalResult;

/**
 * Decides the stage that follows a signal. Pure: no I/O, no state.
 *
 * <p>The graph is a pipeline with one branch point after retrieval and a single
 * resolver-to-escalation edge; escalation has no way back into the pipeline.
 */
@Component
public class TicketRouter {

    public static final double HIGH_URGENCY_THRESHOLD = 0.75;
    public static final double STANDARD_THRESHOLD = 0.60;

    public StageName firstStage() {
        return StageName.CLASSIFIER;
    }

    public RouteDecision next(TicketSession session, RoutingSignal signal) {
        if (signal == null) {
            throw new InvalidTransitionException(session.sessionId(), "no signal");
        }

        // Classification always precedes retrieval, whatever the urgency.
        if (signal instanceof Classified) {
            requireOpen(session, signal);
            return RouteDecision.toStage(StageName.RETRIEVER);
        }

        if (session.urgency() == null || session.retrievalConfidence() == null) {
            throw new InvalidTransitionException(session.sessionId(),
                signal.type() + " before urgency and retrieval confidence were committed");
        }

        if (signal instanceof RetrievalResult result) {
            requireOpen(session, signal);
            double threshold = thresholdFor(session.urgency());
            return result.confidence() >= threshold
                ? RouteDecision.toStage(StageName.RESOLVER)
                : RouteDecision.toStage(StageName.ESCALATION);
        }

        if (signal instanceof ResolutionOutcome outcome) {
            if (!outcome.resolved()) {
                requireOpen(session, signal);
                return RouteDecision.toStage(StageName.ESCALATION);
            }
            requireStatus(session, signal, TicketStatus.RESOLVED);
            return RouteDecision.terminal(TicketStatus.RESOLVED);
        }

        if (signal instanceof EscalationComplete) {
            requireStatus(session, signal, TicketStatus.ESCALATED);
            return RouteDecision.terminal(TicketStatus.ESCALATED);
        }

        throw new InvalidTransitionException(session.sessionId(), "unsupported signal " + signal);
    }

    /**
     * Rebuilds the last committed signal from the persisted tag and session fields.
     */
    public Optional<RoutingSignal> restore(TicketSession session) {
        if (session.lastSignal() == null) {
            return Optional.empty();
        }
        RoutingSignal signal = switch (session.lastSignal()) {
            case CLASSIFIED -> new Classified(session.issueType(), session.urgency());
            case RETRIEVAL_RESULT -> new RetrievalResult(
                session.retrievalConfidence() != null ? session.retrievalConfidence() : 0.0,
                session.articlesFound());
            case RESOLVED -> ResolutionOutcome.resolvedOutcome();
            case NEEDS_ESCALATION -> ResolutionOutcome.needsEscalation();
            case ESCALATION_COMPLETE -> new EscalationComplete();
        };
        return Optional.of(signal);
    }

    static double thresholdFor(Urgency urgency) {
        return urgency == Urgency.HIGH ? HIGH_URGENCY_THRESHOLD : STANDARD_THRESHOLD;
    }

    private static void requireOpen(TicketSession session, RoutingSignal signal) {
        requireStatus(session, signal, TicketStatus.OPEN);
    }

    private static void requireStatus(TicketSession session, RoutingSignal signal, TicketStatus expected) {
        if (session.status() != expected) {
            throw new InvalidTransitionException(session.sessionId(),
                signal.type() + " while ticket is " + session.status() + ", expected " + expected);
        }
    }
}
