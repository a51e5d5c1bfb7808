package com.example.udahub.pipeline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.example.udahub.config.RoutingProperties;
import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketOutcome;
import com.example.udahub.model.TicketSession;
import com.example.udahub.repository.SessionNotFoundException;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.routing.RouteDecision;
import com.example.udahub.routing.StageName;
import com.example.udahub.routing.TicketRouter;
import com.example.udahub.telemetry.RoutingMetrics;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Drives a ticket from the customer's message to a terminal status, one stage at a time, asking
 * the router after every stage. Blocking; callers on an event loop must hop to a worker scheduler.
 */
@Service
public class TicketOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TicketOrchestrator.class);
    static final String MDC_TICKET = "ticket";

    private final Map<StageName, Stage> stages;
    private final TicketRouter router;
    private final SessionStore sessionStore;
    private final RoutingProperties properties;
    private final RoutingMetrics metrics;
    private final Tracer tracer;

    // Ticket id -> abort flag of the run that owns it.
    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public TicketOrchestrator(List<Stage> stages, TicketRouter router, SessionStore sessionStore,
                              RoutingProperties properties, RoutingMetrics metrics) {
        this.stages = new EnumMap<>(StageName.class);
        for (Stage stage : stages) {
            if (this.stages.put(stage.name(), stage) != null) {
                throw new IllegalStateException("Duplicate stage " + stage.name());
            }
        }
        for (StageName name : StageName.values()) {
            if (!this.stages.containsKey(name)) {
                throw new IllegalStateException("No stage registered for " + name);
            }
        }
        this.router = router;
        this.sessionStore = sessionStore;
        this.properties = properties;
        this.metrics = metrics;
        this.tracer = GlobalOpenTelemetry.getTracer("udahub-ticket-routing");
    }

    public TicketOutcome handleMessage(String sessionId, String customerMessage) {
        return handleMessage(sessionId, customerMessage, null);
    }

    /**
     * @throws SessionBusyException       another run holds this ticket
     * @throws RoutingExhaustedException  the run needed more stage executions than allowed
     * @throws StageFailedException       a collaborator kept failing after all attempts
     * @throws RoutingAbortedException    {@link #abort} was called while the run was in flight
     */
    public TicketOutcome handleMessage(String sessionId, String customerMessage, String externalUserId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (customerMessage == null || customerMessage.isBlank()) {
            throw new IllegalArgumentException("customer message must not be blank");
        }

        AtomicBoolean abortFlag = new AtomicBoolean();
        if (activeRuns.putIfAbsent(sessionId, abortFlag) != null) {
            throw new SessionBusyException(sessionId);
        }

        MDC.put(MDC_TICKET, sessionId);
        Span span = tracer.spanBuilder("ticket_routing")
            .setAttribute("udahub.ticket_id", sessionId)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            TicketOutcome outcome = route(sessionId, customerMessage, externalUserId, abortFlag);
            span.setAttribute("udahub.status", outcome.status().name());
            span.setAttribute("udahub.stages_run", (long) outcome.path().size());
            return outcome;

        } catch (RuntimeException e) {
            String errorType = e.getClass().getSimpleName();
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.setAttribute("error.type", errorType);
            metrics.recordRunFailure(errorType);
            log.error("Routing failed for ticket {}: {}", sessionId, e.getMessage());
            throw e;

        } finally {
            span.end();
            MDC.remove(MDC_TICKET);
            activeRuns.remove(sessionId, abortFlag);
        }
    }

    /**
     * Asks the run holding this ticket to stop before its next stage.
     *
     * @return false when no run holds the ticket
     */
    public boolean abort(String sessionId) {
        AtomicBoolean flag = activeRuns.get(sessionId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        log.info("Abort requested for ticket {}", sessionId);
        return true;
    }

    private TicketOutcome route(String sessionId, String customerMessage, String externalUserId,
                                AtomicBoolean abortFlag) {
        TicketSession session = admit(sessionId, customerMessage, externalUserId);
        if (session.isTerminal()) {
            log.warn("Ticket {} is already {}, replaying stored outcome", sessionId, session.status());
            return TicketOutcome.of(session, List.of());
        }

        RouteDecision decision = router.restore(session)
            .map(signal -> {
                log.info("Resuming ticket {} after {}", sessionId, signal.type());
                return router.next(session, signal);
            })
            .orElseGet(() -> RouteDecision.toStage(router.firstStage()));

        List<StageName> path = new ArrayList<>();
        while (!decision.isTerminal()) {
            if (abortFlag.get()) {
                throw new RoutingAbortedException(sessionId);
            }
            if (path.size() >= properties.maxTransitions()) {
                throw new RoutingExhaustedException(sessionId, properties.maxTransitions());
            }

            TicketSession current = sessionStore.load(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            StageResult result = runStage(stages.get(decision.stage()), current, customerMessage);
            path.add(decision.stage());

            RouteDecision next = router.next(result.session(), result.signal());
            metrics.recordTransition(result.signal().type().name(), next.toString());
            log.info("Ticket {}: {} -> {} ({})", sessionId, decision.stage(), next, result.signal().type());
            decision = next;
        }

        TicketSession finished = sessionStore.load(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        metrics.recordOutcome(finished.status().name(), path.size());
        log.info("Ticket {} finished as {} via {}", sessionId, finished.status(), path);
        return TicketOutcome.of(finished, path);
    }

    private TicketSession admit(String sessionId, String customerMessage, String externalUserId) {
        TicketSession session = sessionStore.load(sessionId)
            .orElseGet(() -> sessionStore.open(sessionId, externalUserId, TicketMessage.user(customerMessage)));
        if (session.isTerminal()) {
            return session;
        }
        // A message equal to the latest one is a replay of the same turn.
        if (customerMessage.equals(session.latestUserMessage().orElse(null))) {
            return session;
        }
        return sessionStore.appendMessage(sessionId, TicketMessage.user(customerMessage));
    }

    private StageResult runStage(Stage stage, TicketSession session, String customerMessage) {
        int maxAttempts = properties.stageAttempts();
        for (int attempt = 1; ; attempt++) {
            long start = System.nanoTime();
            CollaboratorFailureException failure;

            Span span = tracer.spanBuilder("stage " + stage.name().spanName())
                .setAttribute("udahub.stage", stage.name().spanName())
                .setAttribute("udahub.attempt", (long) attempt)
                .startSpan();
            try (Scope ignored = span.makeCurrent()) {
                StageResult result = stage.run(session, customerMessage);
                span.setAttribute("udahub.signal", result.signal().type().name());
                metrics.recordStage(stage.name().spanName(), seconds(start), true);
                return result;

            } catch (CollaboratorFailureException e) {
                span.setStatus(StatusCode.ERROR, e.getMessage());
                span.setAttribute("error.type", e.kind().name());
                metrics.recordStage(stage.name().spanName(), seconds(start), false);
                failure = e;

            } catch (RuntimeException e) {
                span.setStatus(StatusCode.ERROR, e.getMessage());
                metrics.recordStage(stage.name().spanName(), seconds(start), false);
                throw e;

            } finally {
                span.end();
            }

            if (attempt >= maxAttempts) {
                throw new StageFailedException(session.sessionId(), stage.name(), attempt, failure);
            }
            long delayMs = backoffWithJitter(attempt - 1);
            metrics.recordStageRetry(stage.name().spanName(), failure.kind().name());
            log.warn("Stage {} failed for ticket {} (attempt {}/{}, {}): {}; retrying in {} ms",
                stage.name(), session.sessionId(), attempt, maxAttempts, failure.kind(),
                failure.getMessage(), delayMs);
            sleep(session.sessionId(), delayMs);
        }
    }

    long backoffWithJitter(int retry) {
        long initial = properties.backoffInitial().toMillis();
        long max = properties.backoffMax().toMillis();
        long base = Math.min(initial * (1L << Math.min(retry, 20)), max);
        long jitter = ThreadLocalRandom.current().nextLong(0, base / 4 + 1);
        return base + jitter;
    }

    private static void sleep(String sessionId, long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingAbortedException(sessionId);
        }
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
