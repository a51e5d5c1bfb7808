package com.example.udahub.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.udahub.model.IllegalStatusTransitionException;
import com.example.udahub.model.TicketOutcome;
import com.example.udahub.model.TicketSession;
import com.example.udahub.pipeline.RoutingAbortedException;
import com.example.udahub.pipeline.RoutingExhaustedException;
import com.example.udahub.pipeline.SessionBusyException;
import com.example.udahub.pipeline.StageFailedException;
import com.example.udahub.pipeline.TicketOrchestrator;
import com.example.udahub.repository.SessionNotFoundException;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.routing.InvalidTransitionException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/tickets")
public class TicketController {

    private static final Logger log = LoggerFactory.getLogger(TicketController.class);

    private final TicketOrchestrator orchestrator;
    private final SessionStore sessionStore;

    public TicketController(TicketOrchestrator orchestrator, SessionStore sessionStore) {
        this.orchestrator = orchestrator;
        this.sessionStore = sessionStore;
    }

    public record MessageRequest(String message, String externalUserId) {}

    @PostMapping("/{sessionId}/messages")
    public Mono<TicketOutcome> postMessage(@PathVariable String sessionId, @RequestBody MessageRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message cannot be empty"));
        }

        return Mono.fromCallable(() -> orchestrator.handleMessage(sessionId, request.message(), request.externalUserId()))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(e -> !(e instanceof ResponseStatusException), TicketController::toResponseStatus);
    }

    @GetMapping("/{sessionId}")
    public Mono<TicketSession> get(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> sessionStore.load(sessionId))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(found -> found.map(Mono::just)
                .orElseGet(() -> Mono.error(
                    new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown ticket " + sessionId))));
    }

    @GetMapping
    public Mono<List<TicketSession>> history(@RequestParam String externalUserId) {
        return Mono.fromCallable(() -> sessionStore.findByExternalUser(externalUserId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{sessionId}/abort")
    public Mono<Map<String, Boolean>> abort(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> Map.of("aborted", orchestrator.abort(sessionId)));
    }

    static ResponseStatusException toResponseStatus(Throwable e) {
        HttpStatus status;
        if (e instanceof SessionBusyException || e instanceof RoutingAbortedException
            || e instanceof IllegalStatusTransitionException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof StageFailedException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else if (e instanceof SessionNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof IllegalArgumentException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof RoutingExhaustedException || e instanceof InvalidTransitionException) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        } else {
            log.error("Unexpected routing error: {}", e.getMessage(), e);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return new ResponseStatusException(status, e.getMessage(), e);
    }
}
