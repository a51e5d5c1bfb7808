package com.example.udahub.controller;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.example.udahub.config.RoutingProperties;
import com.example.udahub.model.IllegalStatusTransitionException;
import com.example.udahub.model.TicketStatus;
import com.example.udahub.pipeline.ClassifierStage;
import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;
import com.example.udahub.pipeline.EscalationStage;
import com.example.udahub.pipeline.ResolverStage;
import com.example.udahub.pipeline.RetrieverStage;
import com.example.udahub.pipeline.RoutingAbortedException;
import com.example.udahub.pipeline.RoutingExhaustedException;
import com.example.udahub.pipeline.SessionBusyException;
import com.example.udahub.pipeline.StageFailedException;
import com.example.udahub.pipeline.TicketOrchestrator;
import com.example.udahub.repository.InMemorySessionStore;
import com.example.udahub.repository.SessionNotFoundException;
import com.example.udahub.routing.InvalidTransitionException;
import com.example.udahub.routing.StageName;
import com.example.udahub.routing.TicketRouter;
import com.example.udahub.telemetry.RoutingMetrics;
import com.example.udahub.testsupport.ScriptedReasoningEngine;
import com.example.udahub.testsupport.StubCustomerDirectory;
import com.example.udahub.testsupport.StubKnowledgeSearch;
import com.example.udahub.tools.AccountTools;

import static org.junit.jupiter.api.Assertions.*;

class TicketControllerTest {

    private final InMemorySessionStore store = new InMemorySessionStore();
    private final ScriptedReasoningEngine engine = new ScriptedReasoningEngine()
        .respond("classify", ScriptedReasoningEngine.classification("login", "low"))
        .respond("retrieve", ScriptedReasoningEngine.retrieval(0.9, 1))
        .respond("resolve", ScriptedReasoningEngine.resolved("Use the Forgot password link."));
    private final WebTestClient client;

    TicketControllerTest() {
        var directory = new StubCustomerDirectory();
        var metrics = new RoutingMetrics();
        var orchestrator = new TicketOrchestrator(List.of(
            new ClassifierStage(engine, store),
            new RetrieverStage(engine, StubKnowledgeSearch.withPasswordArticle(), store, metrics),
            new ResolverStage(engine, store, directory, new AccountTools(directory, store, metrics)),
            new EscalationStage(engine, store, directory)),
            new TicketRouter(), store, new RoutingProperties(5, 3, Duration.ZERO, Duration.ZERO, 3), metrics);
        this.client = WebTestClient.bindToController(new TicketController(orchestrator, store)).build();
    }

    @Test
    void postingMessageRoutesTicketToOutcome() {
        client.post().uri("/api/tickets/t-1/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "I forgot my password", "externalUserId", "a4ab87"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.sessionId").isEqualTo("t-1")
            .jsonPath("$.status").isEqualTo("RESOLVED")
            .jsonPath("$.lastCustomerMessage").isEqualTo("Use the Forgot password link.")
            .jsonPath("$.path.length()").isEqualTo(3);

        client.get().uri("/api/tickets/t-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.externalUserId").isEqualTo("a4ab87")
            .jsonPath("$.issueType").isEqualTo("LOGIN")
            .jsonPath("$.conversation[0].content").isEqualTo("I forgot my password");

        client.get().uri("/api/tickets?externalUserId=a4ab87")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    void blankMessageIsBadRequest() {
        client.post().uri("/api/tickets/t-2/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("message", "   "))
            .exchange()
            .expectStatus().isBadRequest();

        assertTrue(store.load("t-2").isEmpty());
    }

    @Test
    void unknownTicketIsNotFound() {
        client.get().uri("/api/tickets/missing")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void abortWithoutRunningTicket() {
        client.post().uri("/api/tickets/t-3/abort")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.aborted").isEqualTo(false);
    }

    static Stream<Arguments> errorStatuses() {
        return Stream.of(
            Arguments.of(new SessionBusyException("t"), HttpStatus.CONFLICT),
            Arguments.of(new RoutingAbortedException("t"), HttpStatus.CONFLICT),
            Arguments.of(new IllegalStatusTransitionException("t", TicketStatus.RESOLVED, TicketStatus.OPEN),
                HttpStatus.CONFLICT),
            Arguments.of(new StageFailedException("t", StageName.RETRIEVER, 3,
                new CollaboratorFailureException(CollaboratorKind.KNOWLEDGE_SEARCH, "down")),
                HttpStatus.SERVICE_UNAVAILABLE),
            Arguments.of(new RoutingExhaustedException("t", 5), HttpStatus.INTERNAL_SERVER_ERROR),
            Arguments.of(new InvalidTransitionException("t", "bad"), HttpStatus.INTERNAL_SERVER_ERROR),
            Arguments.of(new SessionNotFoundException("t"), HttpStatus.NOT_FOUND),
            Arguments.of(new IllegalArgumentException("blank"), HttpStatus.BAD_REQUEST)
        );
    }

    @ParameterizedTest
    @MethodSource("errorStatuses")
    void mapsRoutingErrorsToHttpStatus(RuntimeException error, HttpStatus expected) {
        assertEquals(expected, TicketController.toResponseStatus(error).getStatusCode());
    }
}
