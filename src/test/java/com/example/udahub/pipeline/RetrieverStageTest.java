package com.example.udahub.pipeline;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;
import com.example.udahub.llm.LlmResponse;
import com.example.udahub.model.IssueType;
import com.example.udahub.model.KnowledgeArticle;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.model.Urgency;
import com.example.udahub.repository.InMemorySessionStore;
import com.example.udahub.routing.RoutingSignal;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;
import com.example.udahub.telemetry.RoutingMetrics;
import com.example.udahub.testsupport.ScriptedReasoningEngine;
import com.example.udahub.testsupport.StubKnowledgeSearch;

import static org.junit.jupiter.api.Assertions.*;

class RetrieverStageTest {

    private final InMemorySessionStore store = new InMemorySessionStore();
    private final ScriptedReasoningEngine engine = new ScriptedReasoningEngine();
    private final RoutingMetrics metrics = new RoutingMetrics();

    private TicketSession classifiedSession(String id) {
        store.open(id, "u-1", TicketMessage.user("I forgot my password"));
        return store.commit(id, SessionUpdate.builder()
            .issueType(IssueType.LOGIN)
            .urgency(Urgency.HIGH)
            .lastSignal(SignalType.CLASSIFIED)
            .build());
    }

    @ParameterizedTest
    @CsvSource({
        "'{\"confidence\": 0.82, \"articles_found\": 2}', 0.82, 2",
        "'{\"confidence\": 0, \"articles_found\": 0, \"retrieved_articles\": []}', 0.0, 0",
        "'{\"confidence\": 1.0, \"articles_found\": 1, \"retrieved_articles\": [{\"title\": \"Refunds\"}]}', 1.0, 1"
    })
    void parsesAssessment(String json, double confidence, int articlesFound) {
        var stage = new RetrieverStage(null, null, null, null);

        var assessment = stage.parseResponse(LlmResponse.of(json), 3);

        assertEquals(confidence, assessment.confidence(), 0.0001);
        assertEquals(articlesFound, assessment.articlesFound());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"confidence\": 1.2, \"articles_found\": 1}",
        "{\"confidence\": -0.1, \"articles_found\": 1}",
        "{\"confidence\": \"high\", \"articles_found\": 1}",
        "{\"confidence\": 0.7, \"articles_found\": -1}",
        "{\"confidence\": 0.7}",
        "{\"articles_found\": 1}",
        "{\"confidence\": 0.9, \"articles_found\": 4}",
        "confidence: 0.7"
    })
    void rejectsOutOfRangeOrMissingFields(String content) {
        var stage = new RetrieverStage(null, null, null, null);

        assertThrows(MalformedReasoningOutputException.class, () -> stage.parseResponse(LlmResponse.of(content), 3));
    }

    @Test
    void commitsConfidenceAndDigestWithoutTouchingClassification() {
        engine.respond("retrieve", ScriptedReasoningEngine.retrieval(0.77, 1));
        var knowledge = StubKnowledgeSearch.withPasswordArticle();
        TicketSession session = classifiedSession("t-1");

        StageResult result = new RetrieverStage(engine, knowledge, store, metrics).run(session, "I forgot my password");

        assertEquals(new RoutingSignal.RetrievalResult(0.77, 1), result.signal());
        assertEquals("login: I forgot my password", knowledge.queries().get(0));
        TicketSession stored = store.load("t-1").orElseThrow();
        assertEquals(0.77, stored.retrievalConfidence(), 0.0001);
        assertEquals(1, stored.articlesFound());
        assertEquals(IssueType.LOGIN, stored.issueType());
        assertEquals(Urgency.HIGH, stored.urgency());
        assertEquals(SignalType.RETRIEVAL_RESULT, stored.lastSignal());
        String digest = stored.latestNote(StageName.RETRIEVER).orElseThrow().content();
        assertTrue(digest.startsWith("RETRIEVAL_RESULT: confidence=0.77, articles_found=1"));
        assertTrue(digest.contains("Tap 'Forgot password'"));
    }

    @Test
    void articleCountAboveSearchResultsIsRejectedBeforeCommit() {
        engine.respond("retrieve", ScriptedReasoningEngine.retrieval(0.9, 2));
        TicketSession session = classifiedSession("t-4");
        var stage = new RetrieverStage(engine, StubKnowledgeSearch.withPasswordArticle(), store, metrics);

        assertThrows(MalformedReasoningOutputException.class, () -> stage.run(session, "I forgot my password"));

        TicketSession stored = store.load("t-4").orElseThrow();
        assertNull(stored.retrievalConfidence());
        assertEquals(SignalType.CLASSIFIED, stored.lastSignal());
    }

    @Test
    void noArticlesMeansZeroConfidenceWithoutAskingTheEngine() {
        TicketSession session = classifiedSession("t-2");

        StageResult result = new RetrieverStage(engine, new StubKnowledgeSearch(), store, metrics)
            .run(session, "Where is my parcel?");

        assertEquals(new RoutingSignal.RetrievalResult(0.0, 0), result.signal());
        assertEquals(0, engine.requests().size());
        assertEquals(0.0, store.load("t-2").orElseThrow().retrievalConfidence());
    }

    @Test
    void searchFailurePropagatesAsCollaboratorFailure() {
        TicketSession session = classifiedSession("t-3");
        var knowledge = StubKnowledgeSearch.withPasswordArticle().failTimes(1);

        var ex = assertThrows(CollaboratorFailureException.class,
            () -> new RetrieverStage(engine, knowledge, store, metrics).run(session, "I forgot my password"));

        assertEquals(CollaboratorKind.KNOWLEDGE_SEARCH, ex.kind());
        assertNull(store.load("t-3").orElseThrow().retrievalConfidence());
    }

    @Test
    void digestListsEveryArticle() {
        var assessment = new RetrieverStage.Assessment(0.5, 2, "- A: relevant\n");
        String digest = RetrieverStage.digest(assessment, List.of(
            new KnowledgeArticle("kb-1", "A", "alpha", 0.9),
            new KnowledgeArticle("kb-2", "B", "beta", 0.8)));

        assertTrue(digest.startsWith("RETRIEVAL_RESULT: confidence=0.50, articles_found=2"));
        assertTrue(digest.contains("### A [kb-1]\nalpha"));
        assertTrue(digest.contains("### B [kb-2]\nbeta"));
    }
}
