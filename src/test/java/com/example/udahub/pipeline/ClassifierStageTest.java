package com.example.udahub.pipeline;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.udahub.llm.LlmResponse;
import com.example.udahub.llm.ReasoningRequest;
import com.example.udahub.model.IssueType;
import com.example.udahub.model.MessageRole;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.model.Urgency;
import com.example.udahub.repository.InMemorySessionStore;
import com.example.udahub.routing.RoutingSignal;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;
import com.example.udahub.testsupport.ScriptedReasoningEngine;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierStageTest {

    private final ClassifierStage classifier = new ClassifierStage(null, null);

    static Stream<Arguments> classificationCases() {
        return Stream.of(
            Arguments.of(
                """
                {"issue_type": "login", "urgency": "medium", "sentiment": "frustrated", "summary": "cannot sign in"}
                """,
                IssueType.LOGIN, Urgency.MEDIUM, "frustrated"
            ),
            Arguments.of(
                """
                {"issue_type": "BILLING", "urgency": "HIGH", "sentiment": "Negative"}
                """,
                IssueType.BILLING, Urgency.HIGH, "negative"
            ),
            Arguments.of(
                """
                ```json
                {"issue_type": "reservation", "urgency": "low", "sentiment": "positive", "summary": "waitlist question"}
                ```
                """,
                IssueType.RESERVATION, Urgency.LOW, "positive"
            ),
            Arguments.of(
                """
                {"issue_type": "general", "urgency": "low"}
                """,
                IssueType.GENERAL, Urgency.LOW, "neutral"
            )
        );
    }

    @ParameterizedTest
    @MethodSource("classificationCases")
    void parsesClassification(String json, IssueType issueType, Urgency urgency, String sentiment) {
        var result = classifier.parseResponse(LlmResponse.of(json));

        assertEquals(issueType, result.issueType());
        assertEquals(urgency, result.urgency());
        assertEquals(sentiment, result.sentiment());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "not json",
        "{\"issue_type\": \"shipping\", \"urgency\": \"low\"}",
        "{\"issue_type\": \"login\", \"urgency\": \"critical\"}",
        "{\"issue_type\": \"login\"}",
        "{\"urgency\": \"low\"}",
        "[\"login\", \"low\"]",
        ""
    })
    void rejectsMalformedClassification(String content) {
        assertThrows(MalformedReasoningOutputException.class,
            () -> classifier.parseResponse(LlmResponse.of(content)));
    }

    @Test
    void commitsClassificationWithInternalNote() {
        var store = new InMemorySessionStore();
        var engine = new ScriptedReasoningEngine()
            .respond("classify", ScriptedReasoningEngine.classification("account", "high"));
        TicketSession session = store.open("t-1", "u-1", TicketMessage.user("My account is blocked"));

        StageResult result = new ClassifierStage(engine, store).run(session, "My account is blocked");

        assertEquals(new RoutingSignal.Classified(IssueType.ACCOUNT, Urgency.HIGH), result.signal());
        TicketSession stored = store.load("t-1").orElseThrow();
        assertEquals(IssueType.ACCOUNT, stored.issueType());
        assertEquals(Urgency.HIGH, stored.urgency());
        assertEquals(SignalType.CLASSIFIED, stored.lastSignal());
        assertNull(stored.retrievalConfidence());
        TicketMessage note = stored.latestNote(StageName.CLASSIFIER).orElseThrow();
        assertEquals(MessageRole.SYSTEM, note.role());
        assertTrue(note.content().startsWith("CLASSIFIED: issue_type=account, urgency=high, sentiment=neutral"));
        assertTrue(stored.lastCustomerMessage().isEmpty());
        assertEquals(ReasoningRequest.ModelTier.FAST, engine.requests().get(0).tier());
    }

    @Test
    void malformedOutputCommitsNothing() {
        var store = new InMemorySessionStore();
        var engine = new ScriptedReasoningEngine().respond("classify", "{\"issue_type\": \"weather\"}");
        TicketSession session = store.open("t-2", null, TicketMessage.user("hello"));

        assertThrows(MalformedReasoningOutputException.class,
            () -> new ClassifierStage(engine, store).run(session, "hello"));

        assertEquals(session, store.load("t-2").orElseThrow());
    }
}
