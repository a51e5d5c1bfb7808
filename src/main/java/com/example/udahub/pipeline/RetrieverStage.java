package com.example.udahub.pipeline;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.udahub.llm.LlmResponse;
import com.example.udahub.llm.ReasoningEngine;
import com.example.udahub.llm.ReasoningRequest;
import com.example.udahub.model.KnowledgeArticle;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.routing.RoutingSignal;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;
import com.example.udahub.service.KnowledgeSearch;
import com.example.udahub.telemetry.RoutingMetrics;
import com.fasterxml.jackson.databind.JsonNode;

import io.opentelemetry.api.trace.Span;

@Component
public class RetrieverStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(RetrieverStage.class);

    private static final String SYSTEM_PROMPT = """
        You are the knowledge retriever for UDA-Hub. You are given a customer ticket and the
        knowledge base articles a search returned for it. Judge, from the article content alone,
        whether the knowledge base is enough to resolve the customer's issue. Do not answer the customer.

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "confidence": 0.0-1.0,
          "articles_found": <number of relevant articles>,
          "retrieved_articles": [
            {"title": "...", "summary": "...", "relevance": "one sentence on why it applies"}
          ]
        }

        Confidence scale:
        - 0.8-1.0: articles directly and fully answer the question
        - 0.6-0.79: relevant, partially answer it; account data can fill the gaps
        - 0.4-0.59: only tangentially related
        - 0.0-0.39: nothing meaningfully addresses the issue
        """;

    record Assessment(double confidence, int articlesFound, String relevanceNotes) {}

    private final ReasoningEngine reasoningEngine;
    private final KnowledgeSearch knowledgeSearch;
    private final SessionStore sessionStore;
    private final RoutingMetrics metrics;

    public RetrieverStage(ReasoningEngine reasoningEngine, KnowledgeSearch knowledgeSearch,
                          SessionStore sessionStore, RoutingMetrics metrics) {
        this.reasoningEngine = reasoningEngine;
        this.knowledgeSearch = knowledgeSearch;
        this.sessionStore = sessionStore;
        this.metrics = metrics;
    }

    @Override
    public StageName name() {
        return StageName.RETRIEVER;
    }

    @Override
    public StageResult run(TicketSession session, String incomingMessage) {
        String query = session.issueType() != null
            ? session.issueType().wireName() + ": " + incomingMessage
            : incomingMessage;
        List<KnowledgeArticle> articles = knowledgeSearch.search(query);

        Assessment assessment;
        if (articles.isEmpty()) {
            // Nothing to judge: the engine is not consulted.
            assessment = new Assessment(0.0, 0, "");
        } else {
            LlmResponse response = reasoningEngine.infer(ReasoningRequest.fast("retrieve", SYSTEM_PROMPT,
                buildUserPrompt(session, incomingMessage, articles)));
            assessment = parseResponse(response, articles.size());
        }

        Span span = Span.current();
        span.setAttribute("udahub.kb.articles_returned", articles.size());
        span.setAttribute("udahub.retrieval.confidence", assessment.confidence());

        metrics.recordRetrievalConfidence(assessment.confidence(),
            session.urgency() != null ? session.urgency().wireName() : "unset");

        TicketSession updated = sessionStore.commit(session.sessionId(), SessionUpdate.builder()
            .retrieval(assessment.confidence(), assessment.articlesFound())
            .message(TicketMessage.internal(StageName.RETRIEVER, digest(assessment, articles)))
            .lastSignal(SignalType.RETRIEVAL_RESULT)
            .build());

        log.info("Retrieval complete for ticket {}: confidence={}, articles_found={}",
            session.sessionId(), String.format(Locale.ROOT, "%.2f", assessment.confidence()),
            assessment.articlesFound());
        return new StageResult(updated,
            new RoutingSignal.RetrievalResult(assessment.confidence(), assessment.articlesFound()));
    }

    Assessment parseResponse(LlmResponse response, int articlesReturned) {
        ReasoningOutput output = ReasoningOutput.parse("retrieve", response);
        double confidence = output.unitInterval("confidence");
        int articlesFound = output.nonNegativeInt("articles_found");
        if (articlesFound > articlesReturned) {
            throw new MalformedReasoningOutputException("retrieve",
                "articles_found " + articlesFound + " exceeds the " + articlesReturned + " articles searched");
        }

        var notes = new StringBuilder();
        for (JsonNode article : output.array("retrieved_articles")) {
            String title = article.path("title").asText("");
            if (title.isBlank()) continue;
            notes.append("- ").append(title);
            String relevance = article.path("relevance").asText("");
            if (!relevance.isBlank()) {
                notes.append(": ").append(relevance);
            }
            notes.append("\n");
        }
        return new Assessment(confidence, articlesFound, notes.toString());
    }

    /**
     * Internal note that carries the article material forward; the resolver has no search access
     * of its own and works from this note.
     */
    static String digest(Assessment assessment, List<KnowledgeArticle> articles) {
        var sb = new StringBuilder(String.format(Locale.ROOT,
            "RETRIEVAL_RESULT: confidence=%.2f, articles_found=%d",
            assessment.confidence(), assessment.articlesFound()));
        if (!assessment.relevanceNotes().isEmpty()) {
            sb.append("\n\nRelevance:\n").append(assessment.relevanceNotes());
        }
        for (KnowledgeArticle article : articles) {
            sb.append("\n\n### ").append(article.title()).append(" [").append(article.articleId()).append("]\n")
                .append(article.content());
        }
        return sb.toString();
    }

    private static String buildUserPrompt(TicketSession session, String incomingMessage,
                                          List<KnowledgeArticle> articles) {
        var sb = new StringBuilder();
        sb.append("Issue type: ")
            .append(session.issueType() != null ? session.issueType().wireName() : "unknown")
            .append("\nCustomer message:\n").append(incomingMessage)
            .append("\n\nSearch results:\n");
        for (int i = 0; i < articles.size(); i++) {
            KnowledgeArticle article = articles.get(i);
            sb.append("\n[").append(i + 1).append("] ").append(article.title()).append("\n")
                .append(article.content()).append("\n");
        }
        return sb.toString();
    }
}
