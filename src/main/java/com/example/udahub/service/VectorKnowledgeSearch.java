package com.example.udahub.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Service;

import com.example.udahub.config.RoutingProperties;
import com.example.udahub.model.KnowledgeArticle;
import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;

import io.opentelemetry.api.trace.Span;

@Service
public class VectorKnowledgeSearch implements KnowledgeSearch {

    private static final Logger log = LoggerFactory.getLogger(VectorKnowledgeSearch.class);

    private final VectorStore vectorStore;
    private final int topK;

    public VectorKnowledgeSearch(VectorStore vectorStore, RoutingProperties properties) {
        this.vectorStore = vectorStore;
        this.topK = properties.knowledgeTopK();
    }

    @Override
    public List<KnowledgeArticle> search(String query) {
        List<Document> results;
        try {
            results = vectorStore.similaritySearch(
                SearchRequest.builder()
                    .query(query)
                    .topK(topK)
                    .build());
        } catch (RuntimeException e) {
            log.error("Knowledge search failed: {}", e.getMessage());
            throw new CollaboratorFailureException(CollaboratorKind.KNOWLEDGE_SEARCH,
                "Knowledge search failed: " + e.getMessage(), e);
        }
        if (results == null) {
            return List.of();
        }

        Span span = Span.current();
        span.setAttribute("udahub.kb.matches_found", results.size());
        if (!results.isEmpty() && results.get(0).getScore() != null) {
            span.setAttribute("udahub.kb.top_similarity", results.get(0).getScore());
        }

        log.debug("Knowledge search returned {} matches for query: {}", results.size(),
            query.length() > 80 ? query.substring(0, 80) + "..." : query);
        return results.stream().map(VectorKnowledgeSearch::toArticle).toList();
    }

    private static KnowledgeArticle toArticle(Document doc) {
        Object id = doc.getMetadata().get("article_id");
        Object title = doc.getMetadata().get("title");
        return new KnowledgeArticle(
            id != null ? id.toString() : doc.getId(),
            title != null ? title.toString() : "",
            doc.getText(),
            doc.getScore());
    }
}
