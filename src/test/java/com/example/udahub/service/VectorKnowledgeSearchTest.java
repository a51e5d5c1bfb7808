package com.example.udahub.service;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import com.example.udahub.config.RoutingProperties;
import com.example.udahub.model.KnowledgeArticle;
import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorKnowledgeSearchTest {

    private final VectorStore vectorStore = mock(VectorStore.class);
    private final VectorKnowledgeSearch search = new VectorKnowledgeSearch(vectorStore, RoutingProperties.defaults());

    @Test
    void mapsDocumentsToArticlesInRankOrder() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
            Document.builder().id("d1").text("Reset steps")
                .metadata(Map.of("article_id", "kb-001", "title", "Password reset")).score(0.92).build(),
            Document.builder().id("d2").text("2FA help").score(0.71).build()));

        List<KnowledgeArticle> articles = search.search("login: forgot password");

        assertEquals(2, articles.size());
        assertEquals(new KnowledgeArticle("kb-001", "Password reset", "Reset steps", 0.92), articles.get(0));
        assertEquals("d2", articles.get(1).articleId());
        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(request.capture());
        assertEquals(3, request.getValue().getTopK());
        assertEquals("login: forgot password", request.getValue().getQuery());
    }

    @Test
    void storeFailureIsKnowledgeSearchFailure() {
        when(vectorStore.similaritySearch(any(SearchRequest.class)))
            .thenThrow(new IllegalStateException("connection refused"));

        var ex = assertThrows(CollaboratorFailureException.class, () -> search.search("anything"));

        assertEquals(CollaboratorKind.KNOWLEDGE_SEARCH, ex.kind());
    }
}
