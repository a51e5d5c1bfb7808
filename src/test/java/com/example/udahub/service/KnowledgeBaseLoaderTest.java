package com.example.udahub.service;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseLoaderTest {

    private final KnowledgeBaseLoader loader =
        new KnowledgeBaseLoader(null, null, new ObjectMapper(), null, "kb_vectors");

    @Test
    void parsesBundledArticles() throws Exception {
        List<Document> docs;
        try (InputStream in = new ClassPathResource("knowledge/articles.jsonl").getInputStream()) {
            docs = loader.parse(in);
        }

        assertEquals(12, docs.size());
        Document first = docs.get(0);
        assertEquals("kb-001", first.getMetadata().get("article_id"));
        assertEquals("How to reset your password", first.getMetadata().get("title"));
        assertTrue(first.getText().startsWith("How to reset your password\n\n"));
        assertTrue(docs.stream().allMatch(d -> "kb_article".equals(d.getMetadata().get("source"))));
    }

    @Test
    void toleratesLinesWithoutIdOrTitle() throws Exception {
        String jsonl = """
            {"title": "Pausing a subscription", "content": "Pause from Settings > Plan."}

            {"id": "kb-x", "content": "Refunds take 5-7 business days."}
            {"id": "kb-y", "title": "Empty"}
            """;

        List<Document> docs = loader.parse(new ByteArrayInputStream(jsonl.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, docs.size());
        assertEquals("line-1", docs.get(0).getMetadata().get("article_id"));
        assertEquals("Pausing a subscription\n\nPause from Settings > Plan.", docs.get(0).getText());
        assertEquals("", docs.get(1).getMetadata().get("title"));
        assertEquals("Refunds take 5-7 business days.", docs.get(1).getText());
    }
}
