package com.example.udahub.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Seeds the vector store with the help-center articles on first start.
 */
@Service
public class KnowledgeBaseLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ArticleLine(String id, String title, String content, String tags) {}

    private final VectorStore vectorStore;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Resource articles;
    private final String tableName;

    public KnowledgeBaseLoader(VectorStore vectorStore, JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                               @Value("${app.knowledge.articles:classpath:knowledge/articles.jsonl}") Resource articles,
                               @Value("${spring.ai.vectorstore.pgvector.table-name:kb_vectors}") String tableName) {
        this.vectorStore = vectorStore;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.articles = articles;
        this.tableName = tableName;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Integer existing = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Integer.class);
        if (existing != null && existing > 0) {
            log.info("Vector store already populated with {} documents, skipping KB load", existing);
            return;
        }

        log.info("Loading KB articles from {} into vector store...", articles.getDescription());
        List<Document> docs;
        try (InputStream in = articles.getInputStream()) {
            docs = parse(in);
        }
        vectorStore.add(docs);
        log.info("Loaded {} KB articles into vector store", docs.size());
    }

    List<Document> parse(InputStream in) throws IOException {
        List<Document> docs = new ArrayList<>();
        var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) continue;
            ArticleLine article = objectMapper.readValue(line, ArticleLine.class);
            if (article.content() == null || article.content().isBlank()) {
                log.warn("Skipping KB line {}: no content", lineNumber);
                continue;
            }
            String id = article.id() != null ? article.id() : "line-" + lineNumber;
            String title = article.title() != null ? article.title() : "";
            Map<String, Object> metadata = Map.of(
                "article_id", id,
                "title", title,
                "tags", article.tags() != null ? article.tags() : "",
                "source", "kb_article"
            );
            String text = title.isEmpty() ? article.content() : title + "\n\n" + article.content();
            docs.add(new Document(text, metadata));
        }
        return docs;
    }
}
