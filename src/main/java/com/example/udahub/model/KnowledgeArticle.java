package com.example.udahub.model;

public record KnowledgeArticle(
    String articleId,
    String title,
    String content,
    Double score
) {}
