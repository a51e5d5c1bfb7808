package com.example.udahub.service;

import java.util.List;

import com.example.udahub.model.KnowledgeArticle;

public interface KnowledgeSearch {

    /**
     * Articles ordered by decreasing relevance, possibly empty.
     *
     * @throws com.example.udahub.failure.CollaboratorFailureException if the search backend fails
     */
    List<KnowledgeArticle> search(String query);
}
