package com.example.udahub.failure;

public enum CollaboratorKind {
    REASONING_ENGINE,
    KNOWLEDGE_SEARCH,
    DATA_SOURCE
}
