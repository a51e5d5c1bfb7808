package com.example.udahub.model;

public enum MessageRole {
    USER,
    // customer-visible reply
    AGENT,
    // internal note, never shown to the customer
    SYSTEM
}
