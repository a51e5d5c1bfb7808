package com.example.udahub.model;

import java.time.Instant;

import com.example.udahub.routing.StageName;

public record TicketMessage(
    MessageRole role,
    StageName stage,
    String content,
    Instant createdAt
) {

    public static TicketMessage user(String content) {
        return new TicketMessage(MessageRole.USER, null, content, Instant.now());
    }

    public static TicketMessage agent(StageName stage, String content) {
        return new TicketMessage(MessageRole.AGENT, stage, content, Instant.now());
    }

    public static TicketMessage internal(StageName stage, String content) {
        return new TicketMessage(MessageRole.SYSTEM, stage, content, Instant.now());
    }

    public boolean customerVisible() {
        return role == MessageRole.AGENT;
    }
}
