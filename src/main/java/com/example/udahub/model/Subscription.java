package com.example.udahub.model;

import java.time.Instant;

public record Subscription(
    String userId,
    String status,
    String tier,
    Instant startedAt,
    Instant endedAt
) {}
