package com.example.udahub.model;

import java.time.Instant;

public record Experience(
    String experienceId,
    String title,
    String location,
    Instant startsAt,
    boolean premium,
    int slotsAvailable
) {}
