package com.example.udahub.model;

import java.time.Instant;

public record Reservation(
    String reservationId,
    String experienceId,
    String experienceTitle,
    String location,
    Instant startsAt,
    boolean premium,
    String status
) {}
