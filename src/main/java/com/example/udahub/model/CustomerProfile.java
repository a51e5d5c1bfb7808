package com.example.udahub.model;

public record CustomerProfile(
    String userId,
    String fullName,
    String email,
    boolean blocked
) {}
