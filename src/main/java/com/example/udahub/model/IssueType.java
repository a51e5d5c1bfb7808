package com.example.udahub.model;

import java.util.Locale;

public enum IssueType {
    LOGIN, BILLING, RESERVATION, SUBSCRIPTION, ACCOUNT, GENERAL;

    public static IssueType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("issue_type is missing");
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
