package com.example.udahub.model;

import java.util.Locale;

public enum Urgency {
    HIGH, MEDIUM, LOW;

    public static Urgency fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("urgency is missing");
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
