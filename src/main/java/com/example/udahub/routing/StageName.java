package com.example.udahub.routing;

import java.util.Locale;

public enum StageName {
    CLASSIFIER, RETRIEVER, RESOLVER, ESCALATION;

    public String spanName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
