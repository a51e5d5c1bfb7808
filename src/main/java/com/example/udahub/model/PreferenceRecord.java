package com.example.udahub.model;

import java.time.Instant;

public record PreferenceRecord(
    String userId,
    String language,
    String channel,
    String notes,
    Instant updatedAt
) {

    public static PreferenceRecord empty(String userId) {
        return new PreferenceRecord(userId, null, null, null, null);
    }

    public PreferenceRecord merge(PreferenceUpdate update, Instant now) {
        return new PreferenceRecord(
            userId,
            update.language() != null ? update.language() : language,
            update.channel() != null ? update.channel() : channel,
            update.notes() != null ? update.notes() : notes,
            now);
    }

    public boolean isEmpty() {
        return language == null && channel == null && notes == null;
    }
}
