package com.example.udahub.model;

/**
 * Partial preference write. Null fields leave the stored value untouched.
 */
public record PreferenceUpdate(String language, String channel, String notes) {

    public boolean isEmpty() {
        return language == null && channel == null && notes == null;
    }
}
