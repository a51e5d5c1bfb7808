package com.example.udahub.repository;

import java.util.List;
import java.util.Optional;

import com.example.udahub.model.PreferenceRecord;
import com.example.udahub.model.PreferenceUpdate;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;

/**
 * Durable per-ticket state plus customer preferences.
 *
 * <p>Every method is a complete unit of work: when it returns, the change is visible to any
 * later {@link #load} on any node. Sessions are never deleted.
 */
public interface SessionStore {

    Optional<TicketSession> load(String sessionId);

    /**
     * Creates the session with its first customer message, or returns the stored session when it
     * already exists (the message is then not appended).
     */
    TicketSession open(String sessionId, String externalUserId, TicketMessage firstMessage);

    /**
     * Atomic read-modify-write. Only the fields set on the update change; its messages are appended
     * in the same step.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws com.example.udahub.model.IllegalStatusTransitionException if the update would
     *         reverse or switch a terminal status
     */
    TicketSession commit(String sessionId, SessionUpdate update);

    TicketSession appendMessage(String sessionId, TicketMessage message);

    List<TicketSession> findByExternalUser(String externalUserId);

    PreferenceRecord getPreferences(String userId);

    PreferenceRecord putPreferences(String userId, PreferenceUpdate update);
}
