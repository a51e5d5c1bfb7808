package com.example.udahub.repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.example.udahub.model.PreferenceRecord;
import com.example.udahub.model.PreferenceUpdate;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;

@Repository
@ConditionalOnProperty(name = "app.session-store", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, TicketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, PreferenceRecord> preferences = new ConcurrentHashMap<>();

    @Override
    public Optional<TicketSession> load(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public TicketSession open(String sessionId, String externalUserId, TicketMessage firstMessage) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.info("Opened ticket {} (user={})", id, externalUserId);
            return TicketSession.open(id, externalUserId, firstMessage);
        });
    }

    @Override
    public TicketSession commit(String sessionId, SessionUpdate update) {
        TicketSession updated = sessions.computeIfPresent(sessionId,
            (id, current) -> current.apply(update, Instant.now()));
        if (updated == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return updated;
    }

    @Override
    public TicketSession appendMessage(String sessionId, TicketMessage message) {
        TicketSession updated = sessions.computeIfPresent(sessionId,
            (id, current) -> current.withMessage(message, Instant.now()));
        if (updated == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return updated;
    }

    @Override
    public List<TicketSession> findByExternalUser(String externalUserId) {
        if (externalUserId == null) {
            return List.of();
        }
        return sessions.values().stream()
            .filter(s -> externalUserId.equals(s.externalUserId()))
            .sorted(Comparator.comparing(TicketSession::createdAt))
            .toList();
    }

    @Override
    public PreferenceRecord getPreferences(String userId) {
        return preferences.getOrDefault(userId, PreferenceRecord.empty(userId));
    }

    @Override
    public PreferenceRecord putPreferences(String userId, PreferenceUpdate update) {
        return preferences.merge(userId, PreferenceRecord.empty(userId).merge(update, Instant.now()),
            (current, ignored) -> current.merge(update, Instant.now()));
    }
}
