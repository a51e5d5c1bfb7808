package com.example.udahub.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.udahub.model.IssueType;
import com.example.udahub.model.MessageRole;
import com.example.udahub.model.PreferenceRecord;
import com.example.udahub.model.PreferenceUpdate;
import com.example.udahub.model.SessionUpdate;
import com.example.udahub.model.TicketMessage;
import com.example.udahub.model.TicketSession;
import com.example.udahub.model.TicketStatus;
import com.example.udahub.model.Urgency;
import com.example.udahub.routing.SignalType;
import com.example.udahub.routing.StageName;

@Repository
@ConditionalOnProperty(name = "app.session-store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

    private static final String SELECT_TICKET = """
        SELECT session_id, external_user_id, issue_type, urgency, sentiment, status,
               retrieval_confidence, articles_found, last_signal, created_at, updated_at
        FROM tickets
        """;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcSessionStore(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    @Override
    public Optional<TicketSession> load(String sessionId) {
        return selectTicket(SELECT_TICKET + " WHERE session_id = ?", sessionId);
    }

    @Override
    public TicketSession open(String sessionId, String externalUserId, TicketMessage firstMessage) {
        Optional<TicketSession> existing = load(sessionId);
        if (existing.isPresent()) {
            return existing.get();
        }
        TicketSession session = TicketSession.open(sessionId, externalUserId, firstMessage);
        try {
            tx.executeWithoutResult(status -> {
                jdbc.update("""
                    INSERT INTO tickets (session_id, external_user_id, status, articles_found, created_at, updated_at)
                    VALUES (?, ?, ?, 0, ?, ?)
                    """,
                    sessionId, externalUserId, session.status().name(),
                    Timestamp.from(session.createdAt()), Timestamp.from(session.updatedAt()));
                insertMessages(sessionId, session.conversation());
            });
            log.info("Opened ticket {} (user={})", sessionId, externalUserId);
            return session;
        } catch (DuplicateKeyException e) {
            log.debug("Ticket {} opened concurrently, using stored session", sessionId);
            return load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        }
    }

    @Override
    public TicketSession commit(String sessionId, SessionUpdate update) {
        return tx.execute(status -> {
            TicketSession current = selectTicket(SELECT_TICKET + " WHERE session_id = ? FOR UPDATE", sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            TicketSession next = current.apply(update, Instant.now());
            jdbc.update("""
                UPDATE tickets SET issue_type = ?, urgency = ?, sentiment = ?, status = ?,
                       retrieval_confidence = ?, articles_found = ?, last_signal = ?, updated_at = ?
                WHERE session_id = ?
                """,
                name(next.issueType()), name(next.urgency()), next.sentiment(), next.status().name(),
                next.retrievalConfidence(), next.articlesFound(), name(next.lastSignal()),
                Timestamp.from(next.updatedAt()), sessionId);
            insertMessages(sessionId, update.messages());
            return next;
        });
    }

    @Override
    public TicketSession appendMessage(String sessionId, TicketMessage message) {
        return tx.execute(status -> {
            TicketSession current = selectTicket(SELECT_TICKET + " WHERE session_id = ? FOR UPDATE", sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            TicketSession next = current.withMessage(message, Instant.now());
            jdbc.update("UPDATE tickets SET updated_at = ? WHERE session_id = ?",
                Timestamp.from(next.updatedAt()), sessionId);
            insertMessages(sessionId, List.of(message));
            return next;
        });
    }

    @Override
    public List<TicketSession> findByExternalUser(String externalUserId) {
        if (externalUserId == null) {
            return List.of();
        }
        List<TicketSession> headers = jdbc.query(
            SELECT_TICKET + " WHERE external_user_id = ? ORDER BY created_at",
            (rs, i) -> mapTicket(rs, List.of()), externalUserId);
        return headers.stream()
            .map(t -> withConversation(t, loadMessages(t.sessionId())))
            .toList();
    }

    @Override
    public PreferenceRecord getPreferences(String userId) {
        return selectPreferences("SELECT user_id, language, channel, notes, updated_at FROM user_preferences WHERE user_id = ?", userId)
            .orElse(PreferenceRecord.empty(userId));
    }

    @Override
    public PreferenceRecord putPreferences(String userId, PreferenceUpdate update) {
        try {
            return tx.execute(status -> upsertPreferences(userId, update));
        } catch (DuplicateKeyException e) {
            // Another ticket created the record first; merge into it.
            return tx.execute(status -> upsertPreferences(userId, update));
        }
    }

    private PreferenceRecord upsertPreferences(String userId, PreferenceUpdate update) {
        Optional<PreferenceRecord> current = selectPreferences(
            "SELECT user_id, language, channel, notes, updated_at FROM user_preferences WHERE user_id = ? FOR UPDATE",
            userId);
        PreferenceRecord merged = current.orElse(PreferenceRecord.empty(userId)).merge(update, Instant.now());
        if (current.isPresent()) {
            jdbc.update("UPDATE user_preferences SET language = ?, channel = ?, notes = ?, updated_at = ? WHERE user_id = ?",
                merged.language(), merged.channel(), merged.notes(), Timestamp.from(merged.updatedAt()), userId);
        } else {
            jdbc.update("INSERT INTO user_preferences (user_id, language, channel, notes, updated_at) VALUES (?, ?, ?, ?, ?)",
                userId, merged.language(), merged.channel(), merged.notes(), Timestamp.from(merged.updatedAt()));
        }
        return merged;
    }

    private Optional<TicketSession> selectTicket(String sql, String sessionId) {
        List<TicketSession> rows = jdbc.query(sql, (rs, i) -> mapTicket(rs, List.of()), sessionId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(withConversation(rows.get(0), loadMessages(sessionId)));
    }

    private Optional<PreferenceRecord> selectPreferences(String sql, String userId) {
        List<PreferenceRecord> rows = jdbc.query(sql, (rs, i) -> new PreferenceRecord(
            rs.getString("user_id"),
            rs.getString("language"),
            rs.getString("channel"),
            rs.getString("notes"),
            instant(rs, "updated_at")), userId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<TicketMessage> loadMessages(String sessionId) {
        return jdbc.query(
            "SELECT role, stage, content, created_at FROM ticket_messages WHERE session_id = ? ORDER BY id",
            (rs, i) -> new TicketMessage(
                MessageRole.valueOf(rs.getString("role")),
                rs.getString("stage") != null ? StageName.valueOf(rs.getString("stage")) : null,
                rs.getString("content"),
                instant(rs, "created_at")),
            sessionId);
    }

    private void insertMessages(String sessionId, List<TicketMessage> messages) {
        for (var msg : messages) {
            jdbc.update(
                "INSERT INTO ticket_messages (session_id, role, stage, content, created_at) VALUES (?, ?, ?, ?, ?)",
                sessionId, msg.role().name(), name(msg.stage()), msg.content(), Timestamp.from(msg.createdAt()));
        }
    }

    private static TicketSession mapTicket(ResultSet rs, List<TicketMessage> conversation) throws SQLException {
        String issueType = rs.getString("issue_type");
        String urgency = rs.getString("urgency");
        String lastSignal = rs.getString("last_signal");
        return new TicketSession(
            rs.getString("session_id"),
            rs.getString("external_user_id"),
            issueType != null ? IssueType.valueOf(issueType) : null,
            urgency != null ? Urgency.valueOf(urgency) : null,
            rs.getString("sentiment"),
            TicketStatus.valueOf(rs.getString("status")),
            rs.getObject("retrieval_confidence", Double.class),
            rs.getInt("articles_found"),
            lastSignal != null ? SignalType.valueOf(lastSignal) : null,
            conversation,
            instant(rs, "created_at"),
            instant(rs, "updated_at"));
    }

    private static TicketSession withConversation(TicketSession t, List<TicketMessage> conversation) {
        return new TicketSession(t.sessionId(), t.externalUserId(), t.issueType(), t.urgency(), t.sentiment(),
            t.status(), t.retrievalConfidence(), t.articlesFound(), t.lastSignal(), conversation,
            t.createdAt(), t.updatedAt());
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private static String name(Enum<?> value) {
        return value != null ? value.name() : null;
    }
}
