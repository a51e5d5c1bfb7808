package com.example.udahub.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.udahub.model.CustomerProfile;
import com.example.udahub.model.Experience;
import com.example.udahub.model.Reservation;
import com.example.udahub.model.Subscription;
import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.failure.CollaboratorKind;

@Repository
public class JdbcCustomerDirectory implements CustomerDirectory {

    private static final Logger log = LoggerFactory.getLogger(JdbcCustomerDirectory.class);

    private final JdbcTemplate jdbc;

    public JdbcCustomerDirectory(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<CustomerProfile> findUser(String userId) {
        return query("user " + userId, () -> first(jdbc.query(
            "SELECT user_id, full_name, email, is_blocked FROM customer_users WHERE user_id = ?",
            (rs, i) -> new CustomerProfile(
                rs.getString("user_id"),
                rs.getString("full_name"),
                rs.getString("email"),
                rs.getBoolean("is_blocked")),
            userId)));
    }

    @Override
    public Optional<Subscription> findSubscription(String userId) {
        return query("subscription of " + userId, () -> first(jdbc.query(
            """
            SELECT user_id, status, tier, started_at, ended_at
            FROM customer_subscriptions
            WHERE user_id = ?
            ORDER BY started_at DESC
            """,
            (rs, i) -> new Subscription(
                rs.getString("user_id"),
                rs.getString("status"),
                rs.getString("tier"),
                instant(rs, "started_at"),
                instant(rs, "ended_at")),
            userId)));
    }

    @Override
    public List<Reservation> findReservations(String userId) {
        return query("reservations of " + userId, () -> jdbc.query(
            """
            SELECT r.reservation_id, r.status, e.experience_id, e.title, e.location, e.starts_at, e.is_premium
            FROM customer_reservations r JOIN experiences e ON r.experience_id = e.experience_id
            WHERE r.user_id = ?
            ORDER BY e.starts_at
            """,
            (rs, i) -> new Reservation(
                rs.getString("reservation_id"),
                rs.getString("experience_id"),
                rs.getString("title"),
                rs.getString("location"),
                instant(rs, "starts_at"),
                rs.getBoolean("is_premium"),
                rs.getString("status")),
            userId));
    }

    @Override
    public Optional<Experience> findExperience(String experienceId) {
        return query("experience " + experienceId, () -> first(jdbc.query(
            "SELECT experience_id, title, location, starts_at, is_premium, slots_available FROM experiences WHERE experience_id = ?",
            (rs, i) -> new Experience(
                rs.getString("experience_id"),
                rs.getString("title"),
                rs.getString("location"),
                instant(rs, "starts_at"),
                rs.getBoolean("is_premium"),
                rs.getInt("slots_available")),
            experienceId)));
    }

    private <T> T query(String what, Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (DataAccessException e) {
            log.error("Customer directory lookup failed for {}: {}", what, e.getMessage());
            throw new CollaboratorFailureException(CollaboratorKind.DATA_SOURCE,
                "Customer directory unavailable for " + what, e);
        }
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
