package com.example.udahub.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import com.example.udahub.model.CustomerProfile;
import com.example.udahub.model.Experience;
import com.example.udahub.model.PreferenceRecord;
import com.example.udahub.model.PreferenceUpdate;
import com.example.udahub.model.Reservation;
import com.example.udahub.model.Subscription;
import com.example.udahub.failure.CollaboratorFailureException;
import com.example.udahub.repository.CustomerDirectory;
import com.example.udahub.repository.SessionStore;
import com.example.udahub.telemetry.RoutingMetrics;

/**
 * Account lookups the resolver's reasoning engine may call while drafting a reply. Failures are
 * reported back to the model as an {@code error} entry rather than thrown.
 */
@Component
public class AccountTools {

    private static final Logger log = LoggerFactory.getLogger(AccountTools.class);

    private final CustomerDirectory directory;
    private final SessionStore sessionStore;
    private final RoutingMetrics metrics;

    public AccountTools(CustomerDirectory directory, SessionStore sessionStore, RoutingMetrics metrics) {
        this.directory = directory;
        this.sessionStore = sessionStore;
        this.metrics = metrics;
    }

    @Tool(description = "Look up a CultPass customer's profile: name, email and whether the account is blocked")
    public Map<String, Object> getUserInfo(
        @ToolParam(description = "CultPass user ID") String userId
    ) {
        log.info("Tool call: getUserInfo({})", userId);
        return call("getUserInfo", () -> directory.findUser(userId)
            .map(AccountTools::profileMap)
            .orElseGet(() -> Map.of("error", "User not found: " + userId)));
    }

    @Tool(description = "Get the customer's subscription status and tier")
    public Map<String, Object> getSubscription(
        @ToolParam(description = "CultPass user ID") String userId
    ) {
        log.info("Tool call: getSubscription({})", userId);
        return call("getSubscription", () -> directory.findSubscription(userId)
            .map(AccountTools::subscriptionMap)
            .orElseGet(() -> Map.of("error", "No subscription found for user: " + userId)));
    }

    @Tool(description = "List the customer's experience reservations with title, location, date and status")
    public Map<String, Object> getReservations(
        @ToolParam(description = "CultPass user ID") String userId
    ) {
        log.info("Tool call: getReservations({})", userId);
        return call("getReservations", () -> {
            List<Map<String, Object>> rows = directory.findReservations(userId).stream()
                .map(AccountTools::reservationMap)
                .toList();
            return Map.of("user_id", userId, "reservations", rows);
        });
    }

    @Tool(description = "Check an experience's date, location, premium flag and remaining slots")
    public Map<String, Object> getExperienceAvailability(
        @ToolParam(description = "Experience ID") String experienceId
    ) {
        log.info("Tool call: getExperienceAvailability({})", experienceId);
        return call("getExperienceAvailability", () -> directory.findExperience(experienceId)
            .map(AccountTools::experienceMap)
            .orElseGet(() -> Map.of("error", "Experience not found: " + experienceId)));
    }

    @Tool(description = "Store the customer's preferences for future tickets. Only the fields given are changed.")
    public Map<String, Object> updateUserPreferences(
        @ToolParam(description = "CultPass user ID") String userId,
        @ToolParam(description = "Preferred language, e.g. en or fr", required = false) String language,
        @ToolParam(description = "Preferred contact channel, e.g. email or chat", required = false) String channel,
        @ToolParam(description = "Free-form notes about the customer", required = false) String notes
    ) {
        log.info("Tool call: updateUserPreferences(userId={}, language={}, channel={})", userId, language, channel);
        return call("updateUserPreferences", () -> {
            PreferenceRecord stored = sessionStore.putPreferences(userId,
                new PreferenceUpdate(blankToNull(language), blankToNull(channel), blankToNull(notes)));
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("user_id", stored.userId());
            result.put("language", stored.language());
            result.put("channel", stored.channel());
            result.put("notes", stored.notes());
            return result;
        });
    }

    private Map<String, Object> call(String toolName, Supplier<Map<String, Object>> lookup) {
        try {
            Map<String, Object> result = lookup.get();
            metrics.recordToolCall(toolName, !result.containsKey("error"));
            return result;
        } catch (CollaboratorFailureException e) {
            log.warn("Tool {} failed: {}", toolName, e.getMessage());
            metrics.recordToolCall(toolName, false);
            return Map.of("error", "Lookup temporarily unavailable, do not retry: " + e.getMessage());
        }
    }

    private static Map<String, Object> profileMap(CustomerProfile profile) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("user_id", profile.userId());
        map.put("full_name", profile.fullName());
        map.put("email", profile.email());
        map.put("is_blocked", profile.blocked());
        return map;
    }

    private static Map<String, Object> subscriptionMap(Subscription subscription) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("user_id", subscription.userId());
        map.put("status", subscription.status());
        map.put("tier", subscription.tier());
        map.put("started_at", subscription.startedAt() != null ? subscription.startedAt().toString() : null);
        map.put("ended_at", subscription.endedAt() != null ? subscription.endedAt().toString() : null);
        return map;
    }

    private static Map<String, Object> reservationMap(Reservation reservation) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("reservation_id", reservation.reservationId());
        map.put("experience_id", reservation.experienceId());
        map.put("title", reservation.experienceTitle());
        map.put("location", reservation.location());
        map.put("starts_at", reservation.startsAt() != null ? reservation.startsAt().toString() : null);
        map.put("is_premium", reservation.premium());
        map.put("status", reservation.status());
        return map;
    }

    private static Map<String, Object> experienceMap(Experience experience) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("experience_id", experience.experienceId());
        map.put("title", experience.title());
        map.put("location", experience.location());
        map.put("starts_at", experience.startsAt() != null ? experience.startsAt().toString() : null);
        map.put("is_premium", experience.premium());
        map.put("slots_available", experience.slotsAvailable());
        map.put("available", experience.slotsAvailable() > 0);
        return map;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
