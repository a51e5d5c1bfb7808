package com.example.udahub.repository;

import java.util.List;
import java.util.Optional;

import com.example.udahub.model.CustomerProfile;
import com.example.udahub.model.Experience;
import com.example.udahub.model.Reservation;
import com.example.udahub.model.Subscription;

/**
 * Read-only view of the customer platform (users, subscriptions, reservations, experiences).
 * Lookups that find nothing return empty results; an unreachable source raises
 * {@link com.example.udahub.failure.CollaboratorFailureException}.
 */
public interface CustomerDirectory {

    Optional<CustomerProfile> findUser(String userId);

    Optional<Subscription> findSubscription(String userId);

    List<Reservation> findReservations(String userId);

    Optional<Experience> findExperience(String experienceId);
}
