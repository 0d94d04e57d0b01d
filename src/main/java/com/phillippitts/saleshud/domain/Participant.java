package com.phillippitts.saleshud.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Meeting attendee as supplied by the caller when a meeting starts.
 *
 * @param id      stable identifier; generated when absent
 * @param name    display name (must not be blank)
 * @param email   optional contact address
 * @param role    meeting role, defaults to attendee
 * @param company optional company name
 * @param title   optional job title
 */
public record Participant(
        String id,
        String name,
        String email,
        ParticipantRole role,
        String company,
        String title
) {

    public Participant {
        Objects.requireNonNull(name, "Participant name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Participant name must not be blank");
        }
        id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        role = role == null ? ParticipantRole.ATTENDEE : role;
    }

    public static Participant of(String name, ParticipantRole role) {
        return new Participant(null, name, null, role, null, null);
    }
}
