package com.phillippitts.saleshud.domain;

import java.util.Locale;

public enum ParticipantRole {
    HOST, PRESENTER, ATTENDEE;

    /** Blank input defaults to {@link #ATTENDEE}. */
    public static ParticipantRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ATTENDEE;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
