package com.phillippitts.saleshud.domain;

import java.util.Locale;

public enum MeetingPlatform {
    ZOOM, TEAMS, MEET, WEBEX, OTHER, NONE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for unknown platforms
     */
    public static MeetingPlatform fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
