package com.phillippitts.saleshud.domain;

import java.util.Locale;

public enum MeetingType {
    SALES("sales"),
    DEMO("demo"),
    DISCOVERY("discovery"),
    FOLLOW_UP("follow-up"),
    CLOSING("closing"),
    SUPPORT("support");

    private final String value;

    MeetingType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses the wire value ({@code follow-up}) or the constant name ({@code FOLLOW_UP}).
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static MeetingType fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Meeting type must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (MeetingType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown meeting type: " + raw);
    }
}
