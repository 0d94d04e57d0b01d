package com.phillippitts.saleshud.domain;

import java.util.Locale;

public enum InsightPriority {
    HIGH, MEDIUM, LOW;

    /** Lenient parse used for AI output; unknown values map to {@link #MEDIUM}. */
    public static InsightPriority fromValue(String raw) {
        if (raw == null) {
            return MEDIUM;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high":
            case "critical":
            case "urgent":
                return HIGH;
            case "low":
                return LOW;
            default:
                return MEDIUM;
        }
    }
}
