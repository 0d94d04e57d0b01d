package com.phillippitts.saleshud.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * AI-derived observation attached to a meeting.
 *
 * @param id              unique id
 * @param type            kind of insight
 * @param priority        urgency for the UI
 * @param title           short headline
 * @param content         full text
 * @param confidence      model confidence between 0.0 and 1.0
 * @param category        free-form grouping, e.g. "pricing"
 * @param suggestedAction optional next action
 * @param timestamp       creation time
 */
public record Insight(
        String id,
        InsightType type,
        InsightPriority priority,
        String title,
        String content,
        double confidence,
        String category,
        String suggestedAction,
        Instant timestamp
) {

    public Insight {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        id = id == null ? UUID.randomUUID().toString() : id;
        priority = priority == null ? InsightPriority.MEDIUM : priority;
        title = title == null ? content : title;
    }
}
