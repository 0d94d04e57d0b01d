package com.phillippitts.saleshud.domain;

import java.util.Objects;

/**
 * @param task     what needs doing
 * @param owner    who owns it, or {@code null} when unassigned
 * @param priority urgency
 */
public record ActionItem(String task, String owner, InsightPriority priority) {

    public ActionItem {
        Objects.requireNonNull(task, "task must not be null");
        priority = priority == null ? InsightPriority.MEDIUM : priority;
    }
}
