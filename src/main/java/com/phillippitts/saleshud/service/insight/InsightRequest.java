package com.phillippitts.saleshud.service.insight;

import java.util.Objects;

/**
 * A queued AI analysis task.
 *
 * @param taskType   short task name used in logs and metrics, e.g. "conversation-analysis"
 * @param completion request to send
 * @param priority   lower values are served first
 * @param cacheKey   caller-supplied cache key, or {@code null} to use the task type
 * @param realTime   real-time requests never read from or write to the cache
 */
public record InsightRequest(String taskType, CompletionRequest completion, int priority, String cacheKey,
                             boolean realTime) {

    public InsightRequest {
        Objects.requireNonNull(taskType, "taskType must not be null");
        Objects.requireNonNull(completion, "completion must not be null");
        if (priority < 0) {
            throw new IllegalArgumentException("priority must not be negative: " + priority);
        }
        cacheKey = cacheKey == null ? taskType : cacheKey;
    }

    public static InsightRequest cached(String taskType, CompletionRequest completion, int priority) {
        return new InsightRequest(taskType, completion, priority, taskType, false);
    }

    public static InsightRequest realTime(String taskType, CompletionRequest completion, int priority) {
        return new InsightRequest(taskType, completion, priority, null, true);
    }
}
