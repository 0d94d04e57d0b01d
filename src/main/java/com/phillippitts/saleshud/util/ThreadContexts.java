package com.phillippitts.saleshud.util;

import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Carries Log4j {@link ThreadContext} entries (meetingId, requestId) across thread hand-offs.
 *
 * <p>The worker thread's own context is restored after the task, so pooled threads never leak a
 * meeting's entries into the next task.
 */
public final class ThreadContexts {

    private ThreadContexts() {
    }

    /** Wraps the task so it runs with the calling thread's current context. */
    public static Runnable propagating(Runnable task) {
        return withContext(task, ThreadContext.getImmutableContext());
    }

    /**
     * Wraps the task so it runs with the given context.
     *
     * @param context entries to install; {@code null} or empty runs the task with a cleared context
     */
    public static Runnable withContext(Runnable task, Map<String, String> context) {
        Map<String, String> captured = context == null ? Map.of() : new HashMap<>(context);
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (!captured.isEmpty()) {
                    ThreadContext.putAll(captured);
                }
                task.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
