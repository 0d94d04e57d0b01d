package com.phillippitts.saleshud.service.transcription;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnect delays: initial, 2x initial, 4x initial, ... capped at the maximum, for a
 * bounded number of attempts. Not thread-safe; guarded by the owning link.
 */
final class ReconnectBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    private Duration currentDelay;
    private int attempts;

    ReconnectBackoff(Duration initialDelay, Duration maxDelay, int maxAttempts) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }

    /** Consumes one attempt and returns its delay. */
    Duration nextDelay() {
        if (!hasAttemptsRemaining()) {
            throw new IllegalStateException("Reconnect attempts exhausted: " + attempts);
        }
        attempts++;
        Duration delay = currentDelay;
        Duration doubled = currentDelay.multipliedBy(2);
        currentDelay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        return delay;
    }

    void reset() {
        attempts = 0;
        currentDelay = initialDelay;
    }

    int getAttempts() {
        return attempts;
    }

    /** Delay of the n-th attempt (1-based): {@code min(initial * 2^(n-1), max)}. */
    static Duration delayForAttempt(int attempt, Duration initial, Duration max) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        Duration delay = initial;
        for (int i = 1; i < attempt && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
