package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.config.properties.HealthMonitorProperties;
import com.phillippitts.saleshud.domain.Dependency;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe circuit breaker for one remote dependency.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CLOSED    → OPEN      when consecutive failures reach the failure threshold
 * OPEN      → HALF_OPEN once the open duration has elapsed (checked lazily on every call)
 * HALF_OPEN → CLOSED    after the success threshold of consecutive trial successes
 * HALF_OPEN → OPEN      on any failure
 * </pre>
 *
 * <p>While half-open at most {@code halfOpenMaxTrialCalls} permits are outstanding.
 * A success in the closed state resets the failure count.
 */
public final class CircuitBreaker {

    /** Receives state changes after the breaker's lock is released. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(Dependency dependency, CircuitState from, CircuitState to);
    }

    private final Dependency dependency;
    private final int failureThreshold;
    private final int successThreshold;
    private final int maxTrialCalls;
    private final Duration openDuration;
    private final Clock clock;
    private final TransitionListener listener;

    private final Lock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int trialsInFlight;
    private Instant lastFailure;
    private Instant nextRetry;

    public CircuitBreaker(Dependency dependency, HealthMonitorProperties props, Clock clock,
                          TransitionListener listener) {
        this.dependency = Objects.requireNonNull(dependency, "dependency must not be null");
        this.failureThreshold = props.getFailureThreshold();
        this.successThreshold = props.getHalfOpenSuccessThreshold();
        this.maxTrialCalls = props.getHalfOpenMaxTrialCalls();
        this.openDuration = Duration.ofMillis(props.getOpenDurationMs());
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener == null ? (d, from, to) -> { } : listener;
    }

    /**
     * Asks to call the dependency. Always granted while closed, never while open, and granted while
     * half-open only if fewer than the maximum trial calls are outstanding.
     *
     * @return {@code true} if the call may proceed
     */
    public boolean tryAcquirePermission() {
        CircuitState from;
        CircuitState to;
        boolean granted;
        lock.lock();
        try {
            from = state;
            refresh();
            to = state;
            switch (state) {
                case CLOSED:
                    granted = true;
                    break;
                case HALF_OPEN:
                    granted = trialsInFlight < maxTrialCalls;
                    if (granted) {
                        trialsInFlight++;
                    }
                    break;
                default:
                    granted = false;
            }
        } finally {
            lock.unlock();
        }
        notifyIfChanged(from, to);
        return granted;
    }

    public void recordSuccess() {
        CircuitState from;
        CircuitState to;
        lock.lock();
        try {
            from = state;
            refresh();
            if (state == CircuitState.CLOSED) {
                failureCount = 0;
            } else if (state == CircuitState.HALF_OPEN) {
                trialsInFlight = Math.max(0, trialsInFlight - 1);
                successCount++;
                if (successCount >= successThreshold) {
                    reset();
                }
            }
            // A late success while OPEN belongs to a call started before the breaker opened
            to = state;
        } finally {
            lock.unlock();
        }
        notifyIfChanged(from, to);
    }

    /** Frees a half-open trial slot for a call that was granted but never made or never judged. */
    public void releasePermission() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                trialsInFlight = Math.max(0, trialsInFlight - 1);
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        CircuitState from;
        CircuitState to;
        lock.lock();
        try {
            from = state;
            refresh();
            Instant now = clock.instant();
            lastFailure = now;
            failureCount++;
            if (state == CircuitState.HALF_OPEN
                    || (state == CircuitState.CLOSED && failureCount >= failureThreshold)) {
                open(now);
            }
            to = state;
        } finally {
            lock.unlock();
        }
        notifyIfChanged(from, to);
    }

    public CircuitState state() {
        CircuitState from;
        CircuitState to;
        lock.lock();
        try {
            from = state;
            refresh();
            to = state;
        } finally {
            lock.unlock();
        }
        notifyIfChanged(from, to);
        return to;
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(dependency, state, failureCount, successCount, lastFailure, nextRetry);
        } finally {
            lock.unlock();
        }
    }

    /** Earliest time an open breaker allows a trial call, or {@code null} when not open. */
    public Instant nextRetry() {
        lock.lock();
        try {
            return nextRetry;
        } finally {
            lock.unlock();
        }
    }

    public Dependency dependency() {
        return dependency;
    }

    private void refresh() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(nextRetry)) {
            state = CircuitState.HALF_OPEN;
            successCount = 0;
            trialsInFlight = 0;
        }
    }

    private void open(Instant now) {
        state = CircuitState.OPEN;
        nextRetry = now.plus(openDuration);
        successCount = 0;
        trialsInFlight = 0;
    }

    private void reset() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        successCount = 0;
        trialsInFlight = 0;
        nextRetry = null;
    }

    private void notifyIfChanged(CircuitState from, CircuitState to) {
        if (from != to) {
            listener.onTransition(dependency, from, to);
        }
    }
}
