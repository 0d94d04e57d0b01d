package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.domain.Dependency;

import java.time.Instant;

/**
 * Read-only view of one dependency's breaker.
 *
 * @param dependency   guarded dependency
 * @param state        current state
 * @param failureCount consecutive failures (closed) or failures since opening (open)
 * @param successCount consecutive successes while half-open
 * @param lastFailure  time of the last recorded failure, or {@code null}
 * @param nextRetry    earliest half-open transition while open, or {@code null}
 */
public record CircuitBreakerSnapshot(
        Dependency dependency,
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailure,
        Instant nextRetry
) { }
