package com.phillippitts.saleshud.exception;

import com.phillippitts.saleshud.domain.Dependency;

import java.time.Instant;

/**
 * Thrown instead of calling a dependency whose circuit breaker is open.
 *
 * <p>Never retryable: the breaker overrides the retry policy of the underlying error kind.
 */
public class CircuitOpenException extends ServiceException {

    private final Instant retryAt;

    public CircuitOpenException(Dependency dependency, Instant retryAt) {
        super("Circuit open for " + dependency.id() + "; retry after " + retryAt,
                dependency.terminalKind(), dependency, false, null, null);
        this.retryAt = retryAt;
    }

    public Instant getRetryAt() {
        return retryAt;
    }
}
