package com.phillippitts.saleshud.exception;

import com.phillippitts.saleshud.domain.Dependency;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a call to a remote dependency or the local audio device fails.
 *
 * <p>Carries the {@link ErrorKind}, the dependency that failed (if any) and whether the failure may
 * be retried. Use {@link ServiceExceptionBuilder} to attach diagnostic metadata.
 */
public class ServiceException extends SalesHudException {

    private final ErrorKind kind;
    private final Dependency dependency;
    private final boolean retryable;
    private final Duration retryAfter;

    public ServiceException(String message, ErrorKind kind) {
        this(message, kind, null, kind.isRetryableByDefault(), null, null);
    }

    public ServiceException(String message, ErrorKind kind, Throwable cause) {
        this(message, kind, null, kind.isRetryableByDefault(), null, cause);
    }

    public ServiceException(String message, ErrorKind kind, Dependency dependency, boolean retryable,
                            Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.dependency = dependency;
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Dependency that produced the failure, or {@code null} for local failures. */
    public Dependency getDependency() {
        return dependency;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Backend-supplied hint for how long to wait before retrying. */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
