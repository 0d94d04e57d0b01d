package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.exception.ErrorKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Published on every failure recorded against a dependency, whether from a probe or from live traffic.
 *
 * @param dependency failing dependency
 * @param kind       error classification, {@code null} for unclassified probe failures
 * @param message    short diagnostic message (no secrets or transcript text)
 * @param at         failure time; defaults to now when {@code null}
 */
public record DependencyFailureEvent(Dependency dependency, ErrorKind kind, String message, Instant at) {

    public DependencyFailureEvent {
        Objects.requireNonNull(dependency, "dependency");
        at = at == null ? Instant.now() : at;
    }
}
