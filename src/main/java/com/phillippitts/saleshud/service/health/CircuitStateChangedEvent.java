package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.domain.Dependency;

import java.time.Instant;
import java.util.Objects;

/**
 * Published whenever a dependency's breaker changes state.
 */
public record CircuitStateChangedEvent(Dependency dependency, CircuitState from, CircuitState to, Instant at) {

    public CircuitStateChangedEvent {
        Objects.requireNonNull(dependency, "dependency");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(at, "at");
    }
}
