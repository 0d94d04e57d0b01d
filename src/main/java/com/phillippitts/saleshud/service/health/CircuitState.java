package com.phillippitts.saleshud.service.health;

public enum CircuitState {
    CLOSED, OPEN, HALF_OPEN
}
