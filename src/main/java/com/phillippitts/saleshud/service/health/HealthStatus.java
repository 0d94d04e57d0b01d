package com.phillippitts.saleshud.service.health;

public enum HealthStatus {
    HEALTHY, DEGRADED, FAILED, UNKNOWN
}
