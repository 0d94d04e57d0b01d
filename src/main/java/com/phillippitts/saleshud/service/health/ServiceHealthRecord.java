package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.domain.Dependency;

import java.time.Instant;

/**
 * Health of one dependency, or the aggregate when {@code dependency} is {@code null}.
 *
 * @param dependency    dependency, {@code null} for the overall record
 * @param status        current status
 * @param lastCheck     time of the last probe or operational report, {@code null} if never checked
 * @param latencyMs     latency of the last successful probe
 * @param errorCount    cumulative failures
 * @param uptimeSeconds cumulative seconds credited by successful probes
 */
public record ServiceHealthRecord(
        Dependency dependency,
        HealthStatus status,
        Instant lastCheck,
        long latencyMs,
        long errorCount,
        long uptimeSeconds
) {

    static ServiceHealthRecord unknown(Dependency dependency) {
        return new ServiceHealthRecord(dependency, HealthStatus.UNKNOWN, null, 0, 0, 0);
    }

    ServiceHealthRecord probeSucceeded(Instant at, long latency, long creditedSeconds) {
        return new ServiceHealthRecord(dependency, HealthStatus.HEALTHY, at, latency, errorCount,
                uptimeSeconds + creditedSeconds);
    }

    ServiceHealthRecord failed(Instant at, HealthStatus newStatus) {
        return new ServiceHealthRecord(dependency, newStatus, at, latencyMs, errorCount + 1, uptimeSeconds);
    }

    ServiceHealthRecord withStatus(HealthStatus newStatus) {
        return new ServiceHealthRecord(dependency, newStatus, lastCheck, latencyMs, errorCount, uptimeSeconds);
    }
}
