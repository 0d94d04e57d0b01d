package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.domain.Dependency;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the remote dependencies (transcription, AI analysis, persistence).
 *
 * <ul>
 *   <li>UP: every dependency healthy (or not yet probed)</li>
 *   <li>DEGRADED: some dependencies failing or a breaker open</li>
 *   <li>DOWN: every dependency failed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ServiceHealthIndicator implements HealthIndicator {

    private final ServiceHealthMonitor monitor;

    public ServiceHealthIndicator(ServiceHealthMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        switch (monitor.overall().status()) {
            case HEALTHY:
                builder.up().withDetail("status", "All dependencies operational");
                break;
            case FAILED:
                builder.down().withDetail("status", "No dependencies available");
                break;
            case DEGRADED:
                builder.status("DEGRADED").withDetail("status", "Partial dependency availability");
                break;
            default:
                builder.up().withDetail("status", "Awaiting first probe");
        }
        for (Dependency dependency : Dependency.values()) {
            builder.withDetail(dependency.id(), describe(dependency));
        }
        return builder.build();
    }

    private Map<String, Object> describe(Dependency dependency) {
        ServiceHealthRecord record = monitor.record(dependency);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", record.status().name().toLowerCase());
        detail.put("circuit", monitor.circuitState(dependency).name().toLowerCase());
        detail.put("errorCount", record.errorCount());
        detail.put("latencyMs", record.latencyMs());
        return detail;
    }
}
