package com.phillippitts.saleshud.presentation.controller;

import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.service.health.CircuitBreakerSnapshot;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.health.ServiceHealthRecord;
import com.phillippitts.saleshud.service.insight.InsightQueueStats;
import com.phillippitts.saleshud.service.insight.InsightRequestQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of dependency health, breaker state and AI queue statistics.
 */
@RestController
@RequestMapping("/api/health")
class ServiceHealthController {

    private final ServiceHealthMonitor monitor;
    private final InsightRequestQueue queue;

    ServiceHealthController(ServiceHealthMonitor monitor, InsightRequestQueue queue) {
        this.monitor = monitor;
        this.queue = queue;
    }

    @GetMapping("/services")
    ResponseEntity<ServicesView> services() {
        Map<Dependency, CircuitBreakerSnapshot> breakers = new EnumMap<>(Dependency.class);
        for (Dependency dependency : Dependency.values()) {
            breakers.put(dependency, monitor.breakerSnapshot(dependency));
        }
        return ResponseEntity.ok(new ServicesView(monitor.overall(), monitor.records(), breakers,
                monitor.connectionQuality().name()));
    }

    @GetMapping("/insights")
    ResponseEntity<InsightQueueStats> insights() {
        return ResponseEntity.ok(queue.stats());
    }

    record ServicesView(ServiceHealthRecord overall,
                        List<ServiceHealthRecord> services,
                        Map<Dependency, CircuitBreakerSnapshot> circuits,
                        String connectionQuality) {
    }
}
