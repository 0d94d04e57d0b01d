package com.phillippitts.saleshud.service.health;

import com.phillippitts.saleshud.config.properties.HealthMonitorProperties;
import com.phillippitts.saleshud.domain.ConnectionQuality;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.exception.CircuitOpenException;
import com.phillippitts.saleshud.exception.ServiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide health records and circuit breakers, one per {@link Dependency}.
 *
 * <p>Failures are counted from two sources: the periodic probes run by {@link #probeAll()} and the
 * operational failures reported by callers through {@link #recordFailure(Dependency, Throwable)}.
 * Callers guard remote calls with {@link #acquirePermission(Dependency)}, which fails fast while the
 * dependency's breaker is open.
 *
 * <p>Aggregation rules for {@link #overall()}:
 * <ul>
 *   <li>HEALTHY: every dependency healthy</li>
 *   <li>FAILED: every dependency failed</li>
 *   <li>UNKNOWN: nothing probed or reported yet</li>
 *   <li>DEGRADED: anything else</li>
 * </ul>
 */
public class ServiceHealthMonitor {

    private static final Logger LOG = LogManager.getLogger(ServiceHealthMonitor.class);

    private final Map<Dependency, HealthProbe> probes;
    private final HealthMonitorProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Map<Dependency, CircuitBreaker> breakers = new EnumMap<>(Dependency.class);
    private final ConcurrentMap<Dependency, ServiceHealthRecord> records = new ConcurrentHashMap<>();

    public ServiceHealthMonitor(Map<Dependency, HealthProbe> probes,
                                HealthMonitorProperties props,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        this.probes = Map.copyOf(Objects.requireNonNull(probes, "probes"));
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (Dependency dependency : Dependency.values()) {
            breakers.put(dependency, new CircuitBreaker(dependency, props, clock, this::onTransition));
            records.put(dependency, ServiceHealthRecord.unknown(dependency));
        }
        LOG.info("Health monitor initialized: probes={}, failureThreshold={}, openDurationMs={}",
                this.probes.keySet(), props.getFailureThreshold(), props.getOpenDurationMs());
    }

    /**
     * Requests permission to call a dependency.
     *
     * @throws CircuitOpenException if the dependency's breaker is open or its half-open trials are exhausted
     */
    public void acquirePermission(Dependency dependency) {
        CircuitBreaker breaker = breakers.get(dependency);
        if (!breaker.tryAcquirePermission()) {
            Instant retryAt = breaker.nextRetry();
            throw new CircuitOpenException(dependency, retryAt != null ? retryAt : clock.instant());
        }
    }

    /** Non-throwing variant of {@link #acquirePermission(Dependency)}. */
    public boolean allowRequest(Dependency dependency) {
        return breakers.get(dependency).tryAcquirePermission();
    }

    /**
     * Records a successful operational call. A degraded dependency returns to healthy once its
     * breaker is closed again.
     */
    public void recordSuccess(Dependency dependency) {
        CircuitBreaker breaker = breakers.get(dependency);
        breaker.recordSuccess();
        if (breaker.state() == CircuitState.CLOSED) {
            records.computeIfPresent(dependency, (d, r) -> r.status() == HealthStatus.HEALTHY
                    ? r
                    : new ServiceHealthRecord(d, HealthStatus.HEALTHY, clock.instant(), r.latencyMs(),
                            r.errorCount(), r.uptimeSeconds()));
        }
    }

    /** Returns a permit whose call ended without an outcome to report. */
    public void releasePermission(Dependency dependency) {
        breakers.get(dependency).releasePermission();
    }

    /**
     * Records an operational failure. Short-circuited calls are not failures of the remote service and
     * are ignored.
     */
    public void recordFailure(Dependency dependency, Throwable cause) {
        if (cause instanceof CircuitOpenException) {
            return;
        }
        CircuitBreaker breaker = breakers.get(dependency);
        breaker.recordFailure();
        HealthStatus status = breaker.state() == CircuitState.OPEN ? HealthStatus.FAILED : HealthStatus.DEGRADED;
        Instant now = clock.instant();
        records.computeIfPresent(dependency, (d, r) -> r.failed(now, status));
        publishFailure(dependency, cause, now);
    }

    /** Probes every dependency that has a registered probe. */
    @Scheduled(fixedRateString = "${health.monitor.probe-interval-ms:30000}",
            initialDelayString = "${health.monitor.initial-delay-ms:5000}")
    public void probeAll() {
        for (Dependency dependency : probes.keySet()) {
            probe(dependency);
        }
    }

    /**
     * Runs one probe. Skipped while the breaker is open; once the cooldown has elapsed the probe is the
     * half-open trial call.
     *
     * @return {@code true} if the probe ran and succeeded
     */
    public boolean probe(Dependency dependency) {
        HealthProbe probe = probes.get(dependency);
        if (probe == null) {
            return false;
        }
        CircuitBreaker breaker = breakers.get(dependency);
        if (!breaker.tryAcquirePermission()) {
            LOG.debug("Skipping probe for {}: circuit {}", dependency.id(), breaker.state());
            return false;
        }
        long start = System.nanoTime();
        try {
            probe.probe();
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            breaker.recordSuccess();
            long credited = TimeUnit.MILLISECONDS.toSeconds(props.getProbeIntervalMs());
            records.computeIfPresent(dependency, (d, r) -> r.probeSucceeded(clock.instant(), latencyMs, credited));
            LOG.debug("Probe ok: dependency={}, latencyMs={}", dependency.id(), latencyMs);
            return true;
        } catch (Exception e) {
            breaker.recordFailure();
            Instant now = clock.instant();
            records.computeIfPresent(dependency, (d, r) -> r.failed(now, HealthStatus.FAILED));
            LOG.warn("Probe failed: dependency={}, error={}", dependency.id(), e.toString());
            publishFailure(dependency, e, now);
            return false;
        }
    }

    public ServiceHealthRecord record(Dependency dependency) {
        return records.get(dependency);
    }

    public List<ServiceHealthRecord> records() {
        return List.of(records.get(Dependency.TRANSCRIPTION), records.get(Dependency.AI_ANALYSIS),
                records.get(Dependency.PERSISTENCE));
    }

    /** Aggregate record; {@code dependency} is {@code null}. */
    public ServiceHealthRecord overall() {
        Collection<ServiceHealthRecord> all = records.values();
        HealthStatus status = aggregate(all.stream().map(ServiceHealthRecord::status).toList());
        Instant lastCheck = all.stream().map(ServiceHealthRecord::lastCheck).filter(Objects::nonNull)
                .max(Instant::compareTo).orElse(null);
        long latency = all.stream().mapToLong(ServiceHealthRecord::latencyMs).max().orElse(0);
        long errors = all.stream().mapToLong(ServiceHealthRecord::errorCount).sum();
        long uptime = all.stream().mapToLong(ServiceHealthRecord::uptimeSeconds).min().orElse(0);
        return new ServiceHealthRecord(null, status, lastCheck, latency, errors, uptime);
    }

    static HealthStatus aggregate(List<HealthStatus> statuses) {
        if (statuses.isEmpty() || statuses.stream().allMatch(s -> s == HealthStatus.UNKNOWN)) {
            return HealthStatus.UNKNOWN;
        }
        if (statuses.stream().allMatch(s -> s == HealthStatus.HEALTHY)) {
            return HealthStatus.HEALTHY;
        }
        if (statuses.stream().allMatch(s -> s == HealthStatus.FAILED)) {
            return HealthStatus.FAILED;
        }
        return HealthStatus.DEGRADED;
    }

    public ConnectionQuality connectionQuality() {
        switch (overall().status()) {
            case HEALTHY:
                return ConnectionQuality.EXCELLENT;
            case DEGRADED:
                return ConnectionQuality.GOOD;
            case FAILED:
                return ConnectionQuality.POOR;
            default:
                return ConnectionQuality.FAIR;
        }
    }

    /**
     * True while the dependency's breaker is open and optional work against it should be deferred. A
     * degraded record alone does not defer work, since only a call that reaches the dependency can
     * restore it.
     */
    public boolean isShortCircuited(Dependency dependency) {
        return breakers.get(dependency).state() == CircuitState.OPEN;
    }

    public CircuitBreakerSnapshot breakerSnapshot(Dependency dependency) {
        return breakers.get(dependency).snapshot();
    }

    public CircuitState circuitState(Dependency dependency) {
        return breakers.get(dependency).state();
    }

    private void onTransition(Dependency dependency, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            LOG.warn("Circuit opened: dependency={}", dependency.id());
        } else {
            LOG.info("Circuit transition: dependency={}, {} -> {}", dependency.id(), from, to);
        }
        publisher.publishEvent(new CircuitStateChangedEvent(dependency, from, to, clock.instant()));
    }

    private void publishFailure(Dependency dependency, Throwable cause, Instant at) {
        ServiceException se = cause instanceof ServiceException ? (ServiceException) cause : null;
        String message = cause == null ? "unknown" : cause.getClass().getSimpleName();
        publisher.publishEvent(new DependencyFailureEvent(dependency, se != null ? se.getKind() : null,
                message, at));
    }
}
