package com.phillippitts.saleshud.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Probe cadence and circuit breaker thresholds, shared by every remote dependency.
 */
@Validated
@ConfigurationProperties(prefix = "health.monitor")
public class HealthMonitorProperties {

    /** Interval between health probes. */
    @Positive(message = "Probe interval must be positive")
    private long probeIntervalMs = 30_000;

    /** Timeout for a single probe call. */
    @Positive
    private long probeTimeoutMs = 5_000;

    /** Failures that open a closed breaker. */
    @Min(1)
    @Max(100)
    private int failureThreshold = 5;

    /** How long an open breaker short-circuits calls before allowing trials. */
    @Positive
    private long openDurationMs = 60_000;

    /** Consecutive half-open successes that close the breaker. */
    @Min(1)
    @Max(100)
    private int halfOpenSuccessThreshold = 3;

    /** Trial calls allowed in flight while half-open. */
    @Min(1)
    @Max(100)
    private int halfOpenMaxTrialCalls = 3;

    public long getProbeIntervalMs() {
        return probeIntervalMs;
    }

    public void setProbeIntervalMs(long probeIntervalMs) {
        this.probeIntervalMs = probeIntervalMs;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getOpenDurationMs() {
        return openDurationMs;
    }

    public void setOpenDurationMs(long openDurationMs) {
        this.openDurationMs = openDurationMs;
    }

    public int getHalfOpenSuccessThreshold() {
        return halfOpenSuccessThreshold;
    }

    public void setHalfOpenSuccessThreshold(int halfOpenSuccessThreshold) {
        this.halfOpenSuccessThreshold = halfOpenSuccessThreshold;
    }

    public int getHalfOpenMaxTrialCalls() {
        return halfOpenMaxTrialCalls;
    }

    public void setHalfOpenMaxTrialCalls(int halfOpenMaxTrialCalls) {
        this.halfOpenMaxTrialCalls = halfOpenMaxTrialCalls;
    }
}
