package com.phillippitts.saleshud.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for meetings and AI analysis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Meeting lifecycle counts and duration</li>
 *   <li>Transcript entries, insights and dropped audio frames</li>
 *   <li>AI request latency and outcomes, cache hits and rate-limit hits</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class MeetingMetrics {

    private static final String METRIC_PREFIX = "saleshud.meeting";
    private static final String AI_PREFIX = "saleshud.ai";

    private final MeterRegistry registry;

    public MeetingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementStarted() {
        counter(METRIC_PREFIX + ".started", "Meetings started").increment();
    }

    public void incrementStopped() {
        counter(METRIC_PREFIX + ".stopped", "Meetings stopped").increment();
    }

    /**
     * @param reason error kind or exception name that aborted the start
     */
    public void incrementStartFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".start.failure")
                .description("Meetings that failed to start")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDuration(Duration duration) {
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Meeting duration from start to stop")
                .register(registry)
                .record(duration);
    }

    public void incrementTranscripts() {
        counter(METRIC_PREFIX + ".transcripts", "Final transcript entries received").increment();
    }

    public void incrementInsights(int count) {
        counter(METRIC_PREFIX + ".insights", "Insights generated").increment(count);
    }

    public void incrementDroppedFrames() {
        counter(METRIC_PREFIX + ".frames.dropped", "Audio frames dropped by backpressure").increment();
    }

    /**
     * Records AI request latency and outcome.
     *
     * @param outcome success, failure or retry
     */
    public void recordAiRequest(String outcome, long durationNanos) {
        Timer.builder(AI_PREFIX + ".latency")
                .description("Time taken by AI backend calls")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCacheHit() {
        counter(AI_PREFIX + ".cache.hit", "AI responses served from cache").increment();
    }

    public void incrementCacheMiss() {
        counter(AI_PREFIX + ".cache.miss", "AI requests not found in cache").increment();
    }

    public void incrementRateLimited() {
        counter(AI_PREFIX + ".rate.limited", "AI requests rejected with RATE_LIMIT").increment();
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }
}
