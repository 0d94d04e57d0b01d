package com.phillippitts.saleshud.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MeetingMetricsTest {

    private MeterRegistry registry;
    private MeetingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MeetingMetrics(registry);
    }

    @Test
    void shouldCountLifecycleEvents() {
        metrics.incrementStarted();
        metrics.incrementStarted();
        metrics.incrementStopped();

        assertThat(registry.get("saleshud.meeting.started").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("saleshud.meeting.stopped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagStartFailuresByReason() {
        metrics.incrementStartFailure("CONNECTION_FAILED");
        metrics.incrementStartFailure("AUDIO_ERROR");
        metrics.incrementStartFailure("AUDIO_ERROR");

        Counter audio = registry.find("saleshud.meeting.start.failure").tag("reason", "AUDIO_ERROR").counter();
        assertThat(audio).isNotNull();
        assertThat(audio.count()).isEqualTo(2.0);
    }

    @Test
    void shouldRecordDurationAndAiLatency() {
        long nanos = TimeUnit.MILLISECONDS.toNanos(250);

        metrics.recordDuration(Duration.ofMinutes(12));
        metrics.recordAiRequest("success", nanos);

        Timer duration = registry.get("saleshud.meeting.duration").timer();
        Timer latency = registry.find("saleshud.ai.latency").tag("outcome", "success").timer();
        assertThat(duration.totalTime(TimeUnit.MINUTES)).isEqualTo(12.0);
        assertThat(latency).isNotNull();
        assertThat(latency.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(nanos);
    }

    @Test
    void shouldAccumulateInsightsAndCacheCounters() {
        metrics.incrementInsights(3);
        metrics.incrementInsights(2);
        metrics.incrementCacheHit();
        metrics.incrementCacheMiss();
        metrics.incrementRateLimited();
        metrics.incrementDroppedFrames();

        assertThat(registry.get("saleshud.meeting.insights").counter().count()).isEqualTo(5.0);
        assertThat(registry.get("saleshud.ai.cache.hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("saleshud.ai.cache.miss").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("saleshud.ai.rate.limited").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("saleshud.meeting.frames.dropped").counter().count()).isEqualTo(1.0);
    }
}
