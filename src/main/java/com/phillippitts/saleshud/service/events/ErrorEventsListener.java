package com.phillippitts.saleshud.service.events;

import com.phillippitts.saleshud.service.audio.AudioErrorEvent;
import com.phillippitts.saleshud.service.health.CircuitState;
import com.phillippitts.saleshud.service.health.CircuitStateChangedEvent;
import com.phillippitts.saleshud.service.health.DependencyFailureEvent;
import com.phillippitts.saleshud.service.orchestration.event.FramesDroppedEvent;
import com.phillippitts.saleshud.service.orchestration.event.MeetingErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onAudioError(AudioErrorEvent e) {
        if (shouldLog("audio-" + e.reason())) {
            LOG.warn("Audio capture error: reason={}. Check microphone device & permissions.", e.reason());
        }
    }

    @EventListener
    void onFramesDropped(FramesDroppedEvent e) {
        if (shouldLog("frames-dropped-" + e.meetingId())) {
            LOG.warn("Transcription send buffer full: meeting={}, droppedFrames={}. Network may be congested.",
                    e.meetingId(), e.totalDropped());
        }
    }

    @EventListener
    void onMeetingError(MeetingErrorEvent e) {
        if (shouldLog("meeting-" + e.meetingId() + '-' + e.kind())) {
            LOG.warn("Meeting error: meeting={}, kind={}, message={}", e.meetingId(), e.kind(), e.message());
        }
    }

    @EventListener
    void onCircuitStateChanged(CircuitStateChangedEvent e) {
        // Transitions are rare and always worth a line
        if (e.to() == CircuitState.OPEN) {
            LOG.warn("Circuit opened for {}: calls fail fast until the open period elapses",
                    e.dependency().id());
        } else {
            LOG.info("Circuit for {}: {} -> {}", e.dependency().id(), e.from(), e.to());
        }
    }

    @EventListener
    void onDependencyFailure(DependencyFailureEvent e) {
        if (shouldLog("dependency-" + e.dependency() + '-' + e.kind())) {
            LOG.warn("Dependency failure: dependency={}, kind={}, message={}",
                    e.dependency().id(), e.kind(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
