package com.phillippitts.saleshud.service.orchestration;

import com.phillippitts.saleshud.domain.AudioQualitySnapshot;
import com.phillippitts.saleshud.domain.BuyingSignal;
import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.MeetingSummary;
import com.phillippitts.saleshud.domain.SpeakerProfile;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import com.phillippitts.saleshud.service.transcription.TranscriptionLink;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one meeting. Only {@link DefaultMeetingOrchestrator} reads or writes it.
 *
 * <p>{@link #lock} guards every field below it; {@link #lifecycleLock} serializes pause, resume and
 * stop so that only one lifecycle operation runs at a time. The lifecycle lock is always taken first.
 */
final class MeetingSession {

    final UUID id;
    final MeetingConfig config;
    final Instant startTime;

    final ReentrantLock lifecycleLock = new ReentrantLock();
    final ReentrantLock lock = new ReentrantLock();
    final List<MeetingListener> listeners = new CopyOnWriteArrayList<>();
    final AtomicLong droppedFrames = new AtomicLong();

    MeetingState state = MeetingState.STARTING;
    Instant endTime;
    TranscriptionLink link;
    boolean pipelineOwned;

    long nextSequence = 1;
    final List<TranscriptEntry> transcript = new ArrayList<>();
    final Deque<TranscriptEntry> importanceQueue = new ArrayDeque<>();
    int entriesSinceBatch;
    final Deque<List<TranscriptEntry>> pendingBatches = new ArrayDeque<>();
    final List<CompletableFuture<?>> inFlightAnalyses = new ArrayList<>();

    final List<Insight> insights = new ArrayList<>();
    final List<BuyingSignal> buyingSignals = new ArrayList<>();
    final Map<Integer, SpeakerProfile> speakers = new LinkedHashMap<>();
    final Set<String> keywords = new LinkedHashSet<>();
    final List<String> errors = new ArrayList<>();
    AudioQualitySnapshot audioQuality;
    MeetingSummary summary;

    MeetingSession(UUID id, MeetingConfig config, Instant startTime) {
        this.id = id;
        this.config = config;
        this.startTime = startTime;
    }

    /** Results still count while ending; the link is stopped before the final drain. */
    boolean acceptsTranscripts() {
        return state == MeetingState.ACTIVE || state == MeetingState.ENDING;
    }

    /** Speaker label to percentage of total talk time, rounded to one decimal. */
    Map<String, Double> talkRatios() {
        double total = speakers.values().stream().mapToDouble(SpeakerProfile::talkTimeSec).sum();
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (SpeakerProfile profile : speakers.values()) {
            double pct = total > 0 ? profile.talkTimeSec() / total * 100.0 : 0.0;
            ratios.put(profile.label(), Math.round(pct * 10.0) / 10.0);
        }
        return ratios;
    }

    String activeSpeaker() {
        return transcript.isEmpty() ? null : transcript.get(transcript.size() - 1).speaker();
    }

    double averageConfidence() {
        return transcript.stream().mapToDouble(TranscriptEntry::confidence).average().orElse(0.0);
    }
}
