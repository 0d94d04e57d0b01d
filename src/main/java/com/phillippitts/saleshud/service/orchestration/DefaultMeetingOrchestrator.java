package com.phillippitts.saleshud.service.orchestration;

import com.phillippitts.saleshud.config.properties.OrchestrationProperties;
import com.phillippitts.saleshud.domain.AudioQualitySnapshot;
import com.phillippitts.saleshud.domain.BuyingSignal;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.MeetingStatusReport;
import com.phillippitts.saleshud.domain.MeetingSummary;
import com.phillippitts.saleshud.domain.SpeakerProfile;
import com.phillippitts.saleshud.domain.Subscription;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import com.phillippitts.saleshud.exception.AudioPipelineException;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.IllegalMeetingStateException;
import com.phillippitts.saleshud.exception.MeetingNotFoundException;
import com.phillippitts.saleshud.exception.MeetingStartException;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.service.analysis.BuyingSignalDetector;
import com.phillippitts.saleshud.service.analysis.TranscriptTagger;
import com.phillippitts.saleshud.service.audio.AudioFrame;
import com.phillippitts.saleshud.service.audio.AudioPipeline;
import com.phillippitts.saleshud.service.audio.AudioPipelineListener;
import com.phillippitts.saleshud.service.audio.DeviceConstraints;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.insight.InsightService;
import com.phillippitts.saleshud.service.insight.SummaryDraft;
import com.phillippitts.saleshud.service.metrics.MeetingMetrics;
import com.phillippitts.saleshud.service.orchestration.event.AudioQualityChangedEvent;
import com.phillippitts.saleshud.service.orchestration.event.BuyingSignalDetectedEvent;
import com.phillippitts.saleshud.service.orchestration.event.FramesDroppedEvent;
import com.phillippitts.saleshud.service.orchestration.event.ImportantTranscriptEvent;
import com.phillippitts.saleshud.service.orchestration.event.InsightGeneratedEvent;
import com.phillippitts.saleshud.service.orchestration.event.MeetingErrorEvent;
import com.phillippitts.saleshud.service.orchestration.event.MeetingStartedEvent;
import com.phillippitts.saleshud.service.orchestration.event.MeetingStateChangedEvent;
import com.phillippitts.saleshud.service.orchestration.event.MeetingStoppedEvent;
import com.phillippitts.saleshud.service.orchestration.event.TranscriptReceivedEvent;
import com.phillippitts.saleshud.service.persistence.MeetingStore;
import com.phillippitts.saleshud.service.transcription.TranscriptionLink;
import com.phillippitts.saleshud.service.transcription.TranscriptionLinkFactory;
import com.phillippitts.saleshud.service.transcription.TranscriptionListener;
import com.phillippitts.saleshud.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Coordinates audio capture, live transcription, batched AI analysis and dependency health for meetings.
 *
 * <p><b>Start:</b> the audio pipeline is reserved, the transcription link connected and capture
 * started, in that order. Any failure rolls back what was already acquired and surfaces a
 * {@link MeetingStartException}; the meeting never stays half-started. A meeting with transcription
 * disabled acquires neither.
 *
 * <p><b>Transcripts:</b> each final entry is stamped with its arrival sequence, appended, profiled,
 * scanned for buying signals and fanned out to subscribers, Spring listeners and the
 * {@link MeetingStore}, all under the session lock so every observer sees arrival order. Every
 * {@code minBatchSize} entries a batch of the last {@code batchWindow} entries is queued for analysis.
 *
 * <p><b>Background pass:</b> {@link #processQueues()} publishes {@link ImportantTranscriptEvent}s and
 * submits queued batches, deferring analysis while the AI backend is degraded.
 *
 * <p><b>Stop:</b> capture and transcription are released, the importance pass and all pending batches
 * are drained, in-flight analysis is awaited up to {@code drainTimeoutMs} and the final summary
 * requested. If the AI summary fails a local summary is returned. Insights that complete after the
 * meeting ended are discarded.
 *
 * <p><b>Threading:</b> audio frames are handed to the link without blocking; drops are counted and
 * surfaced as {@link FramesDroppedEvent}. Persistence runs on the single-threaded
 * {@code persistenceExecutor}, guarded by the persistence circuit breaker.
 *
 * <p><b>Configuration:</b> not annotated as {@code @Component}; see
 * {@link com.phillippitts.saleshud.config.orchestration.OrchestrationConfig} for bean wiring.
 */
public class DefaultMeetingOrchestrator implements MeetingOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultMeetingOrchestrator.class);

    private static final String MDC_MEETING_ID = "meetingId";
    private static final int DROP_EVENT_EVERY = 50;

    private final AudioPipeline pipeline;
    private final TranscriptionLinkFactory linkFactory;
    private final InsightService insightService;
    private final ServiceHealthMonitor monitor;
    private final MeetingStore store;
    private final TranscriptTagger tagger;
    private final BuyingSignalDetector signalDetector;
    private final PipelineOwnership ownership;
    private final OrchestrationProperties props;
    private final MeetingMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Executor persistenceExecutor;
    private final Clock clock;

    private final Map<UUID, MeetingSession> sessions = new ConcurrentHashMap<>();
    private final Map<UUID, MeetingSession> ended;
    private final AtomicBoolean processing = new AtomicBoolean();

    // CHECKSTYLE.OFF: ParameterNumber - collaborators are wired once in OrchestrationConfig
    public DefaultMeetingOrchestrator(AudioPipeline pipeline,
                                      TranscriptionLinkFactory linkFactory,
                                      InsightService insightService,
                                      ServiceHealthMonitor monitor,
                                      MeetingStore store,
                                      TranscriptTagger tagger,
                                      BuyingSignalDetector signalDetector,
                                      PipelineOwnership ownership,
                                      OrchestrationProperties props,
                                      MeetingMetrics metrics,
                                      ApplicationEventPublisher publisher,
                                      Executor persistenceExecutor,
                                      Clock clock) {
        // CHECKSTYLE.ON: ParameterNumber
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.linkFactory = Objects.requireNonNull(linkFactory, "linkFactory");
        this.insightService = Objects.requireNonNull(insightService, "insightService");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.store = Objects.requireNonNull(store, "store");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.signalDetector = Objects.requireNonNull(signalDetector, "signalDetector");
        this.ownership = Objects.requireNonNull(ownership, "ownership");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.persistenceExecutor = Objects.requireNonNull(persistenceExecutor, "persistenceExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        int retention = props.getEndedMeetingRetention();
        this.ended = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, MeetingSession> eldest) {
                return size() > retention;
            }
        });
    }

    @Override
    public UUID startMeeting(MeetingConfig config) {
        Objects.requireNonNull(config, "config");
        UUID id = UUID.randomUUID();
        MeetingSession session = new MeetingSession(id, config, clock.instant());
        sessions.put(id, session);
        ThreadContext.put(MDC_MEETING_ID, id.toString());
        try {
            LOG.info("Starting meeting: type={}, platform={}, transcription={}", config.type(), config.platform(),
                    config.enableTranscription());
            if (config.enableTranscription()) {
                acquireStreaming(session);
            }
            transition(session, MeetingState.ACTIVE);
            publisher.publishEvent(new MeetingStartedEvent(id, config, clock.instant()));
            metrics.incrementStarted();
            LOG.info("Meeting active");
            return id;
        } catch (RuntimeException e) {
            rollback(session);
            ErrorKind kind = e instanceof ServiceException ? ((ServiceException) e).getKind()
                    : e instanceof MeetingStartException ? ((MeetingStartException) e).getKind()
                    : ErrorKind.PROCESSING_ERROR;
            metrics.incrementStartFailure(kind.name());
            LOG.error("Meeting start failed: kind={}, error={}", kind, e.getMessage());
            if (e instanceof MeetingStartException) {
                throw e;
            }
            throw new MeetingStartException("Failed to start meeting: " + e.getMessage(), kind, e);
        } finally {
            ThreadContext.remove(MDC_MEETING_ID);
        }
    }

    private void acquireStreaming(MeetingSession session) {
        UUID id = session.id;
        if (!ownership.acquire(id)) {
            throw new MeetingStartException("Audio pipeline in use by another meeting", ErrorKind.AUDIO_ERROR, null);
        }
        session.pipelineOwned = true;
        TranscriptionLink link = linkFactory.create();
        session.link = link;
        link.connect(new LinkListener(session));
        pipeline.start(DeviceConstraints.defaults(), new FrameListener(session));
    }

    private void rollback(MeetingSession session) {
        LOG.warn("Rolling back partially started meeting");
        if (session.pipelineOwned) {
            if (pipeline.isRunning()) {
                pipeline.stop();
            }
            ownership.release(session.id);
            session.pipelineOwned = false;
        }
        if (session.link != null) {
            session.link.stop();
        }
        session.lock.lock();
        try {
            session.state = MeetingState.ENDED;
            session.endTime = clock.instant();
        } finally {
            session.lock.unlock();
        }
        sessions.remove(session.id);
    }

    @Override
    public void pauseMeeting(UUID meetingId) {
        MeetingSession session = find(meetingId);
        session.lifecycleLock.lock();
        ThreadContext.put(MDC_MEETING_ID, meetingId.toString());
        try {
            requireState(session, MeetingState.ACTIVE, "pause");
            transition(session, MeetingState.PAUSED);
            if (session.pipelineOwned) {
                pipeline.stop();
            }
            if (session.link != null) {
                session.link.stop();
            }
            LOG.info("Meeting paused");
        } finally {
            ThreadContext.remove(MDC_MEETING_ID);
            session.lifecycleLock.unlock();
        }
    }

    @Override
    public void resumeMeeting(UUID meetingId) {
        MeetingSession session = find(meetingId);
        session.lifecycleLock.lock();
        ThreadContext.put(MDC_MEETING_ID, meetingId.toString());
        try {
            requireState(session, MeetingState.PAUSED, "resume");
            if (session.link != null) {
                session.link.connect(new LinkListener(session));
                try {
                    pipeline.start(DeviceConstraints.defaults(), new FrameListener(session));
                } catch (RuntimeException e) {
                    session.link.stop();
                    throw e;
                }
            }
            transition(session, MeetingState.ACTIVE);
            LOG.info("Meeting resumed");
        } finally {
            ThreadContext.remove(MDC_MEETING_ID);
            session.lifecycleLock.unlock();
        }
    }

    @Override
    public MeetingSummary stopMeeting(UUID meetingId) {
        MeetingSession session = find(meetingId);
        session.lifecycleLock.lock();
        ThreadContext.put(MDC_MEETING_ID, meetingId.toString());
        try {
            session.lock.lock();
            try {
                MeetingState current = session.state;
                if (current == MeetingState.ENDED) {
                    return session.summary;
                }
                if (!current.canTransitionTo(MeetingState.ENDING)) {
                    throw new IllegalMeetingStateException(meetingId, current, "stop");
                }
            } finally {
                session.lock.unlock();
            }
            transition(session, MeetingState.ENDING);
            LOG.info("Stopping meeting");

            releaseStreaming(session);
            drain(session);
            SummaryDraft draft = requestFinalSummary(session);
            finish(session, draft);
            return session.summary;
        } finally {
            ThreadContext.remove(MDC_MEETING_ID);
            session.lifecycleLock.unlock();
        }
    }

    private void releaseStreaming(MeetingSession session) {
        if (session.pipelineOwned) {
            try {
                pipeline.stop();
            } catch (RuntimeException e) {
                LOG.warn("Error stopping audio pipeline: {}", e.toString());
            }
            ownership.release(session.id);
            session.pipelineOwned = false;
        }
        if (session.link != null) {
            try {
                session.link.stop();
            } catch (RuntimeException e) {
                LOG.warn("Error stopping transcription link: {}", e.toString());
            }
        }
    }

    private void drain(MeetingSession session) {
        List<CompletableFuture<?>> waiting;
        session.lock.lock();
        try {
            runImportancePass(session);
            if (session.entriesSinceBatch > 0) {
                enqueueBatch(session);
            }
            if (session.config.enableInsights()) {
                while (!session.pendingBatches.isEmpty()) {
                    submitAnalysis(session, session.pendingBatches.pollFirst());
                }
            } else {
                session.pendingBatches.clear();
            }
            waiting = new ArrayList<>(session.inFlightAnalyses);
        } finally {
            session.lock.unlock();
        }
        if (waiting.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(waiting.toArray(new CompletableFuture<?>[0]))
                    .get(props.getDrainTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Drain timed out with {} analyses in flight", waiting.size());
        } catch (ExecutionException e) {
            LOG.debug("Analysis failed during drain: {}", e.getCause() == null ? e : e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private SummaryDraft requestFinalSummary(MeetingSession session) {
        List<TranscriptEntry> transcript;
        session.lock.lock();
        try {
            transcript = List.copyOf(session.transcript);
        } finally {
            session.lock.unlock();
        }
        if (!session.config.autoGenerateSummary() || !session.config.enableInsights() || transcript.isEmpty()) {
            return null;
        }
        try {
            return insightService.summarize(session.id, session.config, transcript)
                    .get(props.getFinalSummaryTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Final summary timed out; using local summary");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Final summary failed; using local summary: {}", cause.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return null;
    }

    private void finish(MeetingSession session, SummaryDraft draft) {
        MeetingSummary summary;
        session.lock.lock();
        try {
            session.endTime = clock.instant();
            summary = buildSummary(session, draft);
            session.summary = summary;
        } finally {
            session.lock.unlock();
        }
        transition(session, MeetingState.ENDED);
        List<MeetingListener> closing = new ArrayList<>(session.listeners);
        session.listeners.clear();
        for (MeetingListener listener : closing) {
            notifySafely(listener, MeetingListener::onClosed);
        }
        sessions.remove(session.id);
        ended.put(session.id, session);
        Duration duration = Duration.between(session.startTime, session.endTime);
        metrics.incrementStopped();
        metrics.recordDuration(duration);
        publisher.publishEvent(new MeetingStoppedEvent(session.id, summary));
        LOG.info("Meeting ended: durationSec={}, transcripts={}, insights={}, aiSummary={}",
                duration.toSeconds(), summary.transcriptCount(), summary.insights().size(), summary.aiGenerated());
    }

    MeetingSummary buildSummary(MeetingSession session, SummaryDraft draft) {
        List<String> keyPoints = session.transcript.stream()
                .filter(TranscriptEntry::important)
                .map(TranscriptEntry::text)
                .limit(props.getMaxKeyPoints())
                .toList();
        List<String> tags = new ArrayList<>();
        tags.add(session.config.type().value());
        tags.add(session.config.platform().value());
        tags.addAll(session.keywords);
        SummaryDraft parts = draft == null ? SummaryDraft.empty() : draft;
        long minutes = Duration.between(session.startTime, session.endTime).toMinutes();
        return new MeetingSummary(null, session.id, session.config.title(), session.startTime, minutes,
                session.config.participants(), keyPoints, parts.decisions(), parts.actionItems(),
                parts.nextSteps(), session.insights, session.buyingSignals, tags, session.talkRatios(),
                session.transcript.size(), qualityScore(session.errors.size(), session.averageConfidence()),
                draft != null);
    }

    static double qualityScore(int errorCount, double averageConfidence) {
        double errorScore = 100.0 - 10.0 * errorCount;
        double score = (errorScore + averageConfidence * 100.0) / 2.0;
        return Math.max(0.0, Math.min(100.0, score));
    }

    @Override
    public MeetingStatusReport getStatus(UUID meetingId) {
        MeetingSession session = find(meetingId);
        session.lock.lock();
        try {
            Instant end = session.endTime != null ? session.endTime : clock.instant();
            boolean transcribing = session.state == MeetingState.ACTIVE && session.link != null
                    && session.link.isTranscribing();
            return new MeetingStatusReport(session.id, session.state, session.startTime, session.endTime,
                    Duration.between(session.startTime, end).toSeconds(), transcribing,
                    session.config.participants().size(), session.activeSpeaker(), monitor.connectionQuality(),
                    session.transcript.size(), session.insights.size(), session.audioQuality,
                    session.talkRatios(), session.errors);
        } finally {
            session.lock.unlock();
        }
    }

    @Override
    public Subscription subscribe(UUID meetingId, MeetingListener listener) {
        Objects.requireNonNull(listener, "listener");
        MeetingSession session = find(meetingId);
        session.lock.lock();
        try {
            if (session.state == MeetingState.ENDED) {
                throw new IllegalMeetingStateException(meetingId, session.state, "subscribe");
            }
            session.listeners.add(listener);
        } finally {
            session.lock.unlock();
        }
        return () -> session.listeners.remove(listener);
    }

    /**
     * Background pass: publishes important entries and submits queued analysis batches for every
     * active meeting. Skips a tick if the previous one is still running.
     */
    @Scheduled(fixedRateString = "${meeting.orchestration.process-interval-ms:2000}")
    public void processQueues() {
        if (!processing.compareAndSet(false, true)) {
            return;
        }
        try {
            boolean aiShortCircuited = monitor.isShortCircuited(Dependency.AI_ANALYSIS);
            for (MeetingSession session : sessions.values()) {
                session.lock.lock();
                try {
                    if (session.state != MeetingState.ACTIVE) {
                        continue;
                    }
                    runImportancePass(session);
                    if (!session.config.enableInsights() || session.pendingBatches.isEmpty()) {
                        continue;
                    }
                    if (aiShortCircuited) {
                        LOG.debug("AI analysis circuit open; deferring {} batches for meeting {}",
                                session.pendingBatches.size(), session.id);
                        continue;
                    }
                    while (!session.pendingBatches.isEmpty()) {
                        submitAnalysis(session, session.pendingBatches.pollFirst());
                    }
                } finally {
                    session.lock.unlock();
                }
            }
        } finally {
            processing.set(false);
        }
    }

    /** Stops any meeting still running at shutdown. */
    @PreDestroy
    public void shutdown() {
        for (UUID id : new ArrayList<>(sessions.keySet())) {
            try {
                MeetingSession session = sessions.get(id);
                if (session != null && session.state.canTransitionTo(MeetingState.ENDING)) {
                    stopMeeting(id);
                }
            } catch (RuntimeException e) {
                LOG.warn("Error stopping meeting {} at shutdown: {}", id, e.toString());
            }
        }
        UUID owner = ownership.forceRelease();
        if (owner != null) {
            LOG.warn("Released audio pipeline still owned by {}", owner);
        }
    }

    // Called on the transcription link's delivery thread, in arrival order
    void acceptTranscript(MeetingSession session, TranscriptEntry raw) {
        session.lock.lock();
        try {
            if (!session.acceptsTranscripts()) {
                LOG.debug("Ignoring transcript for meeting in state {}", session.state);
                return;
            }
            Instant now = clock.instant();
            TranscriptEntry entry = raw.withSequence(session.nextSequence++);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Transcript #{}: speaker={}, text='{}'", entry.sequence(), entry.speaker(),
                        LogSanitizer.truncate(entry.text(), 40));
            }
            session.transcript.add(entry);
            session.keywords.addAll(entry.keywords());
            session.speakers.compute(entry.speakerIndex(), (idx, profile) -> {
                var emotion = tagger.emotion(entry.text(), entry.sentiment());
                return profile == null ? SpeakerProfile.first(entry, emotion) : profile.update(entry, emotion);
            });
            List<BuyingSignal> signals = signalDetector.detect(entry, now);
            session.buyingSignals.addAll(signals);
            session.importanceQueue.addLast(entry);
            session.entriesSinceBatch++;
            if (session.entriesSinceBatch >= props.getMinBatchSize()) {
                enqueueBatch(session);
            }

            for (MeetingListener listener : session.listeners) {
                notifySafely(listener, l -> l.onTranscript(entry));
            }
            publisher.publishEvent(new TranscriptReceivedEvent(session.id, entry));
            for (BuyingSignal signal : signals) {
                for (MeetingListener listener : session.listeners) {
                    notifySafely(listener, l -> l.onBuyingSignal(signal));
                }
                publisher.publishEvent(new BuyingSignalDetectedEvent(session.id, signal));
            }
            persist(() -> store.saveTranscript(session.id, entry));
            metrics.incrementTranscripts();
        } finally {
            session.lock.unlock();
        }
    }

    // Requires session.lock
    private void enqueueBatch(MeetingSession session) {
        int size = session.transcript.size();
        int window = Math.max(props.getBatchWindow(), session.entriesSinceBatch);
        List<TranscriptEntry> batch = List.copyOf(session.transcript.subList(Math.max(0, size - window), size));
        session.entriesSinceBatch = 0;
        if (session.pendingBatches.size() >= props.getMaxPendingBatches()) {
            session.pendingBatches.pollFirst();
            LOG.warn("Analysis backlog full; dropped oldest batch");
        }
        session.pendingBatches.addLast(batch);
        if (props.isRealTimeCoaching() && session.config.enableInsights()
                && session.state == MeetingState.ACTIVE && !monitor.isShortCircuited(Dependency.AI_ANALYSIS)) {
            track(session, insightService.coach(session.config, batch));
        }
    }

    // Requires session.lock
    private void runImportancePass(MeetingSession session) {
        TranscriptEntry entry;
        while ((entry = session.importanceQueue.pollFirst()) != null) {
            if (entry.important()) {
                publisher.publishEvent(new ImportantTranscriptEvent(session.id, entry));
            }
        }
    }

    // Requires session.lock
    private void submitAnalysis(MeetingSession session, List<TranscriptEntry> batch) {
        track(session, insightService.analyzeConversation(session.id, session.config, batch));
    }

    // Requires session.lock
    private void track(MeetingSession session, CompletableFuture<List<Insight>> future) {
        session.inFlightAnalyses.add(future);
        future.whenComplete((insights, error) -> {
            onAnalysisComplete(session, insights, error);
            session.lock.lock();
            try {
                session.inFlightAnalyses.remove(future);
            } finally {
                session.lock.unlock();
            }
        });
    }

    private void onAnalysisComplete(MeetingSession session, List<Insight> insights, Throwable error) {
        session.lock.lock();
        try {
            if (session.state == MeetingState.ENDED || session.state == MeetingState.STARTING) {
                LOG.debug("Discarding analysis result for ended meeting {}", session.id);
                return;
            }
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                ErrorKind kind = cause instanceof ServiceException ? ((ServiceException) cause).getKind()
                        : ErrorKind.PROCESSING_ERROR;
                recordError(session, kind, "AI analysis failed: " + kind);
                return;
            }
            for (Insight insight : insights) {
                session.insights.add(insight);
                for (MeetingListener listener : session.listeners) {
                    notifySafely(listener, l -> l.onInsight(insight));
                }
                publisher.publishEvent(new InsightGeneratedEvent(session.id, insight));
                persist(() -> store.saveInsight(session.id, insight));
            }
            metrics.incrementInsights(insights.size());
        } finally {
            session.lock.unlock();
        }
    }

    private void recordError(MeetingSession session, ErrorKind kind, String message) {
        session.lock.lock();
        try {
            session.errors.add(message);
            for (MeetingListener listener : session.listeners) {
                notifySafely(listener, l -> l.onError(message));
            }
        } finally {
            session.lock.unlock();
        }
        publisher.publishEvent(new MeetingErrorEvent(session.id, kind, message, clock.instant()));
    }

    private void transition(MeetingSession session, MeetingState next) {
        MeetingState previous;
        session.lock.lock();
        try {
            previous = session.state;
            if (!previous.canTransitionTo(next)) {
                throw new IllegalMeetingStateException(session.id, previous, "transition to " + next);
            }
            session.state = next;
            for (MeetingListener listener : session.listeners) {
                notifySafely(listener, l -> l.onStateChanged(next));
            }
        } finally {
            session.lock.unlock();
        }
        publisher.publishEvent(new MeetingStateChangedEvent(session.id, previous, next, clock.instant()));
        persist(() -> store.updateMeetingStatus(session.id, next));
    }

    private void requireState(MeetingSession session, MeetingState expected, String operation) {
        session.lock.lock();
        try {
            if (session.state != expected) {
                throw new IllegalMeetingStateException(session.id, session.state, operation);
            }
        } finally {
            session.lock.unlock();
        }
    }

    private MeetingSession find(UUID meetingId) {
        Objects.requireNonNull(meetingId, "meetingId");
        MeetingSession session = sessions.get(meetingId);
        if (session == null) {
            session = ended.get(meetingId);
        }
        if (session == null) {
            throw new MeetingNotFoundException(meetingId);
        }
        return session;
    }

    private void persist(Runnable action) {
        try {
            persistenceExecutor.execute(() -> {
                if (!monitor.allowRequest(Dependency.PERSISTENCE)) {
                    LOG.debug("Persistence circuit open; skipping write");
                    return;
                }
                try {
                    action.run();
                    monitor.recordSuccess(Dependency.PERSISTENCE);
                } catch (RuntimeException e) {
                    LOG.warn("Persistence call failed: {}", e.toString());
                    monitor.recordFailure(Dependency.PERSISTENCE, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Persistence executor rejected write: {}", e.toString());
        }
    }

    private static void notifySafely(MeetingListener listener, Consumer<MeetingListener> call) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            LOG.warn("Meeting listener failed: {}", e.toString());
        }
    }

    /** Audio callbacks; runs on the capture thread and must not block. */
    private final class FrameListener implements AudioPipelineListener {

        private final MeetingSession session;

        FrameListener(MeetingSession session) {
            this.session = session;
        }

        @Override
        public void onFrame(AudioFrame frame) {
            TranscriptionLink link = session.link;
            if (link == null || link.send(frame) || !link.isTranscribing()) {
                return;
            }
            long dropped = session.droppedFrames.incrementAndGet();
            metrics.incrementDroppedFrames();
            if (dropped == 1 || dropped % DROP_EVENT_EVERY == 0) {
                publisher.publishEvent(new FramesDroppedEvent(session.id, dropped, clock.instant()));
            }
        }

        @Override
        public void onQualityChanged(AudioQualitySnapshot snapshot) {
            session.lock.lock();
            try {
                session.audioQuality = snapshot;
            } finally {
                session.lock.unlock();
            }
            publisher.publishEvent(new AudioQualityChangedEvent(session.id, snapshot));
        }

        @Override
        public void onError(AudioPipelineException error) {
            LOG.error("Audio device lost: reason={}", error.getReason());
            recordError(session, ErrorKind.AUDIO_ERROR, "Audio capture failed: " + error.getReason());
        }
    }

    /** Transcription callbacks; delivered sequentially in arrival order. */
    private final class LinkListener implements TranscriptionListener {

        private final MeetingSession session;

        LinkListener(MeetingSession session) {
            this.session = session;
        }

        @Override
        public void onResult(TranscriptEntry entry) {
            acceptTranscript(session, entry);
        }

        @Override
        public void onInterim(String text, int speakerIndex) {
            for (MeetingListener listener : session.listeners) {
                notifySafely(listener, l -> l.onInterimTranscript(text, speakerIndex));
            }
        }

        @Override
        public void onError(ServiceException error) {
            recordError(session, error.getKind(), "Transcription error: " + error.getKind());
        }

        @Override
        public void onClose(boolean permanent) {
            if (permanent) {
                LOG.warn("Live transcription stopped for meeting {}; meeting continues without transcript",
                        session.id);
            }
        }
    }
}
