package com.phillippitts.saleshud.service.transcription;

import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.domain.Sentiment;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;
import com.phillippitts.saleshud.service.analysis.TranscriptTagger;
import com.phillippitts.saleshud.service.audio.AudioFrame;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.transcription.StreamingConnector.StreamingConnection;
import com.phillippitts.saleshud.service.transcription.TranscriptMessage.RecognizedSpeech;
import com.phillippitts.saleshud.util.ThreadContexts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.scheduling.TaskScheduler;

import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Streaming connection to the transcription backend for one meeting.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED → STREAMING → DISCONNECTED
 *                                            ↓    ↑
 *                                        RECONNECTING   (only while transcribing)
 * </pre>
 *
 * <p>Audio is handed off through a bounded send buffer drained by a dedicated sender thread, so
 * {@link #send(AudioFrame)} never blocks. When the buffer is full the frame is dropped and counted.
 * Frames buffered while reconnecting are sent once the new connection is up.
 *
 * <p>Callbacks from a connection that has been replaced or stopped are ignored.
 */
public class TranscriptionLink {

    private static final Logger LOG = LogManager.getLogger(TranscriptionLink.class);

    static final String CLOSE_STREAM_MESSAGE = "{\"type\":\"CloseStream\"}";
    private static final int NORMAL_CLOSURE = 1000;

    public enum LinkState { DISCONNECTED, CONNECTING, CONNECTED, STREAMING, RECONNECTING }

    private final TranscriptionProperties props;
    private final StreamingConnector connector;
    private final TranscriptTagger tagger;
    private final ServiceHealthMonitor monitor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final URI uri;
    private final Map<String, String> headers;
    private final ReconnectBackoff backoff;
    private final BlockingQueue<AudioFrame> sendBuffer;
    private final AtomicLong droppedFrames = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition streaming = lock.newCondition();

    // Guarded by lock
    private LinkState state = LinkState.DISCONNECTED;
    private boolean transcribing;
    private long generation;
    private StreamingConnection connection;
    private TranscriptionListener listener;
    private Thread sender;
    // Caller's log context, reinstated on reconnect threads
    private Map<String, String> logContext = Map.of();

    private volatile String requestId;

    public TranscriptionLink(TranscriptionProperties props,
                             StreamingConnector connector,
                             TranscriptTagger tagger,
                             ServiceHealthMonitor monitor,
                             TaskScheduler scheduler,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.uri = TranscriptionQueryBuilder.build(props);
        this.headers = props.getApiKey() == null || props.getApiKey().isBlank()
                ? Map.of()
                : Map.of("Authorization", "Token " + props.getApiKey());
        this.backoff = new ReconnectBackoff(Duration.ofMillis(props.getInitialReconnectDelayMs()),
                Duration.ofMillis(props.getMaxReconnectDelayMs()), props.getMaxReconnectAttempts());
        this.sendBuffer = new ArrayBlockingQueue<>(props.getSendBufferFrames());
    }

    /**
     * Opens the connection and starts streaming. Blocks up to the configured connect timeout.
     *
     * @throws ServiceException {@code TIMEOUT} or {@code CONNECTION_FAILED} if the connection cannot be
     *         established, or a {@link com.phillippitts.saleshud.exception.CircuitOpenException} while the
     *         transcription breaker is open
     * @throws IllegalStateException if the link is not disconnected
     */
    public void connect(TranscriptionListener transcriptionListener) {
        Objects.requireNonNull(transcriptionListener, "listener");
        long gen;
        lock.lock();
        try {
            if (state != LinkState.DISCONNECTED) {
                throw new IllegalStateException("Link already " + state);
            }
            monitor.acquirePermission(Dependency.TRANSCRIPTION);
            this.listener = transcriptionListener;
            this.logContext = Map.copyOf(ThreadContext.getImmutableContext());
            state = LinkState.CONNECTING;
            gen = ++generation;
        } finally {
            lock.unlock();
        }

        CompletableFuture<StreamingConnection> future = open(gen);
        StreamingConnection conn;
        try {
            conn = future.get(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw connectFailed(ErrorKind.TIMEOUT, "Transcription connect timed out", e);
        } catch (ExecutionException e) {
            throw connectFailed(ErrorKind.CONNECTION_FAILED, "Transcription connect failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw connectFailed(ErrorKind.CONNECTION_FAILED, "Interrupted while connecting", e);
        }

        boolean current;
        lock.lock();
        try {
            current = gen == generation;
            if (current) {
                connection = conn;
                state = LinkState.CONNECTED;
                transcribing = true;
                backoff.reset();
                sender = new Thread(this::sendLoop, "transcription-sender");
                sender.setDaemon(true);
                sender.start();
                state = LinkState.STREAMING;
                streaming.signalAll();
            }
        } finally {
            lock.unlock();
        }
        // The backend accepted the connection either way
        monitor.recordSuccess(Dependency.TRANSCRIPTION);
        if (!current) {
            // Stopped while connecting
            closeQuietly(conn);
            return;
        }
        LOG.info("Transcription link streaming: model={}, language={}", props.getModel(), props.getLanguage());
    }

    /**
     * Queues a frame for sending. Never blocks.
     *
     * @return {@code false} if the link is not transcribing or the frame was dropped because the send
     *         buffer is full
     */
    public boolean send(AudioFrame frame) {
        if (!isTranscribing()) {
            return false;
        }
        if (sendBuffer.offer(frame)) {
            return true;
        }
        droppedFrames.incrementAndGet();
        return false;
    }

    /**
     * Gracefully stops streaming: sends the close-stream message and closes the connection. Idempotent.
     */
    public void stop() {
        StreamingConnection conn;
        Thread senderThread;
        TranscriptionListener l;
        lock.lock();
        try {
            if (state == LinkState.DISCONNECTED && !transcribing) {
                return;
            }
            transcribing = false;
            generation++;
            conn = connection;
            connection = null;
            senderThread = sender;
            sender = null;
            l = listener;
            state = LinkState.DISCONNECTED;
            streaming.signalAll();
        } finally {
            lock.unlock();
        }
        joinSender(senderThread);
        sendBuffer.clear();
        if (conn != null) {
            try {
                conn.sendText(CLOSE_STREAM_MESSAGE).get(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                LOG.debug("CloseStream not delivered: {}", e.toString());
            }
            closeQuietly(conn);
        }
        LOG.info("Transcription link stopped (dropped frames={})", droppedFrames.get());
        if (l != null) {
            l.onClose(false);
        }
    }

    public LinkState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTranscribing() {
        lock.lock();
        try {
            return transcribing;
        } finally {
            lock.unlock();
        }
    }

    public long getDroppedFrames() {
        return droppedFrames.get();
    }

    /** Backend request id from the latest metadata message, or {@code null}. */
    public String getRequestId() {
        return requestId;
    }

    private CompletableFuture<StreamingConnection> open(long gen) {
        try {
            return connector.connect(uri, headers, new GenerationHandler(gen));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ServiceException connectFailed(ErrorKind kind, String message, Throwable cause) {
        lock.lock();
        try {
            generation++;
            state = LinkState.DISCONNECTED;
        } finally {
            lock.unlock();
        }
        ServiceException error = ServiceExceptionBuilder.create(message, kind)
                .dependency(Dependency.TRANSCRIPTION)
                .metadata("timeoutMs", kind == ErrorKind.TIMEOUT ? props.getConnectTimeoutMs() : null)
                .cause(cause)
                .build();
        monitor.recordFailure(Dependency.TRANSCRIPTION, error);
        LOG.warn("{}: {}", message, cause == null ? "" : cause.toString());
        return error;
    }

    // Sender thread: drains the send buffer, holding a frame across reconnects until it is sent
    private void sendLoop() {
        AudioFrame pending = null;
        while (true) {
            StreamingConnection conn;
            long gen = -1;
            try {
                if (pending == null) {
                    pending = sendBuffer.poll(100, TimeUnit.MILLISECONDS);
                    if (pending == null) {
                        if (!isTranscribing()) {
                            return;
                        }
                        continue;
                    }
                }
                lock.lock();
                try {
                    while (transcribing && state != LinkState.STREAMING) {
                        streaming.await();
                    }
                    if (!transcribing) {
                        return;
                    }
                    conn = connection;
                    gen = generation;
                } finally {
                    lock.unlock();
                }
                conn.sendAudio(ByteBuffer.wrap(pending.toPcmBytes()))
                        .get(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
                pending = null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException | TimeoutException e) {
                handleConnectionLost(gen, "send failed: " + e);
            }
        }
    }

    private void handleConnectionLost(long gen, String reason) {
        StreamingConnection lost;
        lock.lock();
        try {
            if (gen != generation || !transcribing || state != LinkState.STREAMING) {
                return;
            }
            generation++;
            lost = connection;
            connection = null;
            state = LinkState.RECONNECTING;
        } finally {
            lock.unlock();
        }
        closeQuietly(lost);
        LOG.warn("Transcription connection lost: {}", reason);
        monitor.recordFailure(Dependency.TRANSCRIPTION, ServiceExceptionBuilder
                .create("Transcription connection lost", ErrorKind.CONNECTION_FAILED)
                .dependency(Dependency.TRANSCRIPTION)
                .build());
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        Duration delay;
        Map<String, String> context;
        lock.lock();
        try {
            if (!transcribing || state != LinkState.RECONNECTING) {
                return;
            }
            context = logContext;
            if (!backoff.hasAttemptsRemaining()) {
                delay = null;
            } else {
                delay = backoff.nextDelay();
                LOG.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), backoff.getAttempts(),
                        props.getMaxReconnectAttempts());
            }
        } finally {
            lock.unlock();
        }
        if (delay == null) {
            giveUp();
            return;
        }
        scheduler.schedule(ThreadContexts.withContext(this::reconnect, context),
                scheduler.getClock().instant().plus(delay));
    }

    private void reconnect() {
        long gen;
        lock.lock();
        try {
            if (!transcribing || state != LinkState.RECONNECTING) {
                return;
            }
            gen = ++generation;
        } finally {
            lock.unlock();
        }
        if (!monitor.allowRequest(Dependency.TRANSCRIPTION)) {
            LOG.warn("Transcription circuit open; skipping reconnect attempt");
            scheduleReconnect();
            return;
        }
        Map<String, String> context = ThreadContext.getImmutableContext();
        open(gen).orTimeout(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((conn, error) -> ThreadContexts
                        .withContext(() -> onReconnectResult(gen, conn, error), context).run());
    }

    private void onReconnectResult(long gen, StreamingConnection conn, Throwable error) {
        if (error != null) {
            boolean current;
            lock.lock();
            try {
                current = gen == generation && transcribing;
            } finally {
                lock.unlock();
            }
            if (current) {
                LOG.warn("Reconnect attempt failed: {}", error.toString());
                monitor.recordFailure(Dependency.TRANSCRIPTION, ServiceExceptionBuilder
                        .create("Transcription reconnect failed", ErrorKind.CONNECTION_FAILED)
                        .dependency(Dependency.TRANSCRIPTION)
                        .cause(error)
                        .build());
                scheduleReconnect();
            } else {
                // Superseded attempt; its error says nothing about the backend
                monitor.releasePermission(Dependency.TRANSCRIPTION);
            }
            return;
        }
        lock.lock();
        try {
            if (gen != generation || !transcribing) {
                closeQuietly(conn);
            } else {
                connection = conn;
                state = LinkState.STREAMING;
                backoff.reset();
                streaming.signalAll();
                LOG.info("Transcription link reconnected");
            }
        } finally {
            lock.unlock();
        }
        monitor.recordSuccess(Dependency.TRANSCRIPTION);
    }

    private void giveUp() {
        TranscriptionListener l;
        Thread senderThread;
        lock.lock();
        try {
            if (!transcribing) {
                return;
            }
            transcribing = false;
            generation++;
            state = LinkState.DISCONNECTED;
            l = listener;
            senderThread = sender;
            sender = null;
            streaming.signalAll();
        } finally {
            lock.unlock();
        }
        if (senderThread != null) {
            senderThread.interrupt();
        }
        sendBuffer.clear();
        LOG.error("Transcription reconnection gave up after {} attempts", props.getMaxReconnectAttempts());
        ServiceException error = ServiceExceptionBuilder
                .create("Transcription connection lost permanently", ErrorKind.CONNECTION_FAILED)
                .dependency(Dependency.TRANSCRIPTION)
                .retryable(false)
                .metadata("attempts", props.getMaxReconnectAttempts())
                .build();
        if (l != null) {
            l.onError(error);
            l.onClose(true);
        }
    }

    private void dispatch(long gen, String raw) {
        TranscriptionListener l;
        lock.lock();
        try {
            if (gen != generation || !transcribing) {
                return;
            }
            l = listener;
        } finally {
            lock.unlock();
        }
        TranscriptMessage message;
        try {
            message = TranscriptMessageParser.parse(raw);
        } catch (ServiceException e) {
            LOG.warn("Dropping transcription message: {}", e.getMessage());
            l.onError(e);
            return;
        }
        switch (message.type()) {
            case RESULTS:
                RecognizedSpeech speech = message.speech();
                if (speech == null) {
                    return;
                }
                if (speech.isFinal()) {
                    l.onResult(toEntry(speech));
                } else {
                    l.onInterim(speech.text(), speech.speakerIndex());
                }
                break;
            case METADATA:
                requestId = message.requestId();
                LOG.debug("Transcription metadata: requestId={}", requestId);
                break;
            case SPEECH_STARTED:
                l.onSpeechStarted();
                break;
            case UTTERANCE_END:
                l.onUtteranceEnd();
                break;
            case ERROR:
                ServiceException error = ServiceExceptionBuilder
                        .create("Transcription backend error", ErrorKind.PROCESSING_ERROR)
                        .dependency(Dependency.TRANSCRIPTION)
                        .metadata("description", message.error())
                        .build();
                monitor.recordFailure(Dependency.TRANSCRIPTION, error);
                l.onError(error);
                break;
            default:
                LOG.debug("Ignoring unknown transcription message type");
        }
    }

    private TranscriptEntry toEntry(RecognizedSpeech speech) {
        String text = speech.text();
        Sentiment sentiment = tagger.sentiment(text);
        return new TranscriptEntry(0, null, speech.speakerIndex(), text, clock.instant(), speech.durationSec(),
                speech.confidence(), sentiment, tagger.isImportant(text), tagger.keywords(text));
    }

    private void joinSender(Thread senderThread) {
        if (senderThread == null || senderThread == Thread.currentThread()) {
            return;
        }
        senderThread.interrupt();
        try {
            senderThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(StreamingConnection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close(NORMAL_CLOSURE, "client closing");
        } catch (RuntimeException e) {
            LOG.debug("Error closing transcription connection: {}", e.toString());
        }
    }

    /** Routes connection events, tagged with the generation that opened the connection. */
    private final class GenerationHandler implements StreamingConnector.Handler {

        private final long gen;

        GenerationHandler(long gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String message) {
            dispatch(gen, message);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            handleConnectionLost(gen, "closed code=" + statusCode + " reason=" + reason);
        }

        @Override
        public void onFailure(Throwable error) {
            handleConnectionLost(gen, error.toString());
        }
    }
}
