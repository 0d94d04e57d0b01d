package com.phillippitts.saleshud.service.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.phillippitts.saleshud.config.properties.HealthMonitorProperties;
import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.domain.Sentiment;
import com.phillippitts.saleshud.domain.TranscriptEntry;
import com.phillippitts.saleshud.exception.CircuitOpenException;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.service.analysis.TranscriptTagger;
import com.phillippitts.saleshud.service.audio.AudioFrame;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.transcription.TranscriptionLink.LinkState;
import com.phillippitts.saleshud.testutil.EventCapturingPublisher;
import com.phillippitts.saleshud.testutil.FakeStreamingConnector;
import com.phillippitts.saleshud.testutil.FakeStreamingConnector.FakeConnection;
import com.phillippitts.saleshud.testutil.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class TranscriptionLinkTest {

    private static final String FINAL_RESULT = "{\"type\":\"Results\",\"is_final\":true,\"duration\":1.2,"
            + "\"channel\":{\"alternatives\":[{\"transcript\":\"What is the budget?\",\"confidence\":0.9,"
            + "\"words\":[{\"speaker\":1}]}]}}";
    private static final String INTERIM_RESULT = "{\"type\":\"Results\",\"is_final\":false,"
            + "\"channel\":{\"alternatives\":[{\"transcript\":\"What is\",\"confidence\":0.4}]}}";

    private TranscriptionProperties props;
    private HealthMonitorProperties healthProps;
    private FakeStreamingConnector connector;
    private ThreadPoolTaskScheduler scheduler;
    private RecordingListener listener;
    private TranscriptionLink link;

    @BeforeEach
    void setUp() {
        props = new TranscriptionProperties();
        props.setApiKey("test-key");
        props.setConnectTimeoutMs(500);
        props.setInitialReconnectDelayMs(20);
        props.setMaxReconnectDelayMs(50);
        props.setMaxReconnectAttempts(3);
        healthProps = new HealthMonitorProperties();
        healthProps.setFailureThreshold(100);
        connector = new FakeStreamingConnector();
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        listener = new RecordingListener();
        link = newLink();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        link.stop();
        scheduler.shutdown();
    }

    private TranscriptionLink newLink() {
        ServiceHealthMonitor monitor = new ServiceHealthMonitor(Map.of(), healthProps,
                new EventCapturingPublisher(), new MutableClock());
        return new TranscriptionLink(props, connector, new TranscriptTagger(props), monitor, scheduler,
                new MutableClock());
    }

    private static AudioFrame frame(long sequence) {
        return new AudioFrame(sequence, new short[] {1, -1, 256}, Instant.parse("2026-01-15T10:00:00Z"));
    }

    @Test
    void shouldConnectWithTokenHeaderAndStreamAudio() {
        // Act
        link.connect(listener);
        boolean accepted = link.send(frame(1));

        // Assert
        assertThat(link.getState()).isEqualTo(LinkState.STREAMING);
        assertThat(accepted).isTrue();
        assertThat(connector.lastHeaders()).containsEntry("Authorization", "Token test-key");
        assertThat(connector.lastUri().toString()).contains("encoding=linear16");
        FakeConnection connection = connector.lastConnection();
        await().atMost(Duration.ofSeconds(2)).until(() -> connection.audio().size() == 1);
        assertThat(connection.audio().get(0)).containsExactly(1, 0, -1, -1, 0, 1);
    }

    @Test
    void shouldRejectFramesWhenNotTranscribing() {
        assertThat(link.send(frame(1))).isFalse();
        assertThat(link.getDroppedFrames()).isZero();
    }

    @Test
    void shouldDeliverTaggedFinalResultsAndInterims() {
        // Arrange
        link.connect(listener);
        FakeConnection connection = connector.lastConnection();

        // Act
        connection.receive(INTERIM_RESULT);
        connection.receive(FINAL_RESULT);
        connection.receive("{\"type\":\"Metadata\",\"request_id\":\"req-42\"}");

        // Assert
        assertThat(listener.interims).containsExactly("What is");
        assertThat(listener.results).hasSize(1);
        TranscriptEntry entry = listener.results.get(0);
        assertThat(entry.text()).isEqualTo("What is the budget?");
        assertThat(entry.speakerIndex()).isEqualTo(1);
        assertThat(entry.speaker()).isEqualTo("Speaker 2");
        assertThat(entry.sentiment()).isEqualTo(Sentiment.NEUTRAL);
        assertThat(entry.important()).isTrue();
        assertThat(entry.keywords()).contains("budget");
        assertThat(link.getRequestId()).isEqualTo("req-42");
    }

    @Test
    void shouldReportBackendErrorsAndMalformedMessages() {
        link.connect(listener);
        FakeConnection connection = connector.lastConnection();

        connection.receive("{\"type\":\"Error\",\"description\":\"unsupported encoding\"}");
        connection.receive("not json");

        assertThat(listener.errors).hasSize(2);
        assertThat(listener.errors).allSatisfy(e -> assertThat(e.getKind()).isEqualTo(ErrorKind.PROCESSING_ERROR));
        assertThat(link.isTranscribing()).isTrue();
    }

    @Test
    void shouldSendCloseStreamOnStop() {
        // Arrange
        link.connect(listener);
        FakeConnection connection = connector.lastConnection();

        // Act
        link.stop();
        link.stop();

        // Assert
        assertThat(connection.texts()).containsExactly(TranscriptionLink.CLOSE_STREAM_MESSAGE);
        assertThat(connection.isClosed()).isTrue();
        assertThat(connection.closeCode()).isEqualTo(1000);
        assertThat(link.getState()).isEqualTo(LinkState.DISCONNECTED);
        assertThat(listener.closes).containsExactly(false);
        assertThat(link.send(frame(2))).isFalse();
    }

    @Test
    void shouldAllowReconnectAfterStop() {
        link.connect(listener);
        link.stop();

        link.connect(listener);

        assertThat(link.getState()).isEqualTo(LinkState.STREAMING);
        assertThat(connector.connectCalls()).isEqualTo(2);
    }

    @Test
    void shouldReconnectAfterConnectionDrop() {
        // Arrange
        link.connect(listener);
        FakeConnection first = connector.lastConnection();

        // Act
        first.drop("server restart");

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> link.getState() == LinkState.STREAMING);
        assertThat(connector.connectCalls()).isEqualTo(2);
        assertThat(first.isClosed()).isTrue();
        FakeConnection second = connector.lastConnection();
        assertThat(second).isNotSameAs(first);

        link.send(frame(3));
        await().atMost(Duration.ofSeconds(2)).until(() -> second.audio().size() == 1);
        assertThat(first.audio()).isEmpty();
    }

    @Test
    void shouldReconnectUnderCallerLogContext() {
        // Arrange
        ThreadContext.put("meetingId", "m-7");
        link.connect(listener);
        ThreadContext.clearAll();

        // Act
        connector.lastConnection().drop("server restart");

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> connector.connectCalls() == 2
                && link.getState() == LinkState.STREAMING);
        assertThat(connector.connectContexts())
                .hasSize(2)
                .allSatisfy(context -> assertThat(context).containsEntry("meetingId", "m-7"));
    }

    @Test
    void shouldIgnoreMessagesFromReplacedConnection() {
        link.connect(listener);
        FakeConnection first = connector.lastConnection();
        first.drop("network blip");
        await().atMost(Duration.ofSeconds(2)).until(() -> link.getState() == LinkState.STREAMING);

        first.receive(FINAL_RESULT);

        assertThat(listener.results).isEmpty();
    }

    @Test
    void shouldGiveUpAfterReconnectAttemptsExhausted() {
        // Arrange
        props.setMaxReconnectAttempts(2);
        link = newLink();
        link.connect(listener);
        connector.failNext(new IOException("refused"));
        connector.failNext(new IOException("refused"));

        // Act
        connector.lastConnection().drop("gone");

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> listener.closes.contains(true));
        assertThat(connector.connectCalls()).isEqualTo(3);
        assertThat(link.getState()).isEqualTo(LinkState.DISCONNECTED);
        assertThat(link.isTranscribing()).isFalse();
        assertThat(listener.errors).anySatisfy(e -> {
            assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION_FAILED);
            assertThat(e.isRetryable()).isFalse();
        });
    }

    @Test
    void shouldFailConnectWhenBackendRefuses() {
        connector.failNext(new IOException("refused"));

        assertThatThrownBy(() -> link.connect(listener))
                .isInstanceOf(ServiceException.class)
                .satisfies(e -> assertThat(((ServiceException) e).getKind()).isEqualTo(ErrorKind.CONNECTION_FAILED));
        assertThat(link.getState()).isEqualTo(LinkState.DISCONNECTED);
    }

    @Test
    void shouldTimeOutWhenConnectNeverCompletes() {
        props.setConnectTimeoutMs(100);
        link = newLink();
        connector.hang(true);

        assertThatThrownBy(() -> link.connect(listener))
                .isInstanceOf(ServiceException.class)
                .satisfies(e -> assertThat(((ServiceException) e).getKind()).isEqualTo(ErrorKind.TIMEOUT));
        assertThat(link.getState()).isEqualTo(LinkState.DISCONNECTED);
    }

    @Test
    void shouldFailFastWhileTranscriptionCircuitIsOpen() {
        // Arrange
        healthProps.setFailureThreshold(1);
        ServiceHealthMonitor monitor = new ServiceHealthMonitor(Map.of(), healthProps,
                new EventCapturingPublisher(), new MutableClock());
        monitor.recordFailure(Dependency.TRANSCRIPTION, new IOException("down"));
        link = new TranscriptionLink(props, connector, new TranscriptTagger(props), monitor, scheduler,
                new MutableClock());

        // Act / Assert
        assertThatThrownBy(() -> link.connect(listener)).isInstanceOf(CircuitOpenException.class);
        assertThat(connector.connectCalls()).isZero();
    }

    static class RecordingListener implements TranscriptionListener {
        final List<TranscriptEntry> results = new CopyOnWriteArrayList<>();
        final List<String> interims = new CopyOnWriteArrayList<>();
        final List<ServiceException> errors = new CopyOnWriteArrayList<>();
        final List<Boolean> closes = new CopyOnWriteArrayList<>();

        @Override
        public void onResult(TranscriptEntry entry) {
            results.add(entry);
        }

        @Override
        public void onInterim(String text, int speakerIndex) {
            interims.add(text);
        }

        @Override
        public void onError(ServiceException error) {
            errors.add(error);
        }

        @Override
        public void onClose(boolean permanent) {
            closes.add(permanent);
        }
    }
}
