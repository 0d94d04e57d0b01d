package com.phillippitts.saleshud.service.audio;

import com.phillippitts.saleshud.config.properties.AudioPipelineProperties;
import com.phillippitts.saleshud.domain.AudioQualitySnapshot;
import com.phillippitts.saleshud.exception.AudioPipelineException;
import com.phillippitts.saleshud.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JavaSoundAudioPipelineTest {

    private static AudioPipelineProperties smallFrames() {
        AudioPipelineProperties props = new AudioPipelineProperties();
        props.setFrameSamples(256);
        return props;
    }

    @Test
    void shouldDeliverSequencedFramesOfConfiguredSize() {
        // Arrange
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        JavaSoundAudioPipeline pipeline = new JavaSoundAudioPipeline(smallFrames(), publisher, Clock.systemUTC(),
                (fmt, dev) -> new ScriptedTargetDataLine(fmt, -1));
        RecordingListener listener = new RecordingListener();

        // Act
        AudioStream stream = pipeline.start(DeviceConstraints.defaults(), listener);
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.frames.size() >= 3);
        pipeline.stop();

        // Assert
        assertThat(stream.sampleRate()).isEqualTo(16_000);
        assertThat(stream.frameSamples()).isEqualTo(256);
        assertThat(listener.frames.get(0).sequence()).isEqualTo(1);
        assertThat(listener.frames.get(1).sequence()).isEqualTo(2);
        assertThat(listener.frames.get(0).samples()).hasSize(256);
        assertThat(listener.snapshots).isNotEmpty();
        assertThat(listener.errors).isEmpty();
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void shouldRejectSecondStartWhileRunning() {
        // Arrange
        JavaSoundAudioPipeline pipeline = new JavaSoundAudioPipeline(smallFrames(), new EventCapturingPublisher(),
                Clock.systemUTC(), (fmt, dev) -> new ScriptedTargetDataLine(fmt, -1));
        pipeline.start(DeviceConstraints.defaults(), new RecordingListener());

        try {
            // Act / Assert
            assertThatThrownBy(() -> pipeline.start(DeviceConstraints.defaults(), new RecordingListener()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already active");
        } finally {
            pipeline.stop();
        }
    }

    @Test
    void shouldFailStartWithUnavailableReasonWhenNoDevice() {
        // Arrange
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        JavaSoundAudioPipeline pipeline = new JavaSoundAudioPipeline(smallFrames(), publisher, Clock.systemUTC(),
                (fmt, dev) -> {
                    throw new LineUnavailableException("No audio device available");
                });

        // Act / Assert
        assertThatThrownBy(() -> pipeline.start(DeviceConstraints.defaults(), new RecordingListener()))
                .isInstanceOf(AudioPipelineException.class)
                .extracting(e -> ((AudioPipelineException) e).getReason())
                .isEqualTo("MIC_UNAVAILABLE");
        assertThat(publisher.eventsOfType(AudioErrorEvent.class))
                .extracting(AudioErrorEvent::reason)
                .containsExactly("MIC_UNAVAILABLE");
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void shouldMapSecurityExceptionToPermissionDenied() {
        // Arrange
        JavaSoundAudioPipeline pipeline = new JavaSoundAudioPipeline(smallFrames(), new EventCapturingPublisher(),
                Clock.systemUTC(), (fmt, dev) -> {
                    throw new SecurityException("Microphone access denied");
                });

        // Act / Assert
        assertThatThrownBy(() -> pipeline.start(DeviceConstraints.defaults(), new RecordingListener()))
                .isInstanceOf(AudioPipelineException.class)
                .extracting(e -> ((AudioPipelineException) e).getReason())
                .isEqualTo("MIC_PERMISSION_DENIED");
    }

    @Test
    void shouldReportDeviceLossToListenerOnce() {
        // Arrange: line dies after two frames' worth of reads
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        JavaSoundAudioPipeline pipeline = new JavaSoundAudioPipeline(smallFrames(), publisher, Clock.systemUTC(),
                (fmt, dev) -> new ScriptedTargetDataLine(fmt, 4));
        RecordingListener listener = new RecordingListener();

        // Act
        pipeline.start(DeviceConstraints.defaults(), listener);
        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.errors.isEmpty());

        // Assert
        assertThat(listener.errors).hasSize(1);
        assertThat(listener.errors.get(0).getReason()).isEqualTo("DEVICE_LOST");
        assertThat(publisher.eventsOfType(AudioErrorEvent.class)).hasSize(1);
        await().atMost(Duration.ofSeconds(2)).until(() -> !pipeline.isRunning());
        pipeline.stop();
    }

    @Test
    void shouldNotReportErrorForRequestedStop() {
        // Arrange
        JavaSoundAudioPipeline pipeline = new JavaSoundAudioPipeline(smallFrames(), new EventCapturingPublisher(),
                Clock.systemUTC(), (fmt, dev) -> new ScriptedTargetDataLine(fmt, -1));
        RecordingListener listener = new RecordingListener();
        pipeline.start(DeviceConstraints.defaults(), listener);
        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.frames.isEmpty());

        // Act
        pipeline.stop();
        pipeline.stop();

        // Assert
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void shouldDecodeLittleEndianPcm16() {
        // Act
        short[] samples = JavaSoundAudioPipeline.decodePcm16(new byte[]{0x01, 0x00, (byte) 0xff, (byte) 0xff,
                0x00, (byte) 0x80});

        // Assert
        assertThat(samples).containsExactly((short) 1, (short) -1, (short) -32_768);
    }

    static final class RecordingListener implements AudioPipelineListener {
        final List<AudioFrame> frames = new CopyOnWriteArrayList<>();
        final List<AudioQualitySnapshot> snapshots = new CopyOnWriteArrayList<>();
        final List<AudioPipelineException> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onFrame(AudioFrame frame) {
            frames.add(frame);
        }

        @Override
        public void onQualityChanged(AudioQualitySnapshot snapshot) {
            snapshots.add(snapshot);
        }

        @Override
        public void onError(AudioPipelineException error) {
            errors.add(error);
        }
    }

    /**
     * Produces a ramp pattern; after {@code readsBeforeLoss} reads (if non-negative) returns -1 as a
     * disconnected device would.
     */
    static final class ScriptedTargetDataLine implements TargetDataLine {
        private final javax.sound.sampled.AudioFormat fmt;
        private final int readsBeforeLoss;
        private volatile boolean started;
        private volatile boolean open = true;
        private int reads;

        ScriptedTargetDataLine(javax.sound.sampled.AudioFormat fmt, int readsBeforeLoss) {
            this.fmt = fmt;
            this.readsBeforeLoss = readsBeforeLoss;
        }

        @Override public int read(byte[] b, int off, int len) {
            if (!started || !open) {
                return 0;
            }
            if (readsBeforeLoss >= 0 && reads++ >= readsBeforeLoss) {
                return -1;
            }
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            int n = Math.min(len, 256);
            for (int i = 0; i < n; i++) {
                b[off + i] = (byte) (i * 7);
            }
            return n;
        }
        @Override public javax.sound.sampled.AudioFormat getFormat() {
            return fmt;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format, int bufferSize) {
            open = true;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format) {
            open = true;
        }
        @Override public void open() {
            open = true;
        }
        @Override public void start() {
            started = true;
        }
        @Override public void stop() {
            started = false;
        }
        @Override public void close() {
            open = false;
        }
        @Override public boolean isOpen() {
            return open;
        }
        @Override public boolean isActive() {
            return started;
        }
        @Override public boolean isRunning() {
            return started;
        }
        @Override public int available() {
            return 0;
        }
        @Override public void drain() {
        }
        @Override public void flush() {
        }
        @Override public int getBufferSize() {
            return 0;
        }
        @Override public int getFramePosition() {
            return 0;
        }
        @Override public long getLongFramePosition() {
            return 0L;
        }
        @Override public long getMicrosecondPosition() {
            return 0L;
        }
        @Override public float getLevel() {
            return 0;
        }
        @Override public Control getControl(Control.Type control) {
            throw new IllegalArgumentException();
        }
        @Override public Control[] getControls() {
            return new Control[0];
        }
        @Override public boolean isControlSupported(Control.Type control) {
            return false;
        }
        @Override public void addLineListener(LineListener listener) {
        }
        @Override public void removeLineListener(LineListener listener) {
        }
        @Override public javax.sound.sampled.Line.Info getLineInfo() {
            return new DataLine.Info(TargetDataLine.class, fmt);
        }
    }
}
