package com.phillippitts.saleshud.service.audio;

import com.phillippitts.saleshud.config.properties.AudioPipelineProperties;
import com.phillippitts.saleshud.config.properties.AudioPipelineProperties.SampleEncoding;
import com.phillippitts.saleshud.exception.AudioPipelineException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone capture that emits processed PCM16LE mono frames at 16 kHz.
 * Thread-safe for a single active stream.
 *
 * <p>Device acquisition happens synchronously in {@link #start} so that an unavailable or
 * forbidden microphone fails the start. Device loss after that is reported once through
 * {@link AudioPipelineListener#onError}.
 */
@Service
public class JavaSoundAudioPipeline implements AudioPipeline {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioPipeline.class);
    private static final long CAPTURE_THREAD_STOP_TIMEOUT_MS = 2_000;

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioPipelineProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final Clock clock;

    private final Object lock = new Object();
    private Capture current;

    @Autowired
    public JavaSoundAudioPipeline(AudioPipelineProperties props,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        this(props, publisher, clock, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioPipeline(AudioPipelineProperties props,
                           ApplicationEventPublisher publisher,
                           Clock clock,
                           DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String device = props.getDeviceName() != null ? props.getDeviceName() : "default";
        LOG.info("Audio pipeline initialized: device='{}', available-mixers={}, frame={} samples, encoding={}",
                device, AudioSystem.getMixerInfo().length, props.getFrameSamples(), props.getSampleEncoding());
    }

    @PreDestroy
    public void shutdown() {
        if (isRunning()) {
            LOG.info("Shutting down with active audio stream; forcing cleanup");
        }
        stop();
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public AudioStream start(DeviceConstraints constraints, AudioPipelineListener listener) {
        Objects.requireNonNull(constraints, "constraints must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Audio pipeline is already active");
            }
            String device = constraints.deviceName() != null ? constraints.deviceName() : props.getDeviceName();
            TargetDataLine line = openLine(device);
            AudioStream stream = new AudioStream(UUID.randomUUID(), clock.instant(),
                    AudioFormat.REQUIRED_SAMPLE_RATE, props.getFrameSamples());
            Capture capture = new Capture(stream, line, listener, new AudioFrameProcessor(props), constraints);
            capture.active.set(true);
            Thread t = new Thread(() -> doCapture(capture), "audio-capture");
            t.setDaemon(true);
            capture.thread = t;
            current = capture;
            t.start();
            LOG.info("Audio stream {} started (device='{}')", stream.id(), device != null ? device : "default");
            return stream;
        }
    }

    @Override
    public void stop() {
        Capture capture;
        synchronized (lock) {
            capture = current;
            current = null;
            if (capture == null) {
                return;
            }
            capture.active.set(false);
        }
        // Closing the line unblocks a pending read; join outside the lock to avoid deadlock
        closeLine(capture.line);
        joinThread(capture.thread, CAPTURE_THREAD_STOP_TIMEOUT_MS);
        LOG.info("Audio stream {} stopped after {} frames", capture.stream.id(), capture.frames);
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    private TargetDataLine openLine(String device) {
        try {
            TargetDataLine line = provider.open(captureFormat(), Optional.ofNullable(device));
            line.start();
            return line;
        } catch (LineUnavailableException | IllegalArgumentException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            publisher.publishEvent(new AudioErrorEvent("MIC_UNAVAILABLE", clock.instant()));
            throw new AudioPipelineException("Microphone unavailable: " + e.getMessage(), "MIC_UNAVAILABLE", e);
        } catch (SecurityException e) {
            LOG.warn("Microphone access denied: {}", e.getMessage());
            publisher.publishEvent(new AudioErrorEvent("MIC_PERMISSION_DENIED", clock.instant()));
            throw new AudioPipelineException("Microphone access denied", "MIC_PERMISSION_DENIED", e);
        }
    }

    javax.sound.sampled.AudioFormat captureFormat() {
        if (props.getSampleEncoding() == SampleEncoding.FLOAT32) {
            return new javax.sound.sampled.AudioFormat(javax.sound.sampled.AudioFormat.Encoding.PCM_FLOAT,
                    AudioFormat.REQUIRED_SAMPLE_RATE, 32, AudioFormat.REQUIRED_CHANNELS, 4,
                    AudioFormat.REQUIRED_SAMPLE_RATE, AudioFormat.REQUIRED_BIG_ENDIAN);
        }
        return new javax.sound.sampled.AudioFormat(
                AudioFormat.REQUIRED_SAMPLE_RATE,
                AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS,
                AudioFormat.REQUIRED_SIGNED,
                AudioFormat.REQUIRED_BIG_ENDIAN);
    }

    private void doCapture(Capture c) {
        boolean floatInput = props.getSampleEncoding() == SampleEncoding.FLOAT32;
        byte[] buf = new byte[props.getFrameSamples() * (floatInput ? 4 : 2)];
        try {
            while (c.active.get()) {
                if (!fill(c, buf)) {
                    break;
                }
                short[] samples = floatInput ? decodeFloat32(buf) : decodePcm16(buf);
                AudioFrameProcessor.ProcessedFrame processed =
                        c.processor.process(samples, clock.instant(), c.constraints);
                c.frames++;
                deliver(c, new AudioFrame(c.frames, processed.samples(), processed.snapshot().measuredAt()),
                        processed);
            }
        } catch (AudioPipelineException e) {
            reportLoss(c, e);
        } catch (RuntimeException e) {
            reportLoss(c, new AudioPipelineException("Capture failed: " + e, "DEVICE_LOST", e));
        } finally {
            closeLine(c.line);
        }
    }

    /** Reads one full frame; returns false when capture was stopped meanwhile. */
    private boolean fill(Capture c, byte[] buf) {
        int filled = 0;
        while (filled < buf.length) {
            if (!c.active.get()) {
                return false;
            }
            int n = c.line.read(buf, filled, buf.length - filled);
            if (n < 0 || (n == 0 && !c.line.isOpen())) {
                if (!c.active.get()) {
                    return false;
                }
                throw new AudioPipelineException("Audio device stopped delivering data", "DEVICE_LOST");
            }
            filled += n;
        }
        return true;
    }

    private void deliver(Capture c, AudioFrame frame, AudioFrameProcessor.ProcessedFrame processed) {
        try {
            c.listener.onFrame(frame);
            if (processed.qualityChanged()) {
                c.listener.onQualityChanged(processed.snapshot());
            }
        } catch (RuntimeException e) {
            LOG.warn("Audio listener failed on frame {}: {}", frame.sequence(), e.toString());
        }
    }

    private void reportLoss(Capture c, AudioPipelineException e) {
        // Errors raised after stop() are the result of closing the line, not device loss
        if (!c.active.getAndSet(false)) {
            return;
        }
        LOG.warn("Audio device lost on stream {}: {}", c.stream.id(), e.getMessage());
        publisher.publishEvent(new AudioErrorEvent(e.getReason(), clock.instant()));
        c.listener.onError(e);
    }

    static short[] decodePcm16(byte[] buf) {
        short[] out = new short[buf.length / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (short) ((buf[2 * i] & 0xff) | (buf[2 * i + 1] << 8));
        }
        return out;
    }

    static short[] decodeFloat32(byte[] buf) {
        float[] floats = new float[buf.length / 4];
        ByteBuffer.wrap(buf).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(floats);
        return AudioFrameProcessor.floatToPcm16(floats);
    }

    private void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Ignoring error while closing capture line: {}", e.toString());
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Capture {
        final AudioStream stream;
        final TargetDataLine line;
        final AudioPipelineListener listener;
        final AudioFrameProcessor processor;
        final DeviceConstraints constraints;
        final AtomicBoolean active = new AtomicBoolean(false);
        volatile Thread thread;
        volatile long frames;

        Capture(AudioStream stream, TargetDataLine line, AudioPipelineListener listener,
                AudioFrameProcessor processor, DeviceConstraints constraints) {
            this.stream = stream;
            this.line = line;
            this.listener = listener;
            this.processor = processor;
            this.constraints = constraints;
        }
    }
}
