package com.phillippitts.saleshud.service.audio;

import com.phillippitts.saleshud.config.properties.AudioPipelineProperties;
import com.phillippitts.saleshud.domain.AudioQualitySnapshot;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;

import static com.phillippitts.saleshud.service.audio.AudioFormat.PCM_MAX;
import static com.phillippitts.saleshud.service.audio.AudioFormat.PCM_MIN;

/**
 * Per-frame noise gate, automatic gain and quality scoring.
 *
 * <p>Quality is measured on the frame as captured, before gating and gain, so clipping at the
 * device is reported even when the gain stage would attenuate it.
 *
 * <p>Not thread-safe: one instance per capture stream, used only by the capture thread.
 */
public final class AudioFrameProcessor {

    private static final int NOISE_WINDOW_FRAMES = 50;
    private static final double NOISE_FLOOR_PERCENTILE = 0.10;
    private static final double LOW_SIGNAL_RMS = 0.01;
    private static final double HIGH_NOISE_SNR_DB = 10.0;
    private static final double MAX_SNR_DB = 60.0;
    private static final double FULL_SCALE = 32_768.0;

    private static final int CLIPPING_PENALTY = 20;
    private static final int LOW_AMPLITUDE_PENALTY = 15;
    private static final int BACKGROUND_NOISE_PENALTY = 10;

    private final AudioPipelineProperties props;
    private final Deque<Double> recentRms = new ArrayDeque<>();
    private Integer lastEmittedScore;

    public AudioFrameProcessor(AudioPipelineProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * Output of {@link #process}.
     *
     * @param samples        gated and gain-adjusted samples
     * @param snapshot       quality of the captured frame
     * @param qualityChanged whether the score moved enough to be reported
     */
    public record ProcessedFrame(short[] samples, AudioQualitySnapshot snapshot, boolean qualityChanged) { }

    public ProcessedFrame process(short[] captured, Instant capturedAt, DeviceConstraints constraints) {
        AudioQualitySnapshot snapshot = analyze(captured, capturedAt);
        short[] out = Arrays.copyOf(captured, captured.length);
        if (constraints.noiseGate()) {
            applyNoiseGate(out);
        }
        if (constraints.autoGain()) {
            applyAutomaticGain(out);
        }
        return new ProcessedFrame(out, snapshot, shouldEmit(snapshot.score()));
    }

    /**
     * Converts normalized float samples to PCM16: clamp to [-1, 1], then scale negatives by 0x8000
     * and positives by 0x7FFF.
     */
    public static short[] floatToPcm16(float[] input) {
        short[] out = new short[input.length];
        for (int i = 0; i < input.length; i++) {
            float s = Math.max(-1.0f, Math.min(1.0f, input[i]));
            out[i] = (short) (s < 0 ? s * 0x8000 : s * 0x7FFF);
        }
        return out;
    }

    void applyNoiseGate(short[] samples) {
        int threshold = props.getNoiseGateThreshold();
        for (int i = 0; i < samples.length; i++) {
            if (Math.abs(samples[i]) < threshold) {
                samples[i] = 0;
            }
        }
    }

    void applyAutomaticGain(short[] samples) {
        int peak = 0;
        for (short s : samples) {
            peak = Math.max(peak, Math.abs((int) s));
        }
        if (peak == 0) {
            return;
        }
        double gain = Math.min(props.getMaxGain(), props.getTargetPeak() / (double) peak);
        for (int i = 0; i < samples.length; i++) {
            long scaled = Math.round(samples[i] * gain);
            samples[i] = (short) Math.max(PCM_MIN, Math.min(PCM_MAX, scaled));
        }
    }

    AudioQualitySnapshot analyze(short[] samples, Instant at) {
        int n = samples.length;
        long sum = 0;
        double sumSquares = 0;
        int peak = 0;
        int clipped = 0;
        for (short s : samples) {
            int magnitude = Math.abs((int) s);
            sum += magnitude;
            sumSquares += (double) s * s;
            peak = Math.max(peak, magnitude);
            if (magnitude >= PCM_MAX) {
                clipped++;
            }
        }
        double average = n == 0 ? 0.0 : (double) sum / n;
        double clippingRatio = n == 0 ? 0.0 : (double) clipped / n;
        boolean clipping = clipped > n * props.getClippingRatio();
        double rms = n == 0 ? 0.0 : Math.sqrt(sumSquares / n) / FULL_SCALE;

        // Noise floor comes from earlier frames only; the first frame has no floor yet.
        double noiseFloor = noiseFloor();
        recordRms(rms);
        double backgroundNoise = noiseFloor * FULL_SCALE;
        double snrDb = signalToNoise(rms, noiseFloor);

        int score = 100;
        score -= clipping ? CLIPPING_PENALTY : 0;
        score -= average < props.getLowAmplitudeThreshold() ? LOW_AMPLITUDE_PENALTY : 0;
        score -= backgroundNoise > props.getBackgroundNoiseThreshold() ? BACKGROUND_NOISE_PENALTY : 0;
        score = Math.max(0, Math.min(100, score));

        return new AudioQualitySnapshot(average, peak, clippingRatio, clipping, backgroundNoise, rms, snrDb,
                rms < LOW_SIGNAL_RMS, snrDb < HIGH_NOISE_SNR_DB, score, at);
    }

    boolean shouldEmit(int score) {
        if (lastEmittedScore == null || Math.abs(score - lastEmittedScore) > props.getQualityChangeThreshold()) {
            lastEmittedScore = score;
            return true;
        }
        return false;
    }

    private double noiseFloor() {
        if (recentRms.isEmpty()) {
            return 0.0;
        }
        double[] sorted = recentRms.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int index = (int) Math.floor(NOISE_FLOOR_PERCENTILE * (sorted.length - 1));
        return sorted[index];
    }

    private void recordRms(double rms) {
        recentRms.addLast(rms);
        if (recentRms.size() > NOISE_WINDOW_FRAMES) {
            recentRms.removeFirst();
        }
    }

    private static double signalToNoise(double rms, double noiseFloor) {
        if (rms <= 0.0) {
            return 0.0;
        }
        if (noiseFloor <= 0.0) {
            return MAX_SNR_DB;
        }
        double db = 20.0 * Math.log10(rms / noiseFloor);
        return Math.max(0.0, Math.min(MAX_SNR_DB, db));
    }
}
