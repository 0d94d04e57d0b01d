package com.phillippitts.saleshud.service.audio;

import com.phillippitts.saleshud.config.properties.AudioPipelineProperties;
import com.phillippitts.saleshud.domain.AudioQualitySnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AudioFrameProcessorTest {

    private static final Instant AT = Instant.parse("2026-01-15T10:00:00Z");

    private final AudioPipelineProperties props = new AudioPipelineProperties();

    @Test
    void shouldZeroSamplesBelowNoiseGate() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] samples = {100, -400, 600, -700, 499, -500};

        // Act
        processor.applyNoiseGate(samples);

        // Assert
        assertThat(samples).containsExactly((short) 0, (short) 0, (short) 600, (short) -700, (short) 0,
                (short) -500);
    }

    @Test
    void shouldCapGainAtMaxGainForQuietFrames() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] samples = {1000, -500, 250};

        // Act
        processor.applyAutomaticGain(samples);

        // Assert: target/peak would be ~16x, capped at 2x
        assertThat(samples).containsExactly((short) 2000, (short) -1000, (short) 500);
    }

    @Test
    void shouldAttenuateLoudFramesTowardTargetPeak() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] samples = {20_000, -10_000};

        // Act
        processor.applyAutomaticGain(samples);

        // Assert
        assertThat(samples[0]).isEqualTo((short) 16_384);
        assertThat(samples[1]).isEqualTo((short) -8_192);
    }

    @Test
    void shouldLeaveSilentFrameUntouched() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] samples = new short[8];

        // Act
        processor.applyAutomaticGain(samples);

        // Assert
        assertThat(samples).containsOnly((short) 0);
    }

    @Test
    void shouldClampAndScaleFloatSamples() {
        // Act
        short[] pcm = AudioFrameProcessor.floatToPcm16(new float[]{1.0f, -1.0f, 2.0f, -3.0f, 0.0f});

        // Assert
        assertThat(pcm).containsExactly((short) 32_767, (short) -32_768, (short) 32_767, (short) -32_768,
                (short) 0);
    }

    @Test
    void shouldPenalizeClippingAndReportItFromCapturedFrame() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] captured = new short[100];
        Arrays.fill(captured, (short) 32_767);

        // Act
        AudioFrameProcessor.ProcessedFrame frame = processor.process(captured, AT, DeviceConstraints.defaults());

        // Assert
        AudioQualitySnapshot snapshot = frame.snapshot();
        assertThat(snapshot.clippingDetected()).isTrue();
        assertThat(snapshot.clippingRatio()).isEqualTo(1.0);
        assertThat(snapshot.score()).isEqualTo(80);
        assertThat(snapshot.measuredAt()).isEqualTo(AT);
        // Gain stage pulled the output below full scale
        assertThat(frame.samples()[0]).isEqualTo((short) 16_384);
    }

    @Test
    void shouldFlagLowAmplitudeFrames() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] captured = new short[100];
        Arrays.fill(captured, (short) 100);

        // Act
        AudioQualitySnapshot snapshot = processor.analyze(captured, AT);

        // Assert
        assertThat(snapshot.averageAmplitude()).isEqualTo(100.0);
        assertThat(snapshot.lowSignal()).isTrue();
        assertThat(snapshot.clippingDetected()).isFalse();
        assertThat(snapshot.score()).isEqualTo(85);
    }

    @Test
    void shouldEmitQualityOnlyWhenScoreMovesPastThreshold() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);

        // Act / Assert
        assertThat(processor.shouldEmit(90)).isTrue();
        assertThat(processor.shouldEmit(86)).isFalse();
        assertThat(processor.shouldEmit(95)).isFalse();
        assertThat(processor.shouldEmit(80)).isTrue();
    }

    @Test
    void shouldSkipGateAndGainWhenConstraintsDisableThem() {
        // Arrange
        AudioFrameProcessor processor = new AudioFrameProcessor(props);
        short[] captured = {100, 200, 300};

        // Act
        AudioFrameProcessor.ProcessedFrame frame =
                processor.process(captured, AT, new DeviceConstraints(null, false, false));

        // Assert
        assertThat(frame.samples()).containsExactly((short) 100, (short) 200, (short) 300);
        assertThat(frame.samples()).isNotSameAs(captured);
    }
}
