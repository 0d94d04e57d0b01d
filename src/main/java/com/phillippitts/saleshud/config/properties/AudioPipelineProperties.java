package com.phillippitts.saleshud.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture and per-frame processing.
 *
 * <p>Output format is fixed (16 kHz, 16-bit signed PCM, mono, little-endian); these settings
 * only tune frame size, the noise gate, automatic gain and quality scoring.
 */
@Validated
@ConfigurationProperties(prefix = "audio.pipeline")
public class AudioPipelineProperties {

    /** Sample encoding delivered by the capture line before conversion to PCM16. */
    public enum SampleEncoding { PCM16, FLOAT32 }

    /** Samples per emitted frame. */
    @Min(256)
    @Max(16_384)
    private int frameSamples = 4096;

    @NotNull
    private SampleEncoding sampleEncoding = SampleEncoding.PCM16;

    /** Samples with a magnitude below this value are zeroed. */
    @Min(0)
    @Max(32_767)
    private int noiseGateThreshold = 500;

    /** Peak amplitude the automatic gain scales toward. */
    @Min(1)
    @Max(32_767)
    private int targetPeak = 16_384;

    /** Upper bound on the gain applied to quiet frames. */
    @DecimalMin("1.0")
    @DecimalMax("16.0")
    private double maxGain = 2.0;

    /** Average amplitude below which a frame is considered too quiet. */
    @Positive
    private int lowAmplitudeThreshold = 1000;

    /** Noise floor (PCM units) above which a frame is considered noisy. */
    @Positive
    private int backgroundNoiseThreshold = 2000;

    /** Fraction of saturated samples above which clipping is flagged. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double clippingRatio = 0.01;

    /** Minimum score movement before a quality update is emitted. */
    @Min(0)
    @Max(100)
    private int qualityChangeThreshold = 5;

    /** Quality score below which the orchestrator raises a degraded-audio warning. */
    @Min(0)
    @Max(100)
    private int degradedScoreThreshold = 60;

    /** Optional input device name hint; falls back to the system default when blank. */
    private String deviceName;

    public int getFrameSamples() {
        return frameSamples;
    }

    public void setFrameSamples(int frameSamples) {
        this.frameSamples = frameSamples;
    }

    public SampleEncoding getSampleEncoding() {
        return sampleEncoding;
    }

    public void setSampleEncoding(SampleEncoding sampleEncoding) {
        this.sampleEncoding = sampleEncoding;
    }

    public int getNoiseGateThreshold() {
        return noiseGateThreshold;
    }

    public void setNoiseGateThreshold(int noiseGateThreshold) {
        this.noiseGateThreshold = noiseGateThreshold;
    }

    public int getTargetPeak() {
        return targetPeak;
    }

    public void setTargetPeak(int targetPeak) {
        this.targetPeak = targetPeak;
    }

    public double getMaxGain() {
        return maxGain;
    }

    public void setMaxGain(double maxGain) {
        this.maxGain = maxGain;
    }

    public int getLowAmplitudeThreshold() {
        return lowAmplitudeThreshold;
    }

    public void setLowAmplitudeThreshold(int lowAmplitudeThreshold) {
        this.lowAmplitudeThreshold = lowAmplitudeThreshold;
    }

    public int getBackgroundNoiseThreshold() {
        return backgroundNoiseThreshold;
    }

    public void setBackgroundNoiseThreshold(int backgroundNoiseThreshold) {
        this.backgroundNoiseThreshold = backgroundNoiseThreshold;
    }

    public double getClippingRatio() {
        return clippingRatio;
    }

    public void setClippingRatio(double clippingRatio) {
        this.clippingRatio = clippingRatio;
    }

    public int getQualityChangeThreshold() {
        return qualityChangeThreshold;
    }

    public void setQualityChangeThreshold(int qualityChangeThreshold) {
        this.qualityChangeThreshold = qualityChangeThreshold;
    }

    public int getDegradedScoreThreshold() {
        return degradedScoreThreshold;
    }

    public void setDegradedScoreThreshold(int degradedScoreThreshold) {
        this.degradedScoreThreshold = degradedScoreThreshold;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public void setDeviceName(String deviceName) {
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }
}
