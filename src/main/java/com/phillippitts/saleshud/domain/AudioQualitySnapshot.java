package com.phillippitts.saleshud.domain;

import java.time.Instant;

/**
 * Quality metrics of one processed audio frame. Each frame's snapshot supersedes the previous one.
 *
 * @param averageAmplitude mean absolute sample value (PCM16 units)
 * @param peakAmplitude    largest absolute sample value
 * @param clippingRatio    fraction of samples at saturation
 * @param clippingDetected whether the clipping ratio exceeded the configured limit
 * @param backgroundNoise  estimated noise floor (PCM16 units)
 * @param rms              normalized root-mean-square level between 0.0 and 1.0
 * @param snrDb            signal-to-noise estimate in decibels
 * @param lowSignal        RMS below the audible threshold
 * @param highNoise        SNR below the usable threshold
 * @param score            quality score between 0 and 100
 * @param measuredAt       frame capture time
 */
public record AudioQualitySnapshot(
        double averageAmplitude,
        int peakAmplitude,
        double clippingRatio,
        boolean clippingDetected,
        double backgroundNoise,
        double rms,
        double snrDb,
        boolean lowSignal,
        boolean highNoise,
        int score,
        Instant measuredAt
) {

    public AudioQualitySnapshot {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Quality score must be between 0 and 100, got: " + score);
        }
    }
}
