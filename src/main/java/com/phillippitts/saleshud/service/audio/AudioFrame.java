package com.phillippitts.saleshud.service.audio;

import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-size block of processed PCM16 samples.
 *
 * @param sequence   capture order, starting at 1 per stream
 * @param samples    processed samples (the array is owned by the frame)
 * @param capturedAt capture time
 */
public record AudioFrame(long sequence, short[] samples, Instant capturedAt) {

    public AudioFrame {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
    }

    /** Encodes the samples as little-endian PCM16 bytes. */
    public byte[] toPcmBytes() {
        byte[] out = new byte[samples.length * AudioFormat.REQUIRED_BLOCK_ALIGN];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xff);
            out[2 * i + 1] = (byte) ((samples[i] >> 8) & 0xff);
        }
        return out;
    }
}
