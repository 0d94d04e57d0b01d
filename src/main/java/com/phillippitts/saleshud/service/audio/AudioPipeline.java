package com.phillippitts.saleshud.service.audio;

/**
 * Microphone capture producing processed fixed-size PCM16 frames.
 *
 * <p>Exclusive: one stream at a time.
 */
public interface AudioPipeline {

    /**
     * Acquires the capture device and starts delivering frames to {@code listener}.
     *
     * @throws com.phillippitts.saleshud.exception.AudioPipelineException if the device cannot be acquired
     * @throws IllegalStateException if a stream is already running
     */
    AudioStream start(DeviceConstraints constraints, AudioPipelineListener listener);

    /** Stops capture and releases the device. Safe to call when not running. */
    void stop();

    boolean isRunning();
}
