package com.phillippitts.saleshud.service.audio;

import com.phillippitts.saleshud.domain.AudioQualitySnapshot;
import com.phillippitts.saleshud.exception.AudioPipelineException;

/**
 * Callbacks from the capture thread. Implementations must return quickly; blocking here stalls capture.
 */
public interface AudioPipelineListener {

    void onFrame(AudioFrame frame);

    /** Called when the quality score moved by more than the configured threshold. */
    default void onQualityChanged(AudioQualitySnapshot snapshot) {
    }

    /** Called once when the device is lost mid-stream; no frames follow. */
    void onError(AudioPipelineException error);
}
