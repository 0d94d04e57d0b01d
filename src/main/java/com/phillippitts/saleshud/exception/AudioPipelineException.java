package com.phillippitts.saleshud.exception;

/**
 * Thrown when the capture device cannot be acquired or is lost mid-stream.
 */
public class AudioPipelineException extends ServiceException {

    private final String reason;

    /**
     * @param message human readable detail
     * @param reason short machine-readable reason (MIC_UNAVAILABLE, MIC_PERMISSION_DENIED, DEVICE_LOST)
     */
    public AudioPipelineException(String message, String reason) {
        super(message, ErrorKind.AUDIO_ERROR);
        this.reason = reason;
    }

    public AudioPipelineException(String message, String reason, Throwable cause) {
        super(message, ErrorKind.AUDIO_ERROR, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
