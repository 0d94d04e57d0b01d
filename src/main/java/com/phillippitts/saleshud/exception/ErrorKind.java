package com.phillippitts.saleshud.exception;

/**
 * Error taxonomy shared by the audio pipeline, the transcription link and the insight queue.
 *
 * <p>The default retryable flag applies when a failure carries no explicit override; an HTTP 400
 * mapped to {@link #NETWORK_ERROR}, for example, is reported as non-retryable.
 */
public enum ErrorKind {
    /** Device or capture failure; recoverable only by restarting the meeting's audio. */
    AUDIO_ERROR(false),
    /** Transcription link could not be established or was lost. */
    CONNECTION_FAILED(true),
    TIMEOUT(true),
    /** Backend throttling; re-queued instead of rejected. */
    RATE_LIMIT(true),
    AUTH_FAILED(false),
    QUOTA_EXCEEDED(false),
    /** Malformed response or parse failure; retried once. */
    PROCESSING_ERROR(true),
    NETWORK_ERROR(true);

    private final boolean retryableByDefault;

    ErrorKind(boolean retryableByDefault) {
        this.retryableByDefault = retryableByDefault;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
