package com.phillippitts.saleshud.exception;

/**
 * Thrown when {@code startMeeting} cannot acquire audio or open transcription. Any resource that
 * was already acquired has been released when this is thrown.
 */
public class MeetingStartException extends SalesHudException {

    private final ErrorKind kind;

    public MeetingStartException(String message, ErrorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
