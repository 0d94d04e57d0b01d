package com.phillippitts.saleshud.exception;

import java.util.UUID;

/**
 * Thrown when an operation names a meeting that is neither active nor retained after stopping.
 */
public class MeetingNotFoundException extends SalesHudException {

    private final UUID meetingId;

    public MeetingNotFoundException(UUID meetingId) {
        super("Meeting not found: " + meetingId);
        this.meetingId = meetingId;
    }

    public UUID getMeetingId() {
        return meetingId;
    }
}
