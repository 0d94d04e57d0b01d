package com.phillippitts.saleshud.exception;

import com.phillippitts.saleshud.domain.MeetingState;

import java.util.UUID;

/**
 * Thrown when a lifecycle operation is not allowed from the meeting's current state,
 * for example pausing a meeting that is already paused.
 */
public class IllegalMeetingStateException extends SalesHudException {

    private final UUID meetingId;
    private final MeetingState currentState;

    public IllegalMeetingStateException(UUID meetingId, MeetingState currentState, String operation) {
        super("Cannot " + operation + " meeting " + meetingId + " in state " + currentState);
        this.meetingId = meetingId;
        this.currentState = currentState;
    }

    public UUID getMeetingId() {
        return meetingId;
    }

    public MeetingState getCurrentState() {
        return currentState;
    }
}
