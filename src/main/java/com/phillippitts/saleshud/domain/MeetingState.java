package com.phillippitts.saleshud.domain;

/**
 * Meeting lifecycle: {@code STARTING -> ACTIVE <-> PAUSED -> ENDING -> ENDED}.
 * {@code ENDING} is reachable from {@code ACTIVE} or {@code PAUSED}; {@code ENDED} is terminal.
 */
public enum MeetingState {
    STARTING, ACTIVE, PAUSED, ENDING, ENDED;

    public boolean canTransitionTo(MeetingState next) {
        switch (this) {
            case STARTING:
                return next == ACTIVE || next == ENDED;
            case ACTIVE:
                return next == PAUSED || next == ENDING;
            case PAUSED:
                return next == ACTIVE || next == ENDING;
            case ENDING:
                return next == ENDED;
            default:
                return false;
        }
    }

    /** Whether the meeting holds the audio pipeline in this state. */
    public boolean ownsPipeline() {
        return this == ACTIVE || this == PAUSED;
    }
}
