package com.phillippitts.saleshud.service.orchestration;

import com.phillippitts.saleshud.domain.MeetingConfig;
import com.phillippitts.saleshud.domain.MeetingStatusReport;
import com.phillippitts.saleshud.domain.MeetingSummary;
import com.phillippitts.saleshud.domain.Subscription;

import java.util.UUID;

/**
 * Drives meetings through {@code STARTING -> ACTIVE <-> PAUSED -> ENDING -> ENDED}.
 */
public interface MeetingOrchestrator {

    /**
     * Starts a meeting. Returns only once audio and transcription are both running (when transcription
     * is enabled); any partial start is rolled back.
     *
     * @return new meeting id
     * @throws com.phillippitts.saleshud.exception.MeetingStartException if any resource cannot be acquired
     */
    UUID startMeeting(MeetingConfig config);

    /**
     * @throws com.phillippitts.saleshud.exception.MeetingNotFoundException if the id is unknown
     * @throws com.phillippitts.saleshud.exception.IllegalMeetingStateException unless ACTIVE
     */
    void pauseMeeting(UUID meetingId);

    /**
     * @throws com.phillippitts.saleshud.exception.IllegalMeetingStateException unless PAUSED
     */
    void resumeMeeting(UUID meetingId);

    /**
     * Stops a meeting, drains pending analysis and returns its summary. Idempotent: stopping an ended
     * meeting returns the same summary.
     */
    MeetingSummary stopMeeting(UUID meetingId);

    MeetingStatusReport getStatus(UUID meetingId);

    /**
     * @throws com.phillippitts.saleshud.exception.IllegalMeetingStateException if the meeting has ended
     */
    Subscription subscribe(UUID meetingId, MeetingListener listener);
}
