package com.phillippitts.saleshud.service.persistence;

import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.Subscription;
import com.phillippitts.saleshud.domain.TranscriptEntry;

import java.util.UUID;

/**
 * Persistence and real-time fan-out collaborator for meetings.
 *
 * <p>The orchestrator treats every call as fire-and-forget: failures are logged and counted against
 * the persistence dependency, never propagated to the meeting.
 */
public interface MeetingStore {

    void saveTranscript(UUID meetingId, TranscriptEntry entry);

    void saveInsight(UUID meetingId, Insight insight);

    void updateMeetingStatus(UUID meetingId, MeetingState state);

    /** Registers for transcript and insight events of one meeting. */
    Subscription subscribe(UUID meetingId, StoreListener listener);

    /**
     * Cheap liveness check used by the health monitor.
     *
     * @throws Exception if the store is unreachable
     */
    void ping() throws Exception;

    /** Receives records as they are saved. */
    interface StoreListener {
        void onTranscript(TranscriptEntry entry);

        default void onInsight(Insight insight) {
        }

        default void onStatus(MeetingState state) {
        }
    }
}
