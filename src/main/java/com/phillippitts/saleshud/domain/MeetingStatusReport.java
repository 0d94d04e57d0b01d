package com.phillippitts.saleshud.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time view of a meeting returned by {@code getStatus}.
 *
 * @param meetingId         meeting id
 * @param state             lifecycle state
 * @param startTime         start time
 * @param endTime           end time, {@code null} until ended
 * @param durationSeconds   elapsed seconds (to end time once ended)
 * @param transcribing      whether audio is streaming to a connected transcription link
 * @param participantCount  configured participants
 * @param activeSpeaker     speaker of the most recent entry, or {@code null}
 * @param connectionQuality derived from overall dependency health
 * @param transcriptCount   final transcript entries so far
 * @param insightCount      insights so far
 * @param audioQuality      most recent audio quality snapshot, or {@code null}
 * @param talkRatios        speaker label to percentage of total talk time
 * @param errors            meeting-level error messages in occurrence order
 */
public record MeetingStatusReport(
        UUID meetingId,
        MeetingState state,
        Instant startTime,
        Instant endTime,
        long durationSeconds,
        boolean transcribing,
        int participantCount,
        String activeSpeaker,
        ConnectionQuality connectionQuality,
        int transcriptCount,
        int insightCount,
        AudioQualitySnapshot audioQuality,
        Map<String, Double> talkRatios,
        List<String> errors
) {

    public MeetingStatusReport {
        talkRatios = Map.copyOf(talkRatios);
        errors = List.copyOf(errors);
    }
}
