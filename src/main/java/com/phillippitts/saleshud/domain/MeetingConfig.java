package com.phillippitts.saleshud.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Caller-supplied configuration for a meeting. Validated on construction.
 *
 * @param title               meeting title (must not be blank)
 * @param type                kind of sales conversation
 * @param platform            conferencing platform the audio comes from
 * @param participants        expected participants (may be empty)
 * @param scheduledStart      optional scheduled start
 * @param scheduledDuration   optional scheduled length (must not be negative)
 * @param enableTranscription open the audio pipeline and transcription link
 * @param enableInsights      batch transcript entries for AI analysis
 * @param enableRecording     retained for the surrounding application; not acted on here
 * @param autoGenerateSummary request an AI summary when the meeting stops
 */
public record MeetingConfig(
        String title,
        MeetingType type,
        MeetingPlatform platform,
        List<Participant> participants,
        Instant scheduledStart,
        Duration scheduledDuration,
        boolean enableTranscription,
        boolean enableInsights,
        boolean enableRecording,
        boolean autoGenerateSummary
) {

    public MeetingConfig {
        Objects.requireNonNull(title, "Meeting title must not be null");
        if (title.isBlank()) {
            throw new IllegalArgumentException("Meeting title must not be blank");
        }
        Objects.requireNonNull(type, "Meeting type must not be null");
        platform = platform == null ? MeetingPlatform.NONE : platform;
        participants = participants == null ? List.of() : List.copyOf(participants);
        if (scheduledDuration != null && scheduledDuration.isNegative()) {
            throw new IllegalArgumentException("Scheduled duration must not be negative: " + scheduledDuration);
        }
    }

    /**
     * Creates a config with transcription, insights and summary enabled and recording disabled.
     */
    public static MeetingConfig of(String title, MeetingType type, MeetingPlatform platform) {
        return new MeetingConfig(title, type, platform, List.of(), null, null, true, true, false, true);
    }

    public MeetingConfig withParticipants(List<Participant> newParticipants) {
        return new MeetingConfig(title, type, platform, newParticipants, scheduledStart, scheduledDuration,
                enableTranscription, enableInsights, enableRecording, autoGenerateSummary);
    }

    public MeetingConfig withTranscription(boolean enabled) {
        return new MeetingConfig(title, type, platform, participants, scheduledStart, scheduledDuration,
                enabled, enableInsights, enableRecording, autoGenerateSummary);
    }

    public MeetingConfig withInsights(boolean enabled) {
        return new MeetingConfig(title, type, platform, participants, scheduledStart, scheduledDuration,
                enableTranscription, enabled, enableRecording, autoGenerateSummary);
    }
}
