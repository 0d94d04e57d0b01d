package com.phillippitts.saleshud.service.orchestration.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when audio frames are shed because the transcription send buffer is full.
 *
 * @param meetingId    affected meeting
 * @param totalDropped frames dropped so far in this meeting
 * @param timestamp    time of the latest drop
 */
public record FramesDroppedEvent(UUID meetingId, long totalDropped, Instant timestamp) {}
