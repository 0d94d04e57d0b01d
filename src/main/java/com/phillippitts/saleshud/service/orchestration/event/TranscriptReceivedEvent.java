package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.TranscriptEntry;

import java.util.UUID;

/**
 * Emitted for every final transcript entry, in arrival order, after it has been appended.
 *
 * @param meetingId meeting the entry belongs to
 * @param entry     entry with its arrival sequence assigned
 */
public record TranscriptReceivedEvent(UUID meetingId, TranscriptEntry entry) {}
