package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.TranscriptEntry;

import java.util.UUID;

/**
 * Emitted by the background importance pass for entries that mention an important sales topic.
 */
public record ImportantTranscriptEvent(UUID meetingId, TranscriptEntry entry) {}
