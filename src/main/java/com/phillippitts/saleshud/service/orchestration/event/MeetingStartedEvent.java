package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.MeetingConfig;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted once a meeting reaches ACTIVE.
 */
public record MeetingStartedEvent(UUID meetingId, MeetingConfig config, Instant timestamp) {}
