package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.MeetingState;

import java.time.Instant;
import java.util.UUID;

public record MeetingStateChangedEvent(UUID meetingId, MeetingState from, MeetingState to, Instant timestamp) {}
