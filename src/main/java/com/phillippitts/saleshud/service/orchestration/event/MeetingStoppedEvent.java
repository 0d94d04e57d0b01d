package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.MeetingSummary;

import java.util.UUID;

public record MeetingStoppedEvent(UUID meetingId, MeetingSummary summary) {}
