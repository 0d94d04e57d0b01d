package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.Insight;

import java.util.UUID;

public record InsightGeneratedEvent(UUID meetingId, Insight insight) {}
