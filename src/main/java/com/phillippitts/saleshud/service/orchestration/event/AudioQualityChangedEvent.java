package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.AudioQualitySnapshot;

import java.util.UUID;

public record AudioQualityChangedEvent(UUID meetingId, AudioQualitySnapshot snapshot) {}
