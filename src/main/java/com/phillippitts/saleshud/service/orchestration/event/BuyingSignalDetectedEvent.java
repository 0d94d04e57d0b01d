package com.phillippitts.saleshud.service.orchestration.event;

import com.phillippitts.saleshud.domain.BuyingSignal;

import java.util.UUID;

public record BuyingSignalDetectedEvent(UUID meetingId, BuyingSignal signal) {}
