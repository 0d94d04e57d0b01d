package com.phillippitts.saleshud.service.audio;

import java.time.Instant;
import java.util.UUID;

/**
 * Handle returned by {@link AudioPipeline#start}.
 */
public record AudioStream(UUID id, Instant startedAt, int sampleRate, int frameSamples) { }
