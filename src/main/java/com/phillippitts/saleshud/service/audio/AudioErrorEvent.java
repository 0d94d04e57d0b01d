package com.phillippitts.saleshud.service.audio;

import java.time.Instant;

/**
 * Published when microphone capture fails (permissions, device errors, device loss).
 *
 * Payload contains a short reason and timestamp. Avoids any PII.
 */
public record AudioErrorEvent(String reason, Instant at) { }
