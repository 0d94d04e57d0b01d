package com.phillippitts.saleshud.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A buying (or objection) signal detected in a transcript entry.
 *
 * @param description       short label, e.g. "Pricing inquiry"
 * @param strength          how strongly the phrase indicates intent
 * @param positive          {@code true} for buying intent, {@code false} for objections
 * @param suggestedResponse what the seller could say next
 * @param speakerIndex      speaker of the triggering entry
 * @param sourceSequence    sequence of the triggering entry
 * @param detectedAt        detection time
 */
public record BuyingSignal(
        String description,
        SignalStrength strength,
        boolean positive,
        String suggestedResponse,
        int speakerIndex,
        long sourceSequence,
        Instant detectedAt
) {

    public BuyingSignal {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(strength, "strength must not be null");
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");
    }
}
