package com.phillippitts.saleshud.service.transcription;

import com.phillippitts.saleshud.domain.TranscriptEntry;
import com.phillippitts.saleshud.exception.ServiceException;

/**
 * Callbacks from a {@link TranscriptionLink}. Invoked sequentially in message arrival order.
 */
public interface TranscriptionListener {

    /** A final, tagged transcript entry. Sequence is 0; the consumer assigns arrival order. */
    void onResult(TranscriptEntry entry);

    /** A partial transcript that may still change. */
    default void onInterim(String text, int speakerIndex) {
    }

    default void onSpeechStarted() {
    }

    default void onUtteranceEnd() {
    }

    /** A backend error or a permanent loss of the link. */
    void onError(ServiceException error);

    /**
     * The link has closed.
     *
     * @param permanent {@code true} if reconnection gave up, {@code false} for a requested stop
     */
    default void onClose(boolean permanent) {
    }
}
