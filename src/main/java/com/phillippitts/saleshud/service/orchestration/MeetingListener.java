package com.phillippitts.saleshud.service.orchestration;

import com.phillippitts.saleshud.domain.BuyingSignal;
import com.phillippitts.saleshud.domain.Insight;
import com.phillippitts.saleshud.domain.MeetingState;
import com.phillippitts.saleshud.domain.TranscriptEntry;

/**
 * Real-time subscriber for one meeting. Transcript entries arrive in arrival order; callbacks run on the
 * thread that produced the event and must return quickly.
 */
public interface MeetingListener {

    void onTranscript(TranscriptEntry entry);

    default void onInterimTranscript(String text, int speakerIndex) {
    }

    default void onInsight(Insight insight) {
    }

    default void onBuyingSignal(BuyingSignal signal) {
    }

    default void onStateChanged(MeetingState state) {
    }

    default void onError(String message) {
    }

    /** Last callback; the subscription is closed after the meeting ends. */
    default void onClosed() {
    }
}
