package com.phillippitts.saleshud.service.transcription;

/**
 * One decoded inbound message from the transcription backend.
 *
 * @param type      message type
 * @param speech    recognized speech for {@link MessageType#RESULTS}, otherwise {@code null}
 * @param requestId backend request id for {@link MessageType#METADATA}, otherwise {@code null}
 * @param error     error description for {@link MessageType#ERROR}, otherwise {@code null}
 */
record TranscriptMessage(MessageType type, RecognizedSpeech speech, String requestId, String error) {

    enum MessageType {
        RESULTS, METADATA, SPEECH_STARTED, UTTERANCE_END, ERROR, UNKNOWN
    }

    /**
     * Best alternative of a result.
     *
     * @param text         transcript text, trimmed
     * @param confidence   confidence clamped to [0, 1]
     * @param speakerIndex majority speaker over the words (ties to the lowest index), 0 without diarization
     * @param durationSec  audio duration of the result
     * @param isFinal      {@code false} for interim results
     */
    record RecognizedSpeech(String text, double confidence, int speakerIndex, double durationSec, boolean isFinal) {
    }

    static TranscriptMessage of(MessageType type) {
        return new TranscriptMessage(type, null, null, null);
    }
}
