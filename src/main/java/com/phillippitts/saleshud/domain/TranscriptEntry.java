package com.phillippitts.saleshud.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One final transcript utterance attributed to a speaker.
 *
 * <p>Entries are append-only. The only change after creation is the single importance pass
 * ({@link #markImportant()}), and the arrival sequence stamped by the orchestrator.
 *
 * @param sequence     arrival order within the meeting; 0 until appended
 * @param speaker      display label, e.g. "Speaker 2"
 * @param speakerIndex zero-based diarization index
 * @param text         transcript text (must not be null)
 * @param timestamp    when the entry was received
 * @param durationSec  audio duration of the utterance in seconds
 * @param confidence   recognizer confidence between 0.0 and 1.0
 * @param sentiment    keyword-derived sentiment tag
 * @param important    whether the text mentions an important sales topic
 * @param keywords     vocabulary terms found in the text
 */
public record TranscriptEntry(
        long sequence,
        String speaker,
        int speakerIndex,
        String text,
        Instant timestamp,
        double durationSec,
        double confidence,
        Sentiment sentiment,
        boolean important,
        List<String> keywords
) {

    public TranscriptEntry {
        Objects.requireNonNull(text, "Transcript text must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (speakerIndex < 0) {
            throw new IllegalArgumentException("Speaker index must not be negative: " + speakerIndex);
        }
        speaker = speaker == null ? "Speaker " + (speakerIndex + 1) : speaker;
        sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public TranscriptEntry withSequence(long newSequence) {
        return new TranscriptEntry(newSequence, speaker, speakerIndex, text, timestamp, durationSec,
                confidence, sentiment, important, keywords);
    }

    public TranscriptEntry markImportant() {
        if (important) {
            return this;
        }
        return new TranscriptEntry(sequence, speaker, speakerIndex, text, timestamp, durationSec,
                confidence, sentiment, true, keywords);
    }

    public int wordCount() {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
