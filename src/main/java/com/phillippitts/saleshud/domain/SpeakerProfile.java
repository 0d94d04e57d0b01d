package com.phillippitts.saleshud.domain;

import java.time.Instant;

/**
 * Running aggregate for one diarized speaker within a meeting.
 *
 * @param speakerIndex      diarization index
 * @param label             display label
 * @param talkTimeSec       cumulative utterance duration in seconds
 * @param utteranceCount    number of final utterances
 * @param paceWordsPerMin   words per minute of the most recent timed utterance
 * @param lastEmotion       emotion detected in the most recent utterance
 * @param lastSentiment     sentiment of the most recent utterance
 * @param lastSeen          timestamp of the most recent utterance
 */
public record SpeakerProfile(
        int speakerIndex,
        String label,
        double talkTimeSec,
        int utteranceCount,
        double paceWordsPerMin,
        Emotion lastEmotion,
        Sentiment lastSentiment,
        Instant lastSeen
) {

    public static SpeakerProfile first(TranscriptEntry entry, Emotion emotion) {
        return new SpeakerProfile(entry.speakerIndex(), entry.speaker(), 0.0, 0, 0.0,
                Emotion.NEUTRAL, Sentiment.NEUTRAL, entry.timestamp()).update(entry, emotion);
    }

    public SpeakerProfile update(TranscriptEntry entry, Emotion emotion) {
        double duration = Math.max(0.0, entry.durationSec());
        double pace = duration > 0 ? entry.wordCount() / (duration / 60.0) : paceWordsPerMin;
        return new SpeakerProfile(speakerIndex, label, talkTimeSec + duration, utteranceCount + 1,
                pace, emotion, entry.sentiment(), entry.timestamp());
    }
}
