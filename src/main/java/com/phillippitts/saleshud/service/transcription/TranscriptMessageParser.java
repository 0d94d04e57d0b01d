package com.phillippitts.saleshud.service.transcription;

import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;
import com.phillippitts.saleshud.service.transcription.TranscriptMessage.MessageType;
import com.phillippitts.saleshud.service.transcription.TranscriptMessage.RecognizedSpeech;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Map;
import java.util.TreeMap;

/**
 * Parses typed JSON messages from the streaming transcription backend.
 *
 * <p>Thread-safe: all methods are static and stateless.
 *
 * <p>Messages larger than {@link #MAX_MESSAGE_SIZE} are rejected rather than parsed.
 */
final class TranscriptMessageParser {

    static final int MAX_MESSAGE_SIZE = 1_048_576; // 1MB

    private TranscriptMessageParser() {
    }

    /**
     * @throws ServiceException with kind {@code PROCESSING_ERROR} for oversized or malformed messages
     */
    static TranscriptMessage parse(String json) {
        if (json == null || json.isBlank()) {
            throw malformed("empty message", null);
        }
        if (json.length() > MAX_MESSAGE_SIZE) {
            throw malformed("message exceeds " + MAX_MESSAGE_SIZE + " chars", null);
        }
        try {
            JSONObject obj = new JSONObject(json);
            String type = obj.optString("type", "");
            switch (type) {
                case "Results":
                    return new TranscriptMessage(MessageType.RESULTS, parseSpeech(obj), null, null);
                case "Metadata":
                    return new TranscriptMessage(MessageType.METADATA, null, obj.optString("request_id", null), null);
                case "SpeechStarted":
                    return TranscriptMessage.of(MessageType.SPEECH_STARTED);
                case "UtteranceEnd":
                    return TranscriptMessage.of(MessageType.UTTERANCE_END);
                case "Error":
                    String description = obj.optString("description", obj.optString("message", "unknown error"));
                    return new TranscriptMessage(MessageType.ERROR, null, null, description);
                default:
                    return TranscriptMessage.of(MessageType.UNKNOWN);
            }
        } catch (JSONException e) {
            throw malformed("unparseable message", e);
        }
    }

    /** Returns {@code null} when the result carries no alternatives or only blank text. */
    private static RecognizedSpeech parseSpeech(JSONObject obj) {
        JSONObject channel = obj.optJSONObject("channel");
        JSONArray alternatives = channel == null ? null : channel.optJSONArray("alternatives");
        if (alternatives == null || alternatives.isEmpty()) {
            return null;
        }
        JSONObject best = alternatives.getJSONObject(0);
        String text = best.optString("transcript", "").trim();
        if (text.isEmpty()) {
            return null;
        }
        double confidence = Math.min(1.0, Math.max(0.0, best.optDouble("confidence", 0.0)));
        int speaker = majoritySpeaker(best.optJSONArray("words"));
        double duration = Math.max(0.0, obj.optDouble("duration", 0.0));
        return new RecognizedSpeech(text, confidence, speaker, duration, obj.optBoolean("is_final", false));
    }

    static int majoritySpeaker(JSONArray words) {
        if (words == null) {
            return 0;
        }
        // TreeMap iterates lowest index first so ties resolve to it
        Map<Integer, Integer> tally = new TreeMap<>();
        for (int i = 0; i < words.length(); i++) {
            JSONObject word = words.optJSONObject(i);
            if (word != null && word.has("speaker")) {
                tally.merge(word.optInt("speaker", 0), 1, Integer::sum);
            }
        }
        int best = 0;
        int bestCount = -1;
        for (Map.Entry<Integer, Integer> e : tally.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Math.max(0, best);
    }

    private static ServiceException malformed(String reason, Throwable cause) {
        return ServiceExceptionBuilder.create("Malformed transcription message", ErrorKind.PROCESSING_ERROR)
                .dependency(Dependency.TRANSCRIPTION)
                .metadata("reason", reason)
                .cause(cause)
                .build();
    }
}
