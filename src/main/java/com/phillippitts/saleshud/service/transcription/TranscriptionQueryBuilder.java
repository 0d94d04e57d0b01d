package com.phillippitts.saleshud.service.transcription;

import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import com.phillippitts.saleshud.service.audio.AudioFormat;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Encodes the streaming handshake parameters into the connection URI.
 */
final class TranscriptionQueryBuilder {

    private TranscriptionQueryBuilder() {
    }

    static URI build(TranscriptionProperties props) {
        String query = parameters(props).entrySet().stream()
                .map(e -> e.getKey() + '=' + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        String base = props.getUrl();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    static Map<String, String> parameters(TranscriptionProperties props) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("model", props.getModel());
        params.put("language", props.getLanguage());
        params.put("punctuate", String.valueOf(props.isPunctuate()));
        params.put("diarize", String.valueOf(props.isDiarize()));
        params.put("smart_format", String.valueOf(props.isSmartFormat()));
        params.put("numerals", String.valueOf(props.isNumerals()));
        params.put("interim_results", String.valueOf(props.isInterimResults()));
        params.put("endpointing", String.valueOf(props.getEndpointingMs()));
        params.put("vad_events", String.valueOf(props.isVadEvents()));
        params.put("filler_words", String.valueOf(props.isFillerWords()));
        params.put("multichannel", "false");
        params.put("alternatives", String.valueOf(props.getAlternatives()));
        params.put("profanity_filter", String.valueOf(props.isProfanityFilter()));
        params.put("sentiment", String.valueOf(props.isSentiment()));
        params.put("sentiment_threshold", String.valueOf(props.getSentimentThreshold()));
        if (props.getSummarize() != null && !props.getSummarize().isBlank()) {
            params.put("summarize", props.getSummarize());
        }
        params.put("encoding", "linear16");
        params.put("sample_rate", String.valueOf(AudioFormat.REQUIRED_SAMPLE_RATE));
        params.put("channels", String.valueOf(AudioFormat.REQUIRED_CHANNELS));
        if (!props.getVocabulary().isEmpty()) {
            params.put("search", String.join(",", props.getVocabulary()));
        }
        return params;
    }
}
