package com.phillippitts.saleshud.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection, feature and reconnection settings for the streaming transcription backend.
 *
 * <p>Feature flags are encoded into the connection handshake query string by
 * {@code TranscriptionQueryBuilder}.
 */
@Validated
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {

    @NotBlank
    private String url = "wss://api.deepgram.com/v1/listen";

    /** Token sent as {@code Authorization: Token <key>}. */
    private String apiKey;

    /** REST endpoint used by the periodic health probe. */
    private String healthUrl = "https://api.deepgram.com/v1/projects";

    @NotBlank
    private String model = "nova-2";

    @NotBlank
    private String language = "en-US";

    private boolean punctuate = true;
    private boolean diarize = true;
    private boolean smartFormat = true;
    private boolean numerals = true;
    private boolean interimResults = true;
    private boolean vadEvents = true;
    private boolean fillerWords = true;
    private boolean profanityFilter = false;
    private boolean sentiment = true;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double sentimentThreshold = 0.25;

    /** Summarization mode, e.g. {@code v2}; blank disables summarization. */
    private String summarize = "v2";

    /** Silence in milliseconds that ends an utterance. */
    @Min(10)
    @Max(10_000)
    private int endpointingMs = 300;

    @Min(1)
    @Max(10)
    private int alternatives = 3;

    /** Vocabulary-boost terms sent as the {@code search} parameter. */
    private List<String> vocabulary = new ArrayList<>(List.of(
            "ROI", "budget", "decision maker", "timeline", "competitor", "proposal", "pricing",
            "contract", "implementation", "support", "features", "integration", "scalability",
            "enterprise", "SLA", "procurement", "evaluation", "pilot", "trial", "demo"));

    @Positive
    private long connectTimeoutMs = 10_000;

    @Positive
    private long initialReconnectDelayMs = 1_000;

    @Positive
    private long maxReconnectDelayMs = 30_000;

    @Min(0)
    @Max(50)
    private int maxReconnectAttempts = 5;

    /** Frames buffered toward the backend before new frames are dropped. */
    @Min(1)
    @Max(10_000)
    private int sendBufferFrames = 64;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getHealthUrl() {
        return healthUrl;
    }

    public void setHealthUrl(String healthUrl) {
        this.healthUrl = healthUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public boolean isPunctuate() {
        return punctuate;
    }

    public void setPunctuate(boolean punctuate) {
        this.punctuate = punctuate;
    }

    public boolean isDiarize() {
        return diarize;
    }

    public void setDiarize(boolean diarize) {
        this.diarize = diarize;
    }

    public boolean isSmartFormat() {
        return smartFormat;
    }

    public void setSmartFormat(boolean smartFormat) {
        this.smartFormat = smartFormat;
    }

    public boolean isNumerals() {
        return numerals;
    }

    public void setNumerals(boolean numerals) {
        this.numerals = numerals;
    }

    public boolean isInterimResults() {
        return interimResults;
    }

    public void setInterimResults(boolean interimResults) {
        this.interimResults = interimResults;
    }

    public boolean isVadEvents() {
        return vadEvents;
    }

    public void setVadEvents(boolean vadEvents) {
        this.vadEvents = vadEvents;
    }

    public boolean isFillerWords() {
        return fillerWords;
    }

    public void setFillerWords(boolean fillerWords) {
        this.fillerWords = fillerWords;
    }

    public boolean isProfanityFilter() {
        return profanityFilter;
    }

    public void setProfanityFilter(boolean profanityFilter) {
        this.profanityFilter = profanityFilter;
    }

    public boolean isSentiment() {
        return sentiment;
    }

    public void setSentiment(boolean sentiment) {
        this.sentiment = sentiment;
    }

    public double getSentimentThreshold() {
        return sentimentThreshold;
    }

    public void setSentimentThreshold(double sentimentThreshold) {
        this.sentimentThreshold = sentimentThreshold;
    }

    public String getSummarize() {
        return summarize;
    }

    public void setSummarize(String summarize) {
        this.summarize = summarize;
    }

    public int getEndpointingMs() {
        return endpointingMs;
    }

    public void setEndpointingMs(int endpointingMs) {
        this.endpointingMs = endpointingMs;
    }

    public int getAlternatives() {
        return alternatives;
    }

    public void setAlternatives(int alternatives) {
        this.alternatives = alternatives;
    }

    public List<String> getVocabulary() {
        return vocabulary;
    }

    public void setVocabulary(List<String> vocabulary) {
        this.vocabulary = vocabulary == null ? new ArrayList<>() : new ArrayList<>(vocabulary);
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getInitialReconnectDelayMs() {
        return initialReconnectDelayMs;
    }

    public void setInitialReconnectDelayMs(long initialReconnectDelayMs) {
        this.initialReconnectDelayMs = initialReconnectDelayMs;
    }

    public long getMaxReconnectDelayMs() {
        return maxReconnectDelayMs;
    }

    public void setMaxReconnectDelayMs(long maxReconnectDelayMs) {
        this.maxReconnectDelayMs = maxReconnectDelayMs;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public int getSendBufferFrames() {
        return sendBufferFrames;
    }

    public void setSendBufferFrames(int sendBufferFrames) {
        this.sendBufferFrames = sendBufferFrames;
    }
}
