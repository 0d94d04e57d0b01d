package com.phillippitts.saleshud.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Concurrency, retry and cache settings for the AI insight request queue.
 */
@Validated
@ConfigurationProperties(prefix = "insight.queue")
public class InsightQueueProperties {

    /** Requests allowed in flight at once. */
    @Min(1)
    @Max(100)
    private int maxConcurrent = 10;

    /** Retries for retryable failures (rate limits, transient network, 5xx). */
    @Min(0)
    @Max(10)
    private int maxRetries = 3;

    /** Base retry delay; attempt n waits base * 2^n. */
    @Positive
    private long retryBaseDelayMs = 1_000;

    @Positive
    private long cacheTtlMs = 300_000;

    @Min(1)
    @Max(100_000)
    private int cacheMaxEntries = 500;

    /** Interval of the drain tick that dispatches queued requests. */
    @Positive
    private long drainIntervalMs = 1_000;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public long getCacheTtlMs() {
        return cacheTtlMs;
    }

    public void setCacheTtlMs(long cacheTtlMs) {
        this.cacheTtlMs = cacheTtlMs;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public long getDrainIntervalMs() {
        return drainIntervalMs;
    }

    public void setDrainIntervalMs(long drainIntervalMs) {
        this.drainIntervalMs = drainIntervalMs;
    }
}
