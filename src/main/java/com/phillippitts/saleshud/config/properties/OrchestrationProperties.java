package com.phillippitts.saleshud.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for meeting orchestration.
 */
@Validated
@ConfigurationProperties(prefix = "meeting.orchestration")
public class OrchestrationProperties {

    /** Recent transcript entries required before a batch analysis is queued. */
    @Min(1)
    @Max(100)
    private int minBatchSize = 3;

    /** Recent entries considered for a batch. */
    @Min(1)
    @Max(100)
    private int batchWindow = 5;

    /** Batches held per meeting while analysis is deferred. */
    @Min(1)
    @Max(1_000)
    private int maxPendingBatches = 20;

    /** Important entries carried into the summary as key points. */
    @Min(1)
    @Max(100)
    private int maxKeyPoints = 5;

    /** Upper bound for waiting on batch analyses while a meeting stops. */
    @Positive
    private long drainTimeoutMs = 15_000;

    @Positive
    private long finalSummaryTimeoutMs = 30_000;

    /** Issue a real-time coaching request alongside every queued batch. */
    private boolean realTimeCoaching = false;

    /** Stopped meetings kept for status and repeated stop calls. */
    @Min(0)
    @Max(10_000)
    private int endedMeetingRetention = 32;

    public int getMinBatchSize() {
        return minBatchSize;
    }

    public void setMinBatchSize(int minBatchSize) {
        this.minBatchSize = minBatchSize;
    }

    public int getBatchWindow() {
        return batchWindow;
    }

    public void setBatchWindow(int batchWindow) {
        this.batchWindow = batchWindow;
    }

    public int getMaxPendingBatches() {
        return maxPendingBatches;
    }

    public void setMaxPendingBatches(int maxPendingBatches) {
        this.maxPendingBatches = maxPendingBatches;
    }

    public int getMaxKeyPoints() {
        return maxKeyPoints;
    }

    public void setMaxKeyPoints(int maxKeyPoints) {
        this.maxKeyPoints = maxKeyPoints;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public long getFinalSummaryTimeoutMs() {
        return finalSummaryTimeoutMs;
    }

    public void setFinalSummaryTimeoutMs(long finalSummaryTimeoutMs) {
        this.finalSummaryTimeoutMs = finalSummaryTimeoutMs;
    }

    public boolean isRealTimeCoaching() {
        return realTimeCoaching;
    }

    public void setRealTimeCoaching(boolean realTimeCoaching) {
        this.realTimeCoaching = realTimeCoaching;
    }

    public int getEndedMeetingRetention() {
        return endedMeetingRetention;
    }

    public void setEndedMeetingRetention(int endedMeetingRetention) {
        this.endedMeetingRetention = endedMeetingRetention;
    }
}
