package com.phillippitts.saleshud.config;

import com.phillippitts.saleshud.config.properties.HealthMonitorProperties;
import com.phillippitts.saleshud.config.properties.InsightQueueProperties;
import com.phillippitts.saleshud.config.properties.OrchestrationProperties;
import com.phillippitts.saleshud.config.properties.ThreadPoolProperties;
import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Cross-property checks that bean validation cannot express, run at startup to fail fast with
 * actionable messages.
 */
@Component
class ConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(ConfigurationValidator.class);

    private final TranscriptionProperties transcription;
    private final OrchestrationProperties orchestration;
    private final InsightQueueProperties queue;
    private final HealthMonitorProperties health;
    private final ThreadPoolProperties threadPool;

    ConfigurationValidator(TranscriptionProperties transcription,
                           OrchestrationProperties orchestration,
                           InsightQueueProperties queue,
                           HealthMonitorProperties health,
                           ThreadPoolProperties threadPool) {
        this.transcription = transcription;
        this.orchestration = orchestration;
        this.queue = queue;
        this.health = health;
        this.threadPool = threadPool;
    }

    @PostConstruct
    void validate() {
        if (transcription.getMaxReconnectDelayMs() < transcription.getInitialReconnectDelayMs()) {
            throw new IllegalArgumentException("transcription.max-reconnect-delay-ms ("
                    + transcription.getMaxReconnectDelayMs() + ") must be >= initial-reconnect-delay-ms ("
                    + transcription.getInitialReconnectDelayMs() + ")");
        }
        if (orchestration.getBatchWindow() < orchestration.getMinBatchSize()) {
            throw new IllegalArgumentException("meeting.orchestration.batch-window ("
                    + orchestration.getBatchWindow() + ") must be >= min-batch-size ("
                    + orchestration.getMinBatchSize() + ")");
        }
        if (health.getHalfOpenSuccessThreshold() > health.getHalfOpenMaxTrialCalls()) {
            throw new IllegalArgumentException("health.monitor.half-open-success-threshold ("
                    + health.getHalfOpenSuccessThreshold() + ") must be <= half-open-max-trial-calls ("
                    + health.getHalfOpenMaxTrialCalls() + ")");
        }
        int insightThreads = threadPool.getInsight().getCorePoolSize();
        if (insightThreads < queue.getMaxConcurrent()) {
            throw new IllegalArgumentException("threadpool.insight.core-pool-size (" + insightThreads
                    + ") must be >= insight.queue.max-concurrent (" + queue.getMaxConcurrent() + ")");
        }
        if (transcription.getApiKey() == null || transcription.getApiKey().isBlank()) {
            LOG.warn("transcription.api-key is not set; the transcription service will reject connections");
        }
    }
}
