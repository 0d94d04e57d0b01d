package com.phillippitts.saleshud.config.orchestration;

import com.phillippitts.saleshud.config.properties.OrchestrationProperties;
import com.phillippitts.saleshud.service.analysis.BuyingSignalDetector;
import com.phillippitts.saleshud.service.analysis.TranscriptTagger;
import com.phillippitts.saleshud.service.audio.AudioPipeline;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.insight.InsightService;
import com.phillippitts.saleshud.service.metrics.MeetingMetrics;
import com.phillippitts.saleshud.service.orchestration.DefaultMeetingOrchestrator;
import com.phillippitts.saleshud.service.orchestration.PipelineOwnership;
import com.phillippitts.saleshud.service.persistence.MeetingStore;
import com.phillippitts.saleshud.service.transcription.TranscriptionLinkFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the meeting orchestrator explicitly.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class OrchestrationConfig {

    private final AudioPipeline audioPipeline;
    private final TranscriptionLinkFactory linkFactory;
    private final InsightService insightService;
    private final ServiceHealthMonitor healthMonitor;
    private final MeetingStore meetingStore;
    private final OrchestrationProperties orchestrationProperties;
    private final ApplicationEventPublisher publisher;

    public OrchestrationConfig(AudioPipeline audioPipeline,
                               TranscriptionLinkFactory linkFactory,
                               InsightService insightService,
                               ServiceHealthMonitor healthMonitor,
                               MeetingStore meetingStore,
                               OrchestrationProperties orchestrationProperties,
                               ApplicationEventPublisher publisher) {
        this.audioPipeline = audioPipeline;
        this.linkFactory = linkFactory;
        this.insightService = insightService;
        this.healthMonitor = healthMonitor;
        this.meetingStore = meetingStore;
        this.orchestrationProperties = orchestrationProperties;
        this.publisher = publisher;
    }

    /**
     * Exclusive claim on the audio pipeline; one meeting streams at a time.
     */
    @Bean
    public PipelineOwnership pipelineOwnership() {
        return new PipelineOwnership();
    }

    @Bean
    public DefaultMeetingOrchestrator meetingOrchestrator(PipelineOwnership pipelineOwnership,
                                                          TranscriptTagger tagger,
                                                          BuyingSignalDetector signalDetector,
                                                          MeetingMetrics metrics,
                                                          @Qualifier("persistenceExecutor") Executor persistenceExecutor,
                                                          Clock clock) {
        return new DefaultMeetingOrchestrator(audioPipeline, linkFactory, insightService, healthMonitor,
                meetingStore, tagger, signalDetector, pipelineOwnership, orchestrationProperties, metrics,
                publisher, persistenceExecutor, clock);
    }
}
