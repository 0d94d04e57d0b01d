package com.phillippitts.saleshud.service.transcription;

import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import com.phillippitts.saleshud.service.analysis.TranscriptTagger;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates one {@link TranscriptionLink} per meeting, sharing the process-wide connector, health monitor
 * and reconnect scheduler.
 */
@Component
public class TranscriptionLinkFactory {

    private final TranscriptionProperties props;
    private final StreamingConnector connector;
    private final TranscriptTagger tagger;
    private final ServiceHealthMonitor monitor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public TranscriptionLinkFactory(TranscriptionProperties props,
                                    StreamingConnector connector,
                                    TranscriptTagger tagger,
                                    ServiceHealthMonitor monitor,
                                    @Qualifier("transcriptionScheduler") TaskScheduler scheduler,
                                    Clock clock) {
        this.props = props;
        this.connector = connector;
        this.tagger = tagger;
        this.monitor = monitor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public TranscriptionLink create() {
        return new TranscriptionLink(props, connector, tagger, monitor, scheduler, clock);
    }
}
