package com.phillippitts.saleshud.config;

import com.phillippitts.saleshud.config.properties.AiBackendProperties;
import com.phillippitts.saleshud.config.properties.HealthMonitorProperties;
import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.service.health.HealthProbe;
import com.phillippitts.saleshud.service.health.HttpHealthProbe;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.insight.CompletionClient;
import com.phillippitts.saleshud.service.insight.HttpCompletionClient;
import com.phillippitts.saleshud.service.persistence.MeetingStore;
import com.phillippitts.saleshud.service.transcription.JdkWebSocketConnector;
import com.phillippitts.saleshud.service.transcription.StreamingConnector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Clients for the transcription service, the AI backend and the health monitor that guards them.
 *
 * <p>Each dependency gets a probe: an authenticated GET for the two remote services (skipped when
 * the health URL is blank) and {@link MeetingStore#ping()} for persistence.
 */
@Configuration
public class RemoteServicesConfig {

    private static final Logger LOG = LogManager.getLogger(RemoteServicesConfig.class);

    @Bean
    public HttpClient httpClient(TranscriptionProperties transcription) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(transcription.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public StreamingConnector streamingConnector(HttpClient httpClient, TranscriptionProperties transcription) {
        return new JdkWebSocketConnector(httpClient, Duration.ofMillis(transcription.getConnectTimeoutMs()));
    }

    @Bean
    public CompletionClient completionClient(HttpClient httpClient, AiBackendProperties backend) {
        return new HttpCompletionClient(httpClient, backend);
    }

    @Bean
    public ServiceHealthMonitor serviceHealthMonitor(HttpClient httpClient,
                                                     TranscriptionProperties transcription,
                                                     AiBackendProperties backend,
                                                     MeetingStore store,
                                                     HealthMonitorProperties props,
                                                     ApplicationEventPublisher publisher,
                                                     Clock clock) {
        Duration timeout = Duration.ofMillis(props.getProbeTimeoutMs());
        Map<Dependency, HealthProbe> probes = new EnumMap<>(Dependency.class);

        if (isSet(transcription.getHealthUrl())) {
            Map<String, String> headers = new LinkedHashMap<>();
            if (isSet(transcription.getApiKey())) {
                headers.put("Authorization", "Token " + transcription.getApiKey());
            }
            probes.put(Dependency.TRANSCRIPTION, new HttpHealthProbe(httpClient, Dependency.TRANSCRIPTION,
                    URI.create(transcription.getHealthUrl()), headers, timeout));
        } else {
            LOG.info("transcription.health-url not set; transcription health follows live calls only");
        }

        if (isSet(backend.getHealthUrl())) {
            Map<String, String> headers = new LinkedHashMap<>();
            if (isSet(backend.getApiKey())) {
                headers.put("x-api-key", backend.getApiKey());
            }
            headers.put("anthropic-version", backend.getApiVersion());
            probes.put(Dependency.AI_ANALYSIS, new HttpHealthProbe(httpClient, Dependency.AI_ANALYSIS,
                    URI.create(backend.getHealthUrl()), headers, timeout));
        } else {
            LOG.info("insight.backend.health-url not set; AI health follows live calls only");
        }

        probes.put(Dependency.PERSISTENCE, store::ping);
        return new ServiceHealthMonitor(probes, props, publisher, clock);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
