package com.phillippitts.saleshud;

import com.phillippitts.saleshud.config.properties.AiBackendProperties;
import com.phillippitts.saleshud.config.properties.AudioPipelineProperties;
import com.phillippitts.saleshud.config.properties.HealthMonitorProperties;
import com.phillippitts.saleshud.config.properties.InsightQueueProperties;
import com.phillippitts.saleshud.config.properties.OrchestrationProperties;
import com.phillippitts.saleshud.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioPipelineProperties.class,
        TranscriptionProperties.class,
        AiBackendProperties.class,
        InsightQueueProperties.class,
        HealthMonitorProperties.class,
        OrchestrationProperties.class
})
@EnableScheduling
public class SalesHudApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesHudApplication.class, args);
    }

}
