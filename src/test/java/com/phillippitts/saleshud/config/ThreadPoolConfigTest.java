package com.phillippitts.saleshud.config;

import com.phillippitts.saleshud.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldSizeInsightPoolFromProperties() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getInsight().setCorePoolSize(4);
        props.getInsight().setMaxPoolSize(6);
        props.getInsight().setThreadNamePrefix("ai-");

        executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(props).insightExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(6);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("ai-");
    }

    @Test
    void shouldCarryMeetingIdOntoWorkerThreadAndClearAfter() throws Exception {
        // Arrange
        executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).persistenceExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("meetingId", "m-42");

        // Act
        CompletableFuture.runAsync(() -> seen.set(ThreadContext.get("meetingId")), executor)
                .get(5, TimeUnit.SECONDS);
        ThreadContext.clearAll();
        AtomicReference<String> afterward = new AtomicReference<>("unset");
        CompletableFuture.runAsync(() -> afterward.set(ThreadContext.get("meetingId")), executor)
                .get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(seen.get()).isEqualTo("m-42");
        assertThat(afterward.get()).isNull();
    }
}
