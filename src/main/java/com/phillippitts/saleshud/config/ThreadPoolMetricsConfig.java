package com.phillippitts.saleshud.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the insight executor through Micrometer:
 * <ul>
 *   <li>saleshud.insight.pool.size - current number of threads</li>
 *   <li>saleshud.insight.pool.active - threads running an AI request</li>
 *   <li>saleshud.insight.pool.queued - tasks waiting for a thread</li>
 *   <li>saleshud.insight.pool.completed - cumulative completed tasks</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<Executor> insightExecutorProvider;

    public ThreadPoolMetricsConfig(@Qualifier("insightExecutor") ObjectProvider<Executor> insightExecutorProvider) {
        this.insightExecutorProvider = insightExecutorProvider;
    }

    @Bean
    public MeterBinder insightExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = threadPool();
            if (executor == null) {
                return;
            }
            Gauge.builder("saleshud.insight.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the insight pool")
                    .register(registry);
            Gauge.builder("saleshud.insight.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads actively executing AI requests")
                    .register(registry);
            Gauge.builder("saleshud.insight.pool.queued", executor, e -> e.getQueue().size())
                    .description("AI requests waiting for an insight thread")
                    .register(registry);
            Gauge.builder("saleshud.insight.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed AI requests")
                    .register(registry);
            LOG.info("Insight thread pool metrics registered: saleshud.insight.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = threadPool();
        if (executor == null) {
            return;
        }
        LOG.info("Insight Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }

    private ThreadPoolExecutor threadPool() {
        Executor executor = insightExecutorProvider.getIfAvailable();
        return executor instanceof ThreadPoolTaskExecutor pool ? pool.getThreadPoolExecutor() : null;
    }
}
