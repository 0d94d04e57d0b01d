package com.phillippitts.saleshud.config;

import com.phillippitts.saleshud.config.properties.ThreadPoolProperties;
import com.phillippitts.saleshud.util.ThreadContexts;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for AI requests, persistence writes and timed work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on backend rate limits and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for AI completion calls dispatched by the insight queue.
     *
     * <p>The queue itself caps in-flight requests at {@code insight.queue.max-concurrent}; the pool only
     * needs to be at least that large. Rejection policy: {@link ThreadPoolExecutor.AbortPolicy} so the
     * queue can reject the request instead of running a blocking HTTP call on the caller's thread.
     *
     * <p>MDC propagation: copies the submitting thread's ThreadContext (meetingId, requestId).
     *
     * @return executor for AI completion calls
     */
    @Bean(name = "insightExecutor")
    public Executor insightExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getInsight();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Single-threaded executor for meeting store writes, which keeps writes for a meeting in
     * submission order. Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, which applies
     * backpressure rather than dropping writes.
     *
     * @return executor for persistence writes
     */
    @Bean(name = "persistenceExecutor")
    public Executor persistenceExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getPersistence();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for transcription reconnects and the {@code @Scheduled} background passes
     * (health probes, insight queue drain, meeting queue processing).
     *
     * <p>Tasks run without the submitter's ThreadContext; the transcription link wraps its reconnects
     * with the meeting's context itself.
     *
     * @param clock application clock, exposed through {@code TaskScheduler.getClock()}
     * @return the application's task scheduler
     */
    @Bean(name = "transcriptionScheduler")
    public ThreadPoolTaskScheduler transcriptionScheduler(Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setClock(clock);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        return executor;
    }

    // Propagate MDC to worker threads
    static TaskDecorator mdcPropagating() {
        return ThreadContexts::propagating;
    }
}
