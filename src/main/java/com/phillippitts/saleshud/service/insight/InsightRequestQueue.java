package com.phillippitts.saleshud.service.insight;

import com.phillippitts.saleshud.config.properties.AiBackendProperties;
import com.phillippitts.saleshud.config.properties.InsightQueueProperties;
import com.phillippitts.saleshud.domain.Dependency;
import com.phillippitts.saleshud.exception.CircuitOpenException;
import com.phillippitts.saleshud.exception.ErrorKind;
import com.phillippitts.saleshud.exception.ServiceException;
import com.phillippitts.saleshud.exception.ServiceExceptionBuilder;
import com.phillippitts.saleshud.service.health.ServiceHealthMonitor;
import com.phillippitts.saleshud.service.metrics.MeetingMetrics;
import com.phillippitts.saleshud.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Priority queue in front of the AI backend with bounded concurrency, selective retry and a response
 * cache.
 *
 * <p><b>Scheduling:</b> items wait in priority bands (lower value first, FIFO within a band). Whenever
 * a slot frees up, and on every drain tick, eligible items are dispatched until {@code maxConcurrent}
 * are in flight.
 *
 * <p><b>Retry:</b> retryable failures go back to the front of their band, eligible again after
 * {@code base * 2^attempt} or the backend's retry-after hint. PROCESSING_ERROR is retried at most once.
 * Non-retryable failures reject immediately. While the AI breaker is open, dispatch fails fast with a
 * {@link CircuitOpenException} without calling the backend.
 *
 * <p><b>Cache:</b> successful responses are cached by a hash of cache key and request content.
 * Real-time requests bypass the cache entirely.
 */
@Component
public class InsightRequestQueue {

    private static final Logger LOG = LogManager.getLogger(InsightRequestQueue.class);

    private final CompletionClient client;
    private final ServiceHealthMonitor monitor;
    private final InsightQueueProperties props;
    private final AiBackendProperties backendProps;
    private final Executor executor;
    private final MeetingMetrics metrics;
    private final Clock clock;
    private final ResponseCache cache;

    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    private final TreeMap<Integer, Deque<QueueItem<?>>> bands = new TreeMap<>();
    private int queued;
    private int inFlight;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong totalResponseMs = new AtomicLong();
    private final AtomicLong totalTokens = new AtomicLong();
    private final AtomicLong rateLimitHits = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final DoubleAdder estimatedCost = new DoubleAdder();

    public InsightRequestQueue(CompletionClient client,
                               ServiceHealthMonitor monitor,
                               InsightQueueProperties props,
                               AiBackendProperties backendProps,
                               @Qualifier("insightExecutor") Executor executor,
                               MeetingMetrics metrics,
                               Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.props = Objects.requireNonNull(props, "props");
        this.backendProps = Objects.requireNonNull(backendProps, "backendProps");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cache = new ResponseCache(Duration.ofMillis(props.getCacheTtlMs()), props.getCacheMaxEntries(), clock);
    }

    public CompletableFuture<CompletionResponse> submit(InsightRequest request) {
        return submit(request, Function.identity());
    }

    /**
     * Queues a request and returns its eventual, parsed result.
     *
     * <p>The parser runs on the worker thread. A parser that throws a {@code PROCESSING_ERROR}
     * {@link ServiceException} triggers the single processing retry; the unparseable response is not
     * cached.
     */
    public <T> CompletableFuture<T> submit(InsightRequest request, Function<CompletionResponse, T> parser) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(parser, "parser");
        totalRequests.incrementAndGet();
        QueueItem<T> item = new QueueItem<>(request, parser, cacheKeyOf(request), clock.instant());

        if (!request.realTime()) {
            CompletionResponse cached = cache.get(item.cacheKey).orElse(null);
            if (cached != null) {
                cacheHits.incrementAndGet();
                metrics.incrementCacheHit();
                LOG.debug("Cache hit: task={}", request.taskType());
                try {
                    item.future.complete(parser.apply(cached));
                    successfulRequests.incrementAndGet();
                } catch (RuntimeException e) {
                    failedRequests.incrementAndGet();
                    item.future.completeExceptionally(e);
                }
                return item.future;
            }
            cacheMisses.incrementAndGet();
            metrics.incrementCacheMiss();
        }

        lock.lock();
        try {
            bands.computeIfAbsent(request.priority(), p -> new ArrayDeque<>()).addLast(item);
            queued++;
        } finally {
            lock.unlock();
        }
        drain();
        return item.future;
    }

    /** Dispatches eligible items while concurrency slots are free. */
    @Scheduled(fixedRateString = "${insight.queue.drain-interval-ms:1000}")
    public void drain() {
        List<QueueItem<?>> ready = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            while (inFlight < props.getMaxConcurrent()) {
                QueueItem<?> next = pollEligible(now);
                if (next == null) {
                    break;
                }
                queued--;
                inFlight++;
                ready.add(next);
            }
        } finally {
            lock.unlock();
        }
        for (QueueItem<?> item : ready) {
            dispatch(item);
        }
    }

    @Scheduled(fixedRateString = "${insight.queue.cache-eviction-interval-ms:60000}")
    public void evictExpiredResponses() {
        int removed = cache.evictExpired();
        if (removed > 0) {
            LOG.debug("Evicted {} expired AI responses", removed);
        }
    }

    public void invalidateCache() {
        cache.invalidate();
    }

    public InsightQueueStats stats() {
        int q;
        int f;
        lock.lock();
        try {
            q = queued;
            f = inFlight;
        } finally {
            lock.unlock();
        }
        long ok = successfulRequests.get();
        long hits = cacheHits.get();
        long lookups = hits + cacheMisses.get();
        long backendSuccesses = ok - hits;
        return new InsightQueueStats(totalRequests.get(), ok, failedRequests.get(),
                backendSuccesses > 0 ? (double) totalResponseMs.get() / backendSuccesses : 0.0,
                totalTokens.get(), estimatedCost.sum(), rateLimitHits.get(),
                lookups == 0 ? 0.0 : (double) hits / lookups, q, f);
    }

    /** Estimated cost of one response from the configured per-million token prices. */
    static double estimateCost(CompletionResponse response, AiBackendProperties prices) {
        return response.inputTokens() * prices.getInputPricePerMillion() / 1_000_000.0
                + response.outputTokens() * prices.getOutputPricePerMillion() / 1_000_000.0;
    }

    private QueueItem<?> pollEligible(Instant now) {
        for (Iterator<Map.Entry<Integer, Deque<QueueItem<?>>>> bandIt = bands.entrySet().iterator();
             bandIt.hasNext(); ) {
            Deque<QueueItem<?>> band = bandIt.next().getValue();
            for (Iterator<QueueItem<?>> it = band.iterator(); it.hasNext(); ) {
                QueueItem<?> item = it.next();
                if (!item.notBefore.isAfter(now)) {
                    it.remove();
                    if (band.isEmpty()) {
                        bandIt.remove();
                    }
                    return item;
                }
            }
        }
        return null;
    }

    private void dispatch(QueueItem<?> item) {
        try {
            monitor.acquirePermission(Dependency.AI_ANALYSIS);
        } catch (CircuitOpenException e) {
            release();
            reject(item, e);
            return;
        }
        try {
            executor.execute(() -> execute(item));
        } catch (RejectedExecutionException e) {
            monitor.releasePermission(Dependency.AI_ANALYSIS);
            release();
            reject(item, ServiceExceptionBuilder.create("Insight executor rejected task", ErrorKind.PROCESSING_ERROR)
                    .retryable(false)
                    .cause(e)
                    .build());
        }
    }

    private <T> void execute(QueueItem<T> item) {
        InsightRequest request = item.request;
        long start = System.nanoTime();
        // Every granted permit gets exactly one outcome; parser failures come after the call succeeded
        boolean outcomeRecorded = false;
        try {
            CompletionResponse response = client.complete(request.completion());
            monitor.recordSuccess(Dependency.AI_ANALYSIS);
            outcomeRecorded = true;
            T value = item.parser.apply(response);
            long elapsed = TimeUtils.elapsedNanos(start);
            totalResponseMs.addAndGet(TimeUtils.nanosToMillis(elapsed));
            totalTokens.addAndGet(response.totalTokens());
            estimatedCost.add(estimateCost(response, backendProps));
            metrics.recordAiRequest("success", elapsed);
            if (!request.realTime()) {
                cache.put(item.cacheKey, response);
            }
            successfulRequests.incrementAndGet();
            release();
            item.future.complete(value);
        } catch (ServiceException e) {
            if (!outcomeRecorded) {
                monitor.recordFailure(Dependency.AI_ANALYSIS, e);
            }
            metrics.recordAiRequest("failure", TimeUtils.elapsedNanos(start));
            release();
            handleFailure(item, e);
        } catch (RuntimeException e) {
            ServiceException failure = ServiceExceptionBuilder
                    .create("Insight task failed", ErrorKind.PROCESSING_ERROR)
                    .dependency(Dependency.AI_ANALYSIS)
                    .metadata("task", request.taskType())
                    .cause(e)
                    .build();
            if (!outcomeRecorded) {
                monitor.recordFailure(Dependency.AI_ANALYSIS, failure);
            }
            metrics.recordAiRequest("failure", TimeUtils.elapsedNanos(start));
            release();
            handleFailure(item, failure);
        }
        drain();
    }

    private void handleFailure(QueueItem<?> item, ServiceException e) {
        if (e.getKind() == ErrorKind.RATE_LIMIT) {
            rateLimitHits.incrementAndGet();
            metrics.incrementRateLimited();
        }
        int limit = e.getKind() == ErrorKind.PROCESSING_ERROR ? Math.min(1, props.getMaxRetries()) : props.getMaxRetries();
        if (!e.isRetryable() || item.attempts >= limit) {
            LOG.warn("Insight request failed: task={}, kind={}, attempts={}", item.request.taskType(), e.getKind(),
                    item.attempts);
            reject(item, e);
            return;
        }
        Duration delay = e.getRetryAfter()
                .orElse(Duration.ofMillis(props.getRetryBaseDelayMs() << Math.min(item.attempts, 20)));
        item.attempts++;
        item.notBefore = clock.instant().plus(delay);
        lock.lock();
        try {
            bands.computeIfAbsent(item.request.priority(), p -> new ArrayDeque<>()).addFirst(item);
            queued++;
        } finally {
            lock.unlock();
        }
        LOG.info("Retrying insight request: task={}, kind={}, attempt={}, delayMs={}", item.request.taskType(),
                e.getKind(), item.attempts, delay.toMillis());
    }

    private void reject(QueueItem<?> item, ServiceException e) {
        failedRequests.incrementAndGet();
        item.future.completeExceptionally(e);
    }

    private void release() {
        lock.lock();
        try {
            inFlight--;
        } finally {
            lock.unlock();
        }
    }

    private static String cacheKeyOf(InsightRequest request) {
        return request.realTime() ? null : ResponseCache.keyFor(request.cacheKey(), request.completion());
    }

    private static final class QueueItem<T> {
        final InsightRequest request;
        final Function<CompletionResponse, T> parser;
        final String cacheKey;
        final CompletableFuture<T> future = new CompletableFuture<>();
        // Mutated only while the item is owned by one thread (queued under lock, or in flight)
        int attempts;
        Instant notBefore;

        QueueItem(InsightRequest request, Function<CompletionResponse, T> parser, String cacheKey, Instant notBefore) {
            this.request = request;
            this.parser = parser;
            this.cacheKey = cacheKey;
            this.notBefore = notBefore;
        }
    }
}
