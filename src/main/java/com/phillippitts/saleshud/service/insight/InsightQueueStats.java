package com.phillippitts.saleshud.service.insight;

/**
 * Point-in-time usage analytics of the insight queue.
 *
 * @param totalRequests         submissions, including cache hits
 * @param successfulRequests    requests completed with a response
 * @param failedRequests        requests rejected after retries or without retry
 * @param averageResponseTimeMs mean latency of successful backend calls
 * @param totalTokens           input plus output tokens billed
 * @param estimatedCost         cost in the backend's currency
 * @param rateLimitHits         RATE_LIMIT responses seen
 * @param cacheHitRatio         hits / (hits + misses), 0 when nothing was looked up
 * @param queued                items waiting for a slot or retry
 * @param inFlight              items currently executing
 */
public record InsightQueueStats(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double averageResponseTimeMs,
        long totalTokens,
        double estimatedCost,
        long rateLimitHits,
        double cacheHitRatio,
        int queued,
        int inFlight
) { }
