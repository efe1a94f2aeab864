package com.switchboard.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of the resolver's request metrics at one point in time.
 *
 * @param averageProcessingTime running mean over successful requests, in milliseconds
 * @param successRate           percentage of requests that did not end in the terminal fallback
 */
public record MetricsSnapshot(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double averageProcessingTime,
    Map<String, Long> intentDistribution,
    Map<String, Long> serviceUsage,
    long crossPlatformSuccess,
    long cacheHits,
    long insightsGenerated,
    Instant lastRequestTime,
    double successRate,
    String mostUsedIntent,
    String mostUsedService
) {}
