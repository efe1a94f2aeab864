package com.switchboard.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Summarised view of {@link MetricsSnapshot} for dashboards.
 */
public record PerformanceReport(
    Summary summary,
    List<IntentCount> topIntents,
    List<ServiceShare> serviceBreakdown
) {

    public record Summary(long totalRequests, double successRate, long averageProcessingTime,
                          Instant lastRequestTime) {}

    public record IntentCount(String intent, long count) {}

    public record ServiceShare(String service, long count, double percentage) {}
}
