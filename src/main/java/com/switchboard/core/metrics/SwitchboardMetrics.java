package com.switchboard.core.metrics;

import com.switchboard.core.model.MetricsSnapshot;
import com.switchboard.core.model.PerformanceReport;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.model.ResolutionPath;
import com.switchboard.core.model.ResolvedIntent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request metrics for intent resolution.
 * <p>
 * Every event goes to Micrometer under {@code switchboard.*}. A resettable
 * in-memory tally is kept alongside for {@link #getMetrics()} and
 * {@link #getPerformanceReport()}; it is guarded by this object's monitor.
 */
@Service
public class SwitchboardMetrics {

    static final int TOP_INTENTS = 5;

    private final MeterRegistry registry;
    private final Clock clock;

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private double averageProcessingTime;
    private final Map<String, Long> intentDistribution = new HashMap<>();
    private final Map<String, Long> serviceUsage = new HashMap<>();
    private long crossPlatformSuccess;
    private long cacheHits;
    private long insightsGenerated;
    private Instant lastRequestTime;

    @Autowired
    public SwitchboardMetrics(MeterRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    SwitchboardMetrics(MeterRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    /**
     * Records one finished request. A request fails when it ended in the
     * terminal fallback; only successful requests feed the running mean.
     */
    public void recordRequest(ResolvedIntent result, ResolutionMode mode, long processingMs, boolean cacheHit) {
        boolean failed = ResolutionPath.FALLBACK.tag().equals(result.resolutionPath());
        String modeName = mode.wireName();

        Counter.builder("switchboard.requests.total")
                .tag("mode", modeName)
                .tag("outcome", failed ? "failed" : "success")
                .register(registry)
                .increment();
        Timer.builder("switchboard.resolution.duration")
                .tag("path", String.valueOf(result.resolutionPath()))
                .register(registry)
                .record(Duration.ofMillis(processingMs));
        if (!failed) {
            Counter.builder("switchboard.intents.resolved")
                    .tag("intent", result.intent())
                    .register(registry)
                    .increment();
            if (result.crossPlatformAction()) {
                Counter.builder("switchboard.cross_platform.actions")
                        .register(registry)
                        .increment();
            }
        }
        if (cacheHit) {
            Counter.builder("switchboard.cache.hits")
                    .register(registry)
                    .increment();
        }

        synchronized (this) {
            totalRequests++;
            serviceUsage.merge(modeName, 1L, Long::sum);
            if (failed) {
                failedRequests++;
            } else {
                successfulRequests++;
                averageProcessingTime += (processingMs - averageProcessingTime) / successfulRequests;
                intentDistribution.merge(result.intent(), 1L, Long::sum);
                if (result.crossPlatformAction()) {
                    crossPlatformSuccess++;
                }
            }
            if (cacheHit) {
                cacheHits++;
            }
            lastRequestTime = clock.instant();
        }
    }

    public void recordInsights(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("switchboard.insights.generated")
                .register(registry)
                .increment(count);
        synchronized (this) {
            insightsGenerated += count;
        }
    }

    public void recordTraining(int trained, int errors) {
        Counter.builder("switchboard.training.examples")
                .tag("result", "trained")
                .register(registry)
                .increment(trained);
        Counter.builder("switchboard.training.examples")
                .tag("result", "rejected")
                .register(registry)
                .increment(errors);
    }

    public synchronized MetricsSnapshot getMetrics() {
        double successRate = totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests * 100.0;
        return new MetricsSnapshot(
                totalRequests,
                successfulRequests,
                failedRequests,
                averageProcessingTime,
                Map.copyOf(intentDistribution),
                Map.copyOf(serviceUsage),
                crossPlatformSuccess,
                cacheHits,
                insightsGenerated,
                lastRequestTime,
                successRate,
                mostUsed(intentDistribution),
                mostUsed(serviceUsage));
    }

    public PerformanceReport getPerformanceReport() {
        MetricsSnapshot snapshot = getMetrics();
        var summary = new PerformanceReport.Summary(
                snapshot.totalRequests(),
                Math.round(snapshot.successRate() * 100.0) / 100.0,
                Math.round(snapshot.averageProcessingTime()),
                snapshot.lastRequestTime());

        List<PerformanceReport.IntentCount> topIntents = snapshot.intentDistribution().entrySet().stream()
                .sorted(byCountDescending())
                .limit(TOP_INTENTS)
                .map(e -> new PerformanceReport.IntentCount(e.getKey(), e.getValue()))
                .toList();

        long serviceTotal = snapshot.serviceUsage().values().stream().mapToLong(Long::longValue).sum();
        List<PerformanceReport.ServiceShare> breakdown = snapshot.serviceUsage().entrySet().stream()
                .sorted(byCountDescending())
                .map(e -> new PerformanceReport.ServiceShare(e.getKey(), e.getValue(),
                        serviceTotal == 0 ? 0.0 : Math.round(e.getValue() * 1000.0 / serviceTotal) / 10.0))
                .toList();

        return new PerformanceReport(summary, topIntents, breakdown);
    }

    public synchronized void reset() {
        totalRequests = 0;
        successfulRequests = 0;
        failedRequests = 0;
        averageProcessingTime = 0.0;
        intentDistribution.clear();
        serviceUsage.clear();
        crossPlatformSuccess = 0;
        cacheHits = 0;
        insightsGenerated = 0;
        lastRequestTime = null;
    }

    private static Comparator<Map.Entry<String, Long>> byCountDescending() {
        return Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey());
    }

    private static String mostUsed(Map<String, Long> distribution) {
        return distribution.entrySet().stream()
                .sorted(byCountDescending())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse("none");
    }
}
