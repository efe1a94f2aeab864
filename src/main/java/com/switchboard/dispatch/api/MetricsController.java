package com.switchboard.dispatch.api;

import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.MetricsSnapshot;
import com.switchboard.core.model.PerformanceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for resolver request metrics.
 */
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final SwitchboardMetrics metrics;

    public MetricsController(SwitchboardMetrics metrics) {
        this.metrics = metrics;
    }

    @GetMapping
    public ResponseEntity<MetricsSnapshot> metrics() {
        return ResponseEntity.ok(metrics.getMetrics());
    }

    @GetMapping("/report")
    public ResponseEntity<PerformanceReport> report() {
        return ResponseEntity.ok(metrics.getPerformanceReport());
    }

    /**
     * POST /api/v1/metrics/reset: Clear the in-memory tally. Micrometer meters are not reset.
     */
    @PostMapping("/reset")
    public ResponseEntity<Void> reset() {
        metrics.reset();
        log.info("Request metrics reset");
        return ResponseEntity.noContent().build();
    }
}
