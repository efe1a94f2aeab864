package com.switchboard.dispatch.api;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for resolver health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: Component health.
     * 200 while every component is UP or DEGRADED, 503 once any is DOWN.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (healthCheckService == null) {
            body.put("status", HealthStatus.Status.DOWN.name());
            body.put("components", Map.of());
            return ResponseEntity.status(503).body(body);
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        HealthStatus.Status overall = overall(checks);

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
        }
        body.put("status", overall.name());
        body.put("components", components);

        return overall == HealthStatus.Status.DOWN
                ? ResponseEntity.status(503).body(body)
                : ResponseEntity.ok(body);
    }

    static HealthStatus.Status overall(List<HealthStatus> checks) {
        HealthStatus.Status result = HealthStatus.Status.UP;
        for (HealthStatus check : checks) {
            if (check.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            if (check.status() == HealthStatus.Status.DEGRADED) {
                result = HealthStatus.Status.DEGRADED;
            }
        }
        return result;
    }
}
