package com.sahayak.dispatch.api;

import com.sahayak.core.health.HealthCheckService;
import com.sahayak.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status and orchestration probes.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: Detailed component health.
     * Returns 200 unless a component is DOWN, then 503.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        var checks = healthCheckService.checkAll();
        boolean anyDown = false;
        boolean anyDegraded = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);

            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }

        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/healthz: Liveness.
     */
    @GetMapping("/healthz")
    public Map<String, String> healthz() {
        return Map.of("status", "ok");
    }

    /**
     * GET /api/v1/readyz: Readiness: not ready only when the database is DOWN.
     */
    @GetMapping("/readyz")
    public ResponseEntity<Map<String, Object>> readyz() {
        HealthStatus database = healthCheckService.checkDatabase();
        boolean ready = database.status() != HealthStatus.Status.DOWN;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", ready ? "ready" : "not_ready");
        result.put("database", database.status().name());
        return ready ? ResponseEntity.ok(result) : ResponseEntity.status(503).body(result);
    }
}
