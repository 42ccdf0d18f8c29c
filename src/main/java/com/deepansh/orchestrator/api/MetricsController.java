package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.model.MetricsResponse;
import com.deepansh.orchestrator.model.VitalsResponse;
import com.deepansh.orchestrator.observability.MetricsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /v1/metrics/{sessionId}  per-session latency and tool usage
 * GET /v1/vitals               process-wide counters
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsService metricsService;

    @GetMapping("/metrics/{sessionId}")
    public ResponseEntity<MetricsResponse> sessionMetrics(@PathVariable String sessionId) {
        return ResponseEntity.ok(metricsService.sessionMetrics(sessionId));
    }

    @GetMapping("/vitals")
    public ResponseEntity<VitalsResponse> vitals() {
        return ResponseEntity.ok(metricsService.vitals());
    }
}
