package com.deepansh.orchestrator.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * GET /health, unauthenticated. 503 when MongoDB does not answer a ping.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        String database;
        HttpStatus status;
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            database = "connected";
            status = HttpStatus.OK;
        } catch (Exception e) {
            log.warn("Health check: MongoDB ping failed: {}", e.getMessage());
            database = "disconnected";
            status = HttpStatus.SERVICE_UNAVAILABLE;
        }
        return ResponseEntity.status(status).body(Map.of(
                "status", status == HttpStatus.OK ? "healthy" : "unhealthy",
                "database", database,
                "timestamp", clock.instant().toString()));
    }
}
