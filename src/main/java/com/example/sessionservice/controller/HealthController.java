package com.example.sessionservice.controller;

import com.example.sessionservice.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final KvClient kvClient;
    private final String serviceName;
    private final String serviceVersion;

    public HealthController(KvClient kvClient,
                            @Value("${spring.application.name:session-service}") String serviceName,
                            @Value("${app.version:0.1.0}") String serviceVersion) {
        this.kvClient = kvClient;
        this.serviceName = serviceName;
        this.serviceVersion = serviceVersion;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("service", serviceName);
            health.put("version", serviceVersion);

            // Test Redis connection; connection details stay out of the response
            try {
                kvClient.get("health-check");
                health.put("redis", "UP");
            } catch (RuntimeException e) {
                log.warn("Redis health probe failed: {}", e.getMessage());
                health.put("status", "degraded");
                health.put("redis", "DOWN");
            }
            return ResponseEntity.ok(health);
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
