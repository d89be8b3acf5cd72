package com.whereq.herald.controller;

import com.whereq.herald.clock.Clock;
import com.whereq.herald.service.NotificationScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and scheduler status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final NotificationScheduler scheduler;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and its scheduler are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-herald");

            Map<String, Object> schedulerInfo = new HashMap<>();
            schedulerInfo.put("jobs", scheduler.jobCount());
            schedulerInfo.put("active", scheduler.activeCount());
            schedulerInfo.put("armed", scheduler.armedCount());
            schedulerInfo.put("time", clock.now().toString());

            health.put("scheduler", schedulerInfo);
            return ResponseEntity.ok(health);
        });
    }
}
