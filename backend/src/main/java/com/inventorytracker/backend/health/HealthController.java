package com.inventorytracker.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthcheck}) and readiness ({@code /readyz}) probes.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * Answers as long as the process serves requests; the database is not consulted.
     */
    @GetMapping("/healthcheck")
    public HealthResponse healthcheck() {
        return new HealthResponse("ok", now());
    }

    /**
     * Reports the database health indicator, falling back to the aggregate status.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent healthComponent = healthEndpoint.health();
        Status status = healthComponent.getStatus();
        if (healthComponent instanceof CompositeHealth composite
                && composite.getComponents().get("db") instanceof Health dbHealth) {
            status = dbHealth.getStatus();
        }
        return new HealthResponse(status.getCode(), now());
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    public record HealthResponse(
        String status,
        String timestamp // ISO-8601
    ) {}
}
