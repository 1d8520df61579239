package com.apiresilience.service;

import com.apiresilience.model.HealthCheckResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class ResilienceHealthIndicator implements HealthIndicator {
    private final NetworkResilienceEngine engine;

    public ResilienceHealthIndicator(NetworkResilienceEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        // the health check completes within the engine timeout and never fails
        HealthCheckResult result = engine.performHealthCheck().join();
        Health.Builder builder = result.isHealthy() ? Health.up() : Health.down();
        return builder
            .withDetail("host", result.getHost())
            .withDetail("latencyMs", result.getLatencyMs())
            .withDetail("details", result.getDetails())
            .withDetail("activeConnections", engine.getConnectionStats().getActiveConnections())
            .build();
    }
}
