package com.apiresilience.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Exposes connection and rate-limit counters as gauges. Values are read on scrape.
 */
@Component
public class ResilienceMetrics implements MeterBinder {
    private final NetworkResilienceEngine engine;
    private final RateLimiter rateLimiter;

    public ResilienceMetrics(NetworkResilienceEngine engine, RateLimiter rateLimiter) {
        this.engine = engine;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("resilience.connections.active", engine, e -> e.getConnectionStats().getActiveConnections())
            .description("Attempts currently in flight")
            .register(registry);
        Gauge.builder("resilience.requests.total", engine, e -> e.getConnectionStats().getTotalRequests())
            .description("Attempts started since the last reset")
            .register(registry);
        Gauge.builder("resilience.requests.failed", engine, e -> e.getConnectionStats().getFailedRequests())
            .description("Attempts that failed or timed out")
            .register(registry);
        Gauge.builder("resilience.response.time.avg", engine, e -> e.getConnectionStats().getAverageResponseTimeMs())
            .description("Rolling average response time of successful attempts")
            .baseUnit("milliseconds")
            .register(registry);
        Gauge.builder("resilience.ratelimit.actors.active", rateLimiter, r -> r.getStatistics().getActiveUsers())
            .description("Actors with an open rate-limit window")
            .register(registry);
    }
}
