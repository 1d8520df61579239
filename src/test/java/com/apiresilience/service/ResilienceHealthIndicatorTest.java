package com.apiresilience.service;

import com.apiresilience.model.ResilienceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.net.InetAddress;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

public class ResilienceHealthIndicatorTest {
    private final RecordingDelayScheduler scheduler = new RecordingDelayScheduler();
    private NetworkResilienceEngine engine;

    @AfterEach
    void teardown() {
        engine.shutdown();
        scheduler.close();
    }

    private NetworkResilienceEngine engine(HostResolver resolver) {
        return new NetworkResilienceEngine(new ResilienceConfig(1_000, 0, 1, 1, 2, true, 60_000),
            new ErrorClassifier(), scheduler, resolver, "api.example.com");
    }

    @Test
    void upWhenHostResolves() {
        engine = engine(host -> new InetAddress[]{InetAddress.getLoopbackAddress()});

        Health health = new ResilienceHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("host", "api.example.com");
    }

    @Test
    void downWhenLookupFails() {
        engine = engine(host -> {
            throw new UnknownHostException(host);
        });

        Health health = new ResilienceHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("details").toString()).startsWith("Network health check failed");
    }
}
