package com.apiresilience.api;

import com.apiresilience.exception.ApiOperationException;
import com.apiresilience.model.*;
import com.apiresilience.service.RateLimiter;
import com.apiresilience.service.ResilienceOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ResilienceController.class)
public class ResilienceControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResilienceOrchestrator orchestrator;

    @MockBean
    private RateLimiter rateLimiter;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void statsAreReturned() throws Exception {
        when(orchestrator.getNetworkStats()).thenReturn(new ConnectionStats(12, 3, 1, 9, 42.5));

        mockMvc.perform(get("/api/resilience/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalRequests", is(12)))
            .andExpect(jsonPath("$.failedRequests", is(3)))
            .andExpect(jsonPath("$.idleConnections", is(9)))
            .andExpect(jsonPath("$.averageResponseTimeMs", is(42.5)));
    }

    @Test
    void statsCanBeReset() throws Exception {
        mockMvc.perform(delete("/api/resilience/stats"))
            .andExpect(status().isNoContent());

        verify(orchestrator).resetNetworkStats();
    }

    @Test
    void unhealthyNetworkReturnsServiceUnavailable() throws Exception {
        HealthCheckResult result = new HealthCheckResult();
        result.setHealthy(false);
        result.setHost("api.example.com");
        result.setDetails("Network health check failed: api.example.com");
        when(orchestrator.performNetworkHealthCheck()).thenReturn(CompletableFuture.completedFuture(result));

        mockMvc.perform(get("/api/resilience/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.healthy", is(false)))
            .andExpect(jsonPath("$.details", startsWith("Network health check failed")));
    }

    @Test
    void configUpdateIsApplied() throws Exception {
        ResilienceConfigUpdate update = new ResilienceConfigUpdate();
        update.setPoolSize(20);
        when(orchestrator.updateConfig(any(ResilienceConfigUpdate.class)))
            .thenReturn(new ResilienceConfig(30_000, 3, 1000, 30_000, 20, true, 60_000));

        mockMvc.perform(put("/api/resilience/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(update)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.poolSize", is(20)));
    }

    @Test
    void invalidConfigUpdateIsRejected() throws Exception {
        mockMvc.perform(put("/api/resilience/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"poolSize\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors.poolSize", notNullValue()));
    }

    @Test
    void rejectedConfigSurfacesCallerError() throws Exception {
        ClassifiedError error = ClassifiedError.builder(ErrorType.VALIDATION).code(400)
            .message("Validation error: maxDelay below baseDelay").build();
        when(orchestrator.updateConfig(any(ResilienceConfigUpdate.class)))
            .thenThrow(new ApiOperationException(ApiOperationException.Kind.CALLER_INPUT,
                "API Error (validation): Validation error: maxDelay below baseDelay", 400, "Review the input", error));

        mockMvc.perform(put("/api/resilience/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"maxDelayMs\": 5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind", is("CALLER_INPUT")))
            .andExpect(jsonPath("$.troubleshooting", is("Review the input")));
    }

    @Test
    void failurePatternIsReturned() throws Exception {
        when(orchestrator.detectRecentFailurePattern())
            .thenReturn(new FailurePattern(FailurePatternKind.HIGH_TIMEOUT_RATE, 8));

        mockMvc.perform(get("/api/resilience/failure-pattern"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pattern", is("high_timeout_rate")))
            .andExpect(jsonPath("$.severity", is("high")))
            .andExpect(jsonPath("$.sampleSize", is(8)));
    }

    @Test
    void unknownActorHasEmptyWindow() throws Exception {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        when(rateLimiter.getRateLimitStatus("ghost"))
            .thenReturn(new RateLimitStatus("ghost", 0, 1000, now, now.plusSeconds(3600)));

        mockMvc.perform(get("/api/resilience/rate-limits/ghost"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requestCount", is(0)))
            .andExpect(jsonPath("$.remaining", is(1000)));
    }

    @Test
    void actorWindowCanBeReset() throws Exception {
        mockMvc.perform(delete("/api/resilience/rate-limits/alice"))
            .andExpect(status().isNoContent());

        verify(rateLimiter).resetRateLimit("alice");
    }

    @Test
    void summaryCombinesStatsAndLimits() throws Exception {
        when(orchestrator.getNetworkStats()).thenReturn(new ConnectionStats(5, 0, 0, 10, 12.0));
        when(rateLimiter.getStatistics()).thenReturn(new RateLimitStatistics(2, 40, 1));
        when(orchestrator.detectRecentFailurePattern()).thenReturn(new FailurePattern(FailurePatternKind.NO_ERRORS, 0));

        mockMvc.perform(get("/api/resilience/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.connectionStats.totalRequests", is(5)))
            .andExpect(jsonPath("$.rateLimits.totalUsers", is(2)))
            .andExpect(jsonPath("$.failurePattern.pattern", is("no_errors")))
            .andExpect(jsonPath("$.lastUpdated", notNullValue()));
    }
}
