package com.apiresilience.api;

import com.apiresilience.model.*;
import com.apiresilience.service.RateLimiter;
import com.apiresilience.service.ResilienceOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/resilience")
@Tag(name = "Resilience API", description = "Inspect and tune retry, throttling and connection-pool state")
public class ResilienceController {
    private final ResilienceOrchestrator orchestrator;
    private final RateLimiter rateLimiter;

    public ResilienceController(ResilienceOrchestrator orchestrator, RateLimiter rateLimiter) {
        this.orchestrator = orchestrator;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping("/stats")
    @Operation(summary = "Get connection-pool statistics")
    @ApiResponse(responseCode = "200", description = "Current attempt counters and average response time")
    public ResponseEntity<ConnectionStats> getStats() {
        return ResponseEntity.ok(orchestrator.getNetworkStats());
    }

    @DeleteMapping("/stats")
    @Operation(summary = "Reset connection-pool statistics")
    @ApiResponse(responseCode = "204", description = "Statistics reset")
    public ResponseEntity<Void> resetStats() {
        orchestrator.resetNetworkStats();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    @Operation(summary = "Run a network health check",
               description = "Resolves the configured health-check host within the engine timeout")
    @ApiResponse(responseCode = "200", description = "Network is healthy")
    @ApiResponse(responseCode = "503", description = "Network health check failed")
    public ResponseEntity<HealthCheckResult> checkHealth() {
        HealthCheckResult result = orchestrator.performNetworkHealthCheck().join();
        if (!result.isHealthy()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/config")
    @Operation(summary = "Get the active resilience configuration")
    @ApiResponse(responseCode = "200", description = "Active configuration")
    public ResponseEntity<ResilienceConfig> getConfig() {
        return ResponseEntity.ok(orchestrator.getConfig());
    }

    @PutMapping("/config")
    @Operation(summary = "Update the resilience configuration",
               description = "Only the supplied fields change. Pool settings or timeout changes recreate the connection pool")
    @ApiResponse(responseCode = "200", description = "Configuration updated")
    @ApiResponse(responseCode = "400", description = "Invalid configuration values")
    public ResponseEntity<ResilienceConfig> updateConfig(@Valid @RequestBody ResilienceConfigUpdate update) {
        return ResponseEntity.ok(orchestrator.updateConfig(update));
    }

    @GetMapping("/failure-pattern")
    @Operation(summary = "Detect the failure pattern of recent errors")
    @ApiResponse(responseCode = "200", description = "Pattern, severity and recommendation")
    public ResponseEntity<FailurePattern> getFailurePattern() {
        return ResponseEntity.ok(orchestrator.detectRecentFailurePattern());
    }

    @GetMapping("/rate-limits")
    @Operation(summary = "Get aggregate rate-limit statistics")
    @ApiResponse(responseCode = "200", description = "Tracked, active actors and request totals")
    public ResponseEntity<RateLimitStatistics> getRateLimitStatistics() {
        return ResponseEntity.ok(rateLimiter.getStatistics());
    }

    @GetMapping("/rate-limits/{actorId}")
    @Operation(summary = "Get the rate-limit window of an actor",
               description = "Unknown actors report an empty window")
    @ApiResponse(responseCode = "200", description = "Current window")
    public ResponseEntity<RateLimitStatus> getRateLimitStatus(@PathVariable String actorId) {
        return ResponseEntity.ok(rateLimiter.getRateLimitStatus(actorId));
    }

    @DeleteMapping("/rate-limits/{actorId}")
    @Operation(summary = "Reset the rate-limit window of an actor")
    @ApiResponse(responseCode = "204", description = "Window reset")
    public ResponseEntity<Void> resetRateLimit(@PathVariable String actorId) {
        rateLimiter.resetRateLimit(actorId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/rate-limits")
    @Operation(summary = "Clear every tracked rate-limit window")
    @ApiResponse(responseCode = "204", description = "All windows cleared")
    public ResponseEntity<Void> clearRateLimits() {
        rateLimiter.clearAllRateLimits();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/summary")
    @Operation(summary = "Get a resilience summary")
    @ApiResponse(responseCode = "200", description = "Connection stats, rate limits and recent failure pattern")
    public ResponseEntity<ResilienceSummaryResponse> getSummary() {
        ResilienceSummaryResponse summary = new ResilienceSummaryResponse(orchestrator.getNetworkStats(),
            rateLimiter.getStatistics(), orchestrator.detectRecentFailurePattern(), Instant.now());
        return ResponseEntity.ok(summary);
    }
}
