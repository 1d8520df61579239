package com.apiresilience.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;

/**
 * Partial set of engine settings. Only non-null fields are applied.
 */
@Schema(description = "Partial resilience settings; omitted fields keep their current value")
public class ResilienceConfigUpdate {
    @Min(1)
    @Schema(description = "Per-attempt timeout in milliseconds", example = "30000")
    private Long timeoutMs;

    @Min(0)
    @Schema(description = "Retries after the first attempt", example = "3")
    private Integer maxRetries;

    @Min(0)
    @Schema(description = "Base backoff delay in milliseconds", example = "1000")
    private Long baseDelayMs;

    @Min(0)
    @Schema(description = "Backoff cap in milliseconds", example = "30000")
    private Long maxDelayMs;

    @Min(1)
    @Schema(description = "Concurrent exchanges allowed by the connection pool", example = "10")
    private Integer poolSize;

    private Boolean keepAlive;

    @Min(0)
    @Schema(description = "Idle keep-alive duration in milliseconds", example = "60000")
    private Long keepAliveMs;

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(Long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public Long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(Long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public Integer getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(Integer poolSize) {
        this.poolSize = poolSize;
    }

    public Boolean getKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(Boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public Long getKeepAliveMs() {
        return keepAliveMs;
    }

    public void setKeepAliveMs(Long keepAliveMs) {
        this.keepAliveMs = keepAliveMs;
    }
}
