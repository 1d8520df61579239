package com.apiresilience.model;

import java.time.Instant;

public class ResilienceSummaryResponse {
    private ConnectionStats connectionStats;
    private RateLimitStatistics rateLimits;
    private FailurePattern failurePattern;
    private Instant lastUpdated;

    public ResilienceSummaryResponse(ConnectionStats connectionStats, RateLimitStatistics rateLimits,
                                     FailurePattern failurePattern, Instant lastUpdated) {
        this.connectionStats = connectionStats;
        this.rateLimits = rateLimits;
        this.failurePattern = failurePattern;
        this.lastUpdated = lastUpdated;
    }

    public ConnectionStats getConnectionStats() {
        return connectionStats;
    }

    public void setConnectionStats(ConnectionStats connectionStats) {
        this.connectionStats = connectionStats;
    }

    public RateLimitStatistics getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(RateLimitStatistics rateLimits) {
        this.rateLimits = rateLimits;
    }

    public FailurePattern getFailurePattern() {
        return failurePattern;
    }

    public void setFailurePattern(FailurePattern failurePattern) {
        this.failurePattern = failurePattern;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }
}
