package com.apiresilience.model;

import java.time.Instant;

public class RateLimitStatus {
    private final String actorId;
    private final int requestCount;
    private final int limit;
    private final Instant windowStart;
    private final Instant resetTime;

    public RateLimitStatus(String actorId, int requestCount, int limit, Instant windowStart, Instant resetTime) {
        this.actorId = actorId;
        this.requestCount = requestCount;
        this.limit = limit;
        this.windowStart = windowStart;
        this.resetTime = resetTime;
    }

    public String getActorId() {
        return actorId;
    }

    public int getRequestCount() {
        return requestCount;
    }

    public int getLimit() {
        return limit;
    }

    public int getRemaining() {
        return Math.max(0, limit - requestCount);
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getResetTime() {
        return resetTime;
    }
}
