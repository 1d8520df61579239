package com.apiresilience.service;

import com.apiresilience.model.RateLimitStatus;

import java.time.Instant;

/**
 * Fixed-window request counter for one actor. An expired window is reset lazily by the next call that
 * reads or writes it.
 */
public class RateLimitState {
    private final String actorId;
    private final int limit;
    private final long windowDurationMs;
    private long windowStart;
    private int requestCount;

    public RateLimitState(String actorId, int limit, long windowDurationMs, long nowMs) {
        this.actorId = actorId;
        this.limit = limit;
        this.windowDurationMs = windowDurationMs;
        this.windowStart = nowMs;
    }

    public synchronized boolean hasCapacity(long nowMs) {
        resetIfExpired(nowMs);
        return requestCount < limit;
    }

    public synchronized void record(long nowMs) {
        resetIfExpired(nowMs);
        requestCount++;
    }

    /**
     * Check and record in one step.
     *
     * @return false when the window is full, in which case nothing is recorded
     */
    public synchronized boolean tryAcquire(long nowMs) {
        resetIfExpired(nowMs);
        if (requestCount >= limit) {
            return false;
        }
        requestCount++;
        return true;
    }

    public synchronized long millisUntilReset(long nowMs) {
        resetIfExpired(nowMs);
        return Math.max(0, windowStart + windowDurationMs - nowMs);
    }

    public synchronized RateLimitStatus snapshot(long nowMs) {
        resetIfExpired(nowMs);
        return new RateLimitStatus(actorId, requestCount, limit, Instant.ofEpochMilli(windowStart),
            Instant.ofEpochMilli(windowStart + windowDurationMs));
    }

    // Read-only view for statistics: an expired window counts as empty without being advanced.
    synchronized int effectiveCount(long nowMs) {
        return isExpired(nowMs) ? 0 : requestCount;
    }

    synchronized boolean isActive(long nowMs) {
        return !isExpired(nowMs);
    }

    public String getActorId() {
        return actorId;
    }

    private boolean isExpired(long nowMs) {
        return nowMs >= windowStart + windowDurationMs;
    }

    private void resetIfExpired(long nowMs) {
        if (isExpired(nowMs)) {
            requestCount = 0;
            windowStart = nowMs;
        }
    }
}
