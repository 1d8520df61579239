package com.apiresilience.service;

import com.apiresilience.model.ConnectionStats;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Attempt counters plus a rolling average over the last {@value #RESPONSE_TIME_WINDOW} successful response times.
 */
class ConnectionStatsTracker {
    static final int RESPONSE_TIME_WINDOW = 100;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicInteger activeConnections = new AtomicInteger();

    private final Deque<Long> responseTimes = new ArrayDeque<>();
    private long responseTimeSum;

    void attemptStarted() {
        totalRequests.incrementAndGet();
        activeConnections.incrementAndGet();
    }

    void attemptFinished(boolean failed) {
        activeConnections.updateAndGet(current -> Math.max(0, current - 1));
        if (failed) {
            failedRequests.incrementAndGet();
        }
    }

    synchronized void recordResponseTime(long responseTimeMs) {
        responseTimes.addLast(responseTimeMs);
        responseTimeSum += responseTimeMs;
        if (responseTimes.size() > RESPONSE_TIME_WINDOW) {
            responseTimeSum -= responseTimes.removeFirst();
        }
    }

    synchronized double averageResponseTimeMs() {
        return responseTimes.isEmpty() ? 0.0 : (double) responseTimeSum / responseTimes.size();
    }

    int activeConnections() {
        return activeConnections.get();
    }

    ConnectionStats snapshot(int poolSize) {
        int active = activeConnections.get();
        return new ConnectionStats(totalRequests.get(), failedRequests.get(), active,
            Math.max(0, poolSize - active), averageResponseTimeMs());
    }

    // In-flight attempts keep their slot in activeConnections until they finish.
    synchronized void reset() {
        totalRequests.set(0);
        failedRequests.set(0);
        responseTimes.clear();
        responseTimeSum = 0;
    }
}
