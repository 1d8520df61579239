package com.apiresilience.model;

public class ConnectionStats {
    private final long totalRequests;
    private final long failedRequests;
    private final int activeConnections;
    private final int idleConnections;
    private final double averageResponseTimeMs;

    public ConnectionStats(long totalRequests, long failedRequests, int activeConnections,
                           int idleConnections, double averageResponseTimeMs) {
        this.totalRequests = totalRequests;
        this.failedRequests = failedRequests;
        this.activeConnections = activeConnections;
        this.idleConnections = idleConnections;
        this.averageResponseTimeMs = averageResponseTimeMs;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public long getFailedRequests() {
        return failedRequests;
    }

    public int getActiveConnections() {
        return activeConnections;
    }

    public int getIdleConnections() {
        return idleConnections;
    }

    public double getAverageResponseTimeMs() {
        return averageResponseTimeMs;
    }
}
