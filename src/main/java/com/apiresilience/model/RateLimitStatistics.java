package com.apiresilience.model;

public class RateLimitStatistics {
    private final int totalUsers;
    private final long totalRequests;
    private final int activeUsers;

    public RateLimitStatistics(int totalUsers, long totalRequests, int activeUsers) {
        this.totalUsers = totalUsers;
        this.totalRequests = totalRequests;
        this.activeUsers = activeUsers;
    }

    public int getTotalUsers() {
        return totalUsers;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public int getActiveUsers() {
        return activeUsers;
    }
}
