package com.apiresilience.model;

import java.util.Objects;

/**
 * Immutable engine settings. Updates produce a new instance via {@link #merge(ResilienceConfigUpdate)}.
 */
public final class ResilienceConfig {
    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 1_000;
    public static final long DEFAULT_MAX_DELAY_MS = 30_000;
    public static final int DEFAULT_POOL_SIZE = 10;
    public static final boolean DEFAULT_KEEP_ALIVE = true;
    public static final long DEFAULT_KEEP_ALIVE_MS = 60_000;

    private final long timeoutMs;
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int poolSize;
    private final boolean keepAlive;
    private final long keepAliveMs;

    public ResilienceConfig(long timeoutMs, int maxRetries, long baseDelayMs, long maxDelayMs,
                            int poolSize, boolean keepAlive, long keepAliveMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        this.timeoutMs = timeoutMs;
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.poolSize = poolSize;
        this.keepAlive = keepAlive;
        this.keepAliveMs = keepAliveMs;
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(DEFAULT_TIMEOUT_MS, DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY_MS,
            DEFAULT_MAX_DELAY_MS, DEFAULT_POOL_SIZE, DEFAULT_KEEP_ALIVE, DEFAULT_KEEP_ALIVE_MS);
    }

    public ResilienceConfig merge(ResilienceConfigUpdate update) {
        if (update == null) {
            return this;
        }
        return new ResilienceConfig(
            update.getTimeoutMs() != null ? update.getTimeoutMs() : timeoutMs,
            update.getMaxRetries() != null ? update.getMaxRetries() : maxRetries,
            update.getBaseDelayMs() != null ? update.getBaseDelayMs() : baseDelayMs,
            update.getMaxDelayMs() != null ? update.getMaxDelayMs() : maxDelayMs,
            update.getPoolSize() != null ? update.getPoolSize() : poolSize,
            update.getKeepAlive() != null ? update.getKeepAlive() : keepAlive,
            update.getKeepAliveMs() != null ? update.getKeepAliveMs() : keepAliveMs
        );
    }

    /**
     * True when switching to {@code other} requires a new connection pool.
     */
    public boolean poolSettingsDiffer(ResilienceConfig other) {
        return poolSize != other.poolSize
            || keepAlive != other.keepAlive
            || keepAliveMs != other.keepAliveMs
            || timeoutMs != other.timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public long getKeepAliveMs() {
        return keepAliveMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResilienceConfig)) {
            return false;
        }
        ResilienceConfig that = (ResilienceConfig) o;
        return timeoutMs == that.timeoutMs && maxRetries == that.maxRetries && baseDelayMs == that.baseDelayMs
            && maxDelayMs == that.maxDelayMs && poolSize == that.poolSize && keepAlive == that.keepAlive
            && keepAliveMs == that.keepAliveMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeoutMs, maxRetries, baseDelayMs, maxDelayMs, poolSize, keepAlive, keepAliveMs);
    }

    @Override
    public String toString() {
        return "ResilienceConfig{timeoutMs=" + timeoutMs + ", maxRetries=" + maxRetries
            + ", baseDelayMs=" + baseDelayMs + ", maxDelayMs=" + maxDelayMs + ", poolSize=" + poolSize
            + ", keepAlive=" + keepAlive + ", keepAliveMs=" + keepAliveMs + "}";
    }
}
