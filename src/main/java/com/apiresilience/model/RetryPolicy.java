package com.apiresilience.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Retry settings for actor-scoped calls made through the rate limiter.
 */
public final class RetryPolicy {
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double backoffMultiplier;
    private final Set<ErrorType> retryableErrorTypes;

    public RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs, double backoffMultiplier,
                       Set<ErrorType> retryableErrorTypes) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1");
        }
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.backoffMultiplier = backoffMultiplier;
        this.retryableErrorTypes = retryableErrorTypes.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(retryableErrorTypes));
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1_000, 30_000, 2.0,
            EnumSet.of(ErrorType.RATE_LIMIT, ErrorType.NETWORK, ErrorType.API_ERROR));
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableErrorTypes);
    }

    public RetryPolicy withDelays(long baseDelayMs, long maxDelayMs) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableErrorTypes);
    }

    public RetryPolicy withRetryableErrorTypes(Set<ErrorType> retryableErrorTypes) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, retryableErrorTypes);
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

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Set<ErrorType> getRetryableErrorTypes() {
        return retryableErrorTypes;
    }
}
