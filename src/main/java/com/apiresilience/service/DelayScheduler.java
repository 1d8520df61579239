package com.apiresilience.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Timer facility for backoff waits and attempt timeouts. Waits are scheduled continuations, never blocked threads.
 */
public interface DelayScheduler {

    /**
     * Completes after {@code delayMs}. A non-positive delay completes immediately.
     */
    CompletableFuture<Void> delay(long delayMs);

    ScheduledFuture<?> schedule(Runnable task, long delayMs);
}
