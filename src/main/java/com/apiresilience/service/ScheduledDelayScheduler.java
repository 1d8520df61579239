package com.apiresilience.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class ScheduledDelayScheduler implements DelayScheduler, AutoCloseable {
    private final ScheduledExecutorService executor;

    public ScheduledDelayScheduler(int threads) {
        AtomicInteger sequence = new AtomicInteger();
        ScheduledThreadPoolExecutor scheduled = new ScheduledThreadPoolExecutor(Math.max(1, threads), runnable -> {
            Thread thread = new Thread(runnable, "resilience-timer-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        scheduled.setRemoveOnCancelPolicy(true);
        this.executor = Executors.unconfigurableScheduledExecutorService(scheduled);
    }

    @Override
    public CompletableFuture<Void> delay(long delayMs) {
        if (delayMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        executor.schedule(() -> future.complete(null), delayMs, TimeUnit.MILLISECONDS);
        return future;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        return executor.schedule(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
