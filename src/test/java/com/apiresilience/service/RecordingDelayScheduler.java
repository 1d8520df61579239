package com.apiresilience.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Records requested delays and completes them at once. Timers still run on a real scheduler.
 */
public class RecordingDelayScheduler implements DelayScheduler, AutoCloseable {
    private final List<Long> delays = new CopyOnWriteArrayList<>();
    private final ScheduledDelayScheduler timers = new ScheduledDelayScheduler(1);

    @Override
    public CompletableFuture<Void> delay(long delayMs) {
        delays.add(delayMs);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        return timers.schedule(task, delayMs);
    }

    public List<Long> getDelays() {
        return delays;
    }

    @Override
    public void close() {
        timers.close();
    }
}
