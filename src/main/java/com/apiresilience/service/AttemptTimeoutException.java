package com.apiresilience.service;

import java.util.concurrent.TimeoutException;

public class AttemptTimeoutException extends TimeoutException {
    private final long timeoutMs;

    public AttemptTimeoutException(long timeoutMs) {
        super("Operation timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
