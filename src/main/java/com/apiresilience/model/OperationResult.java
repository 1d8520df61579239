package com.apiresilience.model;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Outcome of a retried operation: either the value or the last classified error, never both.
 */
public final class OperationResult<T> {
    private final boolean success;
    private final T data;
    private final ClassifiedError error;
    private final int attempts;
    private final long totalTimeMs;

    private OperationResult(boolean success, T data, ClassifiedError error, int attempts, long totalTimeMs) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.attempts = attempts;
        this.totalTimeMs = totalTimeMs;
    }

    public static <T> OperationResult<T> success(T data, int attempts, long totalTimeMs) {
        return new OperationResult<>(true, data, null, attempts, totalTimeMs);
    }

    public static <T> OperationResult<T> failure(ClassifiedError error, int attempts, long totalTimeMs) {
        if (error == null) {
            throw new IllegalArgumentException("failure requires an error");
        }
        return new OperationResult<>(false, null, error, attempts, totalTimeMs);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        if (!success) {
            throw new NoSuchElementException("operation failed: " + error.getMessage());
        }
        return data;
    }

    public ClassifiedError getError() {
        if (success) {
            throw new NoSuchElementException("operation succeeded");
        }
        return error;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getTotalTimeMs() {
        return totalTimeMs;
    }

    public T orElseThrow(Function<ClassifiedError, ? extends RuntimeException> exceptionMapper) {
        if (success) {
            return data;
        }
        throw exceptionMapper.apply(error);
    }
}
