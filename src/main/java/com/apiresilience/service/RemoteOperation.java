package com.apiresilience.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * One attempt at a remote call. Implementations should stop work when {@code token} is cancelled.
 */
@FunctionalInterface
public interface RemoteOperation<T> {

    CompletionStage<T> execute(CancellationToken token) throws Exception;

    /**
     * Adapts an operation that cannot observe cancellation; on timeout its future is cancelled instead.
     */
    static <T> RemoteOperation<T> of(Supplier<? extends CompletionStage<T>> supplier) {
        return token -> supplier.get();
    }

    static <T> RemoteOperation<T> completed(T value) {
        return token -> CompletableFuture.completedFuture(value);
    }
}
