package com.apiresilience.service;

import com.apiresilience.exception.ClassifiedErrorException;
import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.ErrorType;
import com.apiresilience.model.RateLimitStatistics;
import com.apiresilience.model.RateLimitStatus;
import com.apiresilience.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Per-actor fixed-window throttling plus a retry wrapper that respects it.
 *
 * <p>Each actor has its own {@link RateLimitState} monitor; unrelated actors never contend.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final long DEFAULT_BATCH_DELAY_MS = 100;
    private static final String OPERATION_NAME = "rate_limited_operation";

    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final ErrorClassifier classifier;
    private final DelayScheduler scheduler;
    private final Clock clock;
    private final int limit;
    private final long windowMs;
    private final long defaultRateLimitDelayMs;

    @Autowired
    public RateLimiter(ResilienceProperties properties, ErrorClassifier classifier, DelayScheduler scheduler,
                       Clock clock) {
        this(classifier, scheduler, clock, properties.getRateLimit().getLimit(),
            properties.getRateLimit().getWindow().toMillis(), properties.getRateLimit().getDefaultDelay().toMillis());
    }

    public RateLimiter(ErrorClassifier classifier, DelayScheduler scheduler, Clock clock, int limit, long windowMs,
                       long defaultRateLimitDelayMs) {
        if (limit < 1 || windowMs < 1) {
            throw new IllegalArgumentException("limit and window must be positive");
        }
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.clock = clock;
        this.limit = limit;
        this.windowMs = windowMs;
        this.defaultRateLimitDelayMs = defaultRateLimitDelayMs;
    }

    public boolean checkRateLimit(String actorId) {
        return state(actorId).hasCapacity(now());
    }

    public void recordRequest(String actorId) {
        state(actorId).record(now());
    }

    public boolean tryAcquire(String actorId) {
        return state(actorId).tryAcquire(now());
    }

    /**
     * Current window of {@code actorId}. Unknown actors get a fresh, empty window without being tracked.
     */
    public RateLimitStatus getRateLimitStatus(String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        long now = now();
        RateLimitState existing = states.get(actorId);
        if (existing == null) {
            return new RateLimitStatus(actorId, 0, limit, Instant.ofEpochMilli(now), Instant.ofEpochMilli(now + windowMs));
        }
        return existing.snapshot(now);
    }

    /**
     * Waits out a rate-limit failure: {@code retryAfterSeconds} when the server sent it, the default delay
     * otherwise. Completes immediately for any other error type.
     */
    public CompletableFuture<Void> handleRateLimit(ClassifiedError error) {
        if (error == null || error.getType() != ErrorType.RATE_LIMIT) {
            return CompletableFuture.completedFuture(null);
        }
        long waitMs = error.hasRetryAfter() ? error.getRetryAfterSeconds() * 1000L : defaultRateLimitDelayMs;
        log.info("Rate limit exceeded. Waiting {}ms before retry", waitMs);
        return scheduler.delay(waitMs);
    }

    public <T> CompletableFuture<T> executeWithRetry(RemoteOperation<T> operation) {
        return executeWithRetry(operation, RetryPolicy.defaults(), null);
    }

    public <T> CompletableFuture<T> executeWithRetry(RemoteOperation<T> operation, String actorId) {
        return executeWithRetry(operation, RetryPolicy.defaults(), actorId);
    }

    /**
     * Runs {@code operation}, counting each attempt against {@code actorId} when one is given.
     * Fails with {@link ClassifiedErrorException} once retries are exhausted or the failure is not retryable.
     */
    public <T> CompletableFuture<T> executeWithRetry(RemoteOperation<T> operation, RetryPolicy policy, String actorId) {
        RetryPolicy effective = policy != null ? policy : RetryPolicy.defaults();
        CompletableFuture<T> result = new CompletableFuture<>();
        runAttempt(operation, effective, actorId, 1, result);
        return result;
    }

    private <T> void runAttempt(RemoteOperation<T> operation, RetryPolicy policy, String actorId, int attempt,
                                CompletableFuture<T> result) {
        if (actorId != null) {
            RateLimitState state = state(actorId);
            long now = now();
            if (!state.tryAcquire(now)) {
                handleFailure(operation, policy, actorId, attempt, localLimitError(actorId, state.millisUntilReset(now)),
                    result);
                return;
            }
        }

        invoke(operation).whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(value);
            } else {
                handleFailure(operation, policy, actorId, attempt, classify(failure), result);
            }
        });
    }

    private <T> void handleFailure(RemoteOperation<T> operation, RetryPolicy policy, String actorId, int attempt,
                                   ClassifiedError error, CompletableFuture<T> result) {
        if (!shouldRetry(error, policy)) {
            log.debug("Not retrying {} error: {}", error.getType().getValue(), error.getMessage());
            result.completeExceptionally(new ClassifiedErrorException(error));
            return;
        }
        if (attempt > policy.getMaxRetries()) {
            log.warn("Giving up after {} attempts: {}", attempt, error.getMessage());
            result.completeExceptionally(new ClassifiedErrorException(error));
            return;
        }

        CompletableFuture<Void> pause;
        try {
            if (error.getType() == ErrorType.RATE_LIMIT) {
                pause = handleRateLimit(error);
            } else {
                long delayMs = calculateBackoffDelay(attempt, policy);
                log.info("Retrying in {}ms (attempt {}/{}): {}", delayMs, attempt, policy.getMaxRetries() + 1,
                    error.getMessage());
                pause = scheduler.delay(delayMs);
            }
        } catch (RuntimeException ex) {
            log.warn("Could not schedule retry: {}", ex.toString());
            result.completeExceptionally(new ClassifiedErrorException(error));
            return;
        }

        pause.whenComplete((ignored, pauseFailure) -> {
            if (pauseFailure != null) {
                result.completeExceptionally(new ClassifiedErrorException(error));
            } else {
                runAttempt(operation, policy, actorId, attempt + 1, result);
            }
        });
    }

    /**
     * A failure is retried when its type is listed in the policy and the classifier marked it retryable.
     * API errors are only retried for 5xx codes.
     */
    public boolean shouldRetry(ClassifiedError error, RetryPolicy policy) {
        if (!error.isRetryable() || !policy.getRetryableErrorTypes().contains(error.getType())) {
            return false;
        }
        if (error.getType() == ErrorType.API_ERROR) {
            return error.getCode() >= 500 && error.getCode() < 600;
        }
        return true;
    }

    public long calculateBackoffDelay(int attempt, RetryPolicy policy) {
        double exponential = policy.getBaseDelayMs() * Math.pow(policy.getBackoffMultiplier(), Math.max(0, attempt - 1));
        double jitter = ThreadLocalRandom.current().nextDouble() * 0.1;
        return (long) Math.min(exponential * (1 + jitter), policy.getMaxDelayMs());
    }

    public <T> CompletableFuture<List<T>> executeBatch(List<? extends RemoteOperation<T>> operations, RetryPolicy policy,
                                                       String actorId) {
        return executeBatch(operations, policy, actorId, DEFAULT_BATCH_DELAY_MS);
    }

    /**
     * Runs the operations one after another, pausing {@code batchDelayMs} between them. Results keep the input
     * order; the first terminal failure fails the whole batch.
     */
    public <T> CompletableFuture<List<T>> executeBatch(List<? extends RemoteOperation<T>> operations, RetryPolicy policy,
                                                       String actorId, long batchDelayMs) {
        CompletableFuture<List<T>> chain = CompletableFuture.completedFuture(new ArrayList<>(operations.size()));
        for (int i = 0; i < operations.size(); i++) {
            RemoteOperation<T> operation = operations.get(i);
            boolean pauseFirst = i > 0;
            chain = chain.thenCompose(results -> {
                CompletableFuture<Void> pause = pauseFirst
                    ? scheduler.delay(batchDelayMs)
                    : CompletableFuture.completedFuture(null);
                return pause
                    .thenCompose(ignored -> executeWithRetry(operation, policy, actorId))
                    .thenApply(value -> {
                        results.add(value);
                        return results;
                    });
            });
        }
        return chain.thenApply(Collections::unmodifiableList);
    }

    /**
     * Wraps {@code function} so every call goes through {@link #executeWithRetry(RemoteOperation, RetryPolicy, String)}.
     */
    public <A, R> Function<A, CompletableFuture<R>> rateLimited(Function<A, ? extends CompletionStage<R>> function,
                                                                RetryPolicy policy, String actorId) {
        return argument -> executeWithRetry(token -> function.apply(argument), policy, actorId);
    }

    public void resetRateLimit(String actorId) {
        if (states.remove(actorId) != null) {
            log.info("Rate limit reset for actor {}", actorId);
        }
    }

    public void clearAllRateLimits() {
        states.clear();
        log.info("All rate limits cleared");
    }

    public RateLimitStatistics getStatistics() {
        long now = now();
        long totalRequests = 0;
        int activeUsers = 0;
        int totalUsers = 0;
        for (RateLimitState state : states.values()) {
            totalUsers++;
            totalRequests += state.effectiveCount(now);
            if (state.isActive(now)) {
                activeUsers++;
            }
        }
        return new RateLimitStatistics(totalUsers, totalRequests, activeUsers);
    }

    public int getLimit() {
        return limit;
    }

    public long getWindowMs() {
        return windowMs;
    }

    private ClassifiedError classify(Throwable failure) {
        Throwable cause = ErrorClassifier.unwrap(failure);
        if (cause instanceof ClassifiedErrorException) {
            return ((ClassifiedErrorException) cause).getError();
        }
        return classifier.classify(cause, OPERATION_NAME);
    }

    private ClassifiedError localLimitError(String actorId, long millisUntilReset) {
        int retryAfterSeconds = (int) Math.max(1, (millisUntilReset + 999) / 1000);
        return ClassifiedError.builder(ErrorType.RATE_LIMIT)
            .code(429)
            .message("Rate limit exceeded for " + actorId + " - " + limit + " requests per window used. Retry after "
                + retryAfterSeconds + " seconds")
            .retryable(true)
            .retryAfterSeconds(retryAfterSeconds)
            .detail("actorId", actorId)
            .detail("limit", limit)
            .build();
    }

    private static <T> CompletableFuture<T> invoke(RemoteOperation<T> operation) {
        try {
            CompletionStage<T> stage = operation.execute(CancellationToken.none());
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operation returned no result"));
            }
            return stage.toCompletableFuture();
        } catch (Exception ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private RateLimitState state(String actorId) {
        Objects.requireNonNull(actorId, "actorId");
        return states.computeIfAbsent(actorId, id -> new RateLimitState(id, limit, windowMs, now()));
    }

    private long now() {
        return clock.millis();
    }
}
