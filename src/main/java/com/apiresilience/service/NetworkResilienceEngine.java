package com.apiresilience.service;

import com.apiresilience.exception.RequestValidationException;
import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.ConnectionStats;
import com.apiresilience.model.FailurePattern;
import com.apiresilience.model.HealthCheckResult;
import com.apiresilience.model.OperationResult;
import com.apiresilience.model.ResilienceConfig;
import com.apiresilience.model.ResilienceConfigUpdate;
import com.apiresilience.transport.HttpTransport;
import com.apiresilience.transport.PooledHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs remote operations with a per-attempt timeout, classified failures and exponential backoff, on top of a
 * shared {@link PooledHttpTransport}.
 *
 * <p>Backoff waits go through the {@link DelayScheduler}; no thread is parked between attempts. A timed-out attempt
 * cancels the {@link CancellationToken} it was given, which aborts in-flight exchanges on the pooled transport.
 */
public class NetworkResilienceEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NetworkResilienceEngine.class);

    public static final String DEFAULT_LABEL = "network_operation";
    private static final int LOOKUP_THREADS = 2;

    private final ErrorClassifier classifier;
    private final DelayScheduler scheduler;
    private final HostResolver hostResolver;
    private final String healthCheckHost;
    private final FailurePatternDetector patternDetector = new FailurePatternDetector();
    private final ConnectionStatsTracker stats = new ConnectionStatsTracker();
    private final HttpTransport transportHandle = (request, token) -> currentTransport().send(request, token);
    private final ExecutorService lookupExecutor = newLookupExecutor();

    private final Object configLock = new Object();
    private volatile ResilienceConfig config;
    private volatile PooledHttpTransport transport;
    private volatile boolean shutdown;

    public NetworkResilienceEngine(ResilienceConfig config, ErrorClassifier classifier, DelayScheduler scheduler,
                                   HostResolver hostResolver, String healthCheckHost) {
        this.config = config != null ? config : ResilienceConfig.defaults();
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.hostResolver = hostResolver;
        this.healthCheckHost = healthCheckHost;
        this.transport = new PooledHttpTransport(this.config);
    }

    public <T> CompletableFuture<OperationResult<T>> executeWithRetry(RemoteOperation<T> operation, String label) {
        return executeWithRetry(operation, label, null);
    }

    /**
     * Runs {@code operation} until it succeeds, fails with a non-retryable error, or exhausts
     * {@code maxRetries + 1} attempts. The returned future never completes exceptionally.
     *
     * @param overrides per-call settings layered over the engine config, may be null
     */
    public <T> CompletableFuture<OperationResult<T>> executeWithRetry(RemoteOperation<T> operation, String label,
                                                                     ResilienceConfigUpdate overrides) {
        String operationName = label == null || label.isBlank() ? DEFAULT_LABEL : label;
        long startNanos = System.nanoTime();
        CompletableFuture<OperationResult<T>> result = new CompletableFuture<>();

        ResilienceConfig effective;
        try {
            effective = config.merge(overrides);
        } catch (IllegalArgumentException ex) {
            ClassifiedError error = classifier.classify(new RequestValidationException(ex.getMessage()), operationName);
            result.complete(OperationResult.failure(error, 0, elapsedMs(startNanos)));
            return result;
        }
        if (shutdown) {
            IllegalStateException closed = new IllegalStateException("Resilience engine has been shut down");
            result.complete(OperationResult.failure(classifier.classify(closed, operationName), 0, elapsedMs(startNanos)));
            return result;
        }

        runAttempt(operation, operationName, effective, 1, startNanos, result);
        return result;
    }

    private <T> void runAttempt(RemoteOperation<T> operation, String operationName, ResilienceConfig effective,
                                int attempt, long startNanos, CompletableFuture<OperationResult<T>> result) {
        executeWithTimeout(operation, effective.getTimeoutMs()).whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(OperationResult.success(value, attempt, elapsedMs(startNanos)));
                return;
            }

            ClassifiedError error = classifier.classify(failure, operationName);
            if (!error.isRetryable()) {
                log.debug("{} failed with non-retryable {} error: {}", operationName, error.getType().getValue(),
                    error.getMessage());
                result.complete(OperationResult.failure(error, attempt, elapsedMs(startNanos)));
                return;
            }
            if (attempt > effective.getMaxRetries()) {
                log.warn("{} failed after {} attempts: {}", operationName, attempt, error.getMessage());
                result.complete(OperationResult.failure(error, attempt, elapsedMs(startNanos)));
                return;
            }

            long delayMs = calculateRetryDelay(attempt, error, effective);
            log.info("{} attempt {}/{} failed ({}), retrying in {}ms", operationName, attempt,
                effective.getMaxRetries() + 1, error.getMessage(), delayMs);
            try {
                scheduler.delay(delayMs).whenComplete((ignored, delayFailure) -> {
                    if (delayFailure != null) {
                        result.complete(OperationResult.failure(error, attempt, elapsedMs(startNanos)));
                    } else {
                        runAttempt(operation, operationName, effective, attempt + 1, startNanos, result);
                    }
                });
            } catch (RuntimeException ex) {
                log.warn("Could not schedule retry of {}: {}", operationName, ex.toString());
                result.complete(OperationResult.failure(error, attempt, elapsedMs(startNanos)));
            }
        });
    }

    /**
     * One attempt: the operation races a timer of {@code timeoutMs}. The stats slot taken at the start is
     * released exactly once, whichever side wins.
     */
    private <T> CompletableFuture<T> executeWithTimeout(RemoteOperation<T> operation, long timeoutMs) {
        stats.attemptStarted();
        long attemptStart = System.nanoTime();
        CancellationToken token = new CancellationToken();
        CompletableFuture<T> attempt = new CompletableFuture<>();

        CompletableFuture<T> finished = attempt.whenComplete((value, failure) -> {
            if (failure == null) {
                stats.recordResponseTime(elapsedMs(attemptStart));
            }
            stats.attemptFinished(failure != null);
        });

        CompletableFuture<T> operationFuture = invoke(operation, token);
        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(() -> {
                if (attempt.completeExceptionally(new AttemptTimeoutException(timeoutMs))) {
                    token.cancel("Operation timed out after " + timeoutMs + "ms");
                    operationFuture.cancel(true);
                }
            }, timeoutMs);
        } catch (RuntimeException ex) {
            attempt.completeExceptionally(ex);
            token.cancel("Timeout could not be scheduled");
            return finished;
        }

        operationFuture.whenComplete((value, failure) -> {
            timer.cancel(false);
            if (failure == null) {
                attempt.complete(value);
            } else {
                attempt.completeExceptionally(ErrorClassifier.unwrap(failure));
            }
        });
        return finished;
    }

    private static <T> CompletableFuture<T> invoke(RemoteOperation<T> operation, CancellationToken token) {
        try {
            CompletionStage<T> stage = operation.execute(token);
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operation returned no result"));
            }
            return stage.toCompletableFuture();
        } catch (Exception ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    public long calculateRetryDelay(int attempt, ClassifiedError error) {
        return calculateRetryDelay(attempt, error, config);
    }

    /**
     * Server-provided {@code retryAfterSeconds} wins. Otherwise {@code baseDelay * 2^(attempt-1)} plus up to 10%
     * jitter, capped at {@code maxDelay}.
     */
    public long calculateRetryDelay(int attempt, ClassifiedError error, ResilienceConfig effective) {
        if (error != null && error.hasRetryAfter()) {
            return error.getRetryAfterSeconds() * 1000L;
        }
        double exponential = effective.getBaseDelayMs() * Math.pow(2, Math.max(0, attempt - 1));
        double jitter = ThreadLocalRandom.current().nextDouble() * 0.1;
        return (long) Math.min(exponential * (1 + jitter), effective.getMaxDelayMs());
    }

    /**
     * Stable handle on the pooled transport. Keeps working across pool recreation by {@link #updateConfig}.
     */
    public HttpTransport getTransport() {
        return transportHandle;
    }

    public ConnectionStats getConnectionStats() {
        return stats.snapshot(config.getPoolSize());
    }

    public void resetConnectionStats() {
        stats.reset();
        log.info("Connection statistics reset");
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    public ResilienceConfig updateConfig(ResilienceConfigUpdate update) {
        synchronized (configLock) {
            ResilienceConfig previous = config;
            ResilienceConfig next = previous.merge(update);
            if (next.poolSettingsDiffer(previous) && !shutdown) {
                PooledHttpTransport old = transport;
                transport = new PooledHttpTransport(next);
                old.close();
                log.info("Connection pool recreated: poolSize={}, keepAlive={}, keepAliveMs={}, timeoutMs={}",
                    next.getPoolSize(), next.isKeepAlive(), next.getKeepAliveMs(), next.getTimeoutMs());
            }
            config = next;
            log.info("Resilience config updated: {}", next);
            return next;
        }
    }

    /**
     * Resolves the health-check host within {@code timeoutMs} on a dedicated lookup pool, apart from the HTTP
     * workers. Always completes normally.
     */
    public CompletableFuture<HealthCheckResult> performHealthCheck() {
        long startNanos = System.nanoTime();
        long timeoutMs = config.getTimeoutMs();

        CompletableFuture<InetAddress[]> lookup;
        try {
            lookup = CompletableFuture.supplyAsync(this::resolveHealthCheckHost, lookupExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException ex) {
            lookup = CompletableFuture.failedFuture(ex);
        }

        return lookup.handle((addresses, failure) -> {
            HealthCheckResult result = new HealthCheckResult();
            result.setHost(healthCheckHost);
            result.setLatencyMs(elapsedMs(startNanos));
            result.setTimestamp(Instant.now());
            if (failure == null) {
                result.setHealthy(true);
                result.setDetails("Network health check passed. Resolved " + healthCheckHost + " to "
                    + addresses.length + " address(es) in " + result.getLatencyMs() + "ms");
            } else {
                Throwable cause = ErrorClassifier.unwrap(failure);
                String reason = cause instanceof TimeoutException
                    ? "lookup timed out after " + timeoutMs + "ms"
                    : String.valueOf(cause.getMessage());
                result.setHealthy(false);
                result.setDetails("Network health check failed: " + reason);
                log.warn("Network health check against {} failed: {}", healthCheckHost, reason);
            }
            return result;
        });
    }

    private InetAddress[] resolveHealthCheckHost() {
        try {
            return hostResolver.resolve(healthCheckHost);
        } catch (UnknownHostException ex) {
            throw new CompletionException(ex);
        }
    }

    public FailurePattern detectFailurePattern(List<ClassifiedError> errorHistory) {
        return patternDetector.detect(errorHistory);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Closes the pool and clears statistics. Further executions fail fast.
     */
    public void shutdown() {
        synchronized (configLock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            transport.close();
            lookupExecutor.shutdownNow();
            stats.reset();
        }
        log.info("Network resilience engine shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    private PooledHttpTransport currentTransport() {
        return transport;
    }

    private static ExecutorService newLookupExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(LOOKUP_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "resilience-lookup-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
