package com.apiresilience.service;

import com.apiresilience.exception.ClassifiedErrorException;
import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.ErrorType;
import com.apiresilience.model.RateLimitStatistics;
import com.apiresilience.model.RateLimitStatus;
import com.apiresilience.model.RetryPolicy;
import com.apiresilience.transport.ApiResponseException;
import com.apiresilience.transport.HttpResponseData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RateLimiterTest {
    private static final long WINDOW_MS = Duration.ofHours(1).toMillis();

    private MutableClock clock;
    private RecordingDelayScheduler scheduler;
    private RateLimiter rateLimiter;
    private RetryPolicy fastPolicy;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        scheduler = new RecordingDelayScheduler();
        rateLimiter = new RateLimiter(new ErrorClassifier(), scheduler, clock, 1000, WINDOW_MS, 60_000);
        fastPolicy = RetryPolicy.defaults().withDelays(10, 100);
    }

    @AfterEach
    void teardown() {
        scheduler.close();
    }

    @Test
    void windowFillsAndResets() {
        for (int i = 0; i < 1000; i++) {
            assertThat(rateLimiter.checkRateLimit("alice")).isTrue();
            rateLimiter.recordRequest("alice");
        }

        assertThat(rateLimiter.checkRateLimit("alice")).isFalse();
        assertThat(rateLimiter.checkRateLimit("bob")).isTrue();

        clock.advance(Duration.ofMillis(WINDOW_MS));

        assertThat(rateLimiter.checkRateLimit("alice")).isTrue();
        assertThat(rateLimiter.getRateLimitStatus("alice").getRequestCount()).isZero();
    }

    @Test
    void tryAcquireStopsAtTheLimit() {
        RateLimiter small = new RateLimiter(new ErrorClassifier(), scheduler, clock, 2, WINDOW_MS, 60_000);

        assertThat(small.tryAcquire("alice")).isTrue();
        assertThat(small.tryAcquire("alice")).isTrue();
        assertThat(small.tryAcquire("alice")).isFalse();
        assertThat(small.getRateLimitStatus("alice").getRequestCount()).isEqualTo(2);
    }

    @Test
    void statusOfUnknownActorIsEmptyAndUntracked() {
        RateLimitStatus status = rateLimiter.getRateLimitStatus("nobody");

        assertThat(status.getRequestCount()).isZero();
        assertThat(status.getRemaining()).isEqualTo(1000);
        assertThat(status.getResetTime()).isEqualTo(clock.instant().plusMillis(WINDOW_MS));
        assertThat(rateLimiter.getStatistics().getTotalUsers()).isZero();
    }

    @Test
    void statisticsAggregateActors() {
        rateLimiter.recordRequest("alice");
        rateLimiter.recordRequest("alice");
        clock.advance(Duration.ofMinutes(30));
        rateLimiter.recordRequest("bob");
        clock.advance(Duration.ofMinutes(31));

        RateLimitStatistics statistics = rateLimiter.getStatistics();

        assertThat(statistics.getTotalUsers()).isEqualTo(2);
        assertThat(statistics.getActiveUsers()).isEqualTo(1);
        assertThat(statistics.getTotalRequests()).isEqualTo(1);
    }

    @Test
    void resetAndClear() {
        rateLimiter.recordRequest("alice");
        rateLimiter.recordRequest("bob");

        rateLimiter.resetRateLimit("alice");
        assertThat(rateLimiter.getStatistics().getTotalUsers()).isEqualTo(1);

        rateLimiter.clearAllRateLimits();
        assertThat(rateLimiter.getStatistics().getTotalUsers()).isZero();
    }

    @Test
    void handleRateLimitWaitsForRetryAfter() throws Exception {
        ClassifiedError limited = ClassifiedError.builder(ErrorType.RATE_LIMIT).retryable(true).retryAfterSeconds(5).build();
        ClassifiedError withoutHint = ClassifiedError.builder(ErrorType.RATE_LIMIT).retryable(true).build();
        ClassifiedError network = ClassifiedError.builder(ErrorType.NETWORK).retryable(true).build();

        rateLimiter.handleRateLimit(limited).get(1, TimeUnit.SECONDS);
        rateLimiter.handleRateLimit(withoutHint).get(1, TimeUnit.SECONDS);
        rateLimiter.handleRateLimit(network).get(1, TimeUnit.SECONDS);

        assertThat(scheduler.getDelays()).containsExactly(5000L, 60_000L);
    }

    @Test
    void retriesTransientFailures() throws Exception {
        ScriptedOperation<String> operation = new ScriptedOperation<>("done")
            .thenFail(new ConnectException("Connection refused"))
            .thenFail(new ConnectException("Connection refused"));

        String result = rateLimiter.executeWithRetry(operation, fastPolicy, "alice").get(1, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("done");
        assertThat(operation.getInvocations()).isEqualTo(3);
        assertThat(scheduler.getDelays()).hasSize(2);
        assertThat(rateLimiter.getRateLimitStatus("alice").getRequestCount()).isEqualTo(3);
    }

    @Test
    void rateLimitResponsesWaitForRetryAfter() throws Exception {
        HttpResponseData tooMany = new HttpResponseData(429, "", Map.of("retry-after", List.of("2")), Duration.ZERO);
        ScriptedOperation<String> operation = new ScriptedOperation<>("done").thenFail(new ApiResponseException(tooMany));

        String result = rateLimiter.executeWithRetry(operation, fastPolicy, null).get(1, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("done");
        assertThat(scheduler.getDelays()).containsExactly(2000L);
    }

    @Test
    void clientErrorsAreNotRetried() {
        HttpResponseData notFound = new HttpResponseData(404, "", Map.of(), Duration.ZERO);
        ScriptedOperation<String> operation = new ScriptedOperation<>("done").thenFail(new ApiResponseException(notFound));

        CompletableFuture<String> result = rateLimiter.executeWithRetry(operation, fastPolicy, null);

        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ClassifiedErrorException.class);
        assertThat(operation.getInvocations()).isEqualTo(1);
    }

    @Test
    void givesUpAfterMaxRetries() {
        ScriptedOperation<String> operation = new ScriptedOperation<>("done");
        for (int i = 0; i < 5; i++) {
            operation.thenFail(new ConnectException("Connection refused"));
        }

        CompletableFuture<String> result = rateLimiter.executeWithRetry(operation, fastPolicy.withMaxRetries(2), null);

        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
            .hasCauseInstanceOf(ClassifiedErrorException.class);
        assertThat(operation.getInvocations()).isEqualTo(3);
    }

    @Test
    void exhaustedActorWaitsForWindowReset() throws Exception {
        RateLimiter small = new RateLimiter(new ErrorClassifier(), scheduler, clock, 1, WINDOW_MS, 60_000);
        small.recordRequest("alice");
        // recorded pauses complete without moving the clock, so the window stays full
        ScriptedOperation<String> operation = new ScriptedOperation<>("done");

        CompletableFuture<String> result = small.executeWithRetry(operation, fastPolicy.withMaxRetries(1), "alice");

        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
            .hasCauseInstanceOf(ClassifiedErrorException.class);
        assertThat(operation.getInvocations()).isZero();
        assertThat(scheduler.getDelays()).containsExactly(3_600_000L);
    }

    @Test
    void backoffGrowsWithMultiplier() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(rateLimiter.calculateBackoffDelay(1, policy)).isBetween(1000L, 1100L);
        assertThat(rateLimiter.calculateBackoffDelay(2, policy)).isBetween(2000L, 2200L);
        assertThat(rateLimiter.calculateBackoffDelay(10, policy)).isEqualTo(30_000L);
    }

    @Test
    void batchRunsInOrderWithPauses() throws Exception {
        List<RemoteOperation<Integer>> operations = List.of(
            RemoteOperation.completed(1), RemoteOperation.completed(2), RemoteOperation.completed(3));

        List<Integer> results = rateLimiter.executeBatch(operations, fastPolicy, "alice").get(1, TimeUnit.SECONDS);

        assertThat(results).containsExactly(1, 2, 3);
        assertThat(scheduler.getDelays()).containsExactly(100L, 100L);
        assertThat(rateLimiter.getRateLimitStatus("alice").getRequestCount()).isEqualTo(3);
    }

    @Test
    void batchFailsOnFirstTerminalError() {
        HttpResponseData forbidden = new HttpResponseData(403, "", Map.of(), Duration.ZERO);
        ScriptedOperation<Integer> second = new ScriptedOperation<>(2).thenFail(new ApiResponseException(forbidden));
        ScriptedOperation<Integer> third = new ScriptedOperation<>(3);

        CompletableFuture<List<Integer>> result =
            rateLimiter.executeBatch(List.of(RemoteOperation.completed(1), second, third), fastPolicy, null, 0);

        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
            .hasCauseInstanceOf(ClassifiedErrorException.class);
        assertThat(third.getInvocations()).isZero();
    }

    @Test
    void rateLimitedWrapsAFunction() throws Exception {
        Function<String, CompletableFuture<Integer>> wrapped = rateLimiter.rateLimited(
            text -> CompletableFuture.completedFuture(text.length()), fastPolicy, "alice");

        assertThat(wrapped.apply("hello").get(1, TimeUnit.SECONDS)).isEqualTo(5);
        assertThat(rateLimiter.getRateLimitStatus("alice").getRequestCount()).isEqualTo(1);
    }
}
