package com.apiresilience.transport;

import com.apiresilience.model.ResilienceConfig;
import com.apiresilience.service.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared HTTP transport. At most {@code poolSize} exchanges are in flight; further requests queue until a slot
 * frees up, without blocking the caller.
 */
public class PooledHttpTransport implements HttpTransport, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PooledHttpTransport.class);
    private static final String KEEP_ALIVE_PROPERTY = "jdk.httpclient.keepalive.timeout";
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ResilienceConfig config;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final Semaphore permits;
    private final Queue<PendingExchange> pending = new ConcurrentLinkedQueue<>();
    private volatile boolean closed;

    public PooledHttpTransport(ResilienceConfig config) {
        this.config = config;
        configureKeepAlive(config);
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.getPoolSize(), runnable -> {
            Thread thread = new Thread(runnable, "resilience-http-" + poolId + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofMillis(config.getTimeoutMs()))
            .executor(executor)
            .build();
        this.permits = new Semaphore(config.getPoolSize());
    }

    @Override
    public CompletableFuture<HttpResponseData> send(ApiRequest request, CancellationToken token) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport has been closed"));
        }
        CompletableFuture<HttpResponseData> result = new CompletableFuture<>();
        token.onCancel(() -> result.completeExceptionally(new CancellationException(token.getReason())));
        pending.add(new PendingExchange(request, token, result));
        drain();
        return result;
    }

    public int getPoolSize() {
        return config.getPoolSize();
    }

    public int getActiveExchanges() {
        return config.getPoolSize() - permits.availablePermits();
    }

    public int getQueuedExchanges() {
        return pending.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        PendingExchange queued;
        while ((queued = pending.poll()) != null) {
            queued.result.completeExceptionally(new CancellationException("Transport has been closed"));
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void startExchange(ApiRequest request, CancellationToken token, CompletableFuture<HttpResponseData> result) {
        if (closed || token.isCancelled() || result.isDone()) {
            result.completeExceptionally(new CancellationException(closed ? "Transport has been closed" : token.getReason()));
            release();
            return;
        }

        Instant start = Instant.now();
        CompletableFuture<HttpResponse<String>> exchange;
        try {
            exchange = httpClient.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException ex) {
            log.debug("Rejected request to {}: {}", request.getUrl(), ex.toString());
            result.completeExceptionally(ex);
            release();
            return;
        }
        token.onCancel(() -> exchange.cancel(true));
        exchange.whenComplete((response, ex) -> {
            release();
            if (ex != null) {
                result.completeExceptionally(ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex);
                return;
            }
            Duration duration = Duration.between(start, Instant.now());
            HttpResponseData data = new HttpResponseData(response.statusCode(), response.body(),
                response.headers().map(), duration);
            if (data.isError()) {
                result.completeExceptionally(new ApiResponseException(data));
            } else {
                result.complete(data);
            }
        });
    }

    private HttpRequest buildRequest(ApiRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(request.getUrl()))
            .timeout(request.getTimeout() != null ? request.getTimeout() : Duration.ofMillis(config.getTimeoutMs()));

        if (request.getContentType() != null && !request.getContentType().isBlank()) {
            builder.header("Content-Type", request.getContentType());
        }
        for (Map.Entry<String, String> entry : request.getHeaders().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        Optional<String> body = Optional.ofNullable(request.getBody());
        HttpRequest.BodyPublisher publisher = body.map(HttpRequest.BodyPublishers::ofString)
            .orElseGet(HttpRequest.BodyPublishers::noBody);
        switch (request.getMethod()) {
            case HEAD:
                builder.method("HEAD", HttpRequest.BodyPublishers.noBody());
                break;
            case POST:
                builder.POST(publisher);
                break;
            case PUT:
                builder.PUT(publisher);
                break;
            case PATCH:
                builder.method("PATCH", publisher);
                break;
            case DELETE:
                if (body.isPresent()) {
                    builder.method("DELETE", publisher);
                } else {
                    builder.DELETE();
                }
                break;
            default:
                builder.GET();
        }
        return builder.build();
    }

    private void drain() {
        while (!pending.isEmpty() && permits.tryAcquire()) {
            PendingExchange next = pending.poll();
            if (next == null) {
                permits.release();
            } else {
                startExchange(next.request, next.token, next.result);
            }
        }
    }

    private void release() {
        permits.release();
        if (!closed) {
            drain();
        }
    }

    // The JDK client reads its idle timeout once per process, so only the first pool's setting applies.
    private static void configureKeepAlive(ResilienceConfig config) {
        if (System.getProperty(KEEP_ALIVE_PROPERTY) != null) {
            return;
        }
        long seconds = config.isKeepAlive() ? Math.max(1, TimeUnit.MILLISECONDS.toSeconds(config.getKeepAliveMs())) : 1;
        System.setProperty(KEEP_ALIVE_PROPERTY, Long.toString(seconds));
        log.debug("HTTP keep-alive timeout set to {}s", seconds);
    }

    private static final class PendingExchange {
        private final ApiRequest request;
        private final CancellationToken token;
        private final CompletableFuture<HttpResponseData> result;

        private PendingExchange(ApiRequest request, CancellationToken token, CompletableFuture<HttpResponseData> result) {
            this.request = request;
            this.token = token;
            this.result = result;
        }
    }
}
