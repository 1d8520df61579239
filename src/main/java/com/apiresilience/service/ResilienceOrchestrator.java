package com.apiresilience.service;

import com.apiresilience.exception.ApiOperationException;
import com.apiresilience.exception.RequestValidationException;
import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.ConnectionStats;
import com.apiresilience.model.ErrorType;
import com.apiresilience.model.FailurePattern;
import com.apiresilience.model.HealthCheckResult;
import com.apiresilience.model.OperationResult;
import com.apiresilience.model.ResilienceConfig;
import com.apiresilience.model.ResilienceConfigUpdate;
import com.apiresilience.transport.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers: runs operations through the engine and turns terminal failures into
 * {@link ApiOperationException}s with a formatted message and troubleshooting text.
 */
@Service
public class ResilienceOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ResilienceOrchestrator.class);

    static final long RETRY_BASE_DELAY_MS = 1_000;
    static final long RETRY_MAX_DELAY_MS = 30_000;

    private final ErrorClassifier classifier;
    private final NetworkResilienceEngine engine;
    private final ErrorHistory errorHistory;

    public ResilienceOrchestrator(ErrorClassifier classifier, NetworkResilienceEngine engine, ErrorHistory errorHistory) {
        this.classifier = classifier;
        this.engine = engine;
        this.errorHistory = errorHistory;
    }

    public ClassifiedError classify(Throwable raw) {
        return classifier.classify(raw);
    }

    public boolean shouldRetry(ClassifiedError error) {
        return error.isRetryable();
    }

    public String formatMessage(ClassifiedError error) {
        String base = "API Error (" + error.getType().getValue() + "): " + error.getMessage();
        String troubleshooting = getTroubleshootingGuidance(error);
        return troubleshooting.isEmpty() ? base : base + "\n\nTroubleshooting: " + troubleshooting;
    }

    public String getTroubleshootingGuidance(ClassifiedError error) {
        switch (error.getType()) {
            case AUTHENTICATION:
                return "Verify your API credentials are correct and have not expired. Re-authenticate if necessary.";
            case RATE_LIMIT:
                return "Reduce the frequency of API requests or implement delays between operations. "
                    + "The API allows 1000 requests per hour per actor.";
            case NETWORK:
                return "Check your internet connection and firewall settings. Ensure the API endpoints are accessible.";
            case VALIDATION:
                return "Review the input parameters and ensure all required fields are provided with valid values.";
            case API_ERROR:
                if (error.isRetryable()) {
                    return "This appears to be a temporary server issue. The operation will be retried automatically.";
                }
                return "Check the API documentation for the specific endpoint requirements and limitations.";
            default:
                return "";
        }
    }

    /**
     * Delay before retry number {@code attempt} (1-based): the server's retry-after for rate limits,
     * otherwise 1s doubling per attempt up to 30s.
     */
    public long getRetryDelay(ClassifiedError error, int attempt) {
        if (error.getType() == ErrorType.RATE_LIMIT && error.hasRetryAfter()) {
            return error.getRetryAfterSeconds() * 1000L;
        }
        long delay = RETRY_BASE_DELAY_MS * (1L << Math.min(Math.max(0, attempt - 1), 30));
        return Math.min(delay, RETRY_MAX_DELAY_MS);
    }

    public <T> CompletableFuture<T> executeWithRetry(RemoteOperation<T> operation, String label) {
        return executeWithRetry(operation, label, null);
    }

    public <T> CompletableFuture<T> executeWithRetry(RemoteOperation<T> operation, String label,
                                                     ResilienceConfigUpdate overrides) {
        return engine.executeWithRetry(operation, label, overrides).thenApply(this::unwrapResult);
    }

    private <T> T unwrapResult(OperationResult<T> result) {
        if (result.isSuccess()) {
            return result.getData();
        }
        errorHistory.record(result.getError());
        throw toCallerError(result.getError());
    }

    public ApiOperationException toCallerError(ClassifiedError error) {
        ApiOperationException.Kind kind = error.getType() == ErrorType.VALIDATION
            ? ApiOperationException.Kind.CALLER_INPUT
            : ApiOperationException.Kind.OPERATIONAL;
        return new ApiOperationException(kind, formatMessage(error), error.getCode(),
            getTroubleshootingGuidance(error), error);
    }

    public ConnectionStats getNetworkStats() {
        return engine.getConnectionStats();
    }

    public void resetNetworkStats() {
        engine.resetConnectionStats();
    }

    public ResilienceConfig getConfig() {
        return engine.getConfig();
    }

    /**
     * Applies a partial config update. Settings the engine rejects surface as a caller-input error.
     */
    public ResilienceConfig updateConfig(ResilienceConfigUpdate update) {
        try {
            return engine.updateConfig(update);
        } catch (IllegalArgumentException ex) {
            throw toCallerError(classifier.classify(new RequestValidationException(ex.getMessage()), "update_config"));
        }
    }

    public CompletableFuture<HealthCheckResult> performNetworkHealthCheck() {
        return engine.performHealthCheck();
    }

    public FailurePattern detectFailurePattern(List<ClassifiedError> errors) {
        return engine.detectFailurePattern(errors);
    }

    public FailurePattern detectRecentFailurePattern() {
        return engine.detectFailurePattern(errorHistory.snapshot());
    }

    public List<ClassifiedError> getRecentErrors() {
        return errorHistory.snapshot();
    }

    public HttpTransport getTransport() {
        return engine.getTransport();
    }

    public void destroy() {
        errorHistory.clear();
        engine.shutdown();
        log.info("Resilience orchestrator destroyed");
    }
}
